package alertpipeline.history;

import alertpipeline.model.Alert;
import alertpipeline.model.Disposition;
import lombok.Value;

import java.time.Instant;

/**
 * 告警最终去向的不可变快照
 */
@Value
public class HistoryEntry {
    Alert alert;
    Disposition disposition;
    Instant timestamp;
    String reason;

    public String getAlertId() {
        return alert.getId();
    }
}
