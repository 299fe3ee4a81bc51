package alertpipeline.pipeline;

import alertpipeline.channel.DeliveryOutcome;
import alertpipeline.model.Alert;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 一条告警的处理结果
 */
@Value
@Builder(toBuilder = true)
public class AlertOutcome {
    String alertId;
    OutcomeStatus status;
    /** 最终进入投递或被处理的告警, 可能已被过滤器修改或是聚合后的告警 */
    Alert alert;
    String reason;
    /** 产生判定的过滤器或规则名称 */
    String decidedBy;
    DeliveryOutcome delivery;
    Throwable cause;
    Duration processingTime;

    public boolean isDelivered() {
        return status == OutcomeStatus.DELIVERED
                || status == OutcomeStatus.PARTIALLY_DELIVERED
                || status == OutcomeStatus.ESCALATED;
    }

    static AlertOutcome of(Alert alert, OutcomeStatus status, String reason, String decidedBy) {
        return AlertOutcome.builder()
                .alertId(alert.getId())
                .alert(alert)
                .status(status)
                .reason(reason)
                .decidedBy(decidedBy)
                .build();
    }
}
