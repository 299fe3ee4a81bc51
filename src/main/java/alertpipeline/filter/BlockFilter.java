package alertpipeline.filter;

import alertpipeline.model.Alert;
import org.apache.commons.lang3.StringUtils;

/**
 * 阻断所有告警
 */
public class BlockFilter extends AbstractAlertFilter {

    private final String reason;

    public BlockFilter(String name, int priority, String reason) {
        super(name, priority);
        this.reason = StringUtils.defaultIfBlank(reason, "Blocked");
    }

    @Override
    public FilterDecision evaluate(Alert alert) {
        return FilterDecision.suppress(reason);
    }
}
