package alertpipeline.filter;

import alertpipeline.model.Alert;
import alertpipeline.model.AlertSeverity;

import java.util.Objects;

/**
 * 级别阈值过滤器. alwaysAllowCritical 开启时 Critical 及以上级别总是放行
 */
public class SeverityFilter extends AbstractAlertFilter {

    private final AlertSeverity minimumSeverity;
    private final boolean alwaysAllowCritical;

    public SeverityFilter(String name, int priority, AlertSeverity minimumSeverity, boolean alwaysAllowCritical) {
        super(name, priority);
        this.minimumSeverity = Objects.requireNonNull(minimumSeverity, "minimumSeverity");
        this.alwaysAllowCritical = alwaysAllowCritical;
    }

    @Override
    public FilterDecision evaluate(Alert alert) {
        if (alert.getSeverity().isAtLeast(minimumSeverity)) {
            return FilterDecision.allow();
        }
        if (alwaysAllowCritical && alert.getSeverity().isAtLeast(AlertSeverity.CRITICAL)) {
            return FilterDecision.allow();
        }
        return FilterDecision.suppress("BelowSeverityThreshold");
    }

    public AlertSeverity getMinimumSeverity() {
        return minimumSeverity;
    }
}
