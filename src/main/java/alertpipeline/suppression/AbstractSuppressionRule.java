package alertpipeline.suppression;

import alertpipeline.model.ConfigurationException;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;

public abstract class AbstractSuppressionRule implements SuppressionRule {

    private final String name;
    private final int priority;
    private final RuleStatistics statistics;
    private volatile boolean enabled;

    protected AbstractSuppressionRule(String name, int priority, RuleOptions options) {
        if (StringUtils.isBlank(name)) {
            throw new ConfigurationException("抑制规则名称不能为空");
        }
        options.validate();
        this.name = name;
        this.priority = priority;
        this.statistics = new RuleStatistics(name, options.getStatisticsRetention(), options.isTrackStatistics());
        this.enabled = options.isEnabled();
    }

    protected static void requirePositive(Duration value, String field) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(field + "必须大于0: " + value);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public RuleStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", priority=" + priority + ", enabled=" + enabled + "}";
    }
}
