package alertpipeline.filter;

import alertpipeline.model.ConfigurationException;
import org.apache.commons.lang3.StringUtils;

/**
 * 过滤器基类
 */
public abstract class AbstractAlertFilter implements AlertFilter {

    private final String name;
    private final int priority;
    private final boolean advisory;

    protected AbstractAlertFilter(String name, int priority) {
        this(name, priority, false);
    }

    protected AbstractAlertFilter(String name, int priority, boolean advisory) {
        if (StringUtils.isBlank(name)) {
            throw new ConfigurationException("过滤器名称不能为空");
        }
        this.name = name;
        this.priority = priority;
        this.advisory = advisory;
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
    public boolean isAdvisory() {
        return advisory;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", priority=" + priority + "}";
    }
}
