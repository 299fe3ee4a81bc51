package alertpipeline.filter;

import alertpipeline.model.Alert;

/**
 * 告警过滤器. 数值越小的优先级越先执行
 */
public interface AlertFilter {

    String getName();

    int getPriority();

    /**
     * 建议型过滤器的抑制结果只记录, 不中断过滤链
     */
    default boolean isAdvisory() {
        return false;
    }

    FilterDecision evaluate(Alert alert);
}
