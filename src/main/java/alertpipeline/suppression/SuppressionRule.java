package alertpipeline.suppression;

import alertpipeline.model.Alert;

import java.time.Instant;

/**
 * 有状态的抑制规则. 数值越小的优先级越先评估
 */
public interface SuppressionRule {

    String getName();

    int getPriority();

    boolean isEnabled();

    void setEnabled(boolean enabled);

    SuppressionVerdict evaluate(Alert alert, Instant now);

    /**
     * 清理过期状态
     */
    default void prune(Instant now) {
    }

    /**
     * 已放行该告警, 但之后的规则抑制或延迟了它: 撤销 evaluate 中为它记录的状态
     */
    default void release(Alert alert) {
    }

    RuleStatistics getStatistics();
}
