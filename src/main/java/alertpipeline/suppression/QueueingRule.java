package alertpipeline.suppression;

/**
 * 可以返回 QUEUE 判定的规则, 自带延迟队列
 */
public interface QueueingRule extends SuppressionRule {

    DeferredAlertQueue getDeferredQueue();
}
