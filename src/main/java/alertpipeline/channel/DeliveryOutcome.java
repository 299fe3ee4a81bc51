package alertpipeline.channel;

import lombok.Value;

import java.util.List;

/**
 * 一条告警在所有通道上的投递结果
 */
@Value
public class DeliveryOutcome {
    String alertId;
    List<ChannelDeliveryResult> results;
    /** 本次投递是否包含紧急升级路由 */
    boolean escalated;

    public long getSuccessCount() {
        return results.stream().filter(ChannelDeliveryResult::isSuccess).count();
    }

    public long getFailureCount() {
        return results.size() - getSuccessCount();
    }

    public boolean hasChannels() {
        return !results.isEmpty();
    }

    public boolean isFullyDelivered() {
        return hasChannels() && getFailureCount() == 0;
    }

    public boolean isPartiallyDelivered() {
        return getSuccessCount() > 0 && getFailureCount() > 0;
    }

    public boolean isFailed() {
        return getSuccessCount() == 0;
    }
}
