package alertpipeline.channel;

import lombok.Value;

import java.util.List;

/**
 * 单个通道对一条告警的投递结果, 包含所有尝试
 */
@Value
public class ChannelDeliveryResult {
    String channelName;
    boolean success;
    List<DeliveryAttempt> attempts;
    String error;

    public static ChannelDeliveryResult skipped(String channelName, String reason) {
        return new ChannelDeliveryResult(channelName, false, List.of(), reason);
    }

    public int getAttemptCount() {
        return attempts.size();
    }
}
