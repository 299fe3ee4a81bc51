package alertpipeline.channel;

import alertpipeline.model.ConfigurationException;
import lombok.Builder;
import lombok.Value;

/**
 * 多通道投递方式
 */
@Value
@Builder(toBuilder = true)
public class DeliveryConfig {

    public static final DeliveryConfig DEFAULT = DeliveryConfig.builder().build();

    @Builder.Default
    boolean parallel = true;
    @Builder.Default
    int maxParallelism = 4;
    /** 某个通道失败后是否继续投递其余通道 */
    @Builder.Default
    boolean continueOnChannelFailure = true;
    /** 执行实际发送的线程数 */
    @Builder.Default
    int sendThreads = 16;
    /** 发送线程池的等待队列容量, 满了之后的发送直接拒绝 */
    @Builder.Default
    int sendQueueCapacity = 1000;

    public void validate() {
        if (maxParallelism < 1) {
            throw new ConfigurationException("maxParallelism必须至少为1: " + maxParallelism);
        }
        if (sendThreads < 1) {
            throw new ConfigurationException("sendThreads必须至少为1: " + sendThreads);
        }
        if (sendQueueCapacity < 1) {
            throw new ConfigurationException("sendQueueCapacity必须至少为1: " + sendQueueCapacity);
        }
    }
}
