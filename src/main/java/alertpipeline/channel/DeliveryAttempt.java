package alertpipeline.channel;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * 一次发送尝试的记录
 */
@Value
public class DeliveryAttempt {

    public enum Outcome {
        SUCCESS,
        FAILURE,
        TIMEOUT,
        /** 熔断器或发送线程池拒绝, 未实际发送, 不计入通道健康 */
        REJECTED
    }

    String channelName;
    int attemptNumber;
    Outcome outcome;
    Duration latency;
    String error;
    Instant startedAt;

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
