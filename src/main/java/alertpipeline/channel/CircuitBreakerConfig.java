package alertpipeline.channel;

import alertpipeline.model.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class CircuitBreakerConfig {

    public static final CircuitBreakerConfig DEFAULT = CircuitBreakerConfig.builder().build();

    /** 连续失败多少次后断开 */
    @Builder.Default
    int failureThreshold = 5;
    @Builder.Default
    Duration openDuration = Duration.ofMinutes(1);
    /** 半开状态下连续成功多少次后恢复 */
    @Builder.Default
    int successThreshold = 1;

    public void validate() {
        if (failureThreshold < 1) {
            throw new ConfigurationException("failureThreshold必须至少为1: " + failureThreshold);
        }
        if (openDuration == null || openDuration.isZero() || openDuration.isNegative()) {
            throw new ConfigurationException("openDuration必须大于0: " + openDuration);
        }
        if (successThreshold < 1) {
            throw new ConfigurationException("successThreshold必须至少为1: " + successThreshold);
        }
    }
}
