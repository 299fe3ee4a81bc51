package alertpipeline.channel;

import alertpipeline.model.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 紧急升级配置. 窗口内的通道失败率超过 failureThreshold 时启用兜底通道
 */
@Value
@Builder(toBuilder = true)
public class EscalationConfig {

    public static final EscalationConfig DEFAULT = EscalationConfig.builder().build();

    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    double failureThreshold = 0.5;
    @Builder.Default
    Duration evaluationWindow = Duration.ofMinutes(5);
    /** 窗口内至少多少次投递才计算失败率 */
    @Builder.Default
    int minimumSamples = 5;
    @Builder.Default
    Duration cooldown = Duration.ofMinutes(15);
    String fallbackChannel;

    public void validate() {
        if (failureThreshold < 0.0 || failureThreshold > 1.0) {
            throw new ConfigurationException("escalation failureThreshold必须在0.0-1.0之间: " + failureThreshold);
        }
        if (evaluationWindow == null || evaluationWindow.isZero() || evaluationWindow.isNegative()) {
            throw new ConfigurationException("escalation evaluationWindow必须大于0: " + evaluationWindow);
        }
        if (minimumSamples < 1) {
            throw new ConfigurationException("escalation minimumSamples必须至少为1: " + minimumSamples);
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new ConfigurationException("escalation cooldown不能为负: " + cooldown);
        }
    }
}
