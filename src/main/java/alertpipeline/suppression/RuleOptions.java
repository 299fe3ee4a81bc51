package alertpipeline.suppression;

import alertpipeline.model.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 所有抑制规则共有的选项
 */
@Value
@Builder
public class RuleOptions {

    public static final RuleOptions DEFAULTS = RuleOptions.builder().build();

    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    boolean trackStatistics = true;
    @Builder.Default
    Duration statisticsRetention = Duration.ofHours(1);

    public void validate() {
        if (statisticsRetention == null || statisticsRetention.isNegative() || statisticsRetention.isZero()) {
            throw new ConfigurationException("statisticsRetention必须大于0: " + statisticsRetention);
        }
    }
}
