package alertpipeline.channel;

import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Map;

/**
 * 通道配置
 */
@Value
@Builder(toBuilder = true)
public class ChannelConfig {

    public static final String DEFAULT_TEMPLATE = "[{severity}] {source}: {message}";

    String name;
    ChannelType type;
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    AlertSeverity minSeverity = AlertSeverity.DEBUG;
    @Builder.Default
    AlertSeverity maxSeverity = AlertSeverity.EMERGENCY;
    @Builder.Default
    String messageTemplate = DEFAULT_TEMPLATE;
    /** 是否作为紧急升级时的兜底通道 */
    @Builder.Default
    boolean emergencyChannel = false;
    @Builder.Default
    Duration sendTimeout = Duration.ofSeconds(10);
    @Builder.Default
    Duration healthCheckInterval = Duration.ofMinutes(5);
    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
    @Builder.Default
    CircuitBreakerConfig circuitBreaker = CircuitBreakerConfig.DEFAULT;
    /** 各类型通道自己的设置, 如 webhook 的 url */
    @Singular
    Map<String, Object> settings;

    public void validate() {
        if (StringUtils.isBlank(name)) {
            throw new ConfigurationException("通道名称不能为空");
        }
        if (type == null) {
            throw new ConfigurationException("通道类型不能为空: " + name);
        }
        if (minSeverity == null || maxSeverity == null || minSeverity.compareTo(maxSeverity) > 0) {
            throw new ConfigurationException(
                    String.format("通道级别范围无效: %s, %s - %s", name, minSeverity, maxSeverity));
        }
        if (sendTimeout == null || sendTimeout.isZero() || sendTimeout.isNegative()) {
            throw new ConfigurationException("sendTimeout必须大于0: " + name);
        }
        if (healthCheckInterval == null || healthCheckInterval.isZero() || healthCheckInterval.isNegative()) {
            throw new ConfigurationException("healthCheckInterval必须大于0: " + name);
        }
        if (retryPolicy == null || circuitBreaker == null) {
            throw new ConfigurationException("重试策略和熔断配置不能为空: " + name);
        }
        retryPolicy.validate();
        circuitBreaker.validate();
    }

    public boolean accepts(AlertSeverity severity) {
        return severity.isAtLeast(minSeverity) && severity.isAtMost(maxSeverity);
    }

    public String getString(String key) {
        Object value = settings.get(key);
        return value == null ? null : value.toString();
    }

    public String getString(String key, String defaultValue) {
        return StringUtils.defaultIfBlank(getString(key), defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        Object value = settings.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value == null || StringUtils.isBlank(value.toString())) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(String.format("通道设置%s不是整数: %s", key, value), e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = settings.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value == null ? defaultValue : Boolean.parseBoolean(value.toString().trim());
    }
}
