package alertpipeline.channel;

import alertpipeline.model.ConfigurationException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 重试策略 - 指数退避, 可选抖动. 转换为 Resilience4j RetryConfig 执行
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    public static final RetryPolicy DEFAULT = RetryPolicy.builder().build();
    public static final RetryPolicy NO_RETRY = RetryPolicy.builder().maxAttempts(1).build();

    /** Resilience4j 的退避间隔下限 */
    public static final Duration MIN_DELAY = Duration.ofMillis(10);

    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);
    @Builder.Default
    Duration maxDelay = Duration.ofMinutes(5);
    @Builder.Default
    double backoffMultiplier = 2.0;
    @Builder.Default
    boolean jitterEnabled = true;
    /** 抖动幅度上限, 0.1 表示 ±10%, 必须小于 1 */
    @Builder.Default
    double jitterMaxPercentage = 0.1;

    public void validate() {
        if (maxAttempts < 1) {
            throw new ConfigurationException("maxAttempts必须至少为1: " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.compareTo(MIN_DELAY) < 0) {
            throw new ConfigurationException("baseDelay不能小于" + MIN_DELAY.toMillis() + "ms: " + baseDelay);
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new ConfigurationException("maxDelay不能小于baseDelay: " + maxDelay);
        }
        if (backoffMultiplier < 1.0) {
            throw new ConfigurationException("backoffMultiplier必须不小于1.0: " + backoffMultiplier);
        }
        if (jitterMaxPercentage < 0.0 || jitterMaxPercentage >= 1.0) {
            throw new ConfigurationException("jitterMaxPercentage必须在[0.0, 1.0)之间: " + jitterMaxPercentage);
        }
    }

    /**
     * 第 n 次重试前的等待时间(n 从1开始): baseDelay × multiplier^(n-1), 不超过 maxDelay, 启用抖动时再随机浮动
     */
    public IntervalFunction intervalFunction() {
        if (jitterEnabled && jitterMaxPercentage > 0.0) {
            return IntervalFunction.ofExponentialRandomBackoff(baseDelay, backoffMultiplier, jitterMaxPercentage, maxDelay);
        }
        return IntervalFunction.ofExponentialBackoff(baseDelay, backoffMultiplier, maxDelay);
    }

    /**
     * 按结果重试: retryOnResult 为 true 的结果会在退避后重试, 直到 maxAttempts; 最后一次结果原样返回
     */
    public <T> RetryConfig toRetryConfig(Predicate<T> retryOnResult) {
        return RetryConfig.<T>custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction())
                .retryOnResult(retryOnResult)
                .failAfterMaxAttempts(false)
                .build();
    }
}
