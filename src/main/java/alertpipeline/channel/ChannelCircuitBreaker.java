package alertpipeline.channel;

import alertpipeline.model.AlertException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 通道熔断器, 基于 Resilience4j CircuitBreaker.
 * <p>
 * 计数窗口大小为 failureThreshold, 失败率阈值 100%, 即最近 failureThreshold 次调用全部失败时断开;
 * OPEN 持续 openDuration(按注入的 Clock 计时)后进入 HALF_OPEN, 放行 successThreshold 个试探请求,
 * 全部成功后恢复 CLOSED, 任一失败重新 OPEN.
 */
@Slf4j
public class ChannelCircuitBreaker {

    private final String channelName;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitBreaker delegate;

    private int consecutiveFailures;
    private Instant lastStateChange;
    private Instant openedAt;

    public ChannelCircuitBreaker(String channelName, CircuitBreakerConfig config, Clock clock) {
        this.channelName = channelName;
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastStateChange = clock.instant();
        this.delegate = CircuitBreaker.of(channelName, toResilience4j(config));
        this.delegate.getEventPublisher().onStateTransition(this::onStateTransition);
    }

    static io.github.resilience4j.circuitbreaker.CircuitBreakerConfig toResilience4j(CircuitBreakerConfig config) {
        return io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.custom()
                .slidingWindowType(io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(config.getFailureThreshold())
                .minimumNumberOfCalls(config.getFailureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(config.getOpenDuration())
                .permittedNumberOfCallsInHalfOpenState(config.getSuccessThreshold())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }

    /**
     * 申请一次发送许可. 返回 false 表示快速失败, 不应尝试发送
     */
    public synchronized boolean tryAcquirePermission() {
        if (delegate.getState() == CircuitBreaker.State.OPEN
                && !clock.instant().isBefore(openedAt.plus(config.getOpenDuration()))) {
            delegate.transitionToHalfOpenState();
        }
        return delegate.tryAcquirePermission();
    }

    /**
     * 拿到许可后没有实际发送, 归还许可
     */
    public synchronized void releasePermission() {
        delegate.releasePermission();
    }

    public synchronized void onSuccess(Duration latency) {
        consecutiveFailures = 0;
        delegate.onSuccess(latency.toNanos(), TimeUnit.NANOSECONDS);
    }

    public synchronized void onFailure(Duration latency, String error) {
        consecutiveFailures++;
        delegate.onError(latency.toNanos(), TimeUnit.NANOSECONDS,
                new AlertException(error != null ? error : "发送失败: " + channelName));
        if (delegate.getState() == CircuitBreaker.State.HALF_OPEN) {
            delegate.transitionToOpenState();
        }
    }

    /**
     * 健康检查结果. 检查失败与发送失败同等计数; 检查成功只在 CLOSED 下计为成功, OPEN 的恢复仍需试探发送
     */
    public synchronized void onHealthCheck(boolean healthy) {
        CircuitState state = getState();
        if (!healthy) {
            if (state != CircuitState.OPEN) {
                onFailure(Duration.ZERO, "健康检查失败");
            }
        } else if (state == CircuitState.CLOSED) {
            onSuccess(Duration.ZERO);
        }
    }

    public synchronized void reset() {
        consecutiveFailures = 0;
        delegate.reset();
        lastStateChange = clock.instant();
    }

    private void onStateTransition(CircuitBreakerOnStateTransitionEvent event) {
        CircuitBreaker.StateTransition transition = event.getStateTransition();
        lastStateChange = clock.instant();
        if (transition.getToState() == CircuitBreaker.State.OPEN) {
            openedAt = lastStateChange;
            log.warn("通道熔断器断开: channel={}, 连续失败={}", channelName, consecutiveFailures);
        } else {
            log.info("通道熔断器状态变化: channel={}, {} -> {}",
                    channelName, transition.getFromState(), transition.getToState());
        }
    }

    public synchronized CircuitState getState() {
        switch (delegate.getState()) {
            case OPEN:
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant getLastStateChange() {
        return lastStateChange;
    }

    /**
     * 底层 Resilience4j 熔断器, 供指标和事件订阅使用
     */
    public CircuitBreaker getDelegate() {
        return delegate;
    }
}
