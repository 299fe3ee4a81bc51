package alertpipeline.channel;

import java.time.Clock;
import java.time.Instant;

/**
 * 通道健康状态, 由投递结果和健康检查更新. 所有访问都在对象锁内
 */
public class ChannelHealth {

    private final String channelName;
    private final ChannelCircuitBreaker circuitBreaker;
    private final Clock clock;
    private long totalSends;
    private long successfulSends;
    private long failedSends;
    private long totalLatencyMillis;
    private String lastError;
    private Instant lastHealthCheck;
    private Boolean lastHealthCheckResult;

    public ChannelHealth(String channelName, CircuitBreakerConfig config, Clock clock) {
        this.channelName = channelName;
        this.clock = clock;
        this.circuitBreaker = new ChannelCircuitBreaker(channelName, config, clock);
    }

    public boolean tryAcquirePermission() {
        return circuitBreaker.tryAcquirePermission();
    }

    /**
     * 已取得许可但没有发送(例如发送线程池已满), 不计入发送统计和熔断
     */
    public void releasePermission() {
        circuitBreaker.releasePermission();
    }

    public synchronized void recordAttempt(DeliveryAttempt attempt) {
        switch (attempt.getOutcome()) {
            case SUCCESS:
                totalSends++;
                successfulSends++;
                totalLatencyMillis += attempt.getLatency().toMillis();
                circuitBreaker.onSuccess(attempt.getLatency());
                break;
            case FAILURE:
            case TIMEOUT:
                totalSends++;
                failedSends++;
                totalLatencyMillis += attempt.getLatency().toMillis();
                lastError = attempt.getError();
                circuitBreaker.onFailure(attempt.getLatency(), attempt.getError());
                break;
            case REJECTED:
            default:
                break;
        }
    }

    public synchronized void recordHealthCheck(boolean healthy, String error) {
        lastHealthCheck = clock.instant();
        lastHealthCheckResult = healthy;
        if (!healthy && error != null) {
            lastError = error;
        }
        circuitBreaker.onHealthCheck(healthy);
    }

    public synchronized ChannelHealthStatus snapshot(ChannelConfig config) {
        CircuitState state = circuitBreaker.getState();
        return ChannelHealthStatus.builder()
                .channelName(channelName)
                .type(config.getType())
                .enabled(config.isEnabled())
                .circuitState(state)
                .healthy(state != CircuitState.OPEN && !Boolean.FALSE.equals(lastHealthCheckResult))
                .consecutiveFailures(circuitBreaker.getConsecutiveFailures())
                .lastStateChange(circuitBreaker.getLastStateChange())
                .lastHealthCheck(lastHealthCheck)
                .lastHealthCheckResult(lastHealthCheckResult)
                .totalSends(totalSends)
                .successfulSends(successfulSends)
                .failedSends(failedSends)
                .averageLatencyMillis(totalSends == 0 ? 0.0 : (double) totalLatencyMillis / totalSends)
                .lastError(lastError)
                .build();
    }

    public CircuitState getCircuitState() {
        return circuitBreaker.getState();
    }

    public ChannelCircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
