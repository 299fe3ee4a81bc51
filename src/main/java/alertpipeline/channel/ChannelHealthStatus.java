package alertpipeline.channel;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 通道健康状态快照
 */
@Value
@Builder
public class ChannelHealthStatus {
    String channelName;
    ChannelType type;
    boolean enabled;
    CircuitState circuitState;
    boolean healthy;
    int consecutiveFailures;
    Instant lastStateChange;
    Instant lastHealthCheck;
    Boolean lastHealthCheckResult;
    long totalSends;
    long successfulSends;
    long failedSends;
    double averageLatencyMillis;
    String lastError;

    public double getSuccessRate() {
        long finished = successfulSends + failedSends;
        return finished == 0 ? 1.0 : (double) successfulSends / finished;
    }
}
