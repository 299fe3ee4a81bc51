package alertpipeline.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 管道统计快照
 */
@Value
@Builder
public class AlertStatistics {
    long raised;
    long delivered;
    long partiallyDelivered;
    long failed;
    long filtered;
    long suppressed;
    long queued;
    long aggregated;
    long escalated;
    long rejected;
    long timedOut;
    int activeAlerts;
    int inFlight;
    int deferredAlerts;
    int registeredChannels;
    double averageProcessingMillis;
    boolean emergencyModeActive;
    Instant since;
}
