package alertpipeline.pipeline;

import alertpipeline.channel.DeliveryConfig;
import alertpipeline.channel.EscalationConfig;
import alertpipeline.filter.FilterErrorMode;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 管道配置
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    public static final PipelineConfig DEFAULT = PipelineConfig.builder().build();

    @Builder.Default
    AlertSeverity minimumSeverity = AlertSeverity.INFO;
    @Builder.Default
    boolean suppressionEnabled = true;
    @Builder.Default
    boolean aggregationEnabled = false;
    @Builder.Default
    Duration aggregationWindow = Duration.ofMinutes(1);
    @Builder.Default
    int maxAggregationSize = 100;

    /** 同时处理的告警上限 */
    @Builder.Default
    int maxConcurrentAlerts = 100;
    /** 等待处理的告警上限, 超出时直接拒绝 */
    @Builder.Default
    int alertBufferSize = 1000;
    @Builder.Default
    Duration processingTimeout = Duration.ofSeconds(30);
    @Builder.Default
    int workerThreads = 16;

    @Builder.Default
    int maxHistoryEntries = 10000;
    @Builder.Default
    Duration historyRetention = Duration.ofHours(24);
    @Builder.Default
    Duration maintenanceInterval = Duration.ofMinutes(1);

    @Builder.Default
    FilterErrorMode filterErrorMode = FilterErrorMode.LOG_AND_CONTINUE;
    @Builder.Default
    int maxConsecutiveFilterErrors = 5;

    @Builder.Default
    DeliveryConfig delivery = DeliveryConfig.DEFAULT;
    @Builder.Default
    EscalationConfig escalation = EscalationConfig.DEFAULT;

    public void validate() {
        if (minimumSeverity == null) {
            throw new ConfigurationException("minimumSeverity不能为空");
        }
        if (aggregationEnabled) {
            requirePositive(aggregationWindow, "aggregationWindow");
            if (maxAggregationSize < 1) {
                throw new ConfigurationException("maxAggregationSize必须至少为1: " + maxAggregationSize);
            }
        }
        if (maxConcurrentAlerts < 1) {
            throw new ConfigurationException("maxConcurrentAlerts必须至少为1: " + maxConcurrentAlerts);
        }
        if (alertBufferSize < 0) {
            throw new ConfigurationException("alertBufferSize不能为负: " + alertBufferSize);
        }
        if (workerThreads < 1) {
            throw new ConfigurationException("workerThreads必须至少为1: " + workerThreads);
        }
        requirePositive(processingTimeout, "processingTimeout");
        if (maxHistoryEntries < 1) {
            throw new ConfigurationException("maxHistoryEntries必须至少为1: " + maxHistoryEntries);
        }
        requirePositive(historyRetention, "historyRetention");
        requirePositive(maintenanceInterval, "maintenanceInterval");
        if (filterErrorMode == null) {
            throw new ConfigurationException("filterErrorMode不能为空");
        }
        if (maxConsecutiveFilterErrors < 1) {
            throw new ConfigurationException("maxConsecutiveFilterErrors必须至少为1: " + maxConsecutiveFilterErrors);
        }
        if (delivery == null || escalation == null) {
            throw new ConfigurationException("delivery和escalation配置不能为空");
        }
        delivery.validate();
        escalation.validate();
    }

    private static void requirePositive(Duration value, String field) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(field + "必须大于0: " + value);
        }
    }
}
