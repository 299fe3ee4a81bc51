package alertpipeline.config;

import alertpipeline.channel.ChannelConfig;
import alertpipeline.channel.ChannelType;
import alertpipeline.channel.CircuitBreakerConfig;
import alertpipeline.channel.DeliveryConfig;
import alertpipeline.channel.EscalationConfig;
import alertpipeline.channel.RetryPolicy;
import alertpipeline.filter.FilterErrorMode;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;
import alertpipeline.pipeline.PipelineConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 告警管道配置文件. 结构:
 * <pre>
 * pipeline:          管道参数, 含 delivery 和 escalation 子节点
 * channels:          通道列表
 * suppression_rules: 抑制规则列表
 * filters:           过滤器列表
 * source_severity:   来源 -> 最低级别
 * </pre>
 */
@Slf4j
public class AlertPipelineConfig {

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private final ConfigSection root;

    private AlertPipelineConfig(Map<String, Object> config) {
        this.root = new ConfigSection("", config);
    }

    /**
     * 加载配置文件
     */
    @SuppressWarnings("unchecked")
    public static AlertPipelineConfig load(String configPath) {
        Path path = Paths.get(configPath).toAbsolutePath();
        try (InputStream input = Files.newInputStream(path)) {
            Map<String, Object> config = yamlMapper.readValue(input, Map.class);
            log.info("告警管道配置已加载: {}", path);
            return new AlertPipelineConfig(config);
        } catch (IOException e) {
            throw new ConfigurationException("加载配置文件失败: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static AlertPipelineConfig fromYaml(String yaml) {
        try {
            return new AlertPipelineConfig(yamlMapper.readValue(yaml, Map.class));
        } catch (IOException e) {
            throw new ConfigurationException("解析配置失败", e);
        }
    }

    public static AlertPipelineConfig fromMap(Map<String, Object> config) {
        return new AlertPipelineConfig(config);
    }

    public PipelineConfig toPipelineConfig() {
        ConfigSection pipeline = root.getSection("pipeline");
        PipelineConfig defaults = PipelineConfig.DEFAULT;
        PipelineConfig config = PipelineConfig.builder()
                .minimumSeverity(pipeline.getSeverity("minimum_severity", defaults.getMinimumSeverity()))
                .suppressionEnabled(pipeline.getBoolean("suppression_enabled", defaults.isSuppressionEnabled()))
                .aggregationEnabled(pipeline.getBoolean("aggregation_enabled", defaults.isAggregationEnabled()))
                .aggregationWindow(pipeline.getDuration("aggregation_window", defaults.getAggregationWindow()))
                .maxAggregationSize(pipeline.getInt("max_aggregation_size", defaults.getMaxAggregationSize()))
                .maxConcurrentAlerts(pipeline.getInt("max_concurrent_alerts", defaults.getMaxConcurrentAlerts()))
                .alertBufferSize(pipeline.getInt("alert_buffer_size", defaults.getAlertBufferSize()))
                .processingTimeout(pipeline.getDuration("processing_timeout", defaults.getProcessingTimeout()))
                .workerThreads(pipeline.getInt("worker_threads", defaults.getWorkerThreads()))
                .maxHistoryEntries(pipeline.getInt("max_history_entries", defaults.getMaxHistoryEntries()))
                .historyRetention(pipeline.getDuration("history_retention", defaults.getHistoryRetention()))
                .maintenanceInterval(pipeline.getDuration("maintenance_interval", defaults.getMaintenanceInterval()))
                .filterErrorMode(pipeline.getEnum("filter_error_mode", FilterErrorMode.class, defaults.getFilterErrorMode()))
                .maxConsecutiveFilterErrors(pipeline.getInt("max_consecutive_filter_errors",
                        defaults.getMaxConsecutiveFilterErrors()))
                .delivery(toDeliveryConfig(pipeline.getSection("delivery")))
                .escalation(toEscalationConfig(pipeline.getSection("escalation")))
                .build();
        config.validate();
        return config;
    }

    private static DeliveryConfig toDeliveryConfig(ConfigSection section) {
        DeliveryConfig defaults = DeliveryConfig.DEFAULT;
        return DeliveryConfig.builder()
                .parallel(section.getBoolean("parallel", defaults.isParallel()))
                .maxParallelism(section.getInt("max_parallelism", defaults.getMaxParallelism()))
                .continueOnChannelFailure(section.getBoolean("continue_on_channel_failure",
                        defaults.isContinueOnChannelFailure()))
                .sendThreads(section.getInt("send_threads", defaults.getSendThreads()))
                .sendQueueCapacity(section.getInt("send_queue_capacity", defaults.getSendQueueCapacity()))
                .build();
    }

    private static EscalationConfig toEscalationConfig(ConfigSection section) {
        EscalationConfig defaults = EscalationConfig.DEFAULT;
        return EscalationConfig.builder()
                .enabled(section.getBoolean("enabled", defaults.isEnabled()))
                .failureThreshold(section.getDouble("failure_threshold", defaults.getFailureThreshold()))
                .evaluationWindow(section.getDuration("evaluation_window", defaults.getEvaluationWindow()))
                .minimumSamples(section.getInt("minimum_samples", defaults.getMinimumSamples()))
                .cooldown(section.getDuration("cooldown", defaults.getCooldown()))
                .fallbackChannel(section.getString("fallback_channel"))
                .build();
    }

    /**
     * 通道配置列表. 名称重复时抛出 ConfigurationException
     */
    public List<ChannelConfig> getChannelConfigs() {
        List<ChannelConfig> channels = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (ConfigSection section : root.getSectionList("channels")) {
            ChannelConfig channel = toChannelConfig(section);
            if (!names.add(channel.getName())) {
                throw new ConfigurationException("通道名称重复: " + channel.getName());
            }
            channels.add(channel);
        }
        return channels;
    }

    static ChannelConfig toChannelConfig(ConfigSection section) {
        ChannelType type;
        try {
            type = ChannelType.parse(section.requireString("type"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(section.getPath() + ": " + e.getMessage(), e);
        }
        ChannelConfig defaults = ChannelConfig.builder().build();
        ChannelConfig config = ChannelConfig.builder()
                .name(section.requireString("name"))
                .type(type)
                .enabled(section.getBoolean("enabled", true))
                .minSeverity(section.getSeverity("min_severity", defaults.getMinSeverity()))
                .maxSeverity(section.getSeverity("max_severity", defaults.getMaxSeverity()))
                .messageTemplate(section.getString("message_template", ChannelConfig.DEFAULT_TEMPLATE))
                .emergencyChannel(section.getBoolean("emergency_channel", false))
                .sendTimeout(section.getDuration("send_timeout", defaults.getSendTimeout()))
                .healthCheckInterval(section.getDuration("health_check_interval", defaults.getHealthCheckInterval()))
                .retryPolicy(toRetryPolicy(section.getSection("retry")))
                .circuitBreaker(toCircuitBreakerConfig(section.getSection("circuit_breaker")))
                .settings(section.getSection("settings").asMap())
                .build();
        config.validate();
        return config;
    }

    private static RetryPolicy toRetryPolicy(ConfigSection section) {
        RetryPolicy defaults = RetryPolicy.DEFAULT;
        return RetryPolicy.builder()
                .maxAttempts(section.getInt("max_attempts", defaults.getMaxAttempts()))
                .baseDelay(section.getDuration("base_delay", defaults.getBaseDelay()))
                .maxDelay(section.getDuration("max_delay", defaults.getMaxDelay()))
                .backoffMultiplier(section.getDouble("backoff_multiplier", defaults.getBackoffMultiplier()))
                .jitterEnabled(section.getBoolean("jitter_enabled", defaults.isJitterEnabled()))
                .jitterMaxPercentage(section.getDouble("jitter_max_percentage", defaults.getJitterMaxPercentage()))
                .build();
    }

    private static CircuitBreakerConfig toCircuitBreakerConfig(ConfigSection section) {
        CircuitBreakerConfig defaults = CircuitBreakerConfig.DEFAULT;
        return CircuitBreakerConfig.builder()
                .failureThreshold(section.getInt("failure_threshold", defaults.getFailureThreshold()))
                .openDuration(section.getDuration("open_duration", defaults.getOpenDuration()))
                .successThreshold(section.getInt("success_threshold", defaults.getSuccessThreshold()))
                .build();
    }

    public List<ConfigSection> getFilterSections() {
        return root.getSectionList("filters");
    }

    public List<ConfigSection> getSuppressionRuleSections() {
        return root.getSectionList("suppression_rules");
    }

    public Map<String, AlertSeverity> getSourceSeverities() {
        ConfigSection section = root.getSection("source_severity");
        Map<String, AlertSeverity> severities = new LinkedHashMap<>();
        // 来源名可能包含点号, 不走点号路径解析
        for (Map.Entry<String, Object> entry : section.asMap().entrySet()) {
            try {
                severities.put(entry.getKey(), AlertSeverity.parse(String.valueOf(entry.getValue())));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("source_severity." + entry.getKey() + ": " + e.getMessage(), e);
            }
        }
        return severities;
    }

    /**
     * 校验整个配置, 不创建运行时对象
     */
    public void validate() {
        toPipelineConfig();
        getChannelConfigs();
        getSourceSeverities();
    }

    public ConfigSection getRoot() {
        return root;
    }
}
