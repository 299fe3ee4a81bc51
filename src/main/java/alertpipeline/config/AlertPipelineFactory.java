package alertpipeline.config;

import alertpipeline.channel.ChannelConfig;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;
import alertpipeline.pipeline.AlertOrchestrator;
import alertpipeline.pipeline.PipelineConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.util.Map;

/**
 * 按配置文件组装告警管道: 创建编排器并注册通道、过滤器、抑制规则和来源级别
 */
@Slf4j
public final class AlertPipelineFactory {

    private AlertPipelineFactory() {
    }

    public static AlertOrchestrator create(AlertPipelineConfig pipelineConfig) {
        return create(pipelineConfig, Clock.systemUTC());
    }

    public static AlertOrchestrator create(AlertPipelineConfig pipelineConfig, Clock clock) {
        PipelineConfig config = pipelineConfig.toPipelineConfig();
        AlertOrchestrator orchestrator = new AlertOrchestrator(config, clock);
        try {
            for (ChannelConfig channel : pipelineConfig.getChannelConfigs()) {
                orchestrator.registerChannel(channel);
            }
            String fallback = config.getEscalation().getFallbackChannel();
            if (StringUtils.isNotBlank(fallback) && !orchestrator.getDeliveryService().hasChannel(fallback)) {
                throw new ConfigurationException("兜底通道不存在: " + fallback);
            }

            FilterFactory filterFactory = new FilterFactory(clock);
            for (ConfigSection section : pipelineConfig.getFilterSections()) {
                orchestrator.addFilter(filterFactory.create(section));
            }

            SuppressionRuleFactory ruleFactory = new SuppressionRuleFactory(orchestrator.getHistoryStore());
            for (ConfigSection section : pipelineConfig.getSuppressionRuleSections()) {
                orchestrator.addSuppressionRule(ruleFactory.create(section));
            }

            for (Map.Entry<String, AlertSeverity> entry : pipelineConfig.getSourceSeverities().entrySet()) {
                orchestrator.setSourceMinimumSeverity(entry.getKey(), entry.getValue());
            }
        } catch (RuntimeException e) {
            orchestrator.close();
            throw e;
        }
        log.info("告警管道组装完成: 通道={}, 过滤器={}, 抑制规则={}",
                orchestrator.getDeliveryService().getChannelNames().size(),
                orchestrator.getFilterChain().size(),
                orchestrator.getSuppressionEngine().getRules().size());
        return orchestrator;
    }
}
