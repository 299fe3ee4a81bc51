package alertpipeline.config;

import alertpipeline.pipeline.AlertOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 告警管道的 Spring 装配. 配置错误会使上下文启动失败
 */
@Slf4j
@Configuration
public class AlertPipelineConfiguration {

    @Autowired
    private ConfigFilePathManage configFilePathManage;

    @Bean
    public AlertPipelineConfig alertPipelineConfig() {
        return AlertPipelineConfig.load(configFilePathManage.alertPipelineConfigPath);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public AlertOrchestrator alertOrchestrator(AlertPipelineConfig alertPipelineConfig) {
        log.info("正在根据配置创建告警管道: {}", configFilePathManage.alertPipelineConfigPath);
        return AlertPipelineFactory.create(alertPipelineConfig);
    }
}
