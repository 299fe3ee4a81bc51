package alertpipeline.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ConfigFilePathManage {

    @Value("${alertpipeline.config.path}")
    public String alertPipelineConfigPath;
}
