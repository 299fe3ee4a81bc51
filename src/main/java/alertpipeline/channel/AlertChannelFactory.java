package alertpipeline.channel;

import alertpipeline.model.ConfigurationException;

/**
 * 按通道类型创建未初始化的通道实例
 */
public final class AlertChannelFactory {

    private AlertChannelFactory() {
    }

    public static AlertChannel create(ChannelConfig config) {
        if (config.getType() == null) {
            throw new ConfigurationException("通道类型不能为空: " + config.getName());
        }
        switch (config.getType()) {
            case LOG:
                return new LogAlertChannel();
            case CONSOLE:
                return new ConsoleAlertChannel();
            case WEBHOOK:
                return new WebhookAlertChannel();
            case EMAIL:
                return new EmailAlertChannel();
            case IN_MEMORY:
                return new InMemoryAlertChannel();
            case CUSTOM:
            default:
                throw new ConfigurationException("自定义通道需要直接注册实例: " + config.getName());
        }
    }
}
