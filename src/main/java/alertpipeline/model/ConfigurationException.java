package alertpipeline.model;

/**
 * 配置错误 - 在构造或注册时同步抛出, 不会进入运行时管道
 */
public class ConfigurationException extends AlertException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
