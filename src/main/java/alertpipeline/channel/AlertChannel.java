package alertpipeline.channel;

import alertpipeline.model.Alert;
import alertpipeline.model.AlertException;

/**
 * 告警输出通道
 */
public interface AlertChannel {

    String getName();

    /**
     * 按配置初始化, 失败返回 false
     */
    boolean initialize(ChannelConfig config);

    /**
     * 发送告警, 失败时抛出 AlertException
     */
    void send(Alert alert) throws AlertException;

    boolean healthCheck();

    /**
     * 释放通道资源
     */
    default void close() {
    }
}
