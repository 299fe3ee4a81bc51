package alertpipeline.channel;

import alertpipeline.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通道 - 通过独立的 logger 输出告警, 级别按告警级别映射
 */
public class LogAlertChannel extends AbstractAlertChannel {

    public static final String DEFAULT_LOGGER = "alertpipeline.alerts";

    private Logger alertLogger = LoggerFactory.getLogger(DEFAULT_LOGGER);

    @Override
    protected void doInitialize(ChannelConfig config) {
        alertLogger = LoggerFactory.getLogger(config.getString("logger", DEFAULT_LOGGER));
    }

    @Override
    protected void doSend(Alert alert, String formatted) {
        switch (alert.getSeverity()) {
            case DEBUG:
                alertLogger.debug(formatted);
                break;
            case INFO:
                alertLogger.info(formatted);
                break;
            case WARNING:
                alertLogger.warn(formatted);
                break;
            default:
                alertLogger.error(formatted);
        }
    }
}
