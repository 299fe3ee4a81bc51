package alertpipeline.channel;

import alertpipeline.model.Alert;
import alertpipeline.model.AlertException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * 通道基类 - 负责初始化状态和消息模板渲染
 */
@Slf4j
public abstract class AbstractAlertChannel implements AlertChannel {

    private static final String[] PLACEHOLDERS = {
            "{id}", "{severity}", "{source}", "{message}", "{tag}", "{correlationId}", "{timestamp}", "{count}"
    };

    private volatile ChannelConfig config;

    @Override
    public String getName() {
        return config != null ? config.getName() : getClass().getSimpleName();
    }

    @Override
    public boolean initialize(ChannelConfig config) {
        Objects.requireNonNull(config, "config");
        try {
            config.validate();
            doInitialize(config);
            this.config = config;
            log.info("通道初始化完成: {} ({})", config.getName(), config.getType());
            return true;
        } catch (Exception e) {
            log.error("通道初始化失败: {}", config.getName(), e);
            return false;
        }
    }

    protected void doInitialize(ChannelConfig config) throws Exception {
    }

    @Override
    public void send(Alert alert) throws AlertException {
        if (config == null) {
            throw new AlertException("通道尚未初始化: " + getName());
        }
        doSend(alert, format(alert));
    }

    protected abstract void doSend(Alert alert, String formatted) throws AlertException;

    @Override
    public boolean healthCheck() {
        return config != null;
    }

    /**
     * 按模板渲染告警, 未设置的字段替换为空串
     */
    public String format(Alert alert) {
        String template = config != null ? config.getMessageTemplate() : ChannelConfig.DEFAULT_TEMPLATE;
        String[] values = {
                alert.getId(),
                alert.getSeverity().name(),
                alert.getSource(),
                alert.getMessage(),
                StringUtils.defaultString(alert.getTag()),
                StringUtils.defaultString(alert.getCorrelationId()),
                alert.getTimestamp().toString(),
                String.valueOf(alert.getCount())
        };
        return StringUtils.replaceEach(StringUtils.defaultIfBlank(template, ChannelConfig.DEFAULT_TEMPLATE),
                PLACEHOLDERS, values);
    }

    protected ChannelConfig getConfig() {
        return config;
    }

    protected boolean isInitialized() {
        return config != null;
    }
}
