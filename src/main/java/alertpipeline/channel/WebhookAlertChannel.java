package alertpipeline.channel;

import alertpipeline.model.Alert;
import alertpipeline.model.AlertException;
import alertpipeline.model.ConfigurationException;
import alertpipeline.utils.HttpUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Webhook通道 - 以 JSON 请求体 POST/PUT 告警
 */
@Slf4j
public class WebhookAlertChannel extends AbstractAlertChannel {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private String webhookUrl;
    private String method;
    private String healthUrl;
    private Map<String, String> headers;

    @Override
    protected void doInitialize(ChannelConfig config) {
        this.webhookUrl = config.getString("url");
        this.method = config.getString("method", "POST").toUpperCase();
        this.healthUrl = config.getString("health_url");

        this.headers = new HashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", "AlertPipeline/1.0");
        Object customHeaders = config.getSettings().get("headers");
        if (customHeaders instanceof Map) {
            ((Map<?, ?>) customHeaders).forEach((key, value) -> headers.put(String.valueOf(key), String.valueOf(value)));
        }

        validate();
    }

    @Override
    protected void doSend(Alert alert, String formatted) throws AlertException {
        try {
            String content = buildAlertContent(alert, formatted);
            String response = HttpUtils.send(method, webhookUrl, headers, content, getConfig().getSendTimeout());
            log.debug("Webhook响应: channel={}, body={}", getName(), response);
        } catch (IOException e) {
            throw new AlertException("发送Webhook告警失败: " + getName(), e);
        }
    }

    /**
     * 配置了 health_url 时用 GET 探测, 否则只检查初始化状态
     */
    @Override
    public boolean healthCheck() {
        if (!isInitialized()) {
            return false;
        }
        if (StringUtils.isBlank(healthUrl)) {
            return true;
        }
        try {
            HttpUtils.get(healthUrl, headers, getConfig().getSendTimeout());
            return true;
        } catch (IOException e) {
            log.warn("Webhook健康检查失败: channel={}, url={}, error={}", getName(), healthUrl, e.getMessage());
            return false;
        }
    }

    private String buildAlertContent(Alert alert, String formatted) throws AlertException {
        Map<String, Object> alertData = new LinkedHashMap<>();
        alertData.put("id", alert.getId());
        alertData.put("timestamp", alert.getTimestamp().toString());
        alertData.put("severity", alert.getSeverity().name());
        alertData.put("source", alert.getSource());
        alertData.put("message", alert.getMessage());
        alertData.put("text", formatted);
        alertData.put("count", alert.getCount());
        if (alert.getTag() != null) {
            alertData.put("tag", alert.getTag());
        }
        if (alert.getCorrelationId() != null) {
            alertData.put("correlation_id", alert.getCorrelationId());
        }
        if (!alert.getContext().isEmpty()) {
            alertData.put("context", alert.getContext());
        }
        try {
            return objectMapper.writeValueAsString(alertData);
        } catch (JsonProcessingException e) {
            throw new AlertException("告警内容序列化失败: " + alert.getId(), e);
        }
    }

    private void validate() {
        if (StringUtils.isBlank(webhookUrl)) {
            throw new ConfigurationException("Webhook URL不能为空: " + getName());
        }
        try {
            new URL(webhookUrl);
        } catch (MalformedURLException e) {
            throw new ConfigurationException("无效的Webhook URL: " + webhookUrl, e);
        }
        if (!Arrays.asList("POST", "PUT").contains(method)) {
            throw new ConfigurationException("不支持的HTTP方法: " + method);
        }
    }
}
