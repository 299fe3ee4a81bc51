package alertpipeline.channel;

import alertpipeline.model.Alert;
import alertpipeline.model.AlertException;
import alertpipeline.model.ConfigurationException;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 邮件通道 - 通过 SMTP 发送
 */
@Slf4j
public class EmailAlertChannel extends AbstractAlertChannel {

    private static final String DEFAULT_SUBJECT = "[{severity}] Alert from {source}";

    private JavaMailSender mailSender;
    private String from;
    private String[] recipients;
    private String subjectTemplate;

    public EmailAlertChannel() {
    }

    public EmailAlertChannel(JavaMailSender mailSender) {
        this.mailSender = mailSender;
    }

    @Override
    protected void doInitialize(ChannelConfig config) {
        this.from = config.getString("from");
        this.recipients = parseRecipients(config.getSettings().get("to"));
        this.subjectTemplate = config.getString("subject", DEFAULT_SUBJECT);
        if (StringUtils.isBlank(from) || recipients.length == 0) {
            throw new ConfigurationException("邮件通道需要配置 from 和 to: " + config.getName());
        }
        if (mailSender == null) {
            String host = config.getString("host");
            if (StringUtils.isBlank(host)) {
                throw new ConfigurationException("邮件通道需要配置 host: " + config.getName());
            }
            JavaMailSenderImpl sender = new JavaMailSenderImpl();
            sender.setHost(host);
            sender.setPort(config.getInt("port", 25));
            sender.setUsername(config.getString("username"));
            sender.setPassword(config.getString("password"));
            sender.getJavaMailProperties().put("mail.smtp.auth", String.valueOf(config.getString("username") != null));
            sender.getJavaMailProperties().put("mail.smtp.starttls.enable",
                    String.valueOf(config.getBoolean("starttls", false)));
            String timeoutMillis = String.valueOf(config.getSendTimeout().toMillis());
            sender.getJavaMailProperties().put("mail.smtp.connectiontimeout", timeoutMillis);
            sender.getJavaMailProperties().put("mail.smtp.timeout", timeoutMillis);
            this.mailSender = sender;
        }
    }

    @Override
    protected void doSend(Alert alert, String formatted) throws AlertException {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(recipients);
        message.setSubject(renderSubject(alert));
        message.setText(formatted);
        message.setSentDate(Date.from(alert.getTimestamp()));
        try {
            mailSender.send(message);
        } catch (MailException e) {
            throw new AlertException("发送邮件告警失败: " + getName(), e);
        }
    }

    @Override
    public boolean healthCheck() {
        if (!isInitialized()) {
            return false;
        }
        if (!(mailSender instanceof JavaMailSenderImpl)) {
            return true;
        }
        try {
            ((JavaMailSenderImpl) mailSender).testConnection();
            return true;
        } catch (MessagingException e) {
            log.warn("邮件服务器连接失败: channel={}, error={}", getName(), e.getMessage());
            return false;
        }
    }

    private String renderSubject(Alert alert) {
        return StringUtils.replaceEach(subjectTemplate,
                new String[]{"{severity}", "{source}", "{id}"},
                new String[]{alert.getSeverity().name(), alert.getSource(), alert.getId()});
    }

    private static String[] parseRecipients(Object value) {
        if (value == null) {
            return new String[0];
        }
        List<String> addresses;
        if (value instanceof Collection) {
            addresses = ((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.toList());
        } else {
            addresses = Arrays.asList(value.toString().split(","));
        }
        return addresses.stream().map(String::trim).filter(StringUtils::isNotBlank).toArray(String[]::new);
    }
}
