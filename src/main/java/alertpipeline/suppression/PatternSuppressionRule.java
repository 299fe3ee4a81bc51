package alertpipeline.suppression;

import alertpipeline.filter.MatchType;
import alertpipeline.model.Alert;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * 静默规则. 来源和消息匹配通配符、且级别不高于 maxSeverity 的告警被抑制, 到达 expiresAt 后自动失效
 */
public class PatternSuppressionRule extends AbstractSuppressionRule {

    public static final String REASON = "Silenced";

    private final Pattern sourcePattern;
    private final Pattern messagePattern;
    private final AlertSeverity maxSeverity;
    private final Instant expiresAt;

    public PatternSuppressionRule(String name, int priority, String sourcePattern, String messagePattern,
                                  AlertSeverity maxSeverity, Instant expiresAt, RuleOptions options) {
        super(name, priority, options);
        if (StringUtils.isAllBlank(sourcePattern, messagePattern)) {
            throw new ConfigurationException("静默规则至少需要来源或消息表达式: " + name);
        }
        this.sourcePattern = StringUtils.isBlank(sourcePattern) ? null : MatchType.wildcard(sourcePattern);
        this.messagePattern = StringUtils.isBlank(messagePattern) ? null : MatchType.wildcard(messagePattern);
        this.maxSeverity = maxSeverity;
        this.expiresAt = expiresAt;
    }

    @Override
    public SuppressionVerdict evaluate(Alert alert, Instant now) {
        if (isExpired(now)) {
            return SuppressionVerdict.pass();
        }
        getStatistics().recordEvaluation();
        if (sourcePattern != null && !sourcePattern.matcher(alert.getSource()).matches()) {
            return SuppressionVerdict.pass();
        }
        if (messagePattern != null && !messagePattern.matcher(alert.getMessage()).matches()) {
            return SuppressionVerdict.pass();
        }
        if (maxSeverity != null && !alert.getSeverity().isAtMost(maxSeverity)) {
            return SuppressionVerdict.pass();
        }
        getStatistics().recordTrigger(now);
        return SuppressionVerdict.suppress(getName(), REASON);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
