package alertpipeline.config;

import alertpipeline.history.HistoryStore;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;
import alertpipeline.model.FingerprintField;
import alertpipeline.suppression.BusinessHoursRule;
import alertpipeline.suppression.DuplicateSuppressionRule;
import alertpipeline.suppression.PatternSuppressionRule;
import alertpipeline.suppression.RateLimitRule;
import alertpipeline.suppression.RuleOptions;
import alertpipeline.suppression.SuppressionAction;
import alertpipeline.suppression.SuppressionRule;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 根据配置节点创建抑制规则. 每个节点需要 type 和 name, priority 默认 100
 */
public class SuppressionRuleFactory {

    private final HistoryStore historyStore;

    /**
     * @param historyStore 重复检测配置 use_history 时查询的历史, 可以为空
     */
    public SuppressionRuleFactory(HistoryStore historyStore) {
        this.historyStore = historyStore;
    }

    public SuppressionRule create(ConfigSection section) {
        String type = section.requireString("type").trim().toLowerCase(Locale.ROOT).replace('-', '_');
        String name = section.requireString("name");
        int priority = section.getInt("priority", 100);
        RuleOptions options = RuleOptions.builder()
                .enabled(section.getBoolean("enabled", true))
                .trackStatistics(section.getBoolean("track_statistics", true))
                .statisticsRetention(section.getDuration("statistics_retention", Duration.ofHours(1)))
                .build();

        switch (type) {
            case "duplicate":
                return new DuplicateSuppressionRule(name, priority,
                        section.getDuration("window", Duration.ofMinutes(5)),
                        parseFields(section),
                        section.getDouble("similarity_threshold", 1.0),
                        section.getEnum("action", SuppressionAction.class, SuppressionAction.SUPPRESS),
                        section.getInt("max_tracked", 10_000),
                        section.getBoolean("use_history", false) ? historyStore : null,
                        options);
            case "rate_limit":
                return new RateLimitRule(name, priority,
                        section.getString("source", "*"),
                        section.getSeverity("severity", null),
                        section.getBoolean("per_source", true),
                        section.getInt("max_alerts", 10),
                        section.getDuration("window", Duration.ofMinutes(1)),
                        section.getEnum("action", SuppressionAction.class, SuppressionAction.SUPPRESS),
                        section.getInt("max_tracked", 10_000),
                        section.getInt("max_queue_size", 50),
                        section.getDuration("max_queue_delay", Duration.ofMinutes(5)),
                        options);
            case "business_hours":
                return new BusinessHoursRule(name, priority,
                        FilterFactory.parseZone(section),
                        FilterFactory.parseDays(section, "work_days"),
                        FilterFactory.parseTime(section, "start"),
                        FilterFactory.parseTime(section, "end"),
                        section.getSeverity("business_hours_min_severity", AlertSeverity.WARNING),
                        section.getSeverity("after_hours_min_severity", AlertSeverity.CRITICAL),
                        options);
            case "silence":
            case "pattern":
                return new PatternSuppressionRule(name, priority,
                        section.getString("source"),
                        section.getString("message"),
                        section.getSeverity("max_severity", null),
                        parseInstant(section, "expires_at"),
                        options);
            default:
                throw new ConfigurationException(String.format("%s: 未知的抑制规则类型 %s", section.getPath(), type));
        }
    }

    private static Set<FingerprintField> parseFields(ConfigSection section) {
        List<String> values = section.getStringList("fields");
        if (values.isEmpty()) {
            return EnumSet.of(FingerprintField.SOURCE, FingerprintField.MESSAGE, FingerprintField.SEVERITY);
        }
        Set<FingerprintField> fields = EnumSet.noneOf(FingerprintField.class);
        for (String value : values) {
            try {
                fields.add(FingerprintField.valueOf(value.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(String.format("%s.fields: 未知的字段 %s", section.getPath(), value), e);
            }
        }
        return fields;
    }

    private static Instant parseInstant(ConfigSection section, String key) {
        String value = section.getString(key);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(String.format("%s.%s: 无效的时间 %s", section.getPath(), key, value), e);
        }
    }
}
