package alertpipeline.config;

import alertpipeline.filter.AlertFilter;
import alertpipeline.filter.BlockFilter;
import alertpipeline.filter.CompositeFilter;
import alertpipeline.filter.ContentFilter;
import alertpipeline.filter.CorrelationIdFilter;
import alertpipeline.filter.ListMode;
import alertpipeline.filter.LogicalOperator;
import alertpipeline.filter.MatchType;
import alertpipeline.filter.PassThroughFilter;
import alertpipeline.filter.SeverityFilter;
import alertpipeline.filter.SourceFilter;
import alertpipeline.filter.TagFilter;
import alertpipeline.filter.TimeWindowFilter;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 根据配置节点创建过滤器. 每个节点需要 type 和 name, priority 默认 100
 */
public class FilterFactory {

    private final Clock clock;

    public FilterFactory(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AlertFilter create(ConfigSection section) {
        String type = section.requireString("type").trim().toLowerCase(Locale.ROOT).replace('-', '_');
        String name = section.requireString("name");
        int priority = section.getInt("priority", 100);

        switch (type) {
            case "severity":
                return new SeverityFilter(name, priority,
                        section.getSeverity("min_severity", AlertSeverity.INFO),
                        section.getBoolean("always_allow_critical", true));
            case "source":
                return new SourceFilter(name, priority,
                        section.getStringList("sources"),
                        section.getEnum("mode", ListMode.class, ListMode.WHITELIST),
                        section.getEnum("match", MatchType.class, MatchType.EXACT));
            case "content":
                return new ContentFilter(name, priority,
                        section.getStringList("patterns"),
                        section.getEnum("match", MatchType.class, MatchType.REGEX),
                        section.getBoolean("suppress_on_match", true));
            case "time_window":
                return new TimeWindowFilter(name, priority,
                        parseZone(section),
                        parseTime(section, "start"),
                        parseTime(section, "end"),
                        parseDays(section, "days"),
                        section.getBoolean("allow_inside", true),
                        clock);
            case "tag":
                return new TagFilter(name, priority,
                        section.getStringList("required"),
                        section.getStringList("excluded"),
                        section.getString("default_tag"));
            case "correlation_id":
                return new CorrelationIdFilter(name, priority,
                        section.requireString("pattern"),
                        section.getBoolean("allow_on_match", true));
            case "pass_through":
                return new PassThroughFilter(name, priority);
            case "block":
                return new BlockFilter(name, priority, section.getString("reason"));
            case "composite":
                List<AlertFilter> children = new ArrayList<>();
                for (ConfigSection child : section.getSectionList("filters")) {
                    children.add(create(child));
                }
                return new CompositeFilter(name, priority,
                        section.getEnum("operator", LogicalOperator.class, LogicalOperator.AND),
                        children);
            default:
                throw new ConfigurationException(String.format("%s: 未知的过滤器类型 %s", section.getPath(), type));
        }
    }

    static ZoneId parseZone(ConfigSection section) {
        String zone = section.getString("time_zone", "UTC");
        try {
            return ZoneId.of(zone);
        } catch (RuntimeException e) {
            throw new ConfigurationException(String.format("%s: 无效的时区 %s", section.getPath(), zone), e);
        }
    }

    static LocalTime parseTime(ConfigSection section, String key) {
        String value = section.requireString(key);
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(String.format("%s.%s: 无效的时间 %s", section.getPath(), key, value), e);
        }
    }

    static Set<DayOfWeek> parseDays(ConfigSection section, String key) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String day : section.getStringList(key)) {
            String normalized = day.trim().toUpperCase(Locale.ROOT);
            boolean matched = false;
            for (DayOfWeek candidate : DayOfWeek.values()) {
                if (candidate.name().equals(normalized) || candidate.name().startsWith(normalized) && normalized.length() >= 3) {
                    days.add(candidate);
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                throw new ConfigurationException(String.format("%s.%s: 无效的星期 %s", section.getPath(), key, day));
            }
        }
        return days;
    }
}
