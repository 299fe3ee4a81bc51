package alertpipeline.config;

import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YAML 配置的一个节点, 支持用点号分隔的键访问嵌套值
 */
public class ConfigSection {

    private static final Pattern SHORT_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)");

    private final String path;
    private final Map<String, Object> values;

    public ConfigSection(String path, Map<String, Object> values) {
        this.path = path;
        this.values = values != null ? values : Collections.emptyMap();
    }

    public String getString(String key) {
        return getString(key, null);
    }

    public String getString(String key, String defaultValue) {
        Object value = getValue(key);
        return value != null ? value.toString() : defaultValue;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (StringUtils.isBlank(value)) {
            throw new ConfigurationException(String.format("缺少必填配置项: %s", qualify(key)));
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String && StringUtils.isNotBlank((String) value)) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(String.format("配置项%s不是整数: %s", qualify(key), value), e);
            }
        }
        return defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && StringUtils.isNotBlank((String) value)) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(String.format("配置项%s不是数字: %s", qualify(key), value), e);
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = getValue(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    public Duration getDuration(String key, Duration defaultValue) {
        Object value = getValue(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return Duration.ofSeconds(((Number) value).longValue());
        }
        try {
            return parseDuration(value.toString());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(String.format("配置项%s不是有效的时长: %s", qualify(key), value), e);
        }
    }

    public AlertSeverity getSeverity(String key, AlertSeverity defaultValue) {
        String value = getString(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return AlertSeverity.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(String.format("配置项%s: %s", qualify(key), e.getMessage()), e);
        }
    }

    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = getString(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(String.format("配置项%s的值无效: %s", qualify(key), value), e);
        }
    }

    /**
     * 获取字符串列表. 单个字符串按逗号拆分
     */
    public List<String> getStringList(String key) {
        Object value = getValue(key);
        if (value instanceof List) {
            List<String> result = new ArrayList<>();
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        if (value instanceof String && StringUtils.isNotBlank((String) value)) {
            List<String> result = new ArrayList<>();
            for (String item : ((String) value).split(",")) {
                if (StringUtils.isNotBlank(item)) {
                    result.add(item.trim());
                }
            }
            return result;
        }
        return Collections.emptyList();
    }

    @SuppressWarnings("unchecked")
    public ConfigSection getSection(String key) {
        Object value = getValue(key);
        if (value instanceof Map) {
            return new ConfigSection(qualify(key), (Map<String, Object>) value);
        }
        return new ConfigSection(qualify(key), Collections.emptyMap());
    }

    @SuppressWarnings("unchecked")
    public List<ConfigSection> getSectionList(String key) {
        Object value = getValue(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException(String.format("配置项%s必须是列表", qualify(key)));
        }
        List<ConfigSection> sections = new ArrayList<>();
        List<?> items = (List<?>) value;
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (!(item instanceof Map)) {
                throw new ConfigurationException(String.format("配置项%s[%d]必须是对象", qualify(key), i));
            }
            sections.add(new ConfigSection(qualify(key) + "[" + i + "]", (Map<String, Object>) item));
        }
        return sections;
    }

    public boolean contains(String key) {
        return getValue(key) != null;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String getPath() {
        return path;
    }

    @SuppressWarnings("unchecked")
    private Object getValue(String key) {
        if (StringUtils.isEmpty(key)) {
            return null;
        }
        String[] parts = key.split("\\.");
        Map<String, Object> current = values;
        for (int i = 0; i < parts.length - 1; i++) {
            Object value = current.get(parts[i]);
            if (!(value instanceof Map)) {
                return null;
            }
            current = (Map<String, Object>) value;
        }
        return current.get(parts[parts.length - 1]);
    }

    private String qualify(String key) {
        return StringUtils.isEmpty(path) ? key : path + "." + key;
    }

    /**
     * 解析时长: ISO-8601 (PT5M) 或简写 (500ms, 30s, 5m, 2h, 1d)
     */
    public static Duration parseDuration(String text) {
        String value = StringUtils.trimToEmpty(text);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("时长不能为空");
        }
        if (value.toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("无效的时长: " + text, e);
            }
        }
        Matcher matcher = SHORT_DURATION.matcher(value.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("无效的时长: " + text);
        }
        long amount = Long.parseLong(matcher.group(1));
        switch (matcher.group(2)) {
            case "ms":
                return Duration.ofMillis(amount);
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
            default:
                return Duration.ofDays(amount);
        }
    }
}
