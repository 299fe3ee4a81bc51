package alertpipeline.model;

import org.apache.commons.lang3.StringUtils;

/**
 * 告警级别, 按严重程度升序排列
 */
public enum AlertSeverity {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL,
    EMERGENCY;

    public boolean isAtLeast(AlertSeverity other) {
        return compareTo(other) >= 0;
    }

    public boolean isAtMost(AlertSeverity other) {
        return compareTo(other) <= 0;
    }

    /**
     * 解析级别名称, 忽略大小写. 无法识别时抛出 IllegalArgumentException
     */
    public static AlertSeverity parse(String value) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("告警级别不能为空");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("未知的告警级别: " + value, e);
        }
    }
}
