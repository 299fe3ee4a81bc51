package alertpipeline.channel;

import org.apache.commons.lang3.StringUtils;

/**
 * 通道类型
 */
public enum ChannelType {
    LOG,
    CONSOLE,
    WEBHOOK,
    EMAIL,
    IN_MEMORY,
    CUSTOM;

    public static ChannelType parse(String value) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("通道类型不能为空");
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        if ("MEMORY".equals(normalized) || "INMEMORY".equals(normalized)) {
            return IN_MEMORY;
        }
        return valueOf(normalized);
    }
}
