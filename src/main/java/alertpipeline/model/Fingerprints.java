package alertpipeline.model;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 告警指纹 - 用于识别"相同"告警的派生键. 时间戳不参与计算
 */
public final class Fingerprints {

    private static final Pattern UUID_PATTERN =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern HEX_PATTERN = Pattern.compile("\\b0x[0-9a-fA-F]+\\b");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    public static final Set<FingerprintField> ALL_FIELDS = Collections.unmodifiableSet(EnumSet.allOf(FingerprintField.class));

    private Fingerprints() {
    }

    /**
     * 按指定字段计算指纹
     */
    public static String of(Alert alert, Set<FingerprintField> fields) {
        StringBuilder key = new StringBuilder();
        for (FingerprintField field : FingerprintField.values()) {
            if (!fields.contains(field)) {
                continue;
            }
            key.append(field.name()).append('=');
            switch (field) {
                case SOURCE:
                    key.append(alert.getSource().toLowerCase(Locale.ROOT));
                    break;
                case MESSAGE:
                    key.append(alert.getMessage());
                    break;
                case SEVERITY:
                    key.append(alert.getSeverity().name());
                    break;
                case TAG:
                default:
                    key.append(alert.getTag() != null ? alert.getTag().toLowerCase(Locale.ROOT) : "");
            }
            key.append('|');
        }
        return DigestUtils.md5Hex(key.toString());
    }

    /**
     * 聚合用的相似指纹: 来源 + 级别 + 消息形态(数字、UUID等可变部分被归一化)
     */
    public static String similarity(Alert alert) {
        String key = alert.getSource().toLowerCase(Locale.ROOT)
                + '|' + alert.getSeverity().name()
                + '|' + messageShape(alert.getMessage());
        return DigestUtils.md5Hex(key);
    }

    public static String messageShape(String message) {
        String shape = UUID_PATTERN.matcher(message).replaceAll("<id>");
        shape = HEX_PATTERN.matcher(shape).replaceAll("<hex>");
        shape = NUMBER_PATTERN.matcher(shape).replaceAll("<n>");
        return WHITESPACE.matcher(shape.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public static Set<String> tokens(String message) {
        return Arrays.stream(TOKEN_SEPARATOR.split(message.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }

    /**
     * 两组词的 Jaccard 重合度, 取值 0.0 - 1.0
     */
    public static double tokenOverlap(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        long shared = left.stream().filter(right::contains).count();
        int union = left.size() + right.size() - (int) shared;
        return union == 0 ? 1.0 : (double) shared / union;
    }
}
