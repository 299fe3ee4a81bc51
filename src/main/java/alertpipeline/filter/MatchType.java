package alertpipeline.filter;

import java.util.regex.Pattern;

/**
 * 字符串匹配方式
 */
public enum MatchType {
    EXACT,
    IGNORE_CASE,
    REGEX,
    WILDCARD;

    /**
     * 编译为正则表达式, 便于统一匹配
     */
    public Pattern compile(String value) {
        switch (this) {
            case EXACT:
                return Pattern.compile(Pattern.quote(value));
            case IGNORE_CASE:
                return Pattern.compile(Pattern.quote(value), Pattern.CASE_INSENSITIVE);
            case REGEX:
                return Pattern.compile(value);
            case WILDCARD:
            default:
                return wildcard(value);
        }
    }

    /**
     * '*' 匹配任意字符序列, 忽略大小写
     */
    public static Pattern wildcard(String pattern) {
        String[] parts = pattern.split("\\*", -1);
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            if (!parts[i].isEmpty()) {
                regex.append(Pattern.quote(parts[i]));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }
}
