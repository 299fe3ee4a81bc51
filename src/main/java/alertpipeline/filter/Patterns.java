package alertpipeline.filter;

import alertpipeline.model.ConfigurationException;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

final class Patterns {

    private Patterns() {
    }

    static List<Pattern> compileAll(Collection<String> values, MatchType matchType) {
        return values.stream().map(value -> compile(value, matchType)).collect(Collectors.toUnmodifiableList());
    }

    static Pattern compile(String value, MatchType matchType) {
        try {
            return matchType.compile(value);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("无效的匹配表达式: " + value, e);
        }
    }
}
