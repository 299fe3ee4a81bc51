package alertpipeline.filter;

import alertpipeline.model.Alert;
import alertpipeline.model.ConfigurationException;
import org.apache.commons.collections4.CollectionUtils;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 内容过滤器. suppressOnMatch 为 true 时抑制匹配的告警, 否则只放行匹配的告警
 */
public class ContentFilter extends AbstractAlertFilter {

    private final List<Pattern> patterns;
    private final boolean suppressOnMatch;

    public ContentFilter(String name, int priority, Collection<String> patterns, MatchType matchType, boolean suppressOnMatch) {
        super(name, priority);
        if (CollectionUtils.isEmpty(patterns)) {
            throw new ConfigurationException("内容过滤器至少需要一个匹配表达式: " + name);
        }
        this.patterns = Patterns.compileAll(patterns, matchType);
        this.suppressOnMatch = suppressOnMatch;
    }

    @Override
    public FilterDecision evaluate(Alert alert) {
        // 部分匹配即可
        boolean matched = patterns.stream().anyMatch(p -> p.matcher(alert.getMessage()).find());
        if (matched == suppressOnMatch) {
            return FilterDecision.suppress(suppressOnMatch ? "ContentMatched" : "ContentNotMatched");
        }
        return FilterDecision.allow();
    }
}
