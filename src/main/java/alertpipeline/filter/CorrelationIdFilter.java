package alertpipeline.filter;

import alertpipeline.model.Alert;

import java.util.regex.Pattern;

/**
 * 关联ID过滤器. 没有关联ID的告警视为不匹配
 */
public class CorrelationIdFilter extends AbstractAlertFilter {

    private final Pattern pattern;
    private final boolean allowOnMatch;

    public CorrelationIdFilter(String name, int priority, String pattern, boolean allowOnMatch) {
        super(name, priority);
        this.pattern = Patterns.compile(pattern, MatchType.REGEX);
        this.allowOnMatch = allowOnMatch;
    }

    @Override
    public FilterDecision evaluate(Alert alert) {
        String correlationId = alert.getCorrelationId();
        boolean matched = correlationId != null && pattern.matcher(correlationId).matches();
        if (matched == allowOnMatch) {
            return FilterDecision.allow();
        }
        return FilterDecision.suppress(allowOnMatch ? "CorrelationIdNotMatched" : "CorrelationIdMatched");
    }
}
