package alertpipeline.filter;

import alertpipeline.model.Alert;
import alertpipeline.model.ConfigurationException;
import org.apache.commons.collections4.CollectionUtils;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 来源黑白名单过滤器
 */
public class SourceFilter extends AbstractAlertFilter {

    private final List<Pattern> patterns;
    private final ListMode mode;

    public SourceFilter(String name, int priority, Collection<String> sources, ListMode mode, MatchType matchType) {
        super(name, priority);
        if (CollectionUtils.isEmpty(sources)) {
            throw new ConfigurationException("来源过滤器至少需要一个来源: " + name);
        }
        this.mode = Objects.requireNonNull(mode, "mode");
        this.patterns = Patterns.compileAll(sources, Objects.requireNonNull(matchType, "matchType"));
    }

    @Override
    public FilterDecision evaluate(Alert alert) {
        boolean listed = patterns.stream().anyMatch(p -> p.matcher(alert.getSource()).matches());
        if (mode == ListMode.WHITELIST) {
            return listed ? FilterDecision.allow() : FilterDecision.suppress("SourceNotWhitelisted");
        }
        return listed ? FilterDecision.suppress("SourceBlacklisted") : FilterDecision.allow();
    }
}
