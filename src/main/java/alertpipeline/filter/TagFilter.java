package alertpipeline.filter;

import alertpipeline.model.Alert;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 标签过滤器. 可要求标签存在于指定集合, 排除指定标签, 并为无标签的告警补充默认标签
 */
public class TagFilter extends AbstractAlertFilter {

    private final Set<String> requiredTags;
    private final Set<String> excludedTags;
    private final String defaultTag;

    public TagFilter(String name, int priority, Collection<String> requiredTags,
                     Collection<String> excludedTags, String defaultTag) {
        super(name, priority);
        this.requiredTags = normalize(requiredTags);
        this.excludedTags = normalize(excludedTags);
        this.defaultTag = StringUtils.trimToNull(defaultTag);
    }

    @Override
    public FilterDecision evaluate(Alert alert) {
        Alert current = alert;
        if (current.getTag() == null && defaultTag != null) {
            current = current.withTag(defaultTag);
        }
        String tag = current.getTag() != null ? current.getTag().toLowerCase(Locale.ROOT) : null;

        if (tag != null && excludedTags.contains(tag)) {
            return FilterDecision.suppress("ExcludedTag");
        }
        if (!requiredTags.isEmpty() && (tag == null || !requiredTags.contains(tag))) {
            return FilterDecision.suppress("MissingRequiredTag");
        }
        return current == alert ? FilterDecision.allow() : FilterDecision.modify(current);
    }

    private static Set<String> normalize(Collection<String> tags) {
        if (tags == null) {
            return Set.of();
        }
        return tags.stream()
                .filter(StringUtils::isNotBlank)
                .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
