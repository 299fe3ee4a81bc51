package alertpipeline.filter;

import alertpipeline.model.Alert;
import alertpipeline.model.ConfigurationException;
import org.apache.commons.collections4.CollectionUtils;

import java.util.List;
import java.util.Objects;

/**
 * 组合过滤器. 子过滤器的修改结果视为放行, 组合过滤器本身只产生放行或抑制.
 * XOR 表示恰好一个子过滤器放行; NOT 只接受一个子过滤器并取反
 */
public class CompositeFilter extends AbstractAlertFilter {

    private final LogicalOperator operator;
    private final List<AlertFilter> children;

    public CompositeFilter(String name, int priority, LogicalOperator operator, List<AlertFilter> children) {
        super(name, priority);
        this.operator = Objects.requireNonNull(operator, "operator");
        if (CollectionUtils.isEmpty(children)) {
            throw new ConfigurationException("组合过滤器至少需要一个子过滤器: " + name);
        }
        if (operator == LogicalOperator.NOT && children.size() != 1) {
            throw new ConfigurationException("NOT组合过滤器只能包含一个子过滤器: " + name);
        }
        this.children = List.copyOf(children);
    }

    @Override
    public FilterDecision evaluate(Alert alert) {
        boolean allowed;
        switch (operator) {
            case AND:
                allowed = children.stream().allMatch(child -> child.evaluate(alert).isAllowed());
                break;
            case OR:
                allowed = children.stream().anyMatch(child -> child.evaluate(alert).isAllowed());
                break;
            case XOR:
                allowed = children.stream().filter(child -> child.evaluate(alert).isAllowed()).count() == 1;
                break;
            case NOT:
            default:
                allowed = !children.get(0).evaluate(alert).isAllowed();
        }
        return allowed ? FilterDecision.allow() : FilterDecision.suppress("Composite" + operator.name());
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public List<AlertFilter> getChildren() {
        return children;
    }
}
