package alertpipeline.filter;

import alertpipeline.model.Alert;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 单个过滤器对告警的判定: 放行 / 抑制 / 修改
 */
@Getter
@ToString
public final class FilterDecision {

    public enum Type {
        ALLOW,
        SUPPRESS,
        MODIFY
    }

    private static final FilterDecision ALLOW = new FilterDecision(Type.ALLOW, null, null, null);

    private final Type type;
    private final Alert modifiedAlert;
    private final String reason;
    private final String filterName;

    private FilterDecision(Type type, Alert modifiedAlert, String reason, String filterName) {
        this.type = type;
        this.modifiedAlert = modifiedAlert;
        this.reason = reason;
        this.filterName = filterName;
    }

    public static FilterDecision allow() {
        return ALLOW;
    }

    public static FilterDecision suppress(String reason) {
        return new FilterDecision(Type.SUPPRESS, null, reason, null);
    }

    public static FilterDecision modify(Alert modifiedAlert) {
        return new FilterDecision(Type.MODIFY, Objects.requireNonNull(modifiedAlert, "modifiedAlert"), null, null);
    }

    FilterDecision attributedTo(String name) {
        return new FilterDecision(type, modifiedAlert, reason, name);
    }

    public boolean isSuppressed() {
        return type == Type.SUPPRESS;
    }

    public boolean isAllowed() {
        return type != Type.SUPPRESS;
    }
}
