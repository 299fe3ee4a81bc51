package alertpipeline.aggregation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 聚合结果. FLUSHED 时携带被关闭的组
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AggregationResult {

    public enum Type {
        IMMEDIATE,
        ACCUMULATED,
        FLUSHED
    }

    private static final AggregationResult IMMEDIATE = new AggregationResult(Type.IMMEDIATE, null);

    private final Type type;
    private final AggregationGroup group;

    public static AggregationResult immediate() {
        return IMMEDIATE;
    }

    public static AggregationResult accumulated(AggregationGroup group) {
        return new AggregationResult(Type.ACCUMULATED, group);
    }

    public static AggregationResult flushed(AggregationGroup group) {
        return new AggregationResult(Type.FLUSHED, group);
    }
}
