package alertpipeline.filter;

public enum LogicalOperator {
    AND,
    OR,
    XOR,
    NOT
}
