package alertpipeline.suppression;

public enum SuppressionAction {
    PASS,
    SUPPRESS,
    QUEUE,
    ESCALATE
}
