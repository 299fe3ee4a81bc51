package alertpipeline.model;

public enum AlertState {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED
}
