package alertpipeline.channel;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
