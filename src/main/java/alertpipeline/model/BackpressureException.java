package alertpipeline.model;

/**
 * 告警缓冲区已满, 无法接纳新的告警
 */
public class BackpressureException extends AlertException {
    private final int inFlight;
    private final int capacity;

    public BackpressureException(int inFlight, int capacity) {
        super(String.format("告警缓冲区已满: inFlight=%d, capacity=%d", inFlight, capacity));
        this.inFlight = inFlight;
        this.capacity = capacity;
    }

    public int getInFlight() {
        return inFlight;
    }

    public int getCapacity() {
        return capacity;
    }
}
