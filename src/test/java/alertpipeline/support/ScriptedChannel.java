package alertpipeline.support;

import alertpipeline.channel.AbstractAlertChannel;
import alertpipeline.model.Alert;
import alertpipeline.model.AlertException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Channel double whose failures, latency and health are controlled by the test.
 */
public class ScriptedChannel extends AbstractAlertChannel {

    private final List<Alert> delivered = new CopyOnWriteArrayList<>();
    private final AtomicInteger sendCalls = new AtomicInteger();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final AtomicBoolean alwaysFail = new AtomicBoolean();
    private final AtomicBoolean healthy = new AtomicBoolean(true);
    private volatile Duration sendDelay = Duration.ZERO;
    private volatile CountDownLatch gate;

    public ScriptedChannel failNext(int times) {
        failuresRemaining.set(times);
        return this;
    }

    public ScriptedChannel failAlways(boolean fail) {
        alwaysFail.set(fail);
        return this;
    }

    public ScriptedChannel delay(Duration delay) {
        this.sendDelay = delay;
        return this;
    }

    public ScriptedChannel healthy(boolean value) {
        healthy.set(value);
        return this;
    }

    /**
     * Blocks every send until {@link #release()} is called.
     */
    public ScriptedChannel hold() {
        gate = new CountDownLatch(1);
        return this;
    }

    public void release() {
        CountDownLatch current = gate;
        if (current != null) {
            current.countDown();
        }
    }

    @Override
    protected void doSend(Alert alert, String formatted) {
        sendCalls.incrementAndGet();
        try {
            CountDownLatch current = gate;
            if (current != null && !current.await(30, TimeUnit.SECONDS)) {
                throw new AlertException("gate was never released");
            }
            if (!sendDelay.isZero()) {
                Thread.sleep(sendDelay.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertException("interrupted", e);
        }
        if (alwaysFail.get() || failuresRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new AlertException("simulated failure on " + getName());
        }
        delivered.add(alert);
    }

    @Override
    public boolean healthCheck() {
        return healthy.get();
    }

    public List<Alert> getDelivered() {
        return delivered;
    }

    public int getSendCalls() {
        return sendCalls.get();
    }
}
