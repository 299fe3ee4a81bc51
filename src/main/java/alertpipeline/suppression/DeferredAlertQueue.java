package alertpipeline.suppression;

import alertpipeline.model.Alert;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 有界的延迟队列, 存放被判定为 QUEUE 的告警, 由维护任务重新投入管道
 */
public class DeferredAlertQueue {

    private final int maxSize;
    private final Duration maxDelay;
    private final Deque<DeferredAlert> queue = new ArrayDeque<>();

    public DeferredAlertQueue(int maxSize, Duration maxDelay) {
        this.maxSize = maxSize;
        this.maxDelay = maxDelay;
    }

    /**
     * 入队. queuedSince 为首次入队时间, 重新入队的告警保留原值. 队列已满时返回 false
     */
    public synchronized boolean offer(Alert alert, String ruleName, Instant queuedSince) {
        if (queue.size() >= maxSize) {
            return false;
        }
        queue.addLast(new DeferredAlert(alert, ruleName, queuedSince));
        return true;
    }

    /**
     * 取出全部告警, 按是否超过最大延迟分为待重放和已过期两组
     */
    public synchronized DrainResult drain(Instant now) {
        List<DeferredAlert> ready = new ArrayList<>();
        List<DeferredAlert> expired = new ArrayList<>();
        Instant cutoff = now.minus(maxDelay);
        while (!queue.isEmpty()) {
            DeferredAlert deferred = queue.pollFirst();
            if (deferred.getQueuedSince().isBefore(cutoff)) {
                expired.add(deferred);
            } else {
                ready.add(deferred);
            }
        }
        return new DrainResult(ready, expired);
    }

    public synchronized int size() {
        return queue.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    @Value
    public static class DeferredAlert {
        Alert alert;
        String ruleName;
        Instant queuedSince;
    }

    @Value
    public static class DrainResult {
        List<DeferredAlert> ready;
        List<DeferredAlert> expired;

        public static DrainResult empty() {
            return new DrainResult(List.of(), List.of());
        }

        public DrainResult merge(DrainResult other) {
            List<DeferredAlert> mergedReady = new ArrayList<>(ready);
            mergedReady.addAll(other.ready);
            List<DeferredAlert> mergedExpired = new ArrayList<>(expired);
            mergedExpired.addAll(other.expired);
            return new DrainResult(mergedReady, mergedExpired);
        }
    }
}
