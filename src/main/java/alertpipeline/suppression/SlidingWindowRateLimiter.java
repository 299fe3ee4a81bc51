package alertpipeline.suppression;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 滑动窗口限流器. 记录窗口内每次放行的时间, 不存在固定周期重置带来的边界突发问题
 */
public class SlidingWindowRateLimiter {
    private final int maxPermits;
    private final Duration window;
    private final Deque<Instant> permits = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxPermits, Duration window) {
        this.maxPermits = maxPermits;
        this.window = window;
    }

    /**
     * 窗口 (now - window, now] 内放行次数未达上限时放行并记录
     */
    public synchronized boolean tryAcquire(Instant now) {
        evictExpired(now);
        if (permits.size() >= maxPermits) {
            return false;
        }
        permits.addLast(now);
        return true;
    }

    public synchronized int currentCount(Instant now) {
        evictExpired(now);
        return permits.size();
    }

    public synchronized boolean isIdle(Instant now) {
        evictExpired(now);
        return permits.isEmpty();
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(window);
        while (!permits.isEmpty() && !permits.peekFirst().isAfter(cutoff)) {
            permits.pollFirst();
        }
    }
}
