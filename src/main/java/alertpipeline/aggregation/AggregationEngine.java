package alertpipeline.aggregation;

import alertpipeline.model.Alert;
import alertpipeline.model.ConfigurationException;
import alertpipeline.model.Fingerprints;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 聚合引擎 - 相似告警在窗口内合并为一个组, 组满或窗口到期时整体输出.
 * <p>
 * 达到上限的组由 offer 同步返回; 窗口到期的组交给 flush 监听器, 由定时任务或下一次同指纹的 offer 触发.
 */
@Slf4j
public class AggregationEngine {

    private final boolean enabled;
    private final Duration window;
    private final int maxSize;
    private final Clock clock;
    private final Map<String, AggregationGroup> groups = new ConcurrentHashMap<>();
    private final AtomicLong accumulated = new AtomicLong();
    private final AtomicLong flushedGroups = new AtomicLong();
    private volatile Consumer<AggregationGroup> flushListener = group -> { };

    public AggregationEngine(boolean enabled, Duration window, int maxSize, Clock clock) {
        if (enabled) {
            if (window == null || window.isZero() || window.isNegative()) {
                throw new ConfigurationException("aggregationWindow必须大于0: " + window);
            }
            if (maxSize <= 0) {
                throw new ConfigurationException("maxAggregationSize必须大于0: " + maxSize);
            }
        }
        this.enabled = enabled;
        this.window = window;
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void setFlushListener(Consumer<AggregationGroup> flushListener) {
        this.flushListener = Objects.requireNonNull(flushListener, "flushListener");
    }

    public AggregationResult offer(Alert alert) {
        if (!enabled) {
            return AggregationResult.immediate();
        }
        Instant now = clock.instant();
        String fingerprint = Fingerprints.similarity(alert);

        AggregationGroup[] expired = new AggregationGroup[1];
        AggregationGroup[] full = new AggregationGroup[1];
        AggregationGroup current = groups.compute(fingerprint, (key, group) -> {
            if (group != null && group.isExpired(now, window)) {
                expired[0] = group;
                group = null;
            }
            if (group == null) {
                group = new AggregationGroup(key, alert, now, maxSize);
            } else {
                group.add(alert, now);
            }
            if (group.getCount() >= maxSize) {
                full[0] = group;
                return null;
            }
            return group;
        });

        if (expired[0] != null) {
            emit(expired[0]);
        }
        if (full[0] != null) {
            flushedGroups.incrementAndGet();
            log.debug("聚合组达到上限, 立即输出: {}", full[0]);
            return AggregationResult.flushed(full[0]);
        }
        accumulated.incrementAndGet();
        return AggregationResult.accumulated(current);
    }

    /**
     * 输出所有窗口已到期的组, 返回输出的组数
     */
    public int flushExpired() {
        if (!enabled) {
            return 0;
        }
        Instant now = clock.instant();
        List<AggregationGroup> expired = new ArrayList<>();
        for (String key : groups.keySet()) {
            groups.computeIfPresent(key, (k, group) -> {
                if (group.isExpired(now, window)) {
                    expired.add(group);
                    return null;
                }
                return group;
            });
        }
        expired.forEach(this::emit);
        return expired.size();
    }

    /**
     * 不论是否到期, 输出所有未关闭的组. 关闭管道时调用
     */
    public int flushAll() {
        List<AggregationGroup> all = new ArrayList<>();
        for (String key : groups.keySet()) {
            AggregationGroup group = groups.remove(key);
            if (group != null) {
                all.add(group);
            }
        }
        all.forEach(this::emit);
        return all.size();
    }

    private void emit(AggregationGroup group) {
        flushedGroups.incrementAndGet();
        try {
            flushListener.accept(group);
        } catch (Exception e) {
            log.error("聚合组输出失败: {}", group, e);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getWindow() {
        return window;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getOpenGroupCount() {
        return groups.size();
    }

    public long getAccumulated() {
        return accumulated.get();
    }

    public long getFlushedGroups() {
        return flushedGroups.get();
    }
}
