package alertpipeline.history;

import alertpipeline.model.Alert;
import alertpipeline.model.ConfigurationException;
import alertpipeline.model.Disposition;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * 告警历史 - 同时受条数上限(先进先出淘汰)和保留时间约束.
 * 超过保留时间但尚未被清理的记录对查询不可见
 */
@Slf4j
public class HistoryStore {

    private final int maxEntries;
    private final Duration retention;
    private final Clock clock;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long evictedByCount;
    private long evictedByAge;

    public HistoryStore(int maxEntries, Duration retention) {
        this(maxEntries, retention, Clock.systemUTC());
    }

    public HistoryStore(int maxEntries, Duration retention, Clock clock) {
        if (maxEntries <= 0) {
            throw new ConfigurationException("maxHistoryEntries必须大于0: " + maxEntries);
        }
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new ConfigurationException("historyRetention必须大于0: " + retention);
        }
        this.maxEntries = maxEntries;
        this.retention = retention;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public HistoryEntry record(Alert alert, Disposition disposition, String reason) {
        HistoryEntry entry = new HistoryEntry(alert, disposition, clock.instant(), reason);
        record(entry);
        return entry;
    }

    public void record(HistoryEntry entry) {
        Objects.requireNonNull(entry, "entry");
        lock.writeLock().lock();
        try {
            entries.addLast(entry);
            while (entries.size() > maxEntries) {
                entries.pollFirst();
                evictedByCount++;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 按条件查询, 结果按记录时间从旧到新排列
     */
    public List<HistoryEntry> query(Predicate<HistoryEntry> predicate) {
        Instant cutoff = clock.instant().minus(retention);
        List<HistoryEntry> result = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (HistoryEntry entry : entries) {
                if (!entry.getTimestamp().isBefore(cutoff) && predicate.test(entry)) {
                    result.add(entry);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    public List<HistoryEntry> getAll() {
        return query(entry -> true);
    }

    public List<HistoryEntry> getSince(Duration period) {
        Instant since = clock.instant().minus(period);
        return query(entry -> !entry.getTimestamp().isBefore(since));
    }

    /**
     * 查找最近一条满足条件的记录
     */
    public Optional<HistoryEntry> findLatest(Predicate<HistoryEntry> predicate) {
        Instant cutoff = clock.instant().minus(retention);
        lock.readLock().lock();
        try {
            Iterator<HistoryEntry> iterator = entries.descendingIterator();
            while (iterator.hasNext()) {
                HistoryEntry entry = iterator.next();
                if (entry.getTimestamp().isBefore(cutoff)) {
                    break;
                }
                if (predicate.test(entry)) {
                    return Optional.of(entry);
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 清理超过保留时间的记录, 返回清理的条数
     */
    public int prune() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        lock.writeLock().lock();
        try {
            while (!entries.isEmpty() && entries.peekFirst().getTimestamp().isBefore(cutoff)) {
                entries.pollFirst();
                removed++;
            }
            evictedByAge += removed;
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            log.debug("历史记录清理完成: 清理{}条", removed);
        }
        return removed;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("告警历史已清空");
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<Disposition, Long> countByDisposition() {
        Map<Disposition, Long> counts = new EnumMap<>(Disposition.class);
        for (HistoryEntry entry : getAll()) {
            counts.merge(entry.getDisposition(), 1L, Long::sum);
        }
        return counts;
    }

    public long getEvictedByCount() {
        lock.readLock().lock();
        try {
            return evictedByCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getEvictedByAge() {
        lock.readLock().lock();
        try {
            return evictedByAge;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public Duration getRetention() {
        return retention;
    }
}
