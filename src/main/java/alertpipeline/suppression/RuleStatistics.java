package alertpipeline.suppression;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 规则触发统计. 触发记录只保留 retention 时间窗口内的部分, 与告警历史的保留期无关
 */
public class RuleStatistics {

    private final String ruleName;
    private final Duration retention;
    private final boolean enabled;
    private final Deque<Instant> triggers = new ArrayDeque<>();
    private long evaluations;
    private long totalTriggered;
    private Instant lastTriggered;

    public RuleStatistics(String ruleName, Duration retention, boolean enabled) {
        this.ruleName = ruleName;
        this.retention = retention;
        this.enabled = enabled;
    }

    public synchronized void recordEvaluation() {
        evaluations++;
    }

    public synchronized void recordTrigger(Instant now) {
        totalTriggered++;
        lastTriggered = now;
        if (enabled) {
            triggers.addLast(now);
            prune(now);
        }
    }

    public synchronized void prune(Instant now) {
        Instant cutoff = now.minus(retention);
        while (!triggers.isEmpty() && triggers.peekFirst().isBefore(cutoff)) {
            triggers.pollFirst();
        }
    }

    public synchronized Snapshot snapshot(Instant now) {
        prune(now);
        return new Snapshot(ruleName, evaluations, totalTriggered, enabled ? triggers.size() : 0, lastTriggered);
    }

    @Value
    public static class Snapshot {
        String ruleName;
        long evaluations;
        long totalTriggered;
        /** 保留窗口内的触发次数 */
        int triggeredInWindow;
        Instant lastTriggered;
    }
}
