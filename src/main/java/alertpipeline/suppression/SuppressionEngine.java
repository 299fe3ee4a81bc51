package alertpipeline.suppression;

import alertpipeline.model.Alert;
import alertpipeline.model.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 抑制引擎 - 按优先级升序评估规则, 第一个非 PASS 的判定生效, 之后的规则不再评估.
 * <p>
 * 规则列表写时复制; 各规则自行保护内部状态(按指纹/来源分片), 引擎本身不加全局锁.
 * 告警最终未被放行(抑制或进入延迟队列)时, 之前放行它的规则会收到 release 回调.
 */
@Slf4j
public class SuppressionEngine {

    public static final String REASON_QUEUE_FULL = "QueueFull";

    private final Clock clock;
    private final Object mutationLock = new Object();
    private volatile List<SuppressionRule> rules = Collections.emptyList();
    private volatile boolean enabled = true;

    private final AtomicLong evaluated = new AtomicLong();
    private final AtomicLong suppressed = new AtomicLong();
    private final AtomicLong queued = new AtomicLong();
    private final AtomicLong escalated = new AtomicLong();
    private final AtomicLong ruleErrors = new AtomicLong();

    public SuppressionEngine(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addRule(SuppressionRule rule) {
        Objects.requireNonNull(rule, "rule");
        synchronized (mutationLock) {
            if (findRule(rule.getName()).isPresent()) {
                throw new ConfigurationException("抑制规则名称重复: " + rule.getName());
            }
            List<SuppressionRule> updated = new ArrayList<>(rules);
            updated.add(rule);
            updated.sort(Comparator.comparingInt(SuppressionRule::getPriority));
            rules = Collections.unmodifiableList(updated);
        }
        log.info("抑制规则已添加: {}", rule);
    }

    public boolean removeRule(String name) {
        synchronized (mutationLock) {
            List<SuppressionRule> updated = new ArrayList<>(rules);
            boolean removed = updated.removeIf(rule -> rule.getName().equals(name));
            if (removed) {
                rules = Collections.unmodifiableList(updated);
                log.info("抑制规则已移除: {}", name);
            }
            return removed;
        }
    }

    public boolean enableRule(String name) {
        return findRule(name).map(rule -> {
            rule.setEnabled(true);
            return true;
        }).orElse(false);
    }

    public boolean disableRule(String name) {
        return findRule(name).map(rule -> {
            rule.setEnabled(false);
            return true;
        }).orElse(false);
    }

    public SuppressionVerdict evaluate(Alert alert) {
        return evaluate(alert, null);
    }

    /**
     * 评估告警. queuedSince 不为空表示这是延迟队列重放的告警, 再次排队时保留首次入队时间
     */
    public SuppressionVerdict evaluate(Alert alert, Instant queuedSince) {
        if (!enabled) {
            return SuppressionVerdict.pass();
        }
        evaluated.incrementAndGet();
        Instant now = clock.instant();

        List<SuppressionRule> passed = new ArrayList<>();
        for (SuppressionRule rule : rules) {
            if (!rule.isEnabled()) {
                continue;
            }
            SuppressionVerdict verdict;
            try {
                verdict = rule.evaluate(alert, now);
            } catch (Exception e) {
                ruleErrors.incrementAndGet();
                log.warn("抑制规则执行异常, 按放行处理: rule={}, alert={}", rule.getName(), alert.getId(), e);
                continue;
            }
            if (verdict == null || verdict.isPass()) {
                passed.add(rule);
                continue;
            }
            SuppressionVerdict applied = apply(rule, verdict, alert, queuedSince != null ? queuedSince : now);
            if (applied.getAction() != SuppressionAction.ESCALATE) {
                release(passed, alert);
            }
            return applied;
        }
        return SuppressionVerdict.pass();
    }

    private void release(List<SuppressionRule> passed, Alert alert) {
        for (SuppressionRule rule : passed) {
            try {
                rule.release(alert);
            } catch (Exception e) {
                ruleErrors.incrementAndGet();
                log.warn("抑制规则状态回滚失败: rule={}, alert={}", rule.getName(), alert.getId(), e);
            }
        }
    }

    private SuppressionVerdict apply(SuppressionRule rule, SuppressionVerdict verdict, Alert alert, Instant queuedSince) {
        switch (verdict.getAction()) {
            case QUEUE:
                if (rule instanceof QueueingRule
                        && ((QueueingRule) rule).getDeferredQueue().offer(alert, rule.getName(), queuedSince)) {
                    queued.incrementAndGet();
                    log.debug("告警进入延迟队列: rule={}, alert={}", rule.getName(), alert.getId());
                    return verdict;
                }
                suppressed.incrementAndGet();
                log.debug("延迟队列已满, 告警被抑制: rule={}, alert={}", rule.getName(), alert.getId());
                return SuppressionVerdict.suppress(rule.getName(), REASON_QUEUE_FULL);
            case ESCALATE:
                escalated.incrementAndGet();
                log.debug("告警被规则升级: rule={}, alert={}", rule.getName(), alert.getId());
                return verdict;
            case SUPPRESS:
            default:
                suppressed.incrementAndGet();
                log.debug("告警被抑制: rule={}, alert={}, reason={}", rule.getName(), alert.getId(), verdict.getReason());
                return verdict;
        }
    }

    /**
     * 取出所有规则延迟队列中的告警
     */
    public DeferredAlertQueue.DrainResult drainDeferred(Instant now) {
        DeferredAlertQueue.DrainResult result = DeferredAlertQueue.DrainResult.empty();
        for (SuppressionRule rule : rules) {
            if (rule instanceof QueueingRule) {
                result = result.merge(((QueueingRule) rule).getDeferredQueue().drain(now));
            }
        }
        return result;
    }

    public int deferredSize() {
        int size = 0;
        for (SuppressionRule rule : rules) {
            if (rule instanceof QueueingRule) {
                size += ((QueueingRule) rule).getDeferredQueue().size();
            }
        }
        return size;
    }

    /**
     * 清理各规则的过期状态和统计
     */
    public void prune(Instant now) {
        for (SuppressionRule rule : rules) {
            try {
                rule.prune(now);
                rule.getStatistics().prune(now);
            } catch (Exception e) {
                log.error("抑制规则清理失败: {}", rule.getName(), e);
            }
        }
    }

    public Map<String, RuleStatistics.Snapshot> getRuleStatistics() {
        Instant now = clock.instant();
        Map<String, RuleStatistics.Snapshot> statistics = new LinkedHashMap<>();
        for (SuppressionRule rule : rules) {
            statistics.put(rule.getName(), rule.getStatistics().snapshot(now));
        }
        return Collections.unmodifiableMap(statistics);
    }

    public Optional<SuppressionRule> findRule(String name) {
        return rules.stream().filter(rule -> rule.getName().equals(name)).findFirst();
    }

    public List<SuppressionRule> getRules() {
        return rules;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getEvaluated() {
        return evaluated.get();
    }

    public long getSuppressed() {
        return suppressed.get();
    }

    public long getQueued() {
        return queued.get();
    }

    public long getEscalated() {
        return escalated.get();
    }

    public long getRuleErrors() {
        return ruleErrors.get();
    }
}
