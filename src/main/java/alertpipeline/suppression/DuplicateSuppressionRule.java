package alertpipeline.suppression;

import alertpipeline.history.HistoryEntry;
import alertpipeline.history.HistoryStore;
import alertpipeline.model.Alert;
import alertpipeline.model.ConfigurationException;
import alertpipeline.model.Disposition;
import alertpipeline.model.FingerprintField;
import alertpipeline.model.Fingerprints;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;

/**
 * 重复告警检测.
 * <p>
 * 指纹由配置的字段计算(忽略时间戳). 同一指纹在抑制窗口内再次出现时被抑制;
 * 窗口从上一次放行的时间算起, 窗口过后的第一条告警会被放行并重新开始计时.
 * 相似度阈值小于 1.0 时, 消息不参与指纹计算, 改为比较消息的词重合度.
 * 配置了历史存储时, 还会查询窗口内已投递的历史记录.
 * <p>
 * 放行时先为告警占位, 之后的规则抑制或延迟了它时由 {@link #release(Alert)} 撤销,
 * 所以没有投递出去的告警不会让后续的同类告警被当作重复. 同一告警(相同 id)重放时不与自己比较.
 */
@Slf4j
public class DuplicateSuppressionRule extends AbstractSuppressionRule {

    public static final String REASON = "Duplicate";

    private static final int MAX_SIMILAR_PER_KEY = 32;
    private static final Set<Disposition> DELIVERED_DISPOSITIONS = EnumSet.of(
            Disposition.DELIVERED, Disposition.PARTIALLY_DELIVERED, Disposition.AGGREGATED, Disposition.ESCALATED);

    private final Duration window;
    private final Set<FingerprintField> fields;
    private final Set<FingerprintField> keyFields;
    private final double similarityThreshold;
    private final SuppressionAction action;
    private final HistoryStore historyStore;
    private final Cache<String, List<Seen>> seen;

    public DuplicateSuppressionRule(String name, int priority, Duration window, Set<FingerprintField> fields,
                                    double similarityThreshold, SuppressionAction action, int maxTrackedFingerprints,
                                    HistoryStore historyStore, RuleOptions options) {
        super(name, priority, options);
        requirePositive(window, "duplicate window");
        if (CollectionUtils.isEmpty(fields)) {
            throw new ConfigurationException("重复检测至少需要一个指纹字段: " + name);
        }
        if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
            throw new ConfigurationException("similarityThreshold必须在(0, 1]之间: " + similarityThreshold);
        }
        if (maxTrackedFingerprints <= 0) {
            throw new ConfigurationException("maxTrackedFingerprints必须大于0: " + maxTrackedFingerprints);
        }
        if (action == null || action == SuppressionAction.PASS) {
            throw new ConfigurationException("重复检测的动作不能为PASS: " + name);
        }
        this.window = window;
        this.fields = EnumSet.copyOf(fields);
        this.similarityThreshold = similarityThreshold;
        this.keyFields = EnumSet.copyOf(fields);
        if (isSimilarityMode()) {
            keyFields.remove(FingerprintField.MESSAGE);
        }
        this.action = action;
        this.historyStore = historyStore;
        this.seen = CacheBuilder.newBuilder()
                .maximumSize(maxTrackedFingerprints)
                .build();
    }

    public static DuplicateSuppressionRule exact(String name, int priority, Duration window) {
        return new DuplicateSuppressionRule(name, priority, window,
                EnumSet.of(FingerprintField.SOURCE, FingerprintField.MESSAGE, FingerprintField.SEVERITY),
                1.0, SuppressionAction.SUPPRESS, 10_000, null, RuleOptions.DEFAULTS);
    }

    @Override
    public SuppressionVerdict evaluate(Alert alert, Instant now) {
        getStatistics().recordEvaluation();
        String key = Fingerprints.of(alert, keyFields);
        Set<String> tokens = isSimilarityMode() ? Fingerprints.tokens(alert.getMessage()) : Set.of();

        if (historyStore != null && seenInHistory(alert, now)) {
            return trigger(now, "在历史记录中发现重复告警");
        }

        boolean[] duplicate = new boolean[1];
        ConcurrentMap<String, List<Seen>> map = seen.asMap();
        map.compute(key, (k, entries) -> {
            List<Seen> live = entries == null ? new ArrayList<>() : prune(entries, now);
            for (Seen entry : live) {
                if (entry.alertId.equals(alert.getId())) {
                    continue;
                }
                if (!isSimilarityMode() || Fingerprints.tokenOverlap(entry.tokens, tokens) >= similarityThreshold) {
                    duplicate[0] = true;
                    return live;
                }
            }
            live.removeIf(entry -> entry.alertId.equals(alert.getId()));
            if (live.size() >= MAX_SIMILAR_PER_KEY) {
                live.remove(0);
            }
            live.add(new Seen(alert.getId(), now, tokens));
            return live;
        });

        if (duplicate[0]) {
            return trigger(now, null);
        }
        return SuppressionVerdict.pass();
    }

    @Override
    public void release(Alert alert) {
        String key = Fingerprints.of(alert, keyFields);
        seen.asMap().computeIfPresent(key, (k, entries) -> {
            entries.removeIf(entry -> entry.alertId.equals(alert.getId()));
            return entries.isEmpty() ? null : entries;
        });
    }

    private SuppressionVerdict trigger(Instant now, String detail) {
        getStatistics().recordTrigger(now);
        if (detail != null) {
            log.debug("{}: rule={}", detail, getName());
        }
        return SuppressionVerdict.of(action, getName(), REASON);
    }

    private boolean seenInHistory(Alert alert, Instant now) {
        Instant since = now.minus(window);
        String fingerprint = Fingerprints.of(alert, keyFields);
        Set<String> tokens = isSimilarityMode() ? Fingerprints.tokens(alert.getMessage()) : null;
        return historyStore.findLatest(entry -> isDeliveredDuplicate(entry, alert, since, fingerprint, tokens)).isPresent();
    }

    private boolean isDeliveredDuplicate(HistoryEntry entry, Alert alert, Instant since,
                                         String fingerprint, Set<String> tokens) {
        if (entry.getTimestamp().isBefore(since)
                || !DELIVERED_DISPOSITIONS.contains(entry.getDisposition())
                || entry.getAlert().getId().equals(alert.getId())) {
            return false;
        }
        if (!fingerprint.equals(Fingerprints.of(entry.getAlert(), keyFields))) {
            return false;
        }
        return tokens == null
                || Fingerprints.tokenOverlap(tokens, Fingerprints.tokens(entry.getAlert().getMessage())) >= similarityThreshold;
    }

    private List<Seen> prune(List<Seen> entries, Instant now) {
        Instant cutoff = now.minus(window);
        entries.removeIf(entry -> !entry.passedAt.isAfter(cutoff));
        return entries;
    }

    @Override
    public void prune(Instant now) {
        ConcurrentMap<String, List<Seen>> map = seen.asMap();
        for (String key : map.keySet()) {
            map.computeIfPresent(key, (k, entries) -> {
                List<Seen> live = prune(entries, now);
                return live.isEmpty() ? null : live;
            });
        }
    }

    public long getTrackedFingerprints() {
        return seen.size();
    }

    private boolean isSimilarityMode() {
        return similarityThreshold < 1.0;
    }

    public Duration getWindow() {
        return window;
    }

    public Set<FingerprintField> getFields() {
        return fields;
    }

    private static final class Seen {
        private final String alertId;
        private final Instant passedAt;
        private final Set<String> tokens;

        private Seen(String alertId, Instant passedAt, Set<String> tokens) {
            this.alertId = alertId;
            this.passedAt = passedAt;
            this.tokens = tokens;
        }
    }
}
