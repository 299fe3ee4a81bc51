package alertpipeline.aggregation;

import alertpipeline.model.Alert;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 聚合组 - 同一相似指纹在窗口内的告警累加器. 只在 AggregationEngine 持有的锁内修改
 */
public class AggregationGroup {

    private final String fingerprint;
    private final Instant firstSeen;
    private final int maxSamples;
    private final List<Alert> samples = new ArrayList<>();
    private Instant lastSeen;
    private int count;

    AggregationGroup(String fingerprint, Alert first, Instant now, int maxSamples) {
        this.fingerprint = fingerprint;
        this.firstSeen = now;
        this.maxSamples = maxSamples;
        add(first, now);
    }

    void add(Alert alert, Instant now) {
        count++;
        lastSeen = now;
        if (samples.size() < maxSamples) {
            samples.add(alert);
        }
    }

    boolean isExpired(Instant now, Duration window) {
        return !firstSeen.plus(window).isAfter(now);
    }

    /**
     * 生成代表整个组的告警. 只有一个成员时直接返回原告警
     */
    public Alert toGroupedAlert() {
        Alert first = samples.get(0);
        if (count == 1) {
            return first;
        }
        Map<String, Object> context = new LinkedHashMap<>(first.getContext());
        context.put("aggregated_count", count);
        context.put("aggregation_fingerprint", fingerprint);
        context.put("first_seen", firstSeen.toString());
        context.put("last_seen", lastSeen.toString());
        context.put("sample_ids", samples.stream().map(Alert::getId).collect(Collectors.toUnmodifiableList()));
        return Alert.builder()
                .severity(first.getSeverity())
                .source(first.getSource())
                .message(first.getMessage() + " (x" + count + " similar alerts)")
                .tag(first.getTag())
                .correlationId(first.getCorrelationId())
                .context(context)
                .count(count)
                .timestamp(lastSeen)
                .build();
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public int getCount() {
        return count;
    }

    public List<Alert> getSamples() {
        return Collections.unmodifiableList(samples);
    }

    @Override
    public String toString() {
        return "AggregationGroup{fingerprint=" + fingerprint + ", count=" + count + ", firstSeen=" + firstSeen + "}";
    }
}
