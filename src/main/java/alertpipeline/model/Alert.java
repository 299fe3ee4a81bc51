package alertpipeline.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 告警 - 由生产者创建的不可变事件, 管道中各阶段只引用不修改
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Alert {
    // 基本信息
    private final String id;                     // 告警唯一ID
    private final Instant timestamp;             // 创建时间
    private final AlertSeverity severity;        // 告警级别
    private final String source;                 // 告警来源
    private final String message;                // 告警内容

    // 可选信息
    private final String tag;                    // 标签
    private final String correlationId;          // 关联ID
    private final Map<String, Object> context;   // 结构化上下文

    // 生命周期
    private final int count;                     // 发生次数
    private final AlertState state;
    private final Instant acknowledgedAt;
    private final String acknowledgedBy;
    private final Instant resolvedAt;
    private final String resolvedBy;

    @Builder(toBuilder = true)
    private Alert(String id,
                  Instant timestamp,
                  AlertSeverity severity,
                  String source,
                  String message,
                  String tag,
                  String correlationId,
                  Map<String, Object> context,
                  Integer count,
                  AlertState state,
                  Instant acknowledgedAt,
                  String acknowledgedBy,
                  Instant resolvedAt,
                  String resolvedBy) {
        if (StringUtils.isBlank(source)) {
            throw new IllegalArgumentException("告警来源不能为空");
        }
        this.id = StringUtils.isBlank(id) ? UUID.randomUUID().toString() : id;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.severity = Objects.requireNonNull(severity, "severity");
        this.source = source;
        this.message = message != null ? message : "";
        this.tag = StringUtils.trimToNull(tag);
        this.correlationId = StringUtils.trimToNull(correlationId);
        this.context = context == null || context.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.count = count != null && count > 0 ? count : 1;
        this.state = state != null ? state : AlertState.ACTIVE;
        this.acknowledgedAt = acknowledgedAt;
        this.acknowledgedBy = acknowledgedBy;
        this.resolvedAt = resolvedAt;
        this.resolvedBy = resolvedBy;
    }

    public static Alert create(AlertSeverity severity, String source, String message) {
        return builder().severity(severity).source(source).message(message).build();
    }

    public boolean isActive() {
        return state == AlertState.ACTIVE;
    }

    public boolean isAcknowledged() {
        return state == AlertState.ACKNOWLEDGED || state == AlertState.RESOLVED;
    }

    public boolean isResolved() {
        return state == AlertState.RESOLVED;
    }

    public Alert acknowledge(String by, Instant at) {
        return toBuilder()
                .state(AlertState.ACKNOWLEDGED)
                .acknowledgedAt(at)
                .acknowledgedBy(by)
                .build();
    }

    /**
     * 解决告警, 未确认过的告警同时补全确认信息
     */
    public Alert resolve(String by, Instant at) {
        return toBuilder()
                .state(AlertState.RESOLVED)
                .resolvedAt(at)
                .resolvedBy(by)
                .acknowledgedAt(acknowledgedAt != null ? acknowledgedAt : at)
                .acknowledgedBy(acknowledgedBy != null ? acknowledgedBy : by)
                .build();
    }

    public Alert withCount(int newCount) {
        return toBuilder().count(newCount).build();
    }

    public Alert incrementCount() {
        return withCount(count + 1);
    }

    public Alert withSeverity(AlertSeverity newSeverity) {
        return toBuilder().severity(newSeverity).build();
    }

    public Alert withTag(String newTag) {
        return toBuilder().tag(newTag).build();
    }

    public Object getContextValue(String key) {
        return context.get(key);
    }
}
