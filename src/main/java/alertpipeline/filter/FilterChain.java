package alertpipeline.filter;

import alertpipeline.model.Alert;
import alertpipeline.model.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 过滤链 - 按优先级升序执行过滤器, 遇到第一个抑制结果即停止.
 * <p>
 * 过滤器列表采用写时复制, 运行时增删过滤器不会阻塞正在评估的告警.
 * 单个过滤器抛出的异常按 {@link FilterErrorMode} 处理, 不会中断整个过滤链.
 */
@Slf4j
public class FilterChain {

    private final FilterErrorMode errorMode;
    private final int maxConsecutiveErrors;
    private final Object mutationLock = new Object();
    private volatile List<FilterSlot> slots = Collections.emptyList();

    public FilterChain() {
        this(FilterErrorMode.LOG_AND_CONTINUE, 5);
    }

    public FilterChain(FilterErrorMode errorMode, int maxConsecutiveErrors) {
        if (maxConsecutiveErrors <= 0) {
            throw new ConfigurationException("maxConsecutiveErrors必须大于0: " + maxConsecutiveErrors);
        }
        this.errorMode = Objects.requireNonNull(errorMode, "errorMode");
        this.maxConsecutiveErrors = maxConsecutiveErrors;
    }

    /**
     * 添加过滤器. 名称重复时抛出 ConfigurationException
     */
    public void addFilter(AlertFilter filter) {
        Objects.requireNonNull(filter, "filter");
        synchronized (mutationLock) {
            if (find(filter.getName()).isPresent()) {
                throw new ConfigurationException("过滤器名称重复: " + filter.getName());
            }
            List<FilterSlot> updated = new ArrayList<>(slots);
            updated.add(new FilterSlot(filter));
            // List.sort是稳定排序, 同优先级按添加顺序执行
            updated.sort(Comparator.comparingInt(slot -> slot.filter.getPriority()));
            slots = Collections.unmodifiableList(updated);
        }
        log.info("过滤器已添加: {}, 优先级: {}", filter.getName(), filter.getPriority());
    }

    public boolean removeFilter(String name) {
        synchronized (mutationLock) {
            List<FilterSlot> updated = new ArrayList<>(slots);
            boolean removed = updated.removeIf(slot -> slot.filter.getName().equals(name));
            if (removed) {
                slots = Collections.unmodifiableList(updated);
                log.info("过滤器已移除: {}", name);
            }
            return removed;
        }
    }

    public boolean enableFilter(String name) {
        return find(name).map(slot -> {
            slot.disabled = false;
            slot.consecutiveErrors.set(0);
            return true;
        }).orElse(false);
    }

    public boolean disableFilter(String name) {
        return find(name).map(slot -> {
            slot.disabled = true;
            return true;
        }).orElse(false);
    }

    /**
     * 评估告警. 返回 SUPPRESS 时附带抑制的过滤器名称; 有过滤器修改告警时返回 MODIFY 和修改后的告警
     */
    public FilterDecision evaluate(Alert alert) {
        Alert current = alert;
        boolean modified = false;

        for (FilterSlot slot : slots) {
            if (slot.disabled) {
                continue;
            }
            AlertFilter filter = slot.filter;
            slot.evaluations.incrementAndGet();

            FilterDecision decision;
            try {
                decision = filter.evaluate(current);
                slot.consecutiveErrors.set(0);
            } catch (Exception e) {
                decision = handleFilterError(slot, current, e);
                if (decision == null) {
                    continue;
                }
            }
            if (decision == null) {
                decision = FilterDecision.allow();
            }

            switch (decision.getType()) {
                case SUPPRESS:
                    slot.suppressed.incrementAndGet();
                    if (filter.isAdvisory()) {
                        log.debug("建议型过滤器判定抑制, 继续执行: filter={}, alert={}, reason={}",
                                filter.getName(), current.getId(), decision.getReason());
                        continue;
                    }
                    log.debug("告警被过滤: filter={}, alert={}, reason={}",
                            filter.getName(), current.getId(), decision.getReason());
                    return decision.attributedTo(filter.getName());
                case MODIFY:
                    slot.modified.incrementAndGet();
                    current = decision.getModifiedAlert();
                    modified = true;
                    break;
                default:
                    slot.allowed.incrementAndGet();
            }
        }

        return modified ? FilterDecision.modify(current) : FilterDecision.allow();
    }

    private FilterDecision handleFilterError(FilterSlot slot, Alert alert, Exception error) {
        slot.errors.incrementAndGet();
        int consecutive = slot.consecutiveErrors.incrementAndGet();
        String name = slot.filter.getName();

        switch (errorMode) {
            case ALLOW:
                log.debug("过滤器执行异常, 按放行处理: filter={}, alert={}", name, alert.getId(), error);
                return FilterDecision.allow();
            case SUPPRESS:
                log.warn("过滤器执行异常, 按抑制处理: filter={}, alert={}", name, alert.getId(), error);
                return FilterDecision.suppress("FilterError");
            case DISABLE_AFTER_ERRORS:
                log.warn("过滤器执行异常: filter={}, 连续错误次数={}", name, consecutive, error);
                if (consecutive >= maxConsecutiveErrors) {
                    slot.disabled = true;
                    log.warn("过滤器连续出错{}次, 已禁用: {}", consecutive, name);
                }
                return null;
            case LOG_AND_CONTINUE:
            default:
                log.warn("过滤器执行异常, 跳过: filter={}, alert={}", name, alert.getId(), error);
                return null;
        }
    }

    private Optional<FilterSlot> find(String name) {
        return slots.stream().filter(slot -> slot.filter.getName().equals(name)).findFirst();
    }

    public List<AlertFilter> getFilters() {
        return slots.stream().map(slot -> slot.filter).collect(Collectors.toUnmodifiableList());
    }

    public boolean isFilterDisabled(String name) {
        return find(name).map(slot -> slot.disabled).orElse(false);
    }

    public int size() {
        return slots.size();
    }

    public Map<String, FilterStatistics> getStatistics() {
        Map<String, FilterStatistics> statistics = new LinkedHashMap<>();
        for (FilterSlot slot : slots) {
            statistics.put(slot.filter.getName(), slot.snapshot());
        }
        return Collections.unmodifiableMap(statistics);
    }

    private static final class FilterSlot {
        private final AlertFilter filter;
        private final AtomicLong evaluations = new AtomicLong();
        private final AtomicLong allowed = new AtomicLong();
        private final AtomicLong suppressed = new AtomicLong();
        private final AtomicLong modified = new AtomicLong();
        private final AtomicLong errors = new AtomicLong();
        private final AtomicInteger consecutiveErrors = new AtomicInteger();
        private volatile boolean disabled;

        private FilterSlot(AlertFilter filter) {
            this.filter = filter;
        }

        private FilterStatistics snapshot() {
            return FilterStatistics.builder()
                    .filterName(filter.getName())
                    .priority(filter.getPriority())
                    .evaluations(evaluations.get())
                    .allowed(allowed.get())
                    .suppressed(suppressed.get())
                    .modified(modified.get())
                    .errors(errors.get())
                    .consecutiveErrors(consecutiveErrors.get())
                    .disabled(disabled)
                    .build();
        }
    }
}
