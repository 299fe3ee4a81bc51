package alertpipeline.pipeline;

import alertpipeline.aggregation.AggregationEngine;
import alertpipeline.aggregation.AggregationGroup;
import alertpipeline.aggregation.AggregationResult;
import alertpipeline.channel.AlertChannel;
import alertpipeline.channel.AlertChannelFactory;
import alertpipeline.channel.ChannelConfig;
import alertpipeline.channel.ChannelDeliveryService;
import alertpipeline.channel.ChannelHealthStatus;
import alertpipeline.channel.DeliveryOutcome;
import alertpipeline.filter.AlertFilter;
import alertpipeline.filter.FilterChain;
import alertpipeline.filter.FilterDecision;
import alertpipeline.history.HistoryEntry;
import alertpipeline.history.HistoryStore;
import alertpipeline.model.Alert;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.BackpressureException;
import alertpipeline.model.Disposition;
import alertpipeline.suppression.DeferredAlertQueue;
import alertpipeline.suppression.SuppressionEngine;
import alertpipeline.suppression.SuppressionRule;
import alertpipeline.suppression.SuppressionVerdict;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 告警管道入口 - 依次执行 最低级别检查 → 过滤链 → 抑制引擎 → 聚合 → 通道投递 → 记录历史.
 * <p>
 * 同时在途的告警数超过 maxConcurrentAlerts + alertBufferSize 时, raise 立即返回 REJECTED;
 * 已接收的告警在工作线程池中执行, 同时处理的数量由信号量限制为 maxConcurrentAlerts.
 * 每条告警的处理时间受 processingTimeout 限制, 超时只影响返回结果, 已开始的投递继续完成并记录历史.
 */
@Slf4j
public class AlertOrchestrator implements AutoCloseable {

    public static final String REASON_BELOW_MINIMUM_SEVERITY = "BelowMinimumSeverity";
    public static final String REASON_PIPELINE_STOPPED = "PipelineStopped";
    public static final String REASON_BACKPRESSURE = "Backpressure";
    public static final String REASON_NO_MATCHING_CHANNEL = "NoMatchingChannel";
    public static final String REASON_QUEUE_EXPIRED = "QueueExpired";
    public static final String REASON_PROCESSING_TIMEOUT = "ProcessingTimeout";

    private enum State {
        CREATED,
        RUNNING,
        STOPPED
    }

    private final PipelineConfig config;
    private final Clock clock;
    private final FilterChain filterChain;
    private final SuppressionEngine suppressionEngine;
    private final AggregationEngine aggregationEngine;
    private final ChannelDeliveryService deliveryService;
    private final HistoryStore historyStore;

    private final ThreadPoolExecutor workerPool;
    private final ScheduledExecutorService scheduler;
    private final Semaphore concurrencyGate;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final int admissionCapacity;

    private final Map<String, Alert> activeAlerts = new ConcurrentHashMap<>();
    private final Map<String, AlertSeverity> sourceMinimumSeverity = new ConcurrentHashMap<>();
    private final Map<OutcomeStatus, AtomicLong> outcomeCounters = new EnumMap<>(OutcomeStatus.class);
    private final AtomicLong raised = new AtomicLong();
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong processingNanos = new AtomicLong();
    private volatile Instant statisticsSince;
    private volatile State state = State.CREATED;

    public AlertOrchestrator(PipelineConfig config) {
        this(config, Clock.systemUTC());
    }

    public AlertOrchestrator(PipelineConfig config, Clock clock) {
        this(config, clock, new ChannelDeliveryService(config.getDelivery(), config.getEscalation(), clock));
    }

    public AlertOrchestrator(PipelineConfig config, Clock clock, ChannelDeliveryService deliveryService) {
        Objects.requireNonNull(config, "config").validate();
        this.config = config;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.deliveryService = Objects.requireNonNull(deliveryService, "deliveryService");
        this.filterChain = new FilterChain(config.getFilterErrorMode(), config.getMaxConsecutiveFilterErrors());
        this.suppressionEngine = new SuppressionEngine(clock);
        this.suppressionEngine.setEnabled(config.isSuppressionEnabled());
        this.aggregationEngine = new AggregationEngine(config.isAggregationEnabled(), config.getAggregationWindow(),
                config.getMaxAggregationSize(), clock);
        this.aggregationEngine.setFlushListener(this::deliverGroup);
        this.historyStore = new HistoryStore(config.getMaxHistoryEntries(), config.getHistoryRetention(), clock);

        this.concurrencyGate = new Semaphore(config.getMaxConcurrentAlerts());
        this.admissionCapacity = config.getMaxConcurrentAlerts() + config.getAlertBufferSize();
        // 队列长度由 admissionCapacity 间接限制
        this.workerPool = new ThreadPoolExecutor(
                config.getWorkerThreads(),
                config.getWorkerThreads(),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("alert-pipeline-worker-%d")
                        .setDaemon(true)
                        .build()
        );
        this.workerPool.allowCoreThreadTimeOut(true);
        this.scheduler = Executors.newScheduledThreadPool(2,
                new ThreadFactoryBuilder()
                        .setNameFormat("alert-pipeline-scheduler-%d")
                        .setDaemon(true)
                        .build()
        );

        for (OutcomeStatus status : OutcomeStatus.values()) {
            outcomeCounters.put(status, new AtomicLong());
        }
        this.statisticsSince = clock.instant();
    }

    /**
     * 启动管道: 调度维护任务、聚合刷新和通道健康检查
     */
    public synchronized void start() {
        if (state == State.RUNNING) {
            log.warn("告警管道已经在运行");
            return;
        }
        if (state == State.STOPPED) {
            throw new IllegalStateException("告警管道已关闭, 不能重新启动");
        }
        log.info("正在启动告警管道...");
        long maintenanceMillis = config.getMaintenanceInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::runMaintenance, maintenanceMillis, maintenanceMillis, TimeUnit.MILLISECONDS);
        if (aggregationEngine.isEnabled()) {
            long flushMillis = Math.max(100L, config.getAggregationWindow().toMillis() / 4);
            scheduler.scheduleAtFixedRate(this::runAggregationFlush, flushMillis, flushMillis, TimeUnit.MILLISECONDS);
        }
        deliveryService.startHealthChecks(scheduler);
        state = State.RUNNING;
        log.info("告警管道启动成功: 通道={}, 过滤器={}, 抑制规则={}",
                deliveryService.getChannelNames(), filterChain.size(), suppressionEngine.getRules().size());
    }

    /**
     * 提交告警. 不会因单条告警的处理失败抛出异常, 结果通过 AlertOutcome 返回
     */
    public CompletableFuture<AlertOutcome> raise(Alert alert) {
        Objects.requireNonNull(alert, "alert");
        raised.incrementAndGet();
        if (state != State.RUNNING) {
            return CompletableFuture.completedFuture(
                    countOutcome(AlertOutcome.of(alert, OutcomeStatus.REJECTED, REASON_PIPELINE_STOPPED, null)));
        }

        int current = inFlight.incrementAndGet();
        if (current > admissionCapacity) {
            inFlight.decrementAndGet();
            BackpressureException cause = new BackpressureException(current - 1, admissionCapacity);
            log.warn("告警被拒绝, 在途告警已达上限: alert={}, source={}, capacity={}",
                    alert.getId(), alert.getSource(), admissionCapacity);
            return CompletableFuture.completedFuture(countOutcome(AlertOutcome.of(alert, OutcomeStatus.REJECTED,
                    REASON_BACKPRESSURE, null).toBuilder().cause(cause).build()));
        }

        long startNanos = System.nanoTime();
        CompletableFuture<AlertOutcome> result = new CompletableFuture<>();
        AtomicBoolean settled = new AtomicBoolean();
        CompletableFuture<AlertOutcome> processing;
        try {
            processing = CompletableFuture.supplyAsync(() -> processGated(alert, null, startNanos), workerPool);
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            return CompletableFuture.completedFuture(countOutcome(AlertOutcome.of(alert, OutcomeStatus.REJECTED,
                    REASON_PIPELINE_STOPPED, null).toBuilder().cause(e).build()));
        }

        ScheduledFuture<?> timer = scheduleTimeout(alert, result, settled, startNanos);
        processing.whenComplete((outcome, error) -> {
            inFlight.decrementAndGet();
            if (timer != null) {
                timer.cancel(false);
            }
            AlertOutcome finalOutcome = outcome != null ? outcome : failedOutcome(alert, error, startNanos);
            settle(result, settled, finalOutcome);
        });
        return result;
    }

    /**
     * 处理结果和超时只有先到的一个生效, 计数先于 future 完成
     */
    private boolean settle(CompletableFuture<AlertOutcome> result, AtomicBoolean settled, AlertOutcome outcome) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        countOutcome(outcome);
        result.complete(outcome);
        return true;
    }

    private ScheduledFuture<?> scheduleTimeout(Alert alert, CompletableFuture<AlertOutcome> result,
                                               AtomicBoolean settled, long startNanos) {
        try {
            return scheduler.schedule(() -> {
                AlertOutcome timedOut = AlertOutcome.of(alert, OutcomeStatus.TIMED_OUT, REASON_PROCESSING_TIMEOUT, null)
                        .toBuilder().processingTime(elapsed(startNanos)).build();
                if (settle(result, settled, timedOut)) {
                    log.warn("告警处理超时: alert={}, timeout={}", alert.getId(), config.getProcessingTimeout());
                }
            }, config.getProcessingTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("调度器已关闭, 不设置超时: {}", alert.getId());
            return null;
        }
    }

    private AlertOutcome failedOutcome(Alert alert, Throwable error, long startNanos) {
        log.error("告警处理异常: {}", alert.getId(), error);
        historyStore.record(alert, Disposition.FAILED, "ProcessingError");
        return AlertOutcome.of(alert, OutcomeStatus.FAILED, "ProcessingError", null).toBuilder()
                .cause(error)
                .processingTime(elapsed(startNanos))
                .build();
    }

    /**
     * 在并发闸门内处理. queuedSince 不为空表示延迟队列重放, 从抑制阶段开始
     */
    private AlertOutcome processGated(Alert alert, Instant queuedSince, long startNanos) {
        try {
            concurrencyGate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AlertOutcome.of(alert, OutcomeStatus.REJECTED, REASON_PIPELINE_STOPPED, null);
        }
        try {
            AlertOutcome outcome = queuedSince == null ? process(alert) : processFromSuppression(alert, queuedSince);
            Duration processingTime = elapsed(startNanos);
            processedCount.incrementAndGet();
            processingNanos.addAndGet(processingTime.toNanos());
            return outcome.toBuilder().processingTime(processingTime).build();
        } finally {
            concurrencyGate.release();
        }
    }

    private AlertOutcome process(Alert alert) {
        AlertSeverity floor = effectiveMinimumSeverity(alert.getSource());
        if (!alert.getSeverity().isAtLeast(floor)) {
            log.debug("告警低于最低级别: alert={}, severity={}, floor={}", alert.getId(), alert.getSeverity(), floor);
            historyStore.record(alert, Disposition.FILTERED, REASON_BELOW_MINIMUM_SEVERITY);
            return AlertOutcome.of(alert, OutcomeStatus.FILTERED, REASON_BELOW_MINIMUM_SEVERITY, null);
        }

        FilterDecision decision = filterChain.evaluate(alert);
        if (decision.isSuppressed()) {
            historyStore.record(alert, Disposition.FILTERED, decision.getReason());
            return AlertOutcome.of(alert, OutcomeStatus.FILTERED, decision.getReason(), decision.getFilterName());
        }
        Alert current = decision.getType() == FilterDecision.Type.MODIFY ? decision.getModifiedAlert() : alert;
        return processFromSuppression(current, null);
    }

    private AlertOutcome processFromSuppression(Alert alert, Instant queuedSince) {
        SuppressionVerdict verdict = suppressionEngine.evaluate(alert, queuedSince);
        switch (verdict.getAction()) {
            case SUPPRESS:
                historyStore.record(alert, Disposition.SUPPRESSED, verdict.getReason());
                return AlertOutcome.of(alert, OutcomeStatus.SUPPRESSED, verdict.getReason(), verdict.getRuleName());
            case QUEUE:
                historyStore.record(alert, Disposition.QUEUED, verdict.getReason());
                return AlertOutcome.of(alert, OutcomeStatus.QUEUED, verdict.getReason(), verdict.getRuleName());
            case ESCALATE:
                return escalate(alert, verdict);
            case PASS:
            default:
                return aggregateAndDeliver(alert);
        }
    }

    private AlertOutcome escalate(Alert alert, SuppressionVerdict verdict) {
        DeliveryOutcome delivery = deliveryService.escalate(alert);
        if (delivery.getSuccessCount() > 0) {
            activeAlerts.put(alert.getId(), alert);
        }
        historyStore.record(alert, Disposition.ESCALATED, verdict.getReason());
        return AlertOutcome.of(alert, OutcomeStatus.ESCALATED, verdict.getReason(), verdict.getRuleName())
                .toBuilder().delivery(delivery).build();
    }

    private AlertOutcome aggregateAndDeliver(Alert alert) {
        AggregationResult aggregation = aggregationEngine.offer(alert);
        switch (aggregation.getType()) {
            case ACCUMULATED:
                historyStore.record(alert, Disposition.AGGREGATED, aggregation.getGroup().getFingerprint());
                return AlertOutcome.of(alert, OutcomeStatus.AGGREGATED, "Aggregated", null);
            case FLUSHED:
                return deliver(aggregation.getGroup().toGroupedAlert());
            case IMMEDIATE:
            default:
                return deliver(alert);
        }
    }

    private AlertOutcome deliver(Alert alert) {
        DeliveryOutcome delivery = deliveryService.deliver(alert);
        OutcomeStatus status;
        Disposition disposition;
        String reason = null;
        if (!delivery.hasChannels()) {
            status = OutcomeStatus.FAILED;
            disposition = Disposition.FAILED;
            reason = REASON_NO_MATCHING_CHANNEL;
            log.warn("没有匹配的通道: alert={}, severity={}", alert.getId(), alert.getSeverity());
        } else if (delivery.isFullyDelivered()) {
            status = OutcomeStatus.DELIVERED;
            disposition = Disposition.DELIVERED;
        } else if (delivery.isPartiallyDelivered()) {
            status = OutcomeStatus.PARTIALLY_DELIVERED;
            disposition = Disposition.PARTIALLY_DELIVERED;
        } else {
            status = OutcomeStatus.FAILED;
            disposition = Disposition.FAILED;
            reason = "AllChannelsFailed";
        }
        if (delivery.getSuccessCount() > 0) {
            activeAlerts.put(alert.getId(), alert);
        }
        historyStore.record(alert, disposition, reason);
        return AlertOutcome.of(alert, status, reason, null).toBuilder().delivery(delivery).build();
    }

    private void deliverGroup(AggregationGroup group) {
        Alert grouped = group.toGroupedAlert();
        log.debug("聚合组到期输出: {}", group);
        countOutcome(deliver(grouped));
    }

    private AlertSeverity effectiveMinimumSeverity(String source) {
        return sourceMinimumSeverity.getOrDefault(source.toLowerCase(Locale.ROOT), config.getMinimumSeverity());
    }

    private AlertOutcome countOutcome(AlertOutcome outcome) {
        outcomeCounters.get(outcome.getStatus()).incrementAndGet();
        return outcome;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    // ---------------------------------------------------------------- 维护

    /**
     * 维护: 清理历史和抑制状态, 输出到期的聚合组, 重放延迟队列
     */
    public void performMaintenance() {
        Instant now = clock.instant();
        int prunedHistory = historyStore.prune();
        suppressionEngine.prune(now);
        int flushed = aggregationEngine.flushExpired();
        int replayed = replayDeferred(now);
        int expiredActive = expireActiveAlerts(now);
        log.debug("维护完成: 清理历史{}条, 输出聚合组{}个, 重放{}条, 过期活跃告警{}条",
                prunedHistory, flushed, replayed, expiredActive);
    }

    private void runMaintenance() {
        try {
            performMaintenance();
        } catch (Exception e) {
            log.error("维护任务执行失败", e);
        }
    }

    private void runAggregationFlush() {
        try {
            aggregationEngine.flushExpired();
        } catch (Exception e) {
            log.error("聚合组刷新失败", e);
        }
    }

    private int replayDeferred(Instant now) {
        DeferredAlertQueue.DrainResult drained = suppressionEngine.drainDeferred(now);
        for (DeferredAlertQueue.DeferredAlert expired : drained.getExpired()) {
            historyStore.record(expired.getAlert(), Disposition.SUPPRESSED, REASON_QUEUE_EXPIRED);
            countOutcome(AlertOutcome.of(expired.getAlert(), OutcomeStatus.SUPPRESSED, REASON_QUEUE_EXPIRED,
                    expired.getRuleName()));
            log.debug("延迟告警已过期: alert={}, rule={}", expired.getAlert().getId(), expired.getRuleName());
        }
        for (DeferredAlertQueue.DeferredAlert ready : drained.getReady()) {
            long startNanos = System.nanoTime();
            try {
                CompletableFuture.supplyAsync(() -> processGated(ready.getAlert(), ready.getQueuedSince(), startNanos), workerPool)
                        .whenComplete((outcome, error) -> countOutcome(
                                outcome != null ? outcome : failedOutcome(ready.getAlert(), error, startNanos)));
            } catch (RejectedExecutionException e) {
                log.warn("管道已关闭, 延迟告警被丢弃: {}", ready.getAlert().getId());
            }
        }
        return drained.getReady().size();
    }

    private int expireActiveAlerts(Instant now) {
        Instant cutoff = now.minus(config.getHistoryRetention());
        int before = activeAlerts.size();
        activeAlerts.values().removeIf(alert -> alert.getTimestamp().isBefore(cutoff));
        return before - activeAlerts.size();
    }

    // ---------------------------------------------------------------- 告警生命周期

    public boolean acknowledge(String alertId, String by) {
        Instant now = clock.instant();
        Alert[] changed = new Alert[1];
        activeAlerts.computeIfPresent(alertId, (id, alert) -> {
            if (alert.isAcknowledged()) {
                return alert;
            }
            changed[0] = alert.acknowledge(by, now);
            return changed[0];
        });
        if (changed[0] == null) {
            return false;
        }
        historyStore.record(changed[0], Disposition.ACKNOWLEDGED, by);
        log.info("告警已确认: alert={}, by={}", alertId, by);
        return true;
    }

    public boolean resolve(String alertId, String by) {
        Alert active = activeAlerts.remove(alertId);
        if (active == null) {
            return false;
        }
        Alert resolved = active.resolve(by, clock.instant());
        historyStore.record(resolved, Disposition.RESOLVED, by);
        log.info("告警已解决: alert={}, by={}", alertId, by);
        return true;
    }

    public int acknowledgeAll(Collection<String> alertIds, String by) {
        int count = 0;
        for (String alertId : alertIds) {
            if (acknowledge(alertId, by)) {
                count++;
            }
        }
        return count;
    }

    public int resolveAll(Collection<String> alertIds, String by) {
        int count = 0;
        for (String alertId : alertIds) {
            if (resolve(alertId, by)) {
                count++;
            }
        }
        return count;
    }

    /**
     * 解决指定来源的全部活跃告警
     */
    public int resolveBySource(String source, String by) {
        List<String> ids = activeAlerts.values().stream()
                .filter(alert -> alert.getSource().equalsIgnoreCase(source))
                .map(Alert::getId)
                .collect(Collectors.toList());
        return resolveAll(ids, by);
    }

    public List<Alert> getActiveAlerts() {
        return activeAlerts.values().stream()
                .sorted(Comparator.comparing(Alert::getTimestamp))
                .collect(Collectors.toUnmodifiableList());
    }

    public Optional<Alert> getActiveAlert(String alertId) {
        return Optional.ofNullable(activeAlerts.get(alertId));
    }

    // ---------------------------------------------------------------- 运行时配置

    public void registerChannel(ChannelConfig channelConfig) {
        registerChannel(AlertChannelFactory.create(channelConfig), channelConfig);
    }

    public void registerChannel(AlertChannel channel, ChannelConfig channelConfig) {
        deliveryService.registerChannel(channel, channelConfig);
    }

    public boolean unregisterChannel(String name) {
        return deliveryService.unregisterChannel(name);
    }

    public void addFilter(AlertFilter filter) {
        filterChain.addFilter(filter);
    }

    public boolean removeFilter(String name) {
        return filterChain.removeFilter(name);
    }

    public void addSuppressionRule(SuppressionRule rule) {
        suppressionEngine.addRule(rule);
    }

    public boolean removeSuppressionRule(String name) {
        return suppressionEngine.removeRule(name);
    }

    public void setSourceMinimumSeverity(String source, AlertSeverity severity) {
        Objects.requireNonNull(severity, "severity");
        sourceMinimumSeverity.put(source.toLowerCase(Locale.ROOT), severity);
        log.info("来源最低级别已设置: source={}, severity={}", source, severity);
    }

    public boolean removeSourceMinimumSeverity(String source) {
        return sourceMinimumSeverity.remove(source.toLowerCase(Locale.ROOT)) != null;
    }

    // ---------------------------------------------------------------- 紧急模式

    public void enableEmergencyMode(String reason) {
        deliveryService.getEscalationMonitor().enableEmergencyMode(reason);
    }

    public void disableEmergencyMode() {
        deliveryService.getEscalationMonitor().disableEmergencyMode();
    }

    public boolean isEmergencyModeActive() {
        return deliveryService.getEscalationMonitor().isActive();
    }

    // ---------------------------------------------------------------- 查询

    public Map<String, ChannelHealthStatus> getChannelHealth() {
        return deliveryService.getChannelHealth();
    }

    public List<HistoryEntry> getHistory() {
        return historyStore.getAll();
    }

    public List<HistoryEntry> queryHistory(Predicate<HistoryEntry> predicate) {
        return historyStore.query(predicate);
    }

    public AlertStatistics getStatistics() {
        long processed = processedCount.get();
        return AlertStatistics.builder()
                .raised(raised.get())
                .delivered(count(OutcomeStatus.DELIVERED))
                .partiallyDelivered(count(OutcomeStatus.PARTIALLY_DELIVERED))
                .failed(count(OutcomeStatus.FAILED))
                .filtered(count(OutcomeStatus.FILTERED))
                .suppressed(count(OutcomeStatus.SUPPRESSED))
                .queued(count(OutcomeStatus.QUEUED))
                .aggregated(count(OutcomeStatus.AGGREGATED))
                .escalated(count(OutcomeStatus.ESCALATED))
                .rejected(count(OutcomeStatus.REJECTED))
                .timedOut(count(OutcomeStatus.TIMED_OUT))
                .activeAlerts(activeAlerts.size())
                .inFlight(inFlight.get())
                .deferredAlerts(suppressionEngine.deferredSize())
                .registeredChannels(deliveryService.getChannelNames().size())
                .averageProcessingMillis(processed == 0 ? 0.0 : processingNanos.get() / 1_000_000.0 / processed)
                .emergencyModeActive(isEmergencyModeActive())
                .since(statisticsSince)
                .build();
    }

    public void resetStatistics() {
        raised.set(0);
        processedCount.set(0);
        processingNanos.set(0);
        outcomeCounters.values().forEach(counter -> counter.set(0));
        statisticsSince = clock.instant();
    }

    private long count(OutcomeStatus status) {
        return outcomeCounters.get(status).get();
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public FilterChain getFilterChain() {
        return filterChain;
    }

    public SuppressionEngine getSuppressionEngine() {
        return suppressionEngine;
    }

    public AggregationEngine getAggregationEngine() {
        return aggregationEngine;
    }

    public ChannelDeliveryService getDeliveryService() {
        return deliveryService;
    }

    public HistoryStore getHistoryStore() {
        return historyStore;
    }

    /**
     * 关闭管道: 输出未关闭的聚合组, 等待在途告警完成(最多 processingTimeout), 然后关闭通道
     */
    @Override
    public void close() {
        synchronized (this) {
            if (state == State.STOPPED) {
                return;
            }
            state = State.STOPPED;
        }
        log.info("正在关闭告警管道...");
        scheduler.shutdownNow();
        int flushed = aggregationEngine.flushAll();
        if (flushed > 0) {
            log.info("关闭前输出聚合组{}个", flushed);
        }
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(config.getProcessingTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("在途告警未能在{}内完成, 强制关闭", config.getProcessingTimeout());
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        deliveryService.close();
        log.info("告警管道已关闭");
    }
}
