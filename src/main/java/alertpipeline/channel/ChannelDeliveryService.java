package alertpipeline.channel;

import alertpipeline.model.Alert;
import alertpipeline.model.ConfigurationException;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 通道注册表与投递服务.
 * <p>
 * 每次发送都经过通道的熔断器, 失败按重试策略退避重试(Resilience4j Retry), 单次发送受 sendTimeout 限制(TimeLimiter).
 * 多通道投递可顺序或按 maxParallelism 并行; 全局失败率过高时额外投递到兜底通道.
 */
@Slf4j
public class ChannelDeliveryService implements AutoCloseable {

    public static final String REJECTED_CIRCUIT_OPEN = "CircuitOpen";
    public static final String REJECTED_POOL_FULL = "SendPoolFull";

    private final DeliveryConfig deliveryConfig;
    private final EscalationMonitor escalationMonitor;
    private final Clock clock;
    private final ThreadPoolExecutor sendExecutor;
    private final ExecutorService fanOutExecutor;
    private final Object mutationLock = new Object();
    private final AtomicLong deliveries = new AtomicLong();
    private final AtomicLong escalatedDeliveries = new AtomicLong();
    private volatile Map<String, ChannelSlot> channels = Collections.emptyMap();
    private volatile ScheduledExecutorService healthScheduler;

    public ChannelDeliveryService(DeliveryConfig deliveryConfig, EscalationConfig escalationConfig, Clock clock) {
        deliveryConfig.validate();
        escalationConfig.validate();
        this.deliveryConfig = deliveryConfig;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.escalationMonitor = new EscalationMonitor(escalationConfig, clock);

        this.sendExecutor = new ThreadPoolExecutor(
                deliveryConfig.getSendThreads(),
                deliveryConfig.getSendThreads(),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(deliveryConfig.getSendQueueCapacity()),
                new ThreadFactoryBuilder()
                        .setNameFormat("alert-channel-send-%d")
                        .setDaemon(true)
                        .build()
        );
        this.sendExecutor.allowCoreThreadTimeOut(true);
        this.fanOutExecutor = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder()
                        .setNameFormat("alert-delivery-%d")
                        .setDaemon(true)
                        .build()
        );
    }

    /**
     * 注册通道. 配置无效、名称重复或初始化失败时抛出 ConfigurationException
     */
    public void registerChannel(AlertChannel channel, ChannelConfig config) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(config, "config");
        config.validate();
        synchronized (mutationLock) {
            if (channels.containsKey(config.getName())) {
                throw new ConfigurationException("通道名称重复: " + config.getName());
            }
            if (!channel.initialize(config)) {
                throw new ConfigurationException("通道初始化失败: " + config.getName());
            }
            ChannelSlot slot = new ChannelSlot(channel, config, new ChannelHealth(config.getName(), config.getCircuitBreaker(), clock));
            Map<String, ChannelSlot> updated = new LinkedHashMap<>(channels);
            updated.put(config.getName(), slot);
            channels = Collections.unmodifiableMap(updated);
            if (healthScheduler != null) {
                scheduleHealthCheck(slot);
            }
        }
        log.info("通道已注册: {}, 类型: {}, 级别范围: {} - {}",
                config.getName(), config.getType(), config.getMinSeverity(), config.getMaxSeverity());
    }

    public boolean unregisterChannel(String name) {
        ChannelSlot removed;
        synchronized (mutationLock) {
            Map<String, ChannelSlot> updated = new LinkedHashMap<>(channels);
            removed = updated.remove(name);
            if (removed == null) {
                return false;
            }
            channels = Collections.unmodifiableMap(updated);
        }
        removed.cancelHealthCheck();
        closeChannel(removed);
        log.info("通道已注销: {}", name);
        return true;
    }

    /**
     * 投递到级别范围匹配的通道; 处于升级状态时额外投递到兜底通道
     */
    public DeliveryOutcome deliver(Alert alert) {
        deliveries.incrementAndGet();
        boolean escalated = escalationMonitor.isActive();
        List<ChannelSlot> targets = new ArrayList<>();
        for (ChannelSlot slot : channels.values()) {
            if (slot.config.isEnabled() && slot.config.accepts(alert.getSeverity())) {
                targets.add(slot);
            }
        }
        if (escalated) {
            escalatedDeliveries.incrementAndGet();
            fallbackSlot().filter(slot -> !targets.contains(slot)).ifPresent(targets::add);
        }
        return new DeliveryOutcome(alert.getId(), deliverTo(alert, targets), escalated);
    }

    /**
     * 直接投递到兜底通道和所有紧急通道, 不考虑级别范围
     */
    public DeliveryOutcome escalate(Alert alert) {
        escalatedDeliveries.incrementAndGet();
        List<ChannelSlot> targets = new ArrayList<>();
        fallbackSlot().ifPresent(targets::add);
        for (ChannelSlot slot : channels.values()) {
            if (slot.config.isEnabled() && slot.config.isEmergencyChannel() && !targets.contains(slot)) {
                targets.add(slot);
            }
        }
        if (targets.isEmpty()) {
            log.warn("没有可用的紧急通道, 告警无法升级: {}", alert.getId());
        }
        return new DeliveryOutcome(alert.getId(), deliverTo(alert, targets), true);
    }

    private Optional<ChannelSlot> fallbackSlot() {
        String fallback = escalationMonitor.getFallbackChannel();
        return StringUtils.isBlank(fallback) ? Optional.empty() : Optional.ofNullable(channels.get(fallback));
    }

    private List<ChannelDeliveryResult> deliverTo(Alert alert, List<ChannelSlot> targets) {
        if (targets.isEmpty()) {
            return List.of();
        }
        if (!deliveryConfig.isParallel() || targets.size() == 1 || fanOutExecutor.isShutdown()) {
            return deliverSequentially(alert, targets);
        }
        return deliverInParallel(alert, targets);
    }

    private List<ChannelDeliveryResult> deliverSequentially(Alert alert, List<ChannelSlot> targets) {
        List<ChannelDeliveryResult> results = new ArrayList<>(targets.size());
        boolean aborted = false;
        for (ChannelSlot slot : targets) {
            if (aborted) {
                results.add(ChannelDeliveryResult.skipped(slot.config.getName(), "Aborted"));
                continue;
            }
            ChannelDeliveryResult result = deliverToChannel(slot, alert);
            results.add(result);
            aborted = !result.isSuccess() && !deliveryConfig.isContinueOnChannelFailure();
        }
        return results;
    }

    /**
     * 启动 min(maxParallelism, 通道数) 个并行任务, 共同消费待投递通道
     */
    private List<ChannelDeliveryResult> deliverInParallel(Alert alert, List<ChannelSlot> targets) {
        ConcurrentLinkedQueue<ChannelSlot> pending = new ConcurrentLinkedQueue<>(targets);
        Map<String, ChannelDeliveryResult> results = new ConcurrentHashMap<>();
        AtomicBoolean aborted = new AtomicBoolean();
        int lanes = Math.min(deliveryConfig.getMaxParallelism(), targets.size());

        List<CompletableFuture<Void>> futures = new ArrayList<>(lanes);
        try {
            for (int i = 0; i < lanes; i++) {
                futures.add(CompletableFuture.runAsync(() -> {
                    ChannelSlot slot;
                    while ((slot = pending.poll()) != null) {
                        String name = slot.config.getName();
                        if (aborted.get()) {
                            results.put(name, ChannelDeliveryResult.skipped(name, "Aborted"));
                            continue;
                        }
                        ChannelDeliveryResult result = deliverToChannel(slot, alert);
                        results.put(name, result);
                        if (!result.isSuccess() && !deliveryConfig.isContinueOnChannelFailure()) {
                            aborted.set(true);
                        }
                    }
                }, fanOutExecutor));
            }
        } catch (RejectedExecutionException e) {
            log.warn("并行投递线程池不可用, 改为顺序投递: {}", alert.getId());
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // 线程池拒绝时, 剩余通道在当前线程完成
        ChannelSlot slot;
        while ((slot = pending.poll()) != null) {
            results.put(slot.config.getName(), deliverToChannel(slot, alert));
        }

        List<ChannelDeliveryResult> ordered = new ArrayList<>(targets.size());
        for (ChannelSlot target : targets) {
            ordered.add(results.get(target.config.getName()));
        }
        return ordered;
    }

    private ChannelDeliveryResult deliverToChannel(ChannelSlot slot, Alert alert) {
        String name = slot.config.getName();
        List<DeliveryAttempt> attempts = new ArrayList<>();
        AtomicInteger attemptNumber = new AtomicInteger();

        try {
            Retry.decorateSupplier(slot.retry, () -> {
                DeliveryAttempt result = attemptSend(slot, alert, attemptNumber.incrementAndGet());
                attempts.add(result);
                slot.health.recordAttempt(result);
                if (shouldRetry(result)) {
                    log.debug("通道发送失败: channel={}, alert={}, attempt={}, error={}",
                            name, alert.getId(), result.getAttemptNumber(), result.getError());
                }
                return result;
            }).get();
        } catch (RuntimeException e) {
            // 退避等待被中断时 Retry 直接抛出, 已完成的尝试照常上报
            log.warn("通道重试异常终止: channel={}, alert={}", name, alert.getId(), e);
        }

        DeliveryAttempt last = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
        if (last != null && last.isSuccess()) {
            escalationMonitor.record(true);
            return new ChannelDeliveryResult(name, true, Collections.unmodifiableList(attempts), null);
        }
        String error = last == null ? "Interrupted" : last.getError();
        log.warn("通道投递失败: channel={}, alert={}, 尝试次数={}, error={}", name, alert.getId(), attempts.size(), error);
        escalationMonitor.record(false);
        return new ChannelDeliveryResult(name, false, Collections.unmodifiableList(attempts), error);
    }

    private static boolean shouldRetry(DeliveryAttempt attempt) {
        return !attempt.isSuccess() && attempt.getOutcome() != DeliveryAttempt.Outcome.REJECTED;
    }

    private DeliveryAttempt attemptSend(ChannelSlot slot, Alert alert, int attemptNumber) {
        String name = slot.config.getName();
        Instant startedAt = clock.instant();
        if (!slot.health.tryAcquirePermission()) {
            return new DeliveryAttempt(name, attemptNumber, DeliveryAttempt.Outcome.REJECTED, Duration.ZERO,
                    REJECTED_CIRCUIT_OPEN, startedAt);
        }

        long startNanos = System.nanoTime();
        Future<Object> future;
        try {
            future = sendExecutor.submit(() -> {
                slot.channel.send(alert);
                return null;
            });
        } catch (RejectedExecutionException e) {
            // 本地资源不足, 与通道健康无关
            slot.health.releasePermission();
            return new DeliveryAttempt(name, attemptNumber, DeliveryAttempt.Outcome.REJECTED, Duration.ZERO,
                    REJECTED_POOL_FULL, startedAt);
        }

        try {
            slot.timeLimiter.executeFutureSupplier(() -> future);
            return new DeliveryAttempt(name, attemptNumber, DeliveryAttempt.Outcome.SUCCESS, elapsed(startNanos),
                    null, startedAt);
        } catch (TimeoutException e) {
            return new DeliveryAttempt(name, attemptNumber, DeliveryAttempt.Outcome.TIMEOUT, elapsed(startNanos),
                    "发送超时: " + slot.config.getSendTimeout(), startedAt);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new DeliveryAttempt(name, attemptNumber, DeliveryAttempt.Outcome.FAILURE, elapsed(startNanos),
                    "Interrupted", startedAt);
        } catch (Exception e) {
            return new DeliveryAttempt(name, attemptNumber, DeliveryAttempt.Outcome.FAILURE, elapsed(startNanos),
                    describe(e), startedAt);
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (error.getCause() != null && error.getCause().getMessage() != null) {
            message = message + ": " + error.getCause().getMessage();
        }
        return StringUtils.defaultIfBlank(message, error.getClass().getSimpleName());
    }

    /**
     * 为所有通道按各自间隔调度健康检查
     */
    public void startHealthChecks(ScheduledExecutorService scheduler) {
        synchronized (mutationLock) {
            this.healthScheduler = Objects.requireNonNull(scheduler, "scheduler");
            channels.values().forEach(this::scheduleHealthCheck);
        }
    }

    private void scheduleHealthCheck(ChannelSlot slot) {
        long interval = slot.config.getHealthCheckInterval().toMillis();
        slot.healthCheckFuture = healthScheduler.scheduleAtFixedRate(
                () -> runHealthCheck(slot), interval, interval, TimeUnit.MILLISECONDS);
    }

    public boolean runHealthCheck(String channelName) {
        ChannelSlot slot = channels.get(channelName);
        if (slot == null) {
            throw new IllegalArgumentException("通道不存在: " + channelName);
        }
        return runHealthCheck(slot);
    }

    public Map<String, Boolean> runHealthChecks() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (ChannelSlot slot : channels.values()) {
            results.put(slot.config.getName(), runHealthCheck(slot));
        }
        return results;
    }

    private boolean runHealthCheck(ChannelSlot slot) {
        String name = slot.config.getName();
        boolean healthy;
        String error = null;
        try {
            Boolean result = slot.timeLimiter.executeFutureSupplier(() -> sendExecutor.submit(slot.channel::healthCheck));
            healthy = Boolean.TRUE.equals(result);
        } catch (RejectedExecutionException e) {
            // 线程池满时跳过本轮检查, 不影响熔断
            log.warn("发送线程池已满, 跳过健康检查: {}", name);
            return false;
        } catch (TimeoutException e) {
            healthy = false;
            error = "健康检查超时";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            healthy = false;
            error = describe(e);
            log.error("通道健康检查异常: {}", name, e);
        }
        slot.health.recordHealthCheck(healthy, error);
        if (!healthy) {
            log.warn("通道健康检查失败: channel={}, error={}", name, error);
        }
        return healthy;
    }

    public Map<String, ChannelHealthStatus> getChannelHealth() {
        Map<String, ChannelHealthStatus> health = new LinkedHashMap<>();
        for (ChannelSlot slot : channels.values()) {
            health.put(slot.config.getName(), slot.health.snapshot(slot.config));
        }
        return Collections.unmodifiableMap(health);
    }

    public Optional<ChannelHealthStatus> getChannelHealth(String channelName) {
        ChannelSlot slot = channels.get(channelName);
        return slot == null ? Optional.empty() : Optional.of(slot.health.snapshot(slot.config));
    }

    /**
     * 通道的重试器, 可订阅重试事件
     */
    public Optional<Retry> getRetry(String channelName) {
        ChannelSlot slot = channels.get(channelName);
        return slot == null ? Optional.empty() : Optional.of(slot.retry);
    }

    public Optional<AlertChannel> getChannel(String channelName) {
        ChannelSlot slot = channels.get(channelName);
        return slot == null ? Optional.empty() : Optional.of(slot.channel);
    }

    public List<String> getChannelNames() {
        return List.copyOf(channels.keySet());
    }

    public boolean hasChannel(String channelName) {
        return channels.containsKey(channelName);
    }

    public EscalationMonitor getEscalationMonitor() {
        return escalationMonitor;
    }

    /**
     * 排队等待发送线程的任务数
     */
    public int getPendingSends() {
        return sendExecutor.getQueue().size();
    }

    public long getDeliveries() {
        return deliveries.get();
    }

    public long getEscalatedDeliveries() {
        return escalatedDeliveries.get();
    }

    @Override
    public void close() {
        Map<String, ChannelSlot> current;
        synchronized (mutationLock) {
            current = channels;
            channels = Collections.emptyMap();
            healthScheduler = null;
        }
        for (ChannelSlot slot : current.values()) {
            slot.cancelHealthCheck();
            closeChannel(slot);
        }
        shutdown(fanOutExecutor);
        shutdown(sendExecutor);
        log.info("通道投递服务已关闭");
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void closeChannel(ChannelSlot slot) {
        try {
            slot.channel.close();
        } catch (Exception e) {
            log.warn("关闭通道失败: {}", slot.config.getName(), e);
        }
    }

    private static final class ChannelSlot {
        private final AlertChannel channel;
        private final ChannelConfig config;
        private final ChannelHealth health;
        private final Retry retry;
        private final TimeLimiter timeLimiter;
        private volatile ScheduledFuture<?> healthCheckFuture;

        private ChannelSlot(AlertChannel channel, ChannelConfig config, ChannelHealth health) {
            this.channel = channel;
            this.config = config;
            this.health = health;
            this.retry = Retry.of(config.getName(),
                    config.getRetryPolicy().<DeliveryAttempt>toRetryConfig(ChannelDeliveryService::shouldRetry));
            this.timeLimiter = TimeLimiter.of(config.getName(), TimeLimiterConfig.custom()
                    .timeoutDuration(config.getSendTimeout())
                    .cancelRunningFuture(true)
                    .build());
        }

        private void cancelHealthCheck() {
            ScheduledFuture<?> future = healthCheckFuture;
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
