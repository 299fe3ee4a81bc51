package alertpipeline.channel;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * 统计窗口内全部通道的投递失败率, 超过阈值时进入升级状态并保持 cooldown 时长.
 * 也可以手动开启紧急模式, 与失败率无关
 */
@Slf4j
public class EscalationMonitor {

    private final EscalationConfig config;
    private final Clock clock;
    private final Deque<Sample> samples = new ArrayDeque<>();
    private int failuresInWindow;
    private Instant escalatedUntil;
    private long activations;
    private volatile String emergencyReason;

    public EscalationMonitor(EscalationConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * 记录一次通道投递结果, 并判断是否需要升级. 返回 true 表示本次记录触发了升级
     */
    public synchronized boolean record(boolean success) {
        if (!config.isEnabled()) {
            return false;
        }
        Instant now = clock.instant();
        samples.addLast(new Sample(now, success));
        if (!success) {
            failuresInWindow++;
        }
        evictExpired(now);

        if (isAutoEscalated(now) || samples.size() < config.getMinimumSamples()) {
            return false;
        }
        double ratio = (double) failuresInWindow / samples.size();
        if (ratio <= config.getFailureThreshold()) {
            return false;
        }
        escalatedUntil = now.plus(config.getCooldown());
        activations++;
        log.warn("通道失败率过高, 启用紧急升级: 失败率={}, 样本数={}, 兜底通道={}, 持续到={}",
                String.format("%.2f", ratio), samples.size(), config.getFallbackChannel(), escalatedUntil);
        return true;
    }

    public boolean isActive() {
        return emergencyReason != null || isAutoEscalatedNow();
    }

    private synchronized boolean isAutoEscalatedNow() {
        return isAutoEscalated(clock.instant());
    }

    private boolean isAutoEscalated(Instant now) {
        return escalatedUntil != null && now.isBefore(escalatedUntil);
    }

    public void enableEmergencyMode(String reason) {
        emergencyReason = reason != null ? reason : "manual";
        log.warn("紧急模式已开启: {}", emergencyReason);
    }

    public synchronized void disableEmergencyMode() {
        emergencyReason = null;
        escalatedUntil = null;
        log.info("紧急模式已关闭");
    }

    public boolean isEmergencyModeForced() {
        return emergencyReason != null;
    }

    public String getEmergencyReason() {
        return emergencyReason;
    }

    public synchronized double getFailureRatio() {
        evictExpired(clock.instant());
        return samples.isEmpty() ? 0.0 : (double) failuresInWindow / samples.size();
    }

    public synchronized long getActivations() {
        return activations;
    }

    public String getFallbackChannel() {
        return config.getFallbackChannel();
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(config.getEvaluationWindow());
        while (!samples.isEmpty() && samples.peekFirst().at.isBefore(cutoff)) {
            if (!samples.pollFirst().success) {
                failuresInWindow--;
            }
        }
    }

    private static final class Sample {
        private final Instant at;
        private final boolean success;

        private Sample(Instant at, boolean success) {
            this.at = at;
            this.success = success;
        }
    }
}
