package alertpipeline.suppression;

import alertpipeline.filter.MatchType;
import alertpipeline.model.Alert;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * 按来源限流. 来源匹配通配符表达式; perSource 为 true 时每个来源单独计数, 否则所有匹配来源共享计数.
 * 超出窗口上限的告警按配置的动作抑制、排队或升级
 */
public class RateLimitRule extends AbstractSuppressionRule implements QueueingRule {

    public static final String REASON = "RateLimited";
    private static final String SHARED_KEY = "*";

    private final String sourcePattern;
    private final Pattern compiledPattern;
    private final AlertSeverity severity;
    private final boolean perSource;
    private final int maxAlertsInWindow;
    private final Duration window;
    private final SuppressionAction action;
    private final Cache<String, SlidingWindowRateLimiter> limiters;
    private final DeferredAlertQueue deferredQueue;

    public RateLimitRule(String name, int priority, String sourcePattern, AlertSeverity severity, boolean perSource,
                         int maxAlertsInWindow, Duration window, SuppressionAction action,
                         int maxTrackedSources, int maxQueueSize, Duration maxQueueDelay, RuleOptions options) {
        super(name, priority, options);
        if (maxAlertsInWindow <= 0) {
            throw new ConfigurationException("maxAlertsInWindow必须大于0: " + maxAlertsInWindow);
        }
        requirePositive(window, "rate limit window");
        if (action == null || action == SuppressionAction.PASS) {
            throw new ConfigurationException("限流规则的动作不能为PASS: " + name);
        }
        if (maxTrackedSources <= 0) {
            throw new ConfigurationException("maxTrackedSources必须大于0: " + maxTrackedSources);
        }
        if (maxQueueSize <= 0) {
            throw new ConfigurationException("maxQueueSize必须大于0: " + maxQueueSize);
        }
        requirePositive(maxQueueDelay, "maxQueueDelay");
        this.sourcePattern = StringUtils.defaultIfBlank(sourcePattern, "*");
        this.compiledPattern = MatchType.wildcard(this.sourcePattern);
        this.severity = severity;
        this.perSource = perSource;
        this.maxAlertsInWindow = maxAlertsInWindow;
        this.window = window;
        this.action = action;
        this.limiters = CacheBuilder.newBuilder()
                .maximumSize(maxTrackedSources)
                .build();
        this.deferredQueue = new DeferredAlertQueue(maxQueueSize, maxQueueDelay);
    }

    public static RateLimitRule perSource(String name, int priority, int maxAlertsInWindow, Duration window,
                                          SuppressionAction action) {
        return new RateLimitRule(name, priority, "*", null, true, maxAlertsInWindow, window, action,
                10_000, 50, Duration.ofMinutes(5), RuleOptions.DEFAULTS);
    }

    @Override
    public SuppressionVerdict evaluate(Alert alert, Instant now) {
        if (!compiledPattern.matcher(alert.getSource()).matches()) {
            return SuppressionVerdict.pass();
        }
        if (severity != null && alert.getSeverity() != severity) {
            return SuppressionVerdict.pass();
        }
        getStatistics().recordEvaluation();

        String key = perSource ? alert.getSource().toLowerCase(Locale.ROOT) : SHARED_KEY;
        SlidingWindowRateLimiter limiter = limiters.asMap()
                .computeIfAbsent(key, k -> new SlidingWindowRateLimiter(maxAlertsInWindow, window));
        if (limiter.tryAcquire(now)) {
            return SuppressionVerdict.pass();
        }
        getStatistics().recordTrigger(now);
        return SuppressionVerdict.of(action, getName(), REASON);
    }

    @Override
    public void prune(Instant now) {
        ConcurrentMap<String, SlidingWindowRateLimiter> map = limiters.asMap();
        map.entrySet().removeIf(entry -> entry.getValue().isIdle(now));
    }

    public int currentCount(String source, Instant now) {
        String key = perSource ? source.toLowerCase(Locale.ROOT) : SHARED_KEY;
        SlidingWindowRateLimiter limiter = limiters.getIfPresent(key);
        return limiter == null ? 0 : limiter.currentCount(now);
    }

    @Override
    public DeferredAlertQueue getDeferredQueue() {
        return deferredQueue;
    }

    public String getSourcePattern() {
        return sourcePattern;
    }

    public int getMaxAlertsInWindow() {
        return maxAlertsInWindow;
    }

    public Duration getWindow() {
        return window;
    }

    public SuppressionAction getAction() {
        return action;
    }
}
