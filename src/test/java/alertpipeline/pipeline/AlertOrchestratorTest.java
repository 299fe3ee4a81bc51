package alertpipeline.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import alertpipeline.channel.ChannelConfig;
import alertpipeline.channel.ChannelType;
import alertpipeline.channel.EscalationConfig;
import alertpipeline.channel.InMemoryAlertChannel;
import alertpipeline.channel.RetryPolicy;
import alertpipeline.filter.ContentFilter;
import alertpipeline.filter.MatchType;
import alertpipeline.filter.TagFilter;
import alertpipeline.history.HistoryEntry;
import alertpipeline.model.Alert;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.BackpressureException;
import alertpipeline.model.Disposition;
import alertpipeline.suppression.AbstractSuppressionRule;
import alertpipeline.suppression.DuplicateSuppressionRule;
import alertpipeline.suppression.RateLimitRule;
import alertpipeline.suppression.RuleOptions;
import alertpipeline.suppression.SuppressionAction;
import alertpipeline.suppression.SuppressionVerdict;
import alertpipeline.support.MutableClock;
import alertpipeline.support.ScriptedChannel;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * End-to-end tests for {@link AlertOrchestrator}: severity floors, filters, suppression, aggregation,
 * delivery outcomes, admission control, timeouts, deferred replay and the alert lifecycle.
 */
class AlertOrchestratorTest {

    private static final PipelineConfig BASE = PipelineConfig.builder()
            .minimumSeverity(AlertSeverity.INFO)
            .maintenanceInterval(Duration.ofHours(1))
            .escalation(EscalationConfig.builder().enabled(false).build())
            .build();

    private MutableClock clock;
    private AlertOrchestrator orchestrator;
    private InMemoryAlertChannel memory;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private AlertOrchestrator start(UnaryOperator<PipelineConfig.PipelineConfigBuilder> customizer) {
        orchestrator = new AlertOrchestrator(customizer.apply(BASE.toBuilder()).build(), clock);
        memory = new InMemoryAlertChannel();
        orchestrator.registerChannel(memory, channel("memory").build());
        orchestrator.start();
        return orchestrator;
    }

    private AlertOrchestrator start() {
        return start(UnaryOperator.identity());
    }

    private static ChannelConfig.ChannelConfigBuilder channel(String name) {
        return ChannelConfig.builder()
                .name(name)
                .type(ChannelType.CUSTOM)
                .retryPolicy(RetryPolicy.NO_RETRY);
    }

    private Alert alert(AlertSeverity severity, String source, String message) {
        return Alert.builder().severity(severity).source(source).message(message).timestamp(clock.instant()).build();
    }

    private Alert diskFull() {
        return alert(AlertSeverity.WARNING, "disk-monitor", "disk full");
    }

    private static AlertOutcome outcomeOf(CompletableFuture<AlertOutcome> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    // ========================================================================
    // Happy path and suppression
    // ========================================================================

    @Nested
    @DisplayName("Delivery and duplicate suppression")
    class DeliveryAndDuplicates {

        @Test
        @DisplayName("the same warning twice is delivered once and then suppressed as a duplicate")
        void duplicateScenario() throws Exception {
            start().addSuppressionRule(DuplicateSuppressionRule.exact("dup", 10, Duration.ofMinutes(5)));

            AlertOutcome first = outcomeOf(orchestrator.raise(diskFull()));
            clock.advance(Duration.ofSeconds(10));
            AlertOutcome second = outcomeOf(orchestrator.raise(diskFull()));

            assertThat(first.getStatus()).isEqualTo(OutcomeStatus.DELIVERED);
            assertThat(first.isDelivered()).isTrue();
            assertThat(second.getStatus()).isEqualTo(OutcomeStatus.SUPPRESSED);
            assertThat(second.getReason()).isEqualTo("Duplicate");
            assertThat(second.getDecidedBy()).isEqualTo("dup");
            assertThat(memory.getAlerts()).hasSize(1);
            assertThat(orchestrator.getHistory()).extracting(HistoryEntry::getDisposition)
                    .containsExactly(Disposition.DELIVERED, Disposition.SUPPRESSED);
        }

        @Test
        @DisplayName("suppression can be switched off for the whole pipeline")
        void suppressionDisabled() throws Exception {
            start(builder -> builder.suppressionEnabled(false))
                    .addSuppressionRule(DuplicateSuppressionRule.exact("dup", 10, Duration.ofMinutes(5)));

            outcomeOf(orchestrator.raise(diskFull()));
            AlertOutcome second = outcomeOf(orchestrator.raise(diskFull()));

            assertThat(second.getStatus()).isEqualTo(OutcomeStatus.DELIVERED);
        }

        @Test
        @DisplayName("a rule escalation goes to emergency channels")
        void ruleEscalation() throws Exception {
            start();
            ScriptedChannel oncall = new ScriptedChannel();
            orchestrator.registerChannel(oncall, channel("oncall")
                    .minSeverity(AlertSeverity.EMERGENCY)
                    .emergencyChannel(true)
                    .build());
            orchestrator.addSuppressionRule(new AbstractSuppressionRule("payments-hot", 1, RuleOptions.DEFAULTS) {
                @Override
                public SuppressionVerdict evaluate(Alert alert, Instant now) {
                    return alert.getSource().equals("payments")
                            ? SuppressionVerdict.of(SuppressionAction.ESCALATE, getName(), "HotPath")
                            : SuppressionVerdict.pass();
                }
            });

            AlertOutcome outcome = outcomeOf(orchestrator.raise(alert(AlertSeverity.WARNING, "payments", "refunds stuck")));

            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.ESCALATED);
            assertThat(outcome.getDecidedBy()).isEqualTo("payments-hot");
            assertThat(oncall.getDelivered()).hasSize(1);
            assertThat(memory.getAlerts()).isEmpty();
        }
    }

    // ========================================================================
    // Severity floors and filters
    // ========================================================================

    @Nested
    @DisplayName("Severity floors and filters")
    class FloorsAndFilters {

        @Test
        @DisplayName("alerts below the global minimum are filtered")
        void globalMinimum() throws Exception {
            start(builder -> builder.minimumSeverity(AlertSeverity.WARNING));

            AlertOutcome outcome = outcomeOf(orchestrator.raise(alert(AlertSeverity.INFO, "api", "deploy finished")));

            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FILTERED);
            assertThat(outcome.getReason()).isEqualTo("BelowMinimumSeverity");
            assertThat(memory.getAlerts()).isEmpty();
        }

        @Test
        @DisplayName("a per-source minimum overrides the global one")
        void perSourceMinimum() throws Exception {
            start().setSourceMinimumSeverity("Batch", AlertSeverity.ERROR);

            assertThat(outcomeOf(orchestrator.raise(alert(AlertSeverity.WARNING, "batch", "job slow"))).getStatus())
                    .isEqualTo(OutcomeStatus.FILTERED);
            assertThat(outcomeOf(orchestrator.raise(alert(AlertSeverity.WARNING, "api", "job slow"))).getStatus())
                    .isEqualTo(OutcomeStatus.DELIVERED);

            assertThat(orchestrator.removeSourceMinimumSeverity("batch")).isTrue();
            assertThat(outcomeOf(orchestrator.raise(alert(AlertSeverity.WARNING, "batch", "job slower"))).getStatus())
                    .isEqualTo(OutcomeStatus.DELIVERED);
        }

        @Test
        @DisplayName("a suppressing filter names itself in the outcome")
        void filterSuppresses() throws Exception {
            start().addFilter(new ContentFilter("no-heartbeats", 10, List.of("heartbeat"),
                    MatchType.IGNORE_CASE, true));

            AlertOutcome outcome = outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "agent", "Heartbeat missed")));

            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FILTERED);
            assertThat(outcome.getDecidedBy()).isEqualTo("no-heartbeats");
            assertThat(outcome.getReason()).isEqualTo("ContentMatched");
        }

        @Test
        @DisplayName("a modifying filter changes the delivered alert")
        void filterModifies() throws Exception {
            start().addFilter(new TagFilter("default-tag", 10, null, null, "infra"));

            AlertOutcome outcome = outcomeOf(orchestrator.raise(diskFull()));

            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.DELIVERED);
            assertThat(memory.getAlerts()).singleElement().extracting(Alert::getTag).isEqualTo("infra");
            assertThat(orchestrator.removeFilter("default-tag")).isTrue();
        }
    }

    // ========================================================================
    // Delivery outcomes
    // ========================================================================

    @Nested
    @DisplayName("Delivery outcomes")
    class Outcomes {

        @Test
        @DisplayName("no channel accepting the severity fails with NoMatchingChannel")
        void noMatchingChannel() throws Exception {
            start().unregisterChannel("memory");
            orchestrator.registerChannel(new ScriptedChannel(), channel("pager").minSeverity(AlertSeverity.CRITICAL).build());

            AlertOutcome outcome = outcomeOf(orchestrator.raise(diskFull()));

            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FAILED);
            assertThat(outcome.getReason()).isEqualTo("NoMatchingChannel");
        }

        @Test
        @DisplayName("one failing channel out of two is a partial delivery")
        void partialDelivery() throws Exception {
            start().registerChannel(new ScriptedChannel().failAlways(true), channel("broken").build());

            AlertOutcome outcome = outcomeOf(orchestrator.raise(diskFull()));

            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.PARTIALLY_DELIVERED);
            assertThat(outcome.getDelivery().getFailureCount()).isEqualTo(1);
            assertThat(orchestrator.getActiveAlerts()).hasSize(1);
        }

        @Test
        @DisplayName("every channel failing is a failed delivery")
        void allChannelsFailed() throws Exception {
            start().unregisterChannel("memory");
            orchestrator.registerChannel(new ScriptedChannel().failAlways(true), channel("broken").build());

            AlertOutcome outcome = outcomeOf(orchestrator.raise(diskFull()));

            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FAILED);
            assertThat(outcome.getReason()).isEqualTo("AllChannelsFailed");
            assertThat(orchestrator.getActiveAlerts()).isEmpty();
        }

        @Test
        @DisplayName("manual emergency mode adds the fallback channel")
        void emergencyMode() throws Exception {
            start(builder -> builder.escalation(EscalationConfig.builder().enabled(false).fallbackChannel("pager").build()));
            ScriptedChannel pager = new ScriptedChannel();
            orchestrator.registerChannel(pager, channel("pager").minSeverity(AlertSeverity.EMERGENCY).build());

            orchestrator.enableEmergencyMode("drill");
            outcomeOf(orchestrator.raise(diskFull()));

            assertThat(orchestrator.isEmergencyModeActive()).isTrue();
            assertThat(orchestrator.getStatistics().isEmergencyModeActive()).isTrue();
            assertThat(pager.getDelivered()).hasSize(1);

            orchestrator.disableEmergencyMode();
            assertThat(orchestrator.isEmergencyModeActive()).isFalse();
        }
    }

    // ========================================================================
    // Aggregation
    // ========================================================================

    @Nested
    @DisplayName("Aggregation")
    class Aggregation {

        @Test
        @DisplayName("a full group is delivered as one alert carrying the member count")
        void fullGroup() throws Exception {
            start(builder -> builder.aggregationEnabled(true).maxAggregationSize(3));

            assertThat(outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "db", "pool at 90%"))).getStatus())
                    .isEqualTo(OutcomeStatus.AGGREGATED);
            assertThat(outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "db", "pool at 91%"))).getStatus())
                    .isEqualTo(OutcomeStatus.AGGREGATED);
            AlertOutcome third = outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "db", "pool at 92%")));

            assertThat(third.getStatus()).isEqualTo(OutcomeStatus.DELIVERED);
            assertThat(memory.getAlerts()).singleElement().satisfies(grouped -> {
                assertThat(grouped.getCount()).isEqualTo(3);
                assertThat(grouped.getMessage()).isEqualTo("pool at 90% (x3 similar alerts)");
            });
        }

        @Test
        @DisplayName("maintenance flushes groups whose window has elapsed")
        void windowFlush() throws Exception {
            start(builder -> builder.aggregationEnabled(true).aggregationWindow(Duration.ofMinutes(1)));
            outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "db", "pool at 90%")));
            outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "db", "pool at 95%")));
            assertThat(memory.getAlerts()).isEmpty();

            clock.advance(Duration.ofMinutes(1));
            orchestrator.performMaintenance();

            await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
                assertThat(memory.getAlerts()).singleElement().extracting(Alert::getCount).isEqualTo(2);
                assertThat(orchestrator.getStatistics().getDelivered()).isEqualTo(1);
            });
            assertThat(orchestrator.getStatistics().getAggregated()).isEqualTo(2);
        }

        @Test
        @DisplayName("closing the pipeline flushes open groups")
        void flushOnClose() throws Exception {
            start(builder -> builder.aggregationEnabled(true));
            outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "db", "pool at 90%")));

            orchestrator.close();

            assertThat(memory.getSendCount()).isEqualTo(1);
        }
    }

    // ========================================================================
    // Admission, timeouts and lifecycle of the pipeline
    // ========================================================================

    @Nested
    @DisplayName("Admission and timeouts")
    class Admission {

        @Test
        @DisplayName("raising before start or after close is rejected")
        void stoppedPipeline() throws Exception {
            orchestrator = new AlertOrchestrator(BASE, clock);

            AlertOutcome beforeStart = outcomeOf(orchestrator.raise(diskFull()));
            orchestrator.start();
            orchestrator.close();
            AlertOutcome afterClose = outcomeOf(orchestrator.raise(diskFull()));

            assertThat(beforeStart.getStatus()).isEqualTo(OutcomeStatus.REJECTED);
            assertThat(beforeStart.getReason()).isEqualTo("PipelineStopped");
            assertThat(afterClose.getStatus()).isEqualTo(OutcomeStatus.REJECTED);
            assertThat(orchestrator.isRunning()).isFalse();
            assertThatThrownBy(orchestrator::start).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("alerts beyond concurrency plus buffer are rejected immediately")
        void backpressure() throws Exception {
            start(builder -> builder.maxConcurrentAlerts(1).alertBufferSize(1)).unregisterChannel("memory");
            ScriptedChannel blocking = new ScriptedChannel().hold();
            orchestrator.registerChannel(blocking, channel("blocking").build());

            CompletableFuture<AlertOutcome> first = orchestrator.raise(alert(AlertSeverity.ERROR, "api", "one"));
            CompletableFuture<AlertOutcome> second = orchestrator.raise(alert(AlertSeverity.ERROR, "api", "two"));
            AlertOutcome third = outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "api", "three")));

            assertThat(third.getStatus()).isEqualTo(OutcomeStatus.REJECTED);
            assertThat(third.getReason()).isEqualTo("Backpressure");
            assertThat(third.getCause()).isInstanceOf(BackpressureException.class);

            blocking.release();
            assertThat(outcomeOf(first).getStatus()).isEqualTo(OutcomeStatus.DELIVERED);
            assertThat(outcomeOf(second).getStatus()).isEqualTo(OutcomeStatus.DELIVERED);
            assertThat(orchestrator.getStatistics().getRejected()).isEqualTo(1);
        }

        @Test
        @DisplayName("slow processing times out but the delivery still completes")
        void processingTimeout() throws Exception {
            start(builder -> builder.processingTimeout(Duration.ofMillis(200))).unregisterChannel("memory");
            ScriptedChannel slow = new ScriptedChannel().delay(Duration.ofSeconds(1));
            orchestrator.registerChannel(slow, channel("slow").build());

            AlertOutcome outcome = outcomeOf(orchestrator.raise(diskFull()));

            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.TIMED_OUT);
            assertThat(outcome.getReason()).isEqualTo("ProcessingTimeout");
            await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                    assertThat(orchestrator.getHistory()).extracting(HistoryEntry::getDisposition)
                            .contains(Disposition.DELIVERED));
            assertThat(orchestrator.getStatistics().getTimedOut()).isEqualTo(1);
            assertThat(orchestrator.getStatistics().getDelivered()).isZero();
        }
    }

    // ========================================================================
    // Deferred queue replay
    // ========================================================================

    @Nested
    @DisplayName("Deferred replay")
    class DeferredReplay {

        private RateLimitRule queueingRule() {
            return new RateLimitRule("rate", 20, "*", null, true, 1, Duration.ofMinutes(1),
                    SuppressionAction.QUEUE, 100, 10, Duration.ofMinutes(5), RuleOptions.DEFAULTS);
        }

        @Test
        @DisplayName("queued alerts are delivered by maintenance once the limit allows")
        void replayed() throws Exception {
            start().addSuppressionRule(queueingRule());
            outcomeOf(orchestrator.raise(alert(AlertSeverity.WARNING, "api", "latency high")));
            AlertOutcome queued = outcomeOf(orchestrator.raise(alert(AlertSeverity.WARNING, "api", "latency higher")));
            assertThat(queued.getStatus()).isEqualTo(OutcomeStatus.QUEUED);
            assertThat(orchestrator.getStatistics().getDeferredAlerts()).isEqualTo(1);

            clock.advance(Duration.ofSeconds(61));
            orchestrator.performMaintenance();

            await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertThat(memory.getAlerts()).hasSize(2));
            assertThat(orchestrator.getStatistics().getDeferredAlerts()).isZero();
        }

        @Test
        @DisplayName("queued alerts older than the maximum delay are dropped as QueueExpired")
        void expired() throws Exception {
            start().addSuppressionRule(queueingRule());
            outcomeOf(orchestrator.raise(alert(AlertSeverity.WARNING, "api", "latency high")));
            outcomeOf(orchestrator.raise(alert(AlertSeverity.WARNING, "api", "latency higher")));

            clock.advance(Duration.ofMinutes(6));
            orchestrator.performMaintenance();

            assertThat(orchestrator.queryHistory(entry -> "QueueExpired".equals(entry.getReason()))).hasSize(1);
            assertThat(memory.getAlerts()).hasSize(1);
        }
    }

    // ========================================================================
    // Alert lifecycle and statistics
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle and statistics")
    class Lifecycle {

        @Test
        @DisplayName("delivered alerts can be acknowledged once and resolved")
        void acknowledgeAndResolve() throws Exception {
            start();
            AlertOutcome outcome = outcomeOf(orchestrator.raise(diskFull()));
            String id = outcome.getAlertId();

            assertThat(orchestrator.acknowledge(id, "alice")).isTrue();
            assertThat(orchestrator.acknowledge(id, "bob")).isFalse();
            assertThat(orchestrator.getActiveAlert(id)).get().extracting(Alert::getAcknowledgedBy).isEqualTo("alice");
            assertThat(orchestrator.resolve(id, "alice")).isTrue();
            assertThat(orchestrator.resolve(id, "alice")).isFalse();

            assertThat(orchestrator.getActiveAlerts()).isEmpty();
            assertThat(orchestrator.getHistory()).extracting(HistoryEntry::getDisposition)
                    .containsExactly(Disposition.DELIVERED, Disposition.ACKNOWLEDGED, Disposition.RESOLVED);
        }

        @Test
        @DisplayName("resolveBySource resolves every active alert of a source")
        void resolveBySource() throws Exception {
            start();
            outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "db", "replica lag")));
            outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "db", "disk slow")));
            outcomeOf(orchestrator.raise(alert(AlertSeverity.ERROR, "api", "5xx")));

            assertThat(orchestrator.resolveBySource("DB", "ops")).isEqualTo(2);
            assertThat(orchestrator.getActiveAlerts()).extracting(Alert::getSource).containsExactly("api");
        }

        @Test
        @DisplayName("statistics count every outcome and can be reset")
        void statistics() throws Exception {
            start(builder -> builder.minimumSeverity(AlertSeverity.WARNING))
                    .addSuppressionRule(DuplicateSuppressionRule.exact("dup", 10, Duration.ofMinutes(5)));
            outcomeOf(orchestrator.raise(diskFull()));
            outcomeOf(orchestrator.raise(diskFull()));
            outcomeOf(orchestrator.raise(alert(AlertSeverity.DEBUG, "api", "trace")));

            AlertStatistics statistics = orchestrator.getStatistics();
            assertThat(statistics.getRaised()).isEqualTo(3);
            assertThat(statistics.getDelivered()).isEqualTo(1);
            assertThat(statistics.getSuppressed()).isEqualTo(1);
            assertThat(statistics.getFiltered()).isEqualTo(1);
            assertThat(statistics.getActiveAlerts()).isEqualTo(1);
            assertThat(statistics.getRegisteredChannels()).isEqualTo(1);

            orchestrator.resetStatistics();
            assertThat(orchestrator.getStatistics().getRaised()).isZero();
            assertThat(orchestrator.getStatistics().getSince()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("channel health is reported per channel")
        void channelHealth() throws Exception {
            start();
            outcomeOf(orchestrator.raise(diskFull()));

            assertThat(orchestrator.getChannelHealth()).containsKey("memory");
            assertThat(orchestrator.getChannelHealth().get("memory").getSuccessfulSends()).isEqualTo(1);
        }
    }
}
