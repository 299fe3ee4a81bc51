package alertpipeline.aggregation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import alertpipeline.model.Alert;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;
import alertpipeline.support.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link AggregationEngine} and {@link AggregationGroup}.
 */
class AggregationEngineTest {

    private MutableClock clock;
    private List<AggregationGroup> flushed;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        flushed = new ArrayList<>();
    }

    private AggregationEngine engine(int maxSize) {
        AggregationEngine engine = new AggregationEngine(true, Duration.ofMinutes(1), maxSize, clock);
        engine.setFlushListener(flushed::add);
        return engine;
    }

    private static Alert poolAlert(int percent) {
        return Alert.create(AlertSeverity.ERROR, "db", "connection pool at " + percent + "%");
    }

    @Nested
    @DisplayName("Grouping")
    class Grouping {

        @Test
        @DisplayName("disabled engine passes alerts through immediately")
        void disabled() {
            AggregationEngine engine = new AggregationEngine(false, Duration.ofMinutes(1), 10, clock);

            assertThat(engine.offer(poolAlert(90)).getType()).isEqualTo(AggregationResult.Type.IMMEDIATE);
            assertThat(engine.getOpenGroupCount()).isZero();
        }

        @Test
        @DisplayName("M similar alerts with size cap N close ceil(M/N) groups with true counts")
        void ceilGroups() {
            AggregationEngine engine = engine(4);
            List<AggregationGroup> closed = new ArrayList<>();

            for (int i = 0; i < 10; i++) {
                AggregationResult result = engine.offer(poolAlert(90 + i));
                if (result.getType() == AggregationResult.Type.FLUSHED) {
                    closed.add(result.getGroup());
                }
            }
            engine.flushAll();
            closed.addAll(flushed);

            assertThat(closed).hasSize(3);
            assertThat(closed).extracting(AggregationGroup::getCount).containsExactly(4, 4, 2);
        }

        @Test
        @DisplayName("dissimilar alerts form separate groups")
        void separateGroups() {
            AggregationEngine engine = engine(10);
            engine.offer(poolAlert(90));
            engine.offer(Alert.create(AlertSeverity.ERROR, "db", "replica lag"));
            engine.offer(Alert.create(AlertSeverity.WARNING, "db", "connection pool at 91%"));

            assertThat(engine.getOpenGroupCount()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Window expiry")
    class Expiry {

        @Test
        @DisplayName("flushExpired emits groups whose window has elapsed")
        void flushExpired() {
            AggregationEngine engine = engine(10);
            engine.offer(poolAlert(90));
            engine.offer(poolAlert(91));

            clock.advance(Duration.ofSeconds(59));
            assertThat(engine.flushExpired()).isZero();
            clock.advance(Duration.ofSeconds(1));
            assertThat(engine.flushExpired()).isEqualTo(1);

            assertThat(flushed).singleElement().extracting(AggregationGroup::getCount).isEqualTo(2);
            assertThat(engine.getOpenGroupCount()).isZero();
        }

        @Test
        @DisplayName("an offer after expiry emits the old group and starts a new one")
        void offerAfterExpiry() {
            AggregationEngine engine = engine(10);
            engine.offer(poolAlert(90));
            clock.advance(Duration.ofMinutes(2));

            AggregationResult result = engine.offer(poolAlert(95));

            assertThat(flushed).hasSize(1);
            assertThat(result.getType()).isEqualTo(AggregationResult.Type.ACCUMULATED);
            assertThat(result.getGroup().getCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Grouped alert")
    class GroupedAlert {

        @Test
        @DisplayName("single member group emits the original alert")
        void singleMember() {
            AggregationEngine engine = engine(10);
            Alert only = poolAlert(90);
            engine.offer(only);
            engine.flushAll();

            assertThat(flushed.get(0).toGroupedAlert()).isSameAs(only);
        }

        @Test
        @DisplayName("multi member group carries count and sample ids")
        void multiMember() {
            AggregationEngine engine = engine(3);
            Alert first = poolAlert(90);
            engine.offer(first);
            clock.advance(Duration.ofSeconds(5));
            engine.offer(poolAlert(91));
            clock.advance(Duration.ofSeconds(5));
            AggregationResult result = engine.offer(poolAlert(92));

            Alert grouped = result.getGroup().toGroupedAlert();

            assertThat(grouped.getCount()).isEqualTo(3);
            assertThat(grouped.getMessage()).isEqualTo("connection pool at 90% (x3 similar alerts)");
            assertThat(grouped.getTimestamp()).isEqualTo(clock.instant());
            assertThat(grouped.getContext())
                    .containsEntry("aggregated_count", 3)
                    .containsKeys("aggregation_fingerprint", "first_seen", "last_seen", "sample_ids");
            assertThat((List<?>) grouped.getContextValue("sample_ids")).hasSize(3).first().isEqualTo(first.getId());
        }

        @Test
        @DisplayName("sample ids on the grouped alert cannot be modified")
        @SuppressWarnings("unchecked")
        void sampleIdsAreImmutable() {
            AggregationEngine engine = engine(2);
            engine.offer(poolAlert(90));
            AggregationResult result = engine.offer(poolAlert(91));

            List<Object> sampleIds = (List<Object>) result.getGroup().toGroupedAlert().getContextValue("sample_ids");

            assertThatThrownBy(() -> sampleIds.add("forged"))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThat(sampleIds).hasSize(2);
        }
    }

    @Test
    @DisplayName("enabled engine rejects invalid limits")
    void rejectsInvalidLimits() {
        assertThatThrownBy(() -> new AggregationEngine(true, Duration.ZERO, 10, clock))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new AggregationEngine(true, Duration.ofMinutes(1), 0, clock))
                .isInstanceOf(ConfigurationException.class);
    }
}
