package alertpipeline.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import alertpipeline.model.Alert;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;
import alertpipeline.support.MutableClock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the individual filter kinds.
 */
class AlertFiltersTest {

    private static Alert alert(AlertSeverity severity, String source, String message) {
        return Alert.create(severity, source, message);
    }

    @Nested
    @DisplayName("SeverityFilter")
    class Severity {

        @Test
        void suppressesBelowThreshold() {
            SeverityFilter filter = new SeverityFilter("sev", 1, AlertSeverity.ERROR, false);

            assertThat(filter.evaluate(alert(AlertSeverity.WARNING, "s", "m")).getReason())
                    .isEqualTo("BelowSeverityThreshold");
            assertThat(filter.evaluate(alert(AlertSeverity.ERROR, "s", "m")).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("always allows critical when configured")
        void alwaysAllowCritical() {
            SeverityFilter filter = new SeverityFilter("sev", 1, AlertSeverity.EMERGENCY, true);

            assertThat(filter.evaluate(alert(AlertSeverity.CRITICAL, "s", "m")).isAllowed()).isTrue();
            assertThat(filter.evaluate(alert(AlertSeverity.ERROR, "s", "m")).isSuppressed()).isTrue();
        }
    }

    @Nested
    @DisplayName("SourceFilter")
    class Source {

        @Test
        void whitelistWithWildcard() {
            SourceFilter filter = new SourceFilter("src", 1, List.of("db-*"), ListMode.WHITELIST, MatchType.WILDCARD);

            assertThat(filter.evaluate(alert(AlertSeverity.INFO, "DB-primary", "m")).isAllowed()).isTrue();
            assertThat(filter.evaluate(alert(AlertSeverity.INFO, "api", "m")).getReason())
                    .isEqualTo("SourceNotWhitelisted");
        }

        @Test
        void blacklistExact() {
            SourceFilter filter = new SourceFilter("src", 1, List.of("noisy"), ListMode.BLACKLIST, MatchType.EXACT);

            assertThat(filter.evaluate(alert(AlertSeverity.INFO, "noisy", "m")).getReason())
                    .isEqualTo("SourceBlacklisted");
            assertThat(filter.evaluate(alert(AlertSeverity.INFO, "Noisy", "m")).isAllowed()).isTrue();
        }

        @Test
        void requiresSources() {
            assertThatThrownBy(() -> new SourceFilter("src", 1, List.of(), ListMode.BLACKLIST, MatchType.EXACT))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("ContentFilter")
    class Content {

        @Test
        void suppressOnMatch() {
            ContentFilter filter = new ContentFilter("c", 1, List.of("heartbeat"), MatchType.IGNORE_CASE, true);

            assertThat(filter.evaluate(alert(AlertSeverity.INFO, "s", "Heartbeat missed")).getReason())
                    .isEqualTo("ContentMatched");
            assertThat(filter.evaluate(alert(AlertSeverity.INFO, "s", "disk full")).isAllowed()).isTrue();
        }

        @Test
        void allowOnlyMatching() {
            ContentFilter filter = new ContentFilter("c", 1, List.of("timeout \\d+"), MatchType.REGEX, false);

            assertThat(filter.evaluate(alert(AlertSeverity.INFO, "s", "read timeout 30s")).isAllowed()).isTrue();
            assertThat(filter.evaluate(alert(AlertSeverity.INFO, "s", "ok")).getReason())
                    .isEqualTo("ContentNotMatched");
        }
    }

    @Nested
    @DisplayName("TimeWindowFilter")
    class TimeWindow {

        @Test
        @DisplayName("allows only inside a weekday window")
        void insideWindow() {
            // 2026-03-02 is a Monday
            MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
            TimeWindowFilter filter = new TimeWindowFilter("tw", 1, ZoneOffset.UTC, LocalTime.of(9, 0),
                    LocalTime.of(17, 0), EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), true, clock);
            Alert alert = alert(AlertSeverity.INFO, "s", "m");

            assertThat(filter.evaluate(alert).isAllowed()).isTrue();
            clock.set(Instant.parse("2026-03-02T18:00:00Z"));
            assertThat(filter.evaluate(alert).getReason()).isEqualTo("OutsideTimeWindow");
            clock.set(Instant.parse("2026-03-07T10:00:00Z"));
            assertThat(filter.evaluate(alert).isSuppressed()).isTrue();
        }

        @Test
        @DisplayName("handles windows that cross midnight")
        void crossesMidnight() {
            MutableClock clock = new MutableClock(Instant.parse("2026-03-02T23:30:00Z"));
            TimeWindowFilter filter = new TimeWindowFilter("quiet", 1, ZoneOffset.UTC, LocalTime.of(22, 0),
                    LocalTime.of(6, 0), null, false, clock);
            Alert alert = alert(AlertSeverity.INFO, "s", "m");

            assertThat(filter.evaluate(alert).getReason()).isEqualTo("InsideTimeWindow");
            clock.set(Instant.parse("2026-03-03T05:59:00Z"));
            assertThat(filter.evaluate(alert).isSuppressed()).isTrue();
            clock.set(Instant.parse("2026-03-03T06:00:00Z"));
            assertThat(filter.evaluate(alert).isAllowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("TagFilter and CorrelationIdFilter")
    class TagsAndCorrelation {

        @Test
        void excludedTag() {
            TagFilter filter = new TagFilter("t", 1, null, List.of("Test"), null);
            Alert tagged = alert(AlertSeverity.INFO, "s", "m").withTag("test");

            assertThat(filter.evaluate(tagged).getReason()).isEqualTo("ExcludedTag");
        }

        @Test
        void missingRequiredTag() {
            TagFilter filter = new TagFilter("t", 1, List.of("prod"), null, null);

            assertThat(filter.evaluate(alert(AlertSeverity.INFO, "s", "m")).getReason())
                    .isEqualTo("MissingRequiredTag");
        }

        @Test
        void correlationId() {
            CorrelationIdFilter filter = new CorrelationIdFilter("corr", 1, "req-\\d+", true);
            Alert withId = Alert.builder().severity(AlertSeverity.INFO).source("s").correlationId("req-42").build();

            assertThat(filter.evaluate(withId).isAllowed()).isTrue();
            assertThat(filter.evaluate(alert(AlertSeverity.INFO, "s", "m")).getReason())
                    .isEqualTo("CorrelationIdNotMatched");
        }
    }

    @Nested
    @DisplayName("CompositeFilter")
    class Composite {

        private final AlertFilter allow = new PassThroughFilter("allow", 1);
        private final AlertFilter block = new BlockFilter("block", 1, "Blocked");
        private final Alert alert = alert(AlertSeverity.INFO, "s", "m");

        @Test
        void operators() {
            assertThat(new CompositeFilter("and", 1, LogicalOperator.AND, List.of(allow, block))
                    .evaluate(alert).getReason()).isEqualTo("CompositeAND");
            assertThat(new CompositeFilter("or", 1, LogicalOperator.OR, List.of(allow, block))
                    .evaluate(alert).isAllowed()).isTrue();
            assertThat(new CompositeFilter("xor", 1, LogicalOperator.XOR, List.of(allow, allow))
                    .evaluate(alert).isSuppressed()).isTrue();
            assertThat(new CompositeFilter("not", 1, LogicalOperator.NOT, List.of(block))
                    .evaluate(alert).isAllowed()).isTrue();
        }

        @Test
        void notRequiresSingleChild() {
            assertThatThrownBy(() -> new CompositeFilter("not", 1, LogicalOperator.NOT, List.of(allow, block)))
                    .isInstanceOf(ConfigurationException.class);
        }
    }
}
