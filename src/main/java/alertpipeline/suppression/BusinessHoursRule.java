package alertpipeline.suppression;

import alertpipeline.model.Alert;
import alertpipeline.model.AlertSeverity;
import alertpipeline.model.ConfigurationException;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 工作时间规则. 工作时间内外使用不同的最低级别, 低于当前生效级别的告警直接抑制
 */
public class BusinessHoursRule extends AbstractSuppressionRule {

    public static final String REASON_BELOW_BUSINESS_HOURS = "BelowBusinessHoursSeverity";
    public static final String REASON_OUTSIDE_BUSINESS_HOURS = "OutsideBusinessHours";

    private final ZoneId zone;
    private final Set<DayOfWeek> workDays;
    private final LocalTime start;
    private final LocalTime end;
    private final AlertSeverity businessHoursMinSeverity;
    private final AlertSeverity afterHoursMinSeverity;

    public BusinessHoursRule(String name, int priority, ZoneId zone, Set<DayOfWeek> workDays,
                             LocalTime start, LocalTime end,
                             AlertSeverity businessHoursMinSeverity, AlertSeverity afterHoursMinSeverity,
                             RuleOptions options) {
        super(name, priority, options);
        this.zone = Objects.requireNonNull(zone, "zone");
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new ConfigurationException("工作时间的开始时间必须早于结束时间: " + start + " - " + end);
        }
        this.workDays = workDays == null || workDays.isEmpty()
                ? EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)
                : EnumSet.copyOf(workDays);
        this.businessHoursMinSeverity = Objects.requireNonNull(businessHoursMinSeverity, "businessHoursMinSeverity");
        this.afterHoursMinSeverity = Objects.requireNonNull(afterHoursMinSeverity, "afterHoursMinSeverity");
    }

    @Override
    public SuppressionVerdict evaluate(Alert alert, Instant now) {
        getStatistics().recordEvaluation();
        boolean businessHours = isBusinessHours(now);
        AlertSeverity threshold = businessHours ? businessHoursMinSeverity : afterHoursMinSeverity;
        if (alert.getSeverity().isAtLeast(threshold)) {
            return SuppressionVerdict.pass();
        }
        getStatistics().recordTrigger(now);
        return SuppressionVerdict.suppress(getName(),
                businessHours ? REASON_BELOW_BUSINESS_HOURS : REASON_OUTSIDE_BUSINESS_HOURS);
    }

    public boolean isBusinessHours(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        LocalTime time = local.toLocalTime();
        return workDays.contains(local.getDayOfWeek()) && !time.isBefore(start) && time.isBefore(end);
    }

    public AlertSeverity getBusinessHoursMinSeverity() {
        return businessHoursMinSeverity;
    }

    public AlertSeverity getAfterHoursMinSeverity() {
        return afterHoursMinSeverity;
    }
}
