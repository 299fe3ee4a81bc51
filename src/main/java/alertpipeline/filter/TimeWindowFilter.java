package alertpipeline.filter;

import alertpipeline.model.Alert;
import alertpipeline.model.ConfigurationException;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 时间窗口过滤器. 支持跨午夜的窗口, 例如 22:00-06:00
 */
public class TimeWindowFilter extends AbstractAlertFilter {

    private final ZoneId zone;
    private final LocalTime start;
    private final LocalTime end;
    private final Set<DayOfWeek> days;
    private final boolean allowInside;
    private final Clock clock;

    public TimeWindowFilter(String name, int priority, ZoneId zone, LocalTime start, LocalTime end,
                            Set<DayOfWeek> days, boolean allowInside, Clock clock) {
        super(name, priority);
        this.zone = Objects.requireNonNull(zone, "zone");
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        if (start.equals(end)) {
            throw new ConfigurationException("时间窗口的开始和结束时间不能相同: " + name);
        }
        this.days = days == null || days.isEmpty() ? EnumSet.allOf(DayOfWeek.class) : EnumSet.copyOf(days);
        this.allowInside = allowInside;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public FilterDecision evaluate(Alert alert) {
        boolean inside = isInsideWindow(ZonedDateTime.now(clock).withZoneSameInstant(zone));
        if (inside == allowInside) {
            return FilterDecision.allow();
        }
        return FilterDecision.suppress(allowInside ? "OutsideTimeWindow" : "InsideTimeWindow");
    }

    boolean isInsideWindow(ZonedDateTime now) {
        LocalTime time = now.toLocalTime();
        if (start.isBefore(end)) {
            return days.contains(now.getDayOfWeek()) && !time.isBefore(start) && time.isBefore(end);
        }
        // 跨午夜: 凌晨部分属于前一天的窗口
        if (!time.isBefore(start)) {
            return days.contains(now.getDayOfWeek());
        }
        return time.isBefore(end) && days.contains(now.getDayOfWeek().minus(1));
    }
}
