package microservices.taskmanager.timeout.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.enums.PeriodType;
import microservices.taskmanager.timeout.enums.TimeOutMode;
import microservices.taskmanager.timeout.util.ScheduleTimes;

/**
 * Turns a task's schedule into concrete instants for the cycle that contains
 * "now". Pure: no repository access, no writes.
 * <p>
 * Time-of-day values are anchored to the cycle date in the zone of the
 * injected clock. The cycle date is today for daily and one-off tasks, and
 * the latest recurrence on or before today, counted from period start, for
 * the others.
 */
@Component
public class DeadlineCalculator {

    private final ZoneId zone;
    private final TimeOutMode timeOutMode;

    public DeadlineCalculator(Clock clock,
                              @Value("${task-timeout.deadline.time-out-mode:TIME_OF_DAY}") TimeOutMode timeOutMode) {
        this.zone = clock.getZone();
        this.timeOutMode = timeOutMode;
    }

    /**
     * @return the instant after which the task is overdue in the current cycle,
     * or empty when no timeout is configured, a time field does not parse, or
     * today lies outside the task's period
     */
    public Optional<Instant> timeoutDeadline(Task task, Instant now) {
        Optional<LocalTime> closure = ScheduleTimes.parseTimeOfDay(task.getTimeCloture());
        if (closure.isEmpty()) {
            return Optional.empty();
        }
        return cycleDate(task, now).flatMap(date -> switch (timeOutMode) {
            case TIME_OF_DAY -> ScheduleTimes.parseTimeOfDay(task.getTimeOut())
                    .map(timeOut -> toInstant(date, timeOut));
            case BEFORE_CLOSURE -> ScheduleTimes.parseDuration(task.getTimeOut())
                    .map(offset -> toInstant(date, closure.get()).minus(offset));
        });
    }

    /**
     * Closure of the current cycle. Display only, never used for gating.
     */
    public Optional<Instant> closureDeadline(Task task, Instant now) {
        return ScheduleTimes.parseTimeOfDay(task.getTimeCloture())
                .flatMap(closure -> cycleDate(task, now).map(date -> toInstant(date, closure)));
    }

    Optional<LocalDate> cycleDate(Task task, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        LocalDate start = task.getPeriodStart();
        if (start != null && today.isBefore(start)) {
            return Optional.empty();
        }
        if (task.getPeriodEnd() != null && today.isAfter(task.getPeriodEnd())) {
            return Optional.empty();
        }
        PeriodType periodType = PeriodType.parse(task.getPeriodType());
        if (start == null || periodType.isAnchoredToToday()) {
            return Optional.of(today);
        }
        long step = periodType.getStep();
        long cycles = periodType.getUnit().between(start, today) / step;
        // month arithmetic clamps to month end: Jan 31 plus one month is Feb 28,
        // while MONTHS.between(Jan 31, Feb 28) is still 0
        LocalDate next = start.plus((cycles + 1) * step, periodType.getUnit());
        if (!next.isAfter(today)) {
            return Optional.of(next);
        }
        return Optional.of(start.plus(cycles * step, periodType.getUnit()));
    }

    private Instant toInstant(LocalDate date, LocalTime time) {
        return date.atTime(time).atZone(zone).toInstant();
    }

}
