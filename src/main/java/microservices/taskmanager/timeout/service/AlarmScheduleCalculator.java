package microservices.taskmanager.timeout.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.util.ScheduleTimes;

/**
 * When a task's alarm series starts. The alarm field takes one of three
 * shapes:
 * <ul>
 * <li>an offset object, {"days":1,"hours":2,"minutes":0,"seconds":0}, counted
 * from the start of the period or, without one, from the task's creation</li>
 * <li>a keyed object of times of day; the first key present among the ISO
 * date, the weekday name, the day of month, "daily" and "all" wins for the
 * current cycle date</li>
 * <li>a plain "HH:mm[:ss]" time of day for every cycle date</li>
 * </ul>
 */
@Component
@Slf4j
public class AlarmScheduleCalculator {

    private static final List<String> OFFSET_FIELDS = List.of("days", "hours", "minutes", "seconds");

    private final ObjectMapper objectMapper;
    private final DeadlineCalculator deadlineCalculator;
    private final ZoneId zone;

    public AlarmScheduleCalculator(ObjectMapper objectMapper, DeadlineCalculator deadlineCalculator, Clock clock) {
        this.objectMapper = objectMapper;
        this.deadlineCalculator = deadlineCalculator;
        this.zone = clock.getZone();
    }

    public Optional<Instant> alarmStart(Task task, Instant now) {
        String alarm = task.getAlarm();
        if (alarm == null || alarm.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(alarm);
        } catch (JsonProcessingException e) {
            return timeOfDay(task, now, alarm);
        }
        // "7:45" reads as the number 7, so anything but an object goes back to the raw text
        if (root == null || !root.isObject()) {
            return timeOfDay(task, now, root != null && root.isTextual() ? root.asText() : alarm);
        }
        if (OFFSET_FIELDS.stream().anyMatch(root::has)) {
            return offset(task, root);
        }
        return keyed(task, now, root);
    }

    private Optional<Instant> offset(Task task, JsonNode root) {
        Instant base = task.getPeriodStart() != null
                ? task.getPeriodStart().atStartOfDay(zone).toInstant()
                : task.getCreatedAt();
        if (base == null) {
            return Optional.empty();
        }
        Duration offset = Duration.ofDays(root.path("days").asLong(0))
                .plusHours(root.path("hours").asLong(0))
                .plusMinutes(root.path("minutes").asLong(0))
                .plusSeconds(root.path("seconds").asLong(0));
        return Optional.of(base.plus(offset));
    }

    private Optional<Instant> keyed(Task task, Instant now, JsonNode root) {
        return deadlineCalculator.cycleDate(task, now).flatMap(date -> {
            List<String> keys = List.of(
                    date.toString(),
                    date.getDayOfWeek().name().toLowerCase(Locale.ROOT),
                    String.valueOf(date.getDayOfMonth()),
                    "daily",
                    "all");
            for (String key : keys) {
                JsonNode value = root.get(key);
                if (value != null && value.isTextual()) {
                    return ScheduleTimes.parseTimeOfDay(value.asText()).map(time -> toInstant(date, time));
                }
            }
            return Optional.empty();
        });
    }

    private Optional<Instant> timeOfDay(Task task, Instant now, String value) {
        Optional<LocalTime> time = ScheduleTimes.parseTimeOfDay(value);
        if (time.isEmpty()) {
            log.debug("Task {} has an unreadable alarm: {}", task.getId(), value);
            return Optional.empty();
        }
        return deadlineCalculator.cycleDate(task, now).map(date -> toInstant(date, time.get()));
    }

    private Instant toInstant(LocalDate date, LocalTime time) {
        return date.atTime(time).atZone(zone).toInstant();
    }

}
