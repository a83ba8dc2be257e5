package microservices.taskmanager.timeout.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.entity.Delay;
import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.enums.ErrorCode;
import microservices.taskmanager.timeout.exception.TaskTimeoutException;
import microservices.taskmanager.timeout.repository.DelayRepository;
import microservices.taskmanager.timeout.util.ScheduleTimes;

/**
 * Rest allowances per (task, user). Persistence failures surface as
 * {@link TaskTimeoutException} with {@link ErrorCode#DELAY_LEDGER_FAILURE}.
 */
@Component
@Slf4j
public class DelayLedger {

    private final DelayRepository delayRepository;
    private final Duration defaultRestTime;

    public DelayLedger(DelayRepository delayRepository,
                       @Value("${task-timeout.delay.default-rest-time:PT15M}") Duration defaultRestTime) {
        this.delayRepository = delayRepository;
        this.defaultRestTime = defaultRestTime;
    }

    /**
     * True while any user of the task still holds a rest. Gates the whole task.
     */
    public boolean hasActiveDelay(Task task) {
        try {
            return delayRepository.existsByTaskIdAndRestMaxGreaterThan(task.getId(), 0);
        } catch (DataAccessException e) {
            throw new TaskTimeoutException("Failed to read delays for task " + task.getId(), e, ErrorCode.DELAY_LEDGER_FAILURE);
        }
    }

    /**
     * Fetches or creates the row for (task, user) and resets it to the task's
     * current rest configuration. The remaining count is overwritten, not
     * decremented.
     */
    public Delay grantOrRefreshDelay(Task task, Long userId, Instant now) {
        try {
            Delay delay = delayRepository.findByTaskIdAndUserId(task.getId(), userId).orElseGet(() -> {
                Delay created = new Delay();
                created.setTaskId(task.getId());
                created.setUserId(userId);
                return created;
            });
            if (task.getRestTime() != null) {
                delay.setRestTime(task.getRestTime());
            }
            delay.setRestMax(configuredRestMax(task));
            delay.setAlarmCount(0);
            delay.setNextAlarmAt(nextAlarmAt(delay.getRestTime(), delay.getRestMax(), now));
            delay.setUpdatedAt(now);
            Delay saved = delayRepository.save(delay);
            log.debug("Granted {} rest(s) on task {} to user {}", saved.getRestMax(), task.getId(), userId);
            return saved;
        } catch (DataAccessException e) {
            throw new TaskTimeoutException("Failed to grant delay on task " + task.getId() + " to user " + userId, e, ErrorCode.DELAY_LEDGER_FAILURE);
        }
    }

    public boolean isLastRest(Delay delay) {
        return delay.getRestMax() == 1;
    }

    /**
     * Active delays whose next reminder is due.
     */
    public List<Delay> findDueAlarms(Instant now) {
        try {
            return delayRepository.findByRestMaxGreaterThanAndNextAlarmAtLessThanEqual(0, now);
        } catch (DataAccessException e) {
            throw new TaskTimeoutException("Failed to load due delay alarms", e, ErrorCode.DELAY_LEDGER_FAILURE);
        }
    }

    /**
     * Uses up one rest: the count goes down by one, the alarm is recorded and the
     * next one scheduled while rests remain.
     */
    public Delay consumeRest(Delay delay, Instant now) {
        delay.setRestMax(Math.max(0, delay.getRestMax() - 1));
        delay.setAlarmCount(delay.getAlarmCount() + 1);
        delay.setLastAlarmAt(now);
        delay.setNextAlarmAt(nextAlarmAt(delay.getRestTime(), delay.getRestMax(), now));
        delay.setUpdatedAt(now);
        try {
            return delayRepository.save(delay);
        } catch (DataAccessException e) {
            throw new TaskTimeoutException("Failed to consume rest for delay " + delay.getId(), e, ErrorCode.DELAY_LEDGER_FAILURE);
        }
    }

    /**
     * A rest the user asked for: one is taken off the remaining count and the
     * reminder is rescheduled from now. The first request on a task without a
     * row starts from the task's configured count.
     *
     * @throws TaskTimeoutException with {@link ErrorCode#REST_LIMIT_REACHED} when no rest is left
     */
    public Delay requestRest(Task task, Long userId, Instant now) {
        try {
            Optional<Delay> existing = delayRepository.findByTaskIdAndUserId(task.getId(), userId);
            int remaining = existing.map(Delay::getRestMax).orElseGet(() -> configuredRestMax(task));
            if (remaining <= 0) {
                throw new TaskTimeoutException("No rest left on task " + task.getId() + " for user " + userId, ErrorCode.REST_LIMIT_REACHED);
            }
            Delay delay = existing.orElseGet(() -> {
                Delay created = new Delay();
                created.setTaskId(task.getId());
                created.setUserId(userId);
                created.setRestTime(task.getRestTime());
                return created;
            });
            delay.setRestMax(remaining - 1);
            delay.setAlarmCount(0);
            delay.setLastAlarmAt(null);
            delay.setNextAlarmAt(nextAlarmAt(delay.getRestTime(), delay.getRestMax(), now));
            delay.setUpdatedAt(now);
            Delay saved = delayRepository.save(delay);
            log.info("User {} took a rest on task {}, {} left", userId, task.getId(), saved.getRestMax());
            return saved;
        } catch (DataAccessException e) {
            throw new TaskTimeoutException("Failed to record rest on task " + task.getId() + " for user " + userId, e, ErrorCode.DELAY_LEDGER_FAILURE);
        }
    }

    /**
     * When the next reminder for a fresh grant of the task's rests would fire,
     * or null when the task grants none.
     */
    public Instant nextAlarmAt(Task task, Instant now) {
        return nextAlarmAt(task.getRestTime(), configuredRestMax(task), now);
    }

    /**
     * Gap between two reminders. Missing, zero or unparseable rest times fall
     * back to the configured default.
     */
    public Duration restInterval(String restTime) {
        return ScheduleTimes.parseDuration(restTime)
                .filter(duration -> !duration.isZero())
                .orElse(defaultRestTime);
    }

    private Instant nextAlarmAt(String restTime, int restMax, Instant now) {
        if (restMax <= 0) {
            return null;
        }
        return now.plus(restInterval(restTime));
    }

    private int configuredRestMax(Task task) {
        return task.getRestMax() == null ? 0 : Math.max(0, task.getRestMax());
    }

}
