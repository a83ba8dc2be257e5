package microservices.taskmanager.timeout.service;

import java.time.Instant;
import java.util.Optional;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.repository.TaskRepository;

/**
 * The "already notified" marker on a task. The marker records the deadline it
 * was set for; once the current cycle's deadline moves past it the marker is
 * stale and the task may fire again. A marker without a recorded deadline is
 * taken as current.
 */
@Component
@Slf4j
public class IdempotencyGuard {

    private final DeadlineCalculator deadlineCalculator;
    private final DelayLedger delayLedger;
    private final TaskRepository taskRepository;

    public IdempotencyGuard(DeadlineCalculator deadlineCalculator, DelayLedger delayLedger, TaskRepository taskRepository) {
        this.deadlineCalculator = deadlineCalculator;
        this.delayLedger = delayLedger;
        this.taskRepository = taskRepository;
    }

    /**
     * A task stays in scope if it was not notified this cycle, or if it was and
     * a rest is still running on it.
     */
    public boolean isEligibleForScan(Task task, Instant now) {
        if (task.getTimeoutNotifiedAt() == null) {
            return true;
        }
        Optional<Instant> deadline = deadlineCalculator.timeoutDeadline(task, now);
        if (deadline.isPresent() && !isNotifiedFor(task, deadline.get())) {
            return true;
        }
        return delayLedger.hasActiveDelay(task);
    }

    public boolean isNotifiedFor(Task task, Instant deadline) {
        if (task.getTimeoutNotifiedAt() == null) {
            return false;
        }
        Instant notifiedDeadline = task.getTimeoutNotifiedDeadline();
        return notifiedDeadline == null || !notifiedDeadline.isBefore(deadline);
    }

    public void markNotified(Task task, Instant at, Instant deadline) {
        task.setTimeoutNotifiedAt(at);
        task.setTimeoutNotifiedDeadline(deadline);
        taskRepository.save(task);
        log.debug("Task {} marked notified at {} for deadline {}", task.getId(), at, deadline);
    }

    /**
     * Drops the marker so the task fires again once its rests are used up.
     */
    public void clearNotified(Task task) {
        task.setTimeoutNotifiedAt(null);
        task.setTimeoutNotifiedDeadline(null);
        taskRepository.save(task);
        log.debug("Task {} notified marker cleared", task.getId());
    }

}
