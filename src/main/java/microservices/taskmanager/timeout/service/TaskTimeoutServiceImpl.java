package microservices.taskmanager.timeout.service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.entity.Delay;
import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.entity.UserAccount;
import microservices.taskmanager.timeout.enums.ErrorCode;
import microservices.taskmanager.timeout.exception.TaskTimeoutException;
import microservices.taskmanager.timeout.model.DispatchResult;
import microservices.taskmanager.timeout.model.RestGrant;
import microservices.taskmanager.timeout.model.ScanSummary;
import microservices.taskmanager.timeout.repository.TaskRepository;
import microservices.taskmanager.timeout.util.RemainingTimeFormatter;

/**
 * The timeout scanner. Tasks are processed one at a time; an error on one task
 * is logged and counted and the sweep moves on to the next.
 */
@Service
@Slf4j
public class TaskTimeoutServiceImpl implements TaskTimeoutService {

    private final TaskRepository taskRepository;
    private final DeadlineCalculator deadlineCalculator;
    private final DelayLedger delayLedger;
    private final IdempotencyGuard idempotencyGuard;
    private final NotificationDispatcher notificationDispatcher;
    private final RecipientResolver recipientResolver;
    private final AlarmNotificationProcessor alarmNotificationProcessor;
    private final TimeoutRepeatProcessor timeoutRepeatProcessor;

    // scheduled and manual runs in this process never overlap
    private final ReentrantLock scanLock = new ReentrantLock();

    public TaskTimeoutServiceImpl(TaskRepository taskRepository,
                                  DeadlineCalculator deadlineCalculator,
                                  DelayLedger delayLedger,
                                  IdempotencyGuard idempotencyGuard,
                                  NotificationDispatcher notificationDispatcher,
                                  RecipientResolver recipientResolver,
                                  AlarmNotificationProcessor alarmNotificationProcessor,
                                  TimeoutRepeatProcessor timeoutRepeatProcessor) {
        this.taskRepository = taskRepository;
        this.deadlineCalculator = deadlineCalculator;
        this.delayLedger = delayLedger;
        this.idempotencyGuard = idempotencyGuard;
        this.notificationDispatcher = notificationDispatcher;
        this.recipientResolver = recipientResolver;
        this.alarmNotificationProcessor = alarmNotificationProcessor;
        this.timeoutRepeatProcessor = timeoutRepeatProcessor;
    }

    @Override
    public ScanSummary checkTaskTimeouts(Instant now) {
        scanLock.lock();
        try {
            ScanSummary summary = new ScanSummary();
            log.info("Checking for alarms, delay alarms and task timeouts at {}", now);

            alarmNotificationProcessor.process(now, summary);
            processDelayAlarms(now, summary);
            timeoutRepeatProcessor.process(now, summary);

            List<Task> candidates;
            try {
                candidates = taskRepository.findByStatusTrueAndTimeClotureNotNullAndTimeOutNotNull();
            } catch (RuntimeException e) {
                log.error("Failed to load tasks for timeout check", e);
                summary.fail("could not load tasks: " + e.getMessage());
                return summary;
            }

            List<Task> tasks = candidates.stream()
                    .filter(task -> isEligible(task, now, summary))
                    .collect(Collectors.toList());
            log.info("Found {} tasks to check for timeout", tasks.size());

            for (Task task : tasks) {
                summary.incrementConsidered();
                try {
                    processTask(task, now, summary);
                } catch (Exception e) {
                    log.error("Error processing task {} ({}): {}", task.getId(), task.getName(), e.getMessage(), e);
                    summary.incrementSkipped();
                }
            }

            log.info("Timeout check finished: notified={}, alarms={}, delayAlarms={}, timeoutRepeats={}, skipped={}, considered={}",
                    summary.getNotified(), summary.getAlarmNotifications(), summary.getDelayAlarms(),
                    summary.getTimeoutRepeats(), summary.getSkipped(), summary.getConsidered());
            return summary;
        } finally {
            scanLock.unlock();
        }
    }

    private boolean isEligible(Task task, Instant now, ScanSummary summary) {
        try {
            return idempotencyGuard.isEligibleForScan(task, now);
        } catch (Exception e) {
            log.error("Error checking eligibility of task {}: {}", task.getId(), e.getMessage(), e);
            summary.incrementSkipped();
            return false;
        }
    }

    private void processTask(Task task, Instant now, ScanSummary summary) {
        if (delayLedger.hasActiveDelay(task)) {
            log.info("Task {} ({}): active delay exists, skipping timeout notification", task.getId(), task.getName());
            summary.incrementSkipped();
            return;
        }

        Optional<Instant> deadline = deadlineCalculator.timeoutDeadline(task, now);
        if (deadline.isEmpty()) {
            log.warn("Task {} ({}): could not calculate timeout deadline", task.getId(), task.getName());
            summary.incrementSkipped();
            return;
        }

        if (now.isBefore(deadline.get())) {
            log.debug("Task {} ({}): timeout not reached yet, time remaining {}",
                    task.getId(), task.getName(), RemainingTimeFormatter.format(now, deadline));
            return;
        }

        if (idempotencyGuard.isNotifiedFor(task, deadline.get())) {
            log.debug("Task {} ({}): already notified for deadline {}", task.getId(), task.getName(), deadline.get());
            return;
        }

        log.info("Task {} ({}): timeout reached, sending notifications", task.getId(), task.getName());
        DispatchResult result = notificationDispatcher.dispatch(task, now);
        idempotencyGuard.markNotified(task, now, deadline.get());
        summary.incrementNotified();
        log.info("Task {} marked as notified (delivered={}, failed={})", task.getId(), result.getSuccessCount(), result.getFailedCount());
    }

    private void processDelayAlarms(Instant now, ScanSummary summary) {
        List<Delay> dueAlarms;
        try {
            dueAlarms = delayLedger.findDueAlarms(now);
        } catch (RuntimeException e) {
            log.error("Failed to load due delay alarms", e);
            summary.incrementSkipped();
            return;
        }

        for (Delay delay : dueAlarms) {
            try {
                Optional<Task> task = taskRepository.findById(delay.getTaskId()).filter(Task::isStatus);
                if (task.isEmpty()) {
                    log.debug("Delay {} belongs to a missing or inactive task {}, skipping", delay.getId(), delay.getTaskId());
                    continue;
                }
                // nobody to remind: the rest stays unconsumed until the user can be reached
                Optional<UserAccount> user = recipientResolver.reachableUser(delay.getUserId());
                if (user.isEmpty()) {
                    log.info("User {} not found or has no push token, delay {} of task {} left as is",
                            delay.getUserId(), delay.getId(), delay.getTaskId());
                    continue;
                }
                if (!notificationDispatcher.isTransportAvailable()) {
                    log.warn("Push transport not available, delay {} of task {} postponed", delay.getId(), delay.getTaskId());
                    summary.incrementSkipped();
                    continue;
                }
                boolean lastTime = delayLedger.isLastRest(delay);
                Delay consumed = delayLedger.consumeRest(delay, now);
                if (notificationDispatcher.sendDelayReminder(task.get(), consumed, user.get(), lastTime, now)) {
                    summary.incrementDelayAlarms();
                } else {
                    summary.incrementSkipped();
                }
            } catch (Exception e) {
                log.error("Error processing delay {} of task {}: {}", delay.getId(), delay.getTaskId(), e.getMessage(), e);
                summary.incrementSkipped();
            }
        }
    }

    @Override
    public RestGrant requestRest(String taskId, Long userId, Instant now) {
        scanLock.lock();
        try {
            Task task = taskRepository.findById(taskId)
                    .orElseThrow(() -> new TaskTimeoutException("Task not found: " + taskId, ErrorCode.TASK_NOT_FOUND));
            if (!recipientResolver.isAssigned(task, userId)) {
                throw new TaskTimeoutException("User " + userId + " is not assigned to task " + taskId, ErrorCode.NOT_ASSIGNED);
            }
            if (task.getTimeoutNotifiedAt() == null) {
                throw new TaskTimeoutException("Timeout notification for task " + taskId + " has not been sent yet", ErrorCode.TIMEOUT_NOT_NOTIFIED);
            }

            Delay delay = delayLedger.requestRest(task, userId, now);
            idempotencyGuard.clearNotified(task);
            log.info("Rest granted on task {} to user {}, {} left", taskId, userId, delay.getRestMax());
            return new RestGrant(delay.getId(), delay.getRestMax(), delayLedger.isLastRest(delay));
        } finally {
            scanLock.unlock();
        }
    }

}
