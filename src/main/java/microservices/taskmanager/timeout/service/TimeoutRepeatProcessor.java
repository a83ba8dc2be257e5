package microservices.taskmanager.timeout.service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.entity.NotificationTimeout;
import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.entity.UserAccount;
import microservices.taskmanager.timeout.enums.NotificationType;
import microservices.taskmanager.timeout.model.ScanSummary;
import microservices.taskmanager.timeout.notifier.PushDeliveryException;
import microservices.taskmanager.timeout.notifier.PushNotifier;
import microservices.taskmanager.timeout.repository.NotificationTimeoutRepository;
import microservices.taskmanager.timeout.repository.TaskRepository;
import microservices.taskmanager.timeout.util.RemainingTimeFormatter;

/**
 * Repeats a timeout notification every rest interval until the row's repeat
 * limit is reached. Each handled row is closed (next cleared) and, unless it
 * was the last repeat, a new row carries the following one.
 */
@Component
@Slf4j
public class TimeoutRepeatProcessor {

    private final NotificationTimeoutRepository notificationTimeoutRepository;
    private final TaskRepository taskRepository;
    private final RecipientResolver recipientResolver;
    private final DelayLedger delayLedger;
    private final DeadlineCalculator deadlineCalculator;
    private final PushNotifier pushNotifier;

    public TimeoutRepeatProcessor(NotificationTimeoutRepository notificationTimeoutRepository,
                                  TaskRepository taskRepository,
                                  RecipientResolver recipientResolver,
                                  DelayLedger delayLedger,
                                  DeadlineCalculator deadlineCalculator,
                                  PushNotifier pushNotifier) {
        this.notificationTimeoutRepository = notificationTimeoutRepository;
        this.taskRepository = taskRepository;
        this.recipientResolver = recipientResolver;
        this.delayLedger = delayLedger;
        this.deadlineCalculator = deadlineCalculator;
        this.pushNotifier = pushNotifier;
    }

    public void process(Instant now, ScanSummary summary) {
        List<NotificationTimeout> due;
        try {
            due = notificationTimeoutRepository.findByNextLessThanEqual(now);
        } catch (RuntimeException e) {
            log.error("Failed to load due timeout repeats", e);
            summary.incrementSkipped();
            return;
        }

        for (NotificationTimeout row : due) {
            try {
                processRepeat(row, now, summary);
            } catch (Exception e) {
                log.error("Error processing timeout repeat {} of task {}: {}", row.getId(), row.getTaskId(), e.getMessage(), e);
                summary.incrementSkipped();
            }
        }
    }

    private void processRepeat(NotificationTimeout row, Instant now, ScanSummary summary) {
        Optional<Task> task = taskRepository.findById(row.getTaskId()).filter(Task::isStatus);
        if (task.isEmpty()) {
            log.info("Timeout repeat {}: task {} missing or inactive, closing", row.getId(), row.getTaskId());
            close(row);
            summary.incrementSkipped();
            return;
        }

        int restMax = row.getRestMax();
        int repeatCount = row.getRepeatCount();
        if (restMax > 0 && repeatCount >= restMax) {
            log.info("Timeout repeat {}: limit {} reached for task {}", row.getId(), restMax, row.getTaskId());
            close(row);
            summary.incrementSkipped();
            return;
        }

        // left pending: the user may register a token, the transport may come back
        Optional<UserAccount> user = recipientResolver.reachableUser(row.getUsersId());
        if (user.isEmpty()) {
            log.info("Timeout repeat {}: user {} not found or has no push token", row.getId(), row.getUsersId());
            summary.incrementSkipped();
            return;
        }
        if (!pushNotifier.isAvailable()) {
            log.warn("Push transport not available, timeout repeat {} postponed", row.getId());
            summary.incrementSkipped();
            return;
        }

        int sendNumber = repeatCount + 1;
        boolean lastTime = restMax > 0 && sendNumber >= restMax;
        String timeRemaining = RemainingTimeFormatter.format(now, deadlineCalculator.closureDeadline(task.get(), now));
        if (send(task.get(), user.get(), row, sendNumber, lastTime, timeRemaining)) {
            summary.incrementTimeoutRepeats();
        } else {
            summary.incrementSkipped();
        }

        row.setRepeatCount(sendNumber);
        row.setNext(null);
        row.setDescription(String.join("\n",
                "Timeout repeat notification sent.",
                "Task: " + task.get().getName() + " (ID: " + task.get().getId() + ")",
                "User: " + user.get().getUserName() + " (ID: " + user.get().getId() + ")",
                "Repeat number: " + sendNumber + (restMax > 0 ? " of " + restMax : ""),
                "Time remaining until closure: " + timeRemaining));
        notificationTimeoutRepository.save(row);

        if (restMax > 0 && !lastTime) {
            scheduleNext(task.get(), user.get(), row, now);
        }
    }

    private boolean send(Task task, UserAccount user, NotificationTimeout row, int sendNumber, boolean lastTime,
                         String timeRemaining) {
        String title;
        String body = "Reminder: The timeout for task '" + task.getName() + "' is active. Time remaining until closure: " + timeRemaining + ".";
        if (lastTime) {
            title = PushPayloads.LAST_TIME_PREFIX + "Task Timeout Reminder: " + task.getName();
            body = PushPayloads.LAST_TIME_PREFIX + body + " This is your last timeout reminder.";
        } else {
            title = "Task Timeout Reminder: " + task.getName();
            if (sendNumber > 1) {
                body = body + " This is timeout reminder number " + sendNumber + ".";
            }
        }

        Map<String, String> data = PushPayloads.baseData(task, user, title, body, NotificationType.TIMEOUT_REPEAT, lastTime);
        data.put("notification_timeout_id", String.valueOf(row.getId()));
        data.put("rest_max", String.valueOf(row.getRestMax()));
        data.put("repeat_count", String.valueOf(row.getRepeatCount()));
        data.put("send_number", String.valueOf(sendNumber));

        try {
            pushNotifier.send(PushPayloads.message(user, title, body, data));
            log.info("Timeout repeat {} sent to user {} for task {} (send_number={}, last_time={})",
                    row.getId(), user.getId(), task.getId(), sendNumber, lastTime);
            return true;
        } catch (PushDeliveryException e) {
            log.error("Failed to send timeout repeat {} to user {}: {}", row.getId(), user.getId(), e.getMessage(), e);
            return false;
        }
    }

    private void scheduleNext(Task task, UserAccount user, NotificationTimeout previous, Instant now) {
        Instant next = now.plus(delayLedger.restInterval(task.getRestTime()));
        NotificationTimeout row = new NotificationTimeout();
        row.setTaskId(task.getId());
        row.setUsersId(user.getId());
        row.setDescription(String.join("\n",
                "Timeout repeat notification scheduled.",
                "Task: " + task.getName() + " (ID: " + task.getId() + ")",
                "Repeats sent so far: " + previous.getRepeatCount() + " of " + previous.getRestMax(),
                "Next notification at: " + next));
        row.setNext(next);
        row.setRestMax(previous.getRestMax());
        row.setRepeatCount(previous.getRepeatCount());
        row.setRead(false);
        row.setCreatedAt(now);
        notificationTimeoutRepository.save(row);
    }

    private void close(NotificationTimeout row) {
        row.setNext(null);
        notificationTimeoutRepository.save(row);
    }

}
