package microservices.taskmanager.timeout.service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.entity.Delay;
import microservices.taskmanager.timeout.entity.NotificationTimeout;
import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.entity.UserAccount;
import microservices.taskmanager.timeout.enums.NotificationType;
import microservices.taskmanager.timeout.model.DispatchResult;
import microservices.taskmanager.timeout.notifier.PushDeliveryException;
import microservices.taskmanager.timeout.notifier.PushNotifier;
import microservices.taskmanager.timeout.repository.NotificationTimeoutRepository;
import microservices.taskmanager.timeout.util.RemainingTimeFormatter;

/**
 * Fans a timeout out to a task's assignees. Every recipient is handled on its
 * own: audit row and delay grant first, then one delivery attempt. Nothing
 * thrown here reaches the caller.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private static final String LAST_TIME_PREFIX = PushPayloads.LAST_TIME_PREFIX;

    private final RecipientResolver recipientResolver;
    private final NotificationTimeoutRepository notificationTimeoutRepository;
    private final DelayLedger delayLedger;
    private final DeadlineCalculator deadlineCalculator;
    private final PushNotifier pushNotifier;

    public NotificationDispatcher(RecipientResolver recipientResolver,
                                  NotificationTimeoutRepository notificationTimeoutRepository,
                                  DelayLedger delayLedger,
                                  DeadlineCalculator deadlineCalculator,
                                  PushNotifier pushNotifier) {
        this.recipientResolver = recipientResolver;
        this.notificationTimeoutRepository = notificationTimeoutRepository;
        this.delayLedger = delayLedger;
        this.deadlineCalculator = deadlineCalculator;
        this.pushNotifier = pushNotifier;
    }

    public DispatchResult dispatch(Task task, Instant now) {
        try {
            return dispatchToRecipients(task, now);
        } catch (Exception e) {
            log.error("Error sending timeout notifications for task {}", task.getId(), e);
            return DispatchResult.empty();
        }
    }

    private DispatchResult dispatchToRecipients(Task task, Instant now) {
        List<UserAccount> recipients = recipientResolver.assignees(task, true);
        if (recipients.isEmpty()) {
            return DispatchResult.empty();
        }

        if (!pushNotifier.isAvailable()) {
            log.warn("Push transport not available, cannot send timeout notifications for task {}", task.getId());
            return DispatchResult.empty();
        }

        String timeRemaining = RemainingTimeFormatter.format(now, deadlineCalculator.closureDeadline(task, now));
        String title = "Task Start Time: " + task.getName();
        String body = "The start time for task '" + task.getName() + "' has been reached. Time remaining until closure: " + timeRemaining + ".";

        int successCount = 0;
        int failedCount = 0;
        for (UserAccount user : recipients) {
            try {
                recordAudit(task, user, timeRemaining, now);
                Delay delay = delayLedger.grantOrRefreshDelay(task, user.getId(), now);
                boolean lastTime = delayLedger.isLastRest(delay);
                String userBody = lastTime
                        ? LAST_TIME_PREFIX + body + " This is your last rest/delay opportunity."
                        : body;

                Map<String, String> data = PushPayloads.baseData(task, user, title, userBody, NotificationType.START_TIME, lastTime);
                data.put("rest_max", String.valueOf(delay.getRestMax()));

                String messageId = pushNotifier.send(PushPayloads.message(user, title, userBody, data));
                successCount++;
                log.info("Timeout notification {} sent to user {} for task {} (rest_max={}, last_time={})",
                        messageId, user.getId(), task.getId(), delay.getRestMax(), lastTime);
            } catch (PushDeliveryException | RuntimeException e) {
                failedCount++;
                log.error("Failed to send timeout notification to user {} for task {}: {}", user.getId(), task.getId(), e.getMessage(), e);
            }
        }

        log.info("Task timeout notifications sent for task {} ({}): success={}, failed={}, total={}",
                task.getId(), task.getName(), successCount, failedCount, recipients.size());
        return new DispatchResult(successCount, failedCount);
    }

    public boolean isTransportAvailable() {
        return pushNotifier.isAvailable();
    }

    /**
     * Reminder for a delay whose rest just ran out. The caller has already
     * resolved a reachable user.
     *
     * @return true when the push was accepted by the transport
     */
    public boolean sendDelayReminder(Task task, Delay delay, UserAccount user, boolean lastTime, Instant now) {
        if (!pushNotifier.isAvailable()) {
            log.warn("Push transport not available, cannot send delay reminder for task {} to user {}", task.getId(), user.getId());
            return false;
        }

        String timeRemaining = RemainingTimeFormatter.format(now, deadlineCalculator.closureDeadline(task, now));
        String title;
        String body;
        if (lastTime) {
            title = LAST_TIME_PREFIX + "Task Reminder: " + task.getName();
            body = LAST_TIME_PREFIX + "This is your final reminder for task '" + task.getName() + "'. Time remaining until closure: " + timeRemaining + ".";
        } else {
            title = "Task Reminder: " + task.getName();
            body = "Reminder: Task '" + task.getName() + "' is still active. Time remaining until closure: " + timeRemaining + ".";
        }

        Map<String, String> data = PushPayloads.baseData(task, user, title, body, NotificationType.DELAY_REPEAT_ALARM, lastTime);
        data.put("rest_max", String.valueOf(delay.getRestMax()));
        data.put("alarm_count", String.valueOf(delay.getAlarmCount()));

        try {
            pushNotifier.send(PushPayloads.message(user, title, body, data));
            log.info("Delay reminder sent to user {} for task {} (rest_max={}, alarm_count={}, last_time={})",
                    user.getId(), task.getId(), delay.getRestMax(), delay.getAlarmCount(), lastTime);
            return true;
        } catch (PushDeliveryException e) {
            log.error("Failed to send delay reminder to user {} for task {}: {}", user.getId(), task.getId(), e.getMessage(), e);
            return false;
        }
    }

    private void recordAudit(Task task, UserAccount user, String timeRemaining, Instant now) {
        Instant next = delayLedger.nextAlarmAt(task, now);
        int restMax = task.getRestMax() == null ? 0 : task.getRestMax();

        NotificationTimeout audit = new NotificationTimeout();
        audit.setTaskId(task.getId());
        audit.setUsersId(user.getId());
        audit.setDescription(String.join("\n",
                "Start timeout notification created.",
                "Task: " + task.getName() + " (ID: " + task.getId() + ")",
                "User: " + user.getUserName() + " (ID: " + user.getId() + ")",
                "Time remaining until closure: " + timeRemaining,
                "Rest time between timeout notifications: " + (task.getRestTime() != null ? task.getRestTime() : "none"),
                "Max repeats (rest_max): " + restMax,
                "Next notification at: " + (next != null ? next : "none")));
        audit.setNext(next);
        audit.setRestMax(restMax);
        audit.setRepeatCount(0);
        audit.setRead(false);
        audit.setCreatedAt(now);
        notificationTimeoutRepository.save(audit);
    }

}
