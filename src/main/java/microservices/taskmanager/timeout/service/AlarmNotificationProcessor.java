package microservices.taskmanager.timeout.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.entity.AlarmNotification;
import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.entity.UserAccount;
import microservices.taskmanager.timeout.enums.NotificationType;
import microservices.taskmanager.timeout.enums.TaskStep;
import microservices.taskmanager.timeout.model.ScanSummary;
import microservices.taskmanager.timeout.notifier.PushDeliveryException;
import microservices.taskmanager.timeout.notifier.PushNotifier;
import microservices.taskmanager.timeout.repository.AlarmNotificationRepository;
import microservices.taskmanager.timeout.repository.TaskRepository;
import microservices.taskmanager.timeout.util.RemainingTimeFormatter;

/**
 * Task alarms. A pending task alarms its assignees, a task in progress alarms
 * its controller. Once the alarm start passes, one series per recipient is
 * opened and its first alarm sent; further alarms follow every rest interval
 * until the series has sent rest_max of them or the recipient is no longer
 * the one the task's step calls for.
 */
@Component
@Slf4j
public class AlarmNotificationProcessor {

    private static final List<String> ALARMED_STEPS = List.of(TaskStep.PENDING.getValue(), TaskStep.IN_PROGRESS.getValue());

    private final AlarmNotificationRepository alarmNotificationRepository;
    private final TaskRepository taskRepository;
    private final AlarmScheduleCalculator alarmScheduleCalculator;
    private final RecipientResolver recipientResolver;
    private final DelayLedger delayLedger;
    private final DeadlineCalculator deadlineCalculator;
    private final PushNotifier pushNotifier;

    public AlarmNotificationProcessor(AlarmNotificationRepository alarmNotificationRepository,
                                      TaskRepository taskRepository,
                                      AlarmScheduleCalculator alarmScheduleCalculator,
                                      RecipientResolver recipientResolver,
                                      DelayLedger delayLedger,
                                      DeadlineCalculator deadlineCalculator,
                                      PushNotifier pushNotifier) {
        this.alarmNotificationRepository = alarmNotificationRepository;
        this.taskRepository = taskRepository;
        this.alarmScheduleCalculator = alarmScheduleCalculator;
        this.recipientResolver = recipientResolver;
        this.delayLedger = delayLedger;
        this.deadlineCalculator = deadlineCalculator;
        this.pushNotifier = pushNotifier;
    }

    /**
     * Due alarms first, then new series for tasks whose alarm start has
     * passed. Never throws.
     */
    public void process(Instant now, ScanSummary summary) {
        processDueAlarms(now, summary);
        initializeAlarms(now, summary);
    }

    private void processDueAlarms(Instant now, ScanSummary summary) {
        List<AlarmNotification> due;
        try {
            due = alarmNotificationRepository.findByNextLessThanEqual(now);
        } catch (RuntimeException e) {
            log.error("Failed to load due alarm notifications", e);
            summary.incrementSkipped();
            return;
        }

        Map<String, List<AlarmNotification>> byTask = new LinkedHashMap<>();
        for (AlarmNotification alarm : due) {
            byTask.computeIfAbsent(alarm.getTaskId(), id -> new ArrayList<>()).add(alarm);
        }

        byTask.forEach((taskId, alarms) -> {
            try {
                Optional<Task> task = taskRepository.findById(taskId).filter(Task::isStatus);
                if (task.isEmpty()) {
                    log.debug("Alarms of missing or inactive task {} ignored", taskId);
                    return;
                }
                Optional<TaskStep> step = TaskStep.from(task.get().getStep());
                if (step.isPresent() && step.get() == TaskStep.COMPLETED) {
                    stopAlarms(task.get());
                    return;
                }
                for (AlarmNotification alarm : alarms) {
                    processDueAlarm(task.get(), step.orElse(null), alarm, now, summary);
                }
            } catch (Exception e) {
                log.error("Error processing alarms of task {}: {}", taskId, e.getMessage(), e);
                summary.incrementSkipped();
            }
        });
    }

    private void processDueAlarm(Task task, TaskStep step, AlarmNotification alarm, Instant now, ScanSummary summary) {
        try {
            Optional<UserAccount> user = recipientResolver.reachableUser(alarm.getUsersId());
            if (user.isEmpty()) {
                log.info("Alarm {}: user {} not found or has no push token", alarm.getId(), alarm.getUsersId());
                summary.incrementSkipped();
                return;
            }

            if (!isCurrentRecipient(task, step, user.get())) {
                log.info("Alarm {}: user {} no longer alarmed for task {} in step {}", alarm.getId(), user.get().getId(), task.getId(), task.getStep());
                alarm.setNext(null);
                alarmNotificationRepository.save(alarm);
                summary.incrementSkipped();
                return;
            }

            int restMax = alarm.getRestMax();
            if (restMax > 0 && alarm.getNotificationCount() >= restMax) {
                alarm.setNext(null);
                alarmNotificationRepository.save(alarm);
                summary.incrementSkipped();
                return;
            }

            if (!pushNotifier.isAvailable()) {
                log.warn("Push transport not available, alarm {} postponed", alarm.getId());
                summary.incrementSkipped();
                return;
            }

            if (sendAlarm(task, user.get(), alarm, now)) {
                summary.incrementAlarmNotifications();
            } else {
                summary.incrementSkipped();
            }

            int count = alarm.getNotificationCount() + 1;
            alarm.setNotificationCount(count);
            alarm.setNext(restMax > 0 && count < restMax ? now.plus(delayLedger.restInterval(task.getRestTime())) : null);
            alarmNotificationRepository.save(alarm);
        } catch (Exception e) {
            log.error("Error processing alarm {} of task {}: {}", alarm.getId(), task.getId(), e.getMessage(), e);
            summary.incrementSkipped();
        }
    }

    private void initializeAlarms(Instant now, ScanSummary summary) {
        List<Task> tasks;
        try {
            tasks = taskRepository.findByStatusTrueAndAlarmNotNullAndTimeClotureNotNullAndStepIn(ALARMED_STEPS);
        } catch (RuntimeException e) {
            log.error("Failed to load tasks with alarms", e);
            summary.incrementSkipped();
            return;
        }

        for (Task task : tasks) {
            try {
                Optional<Instant> start = alarmScheduleCalculator.alarmStart(task, now);
                if (start.isEmpty() || now.isBefore(start.get())) {
                    continue;
                }
                if (alarmNotificationRepository.existsByTaskIdAndCreatedAtGreaterThanEqual(task.getId(), start.get())) {
                    continue;
                }
                initializeAlarm(task, now, summary);
            } catch (Exception e) {
                log.error("Error initializing alarms of task {}: {}", task.getId(), e.getMessage(), e);
                summary.incrementSkipped();
            }
        }
    }

    private void initializeAlarm(Task task, Instant now, ScanSummary summary) {
        TaskStep step = TaskStep.from(task.getStep()).orElse(null);
        List<UserAccount> recipients = step == TaskStep.IN_PROGRESS
                ? recipientResolver.controller(task).map(List::of).orElse(List.of())
                : recipientResolver.assignees(task, false);
        if (recipients.isEmpty()) {
            log.info("Task {} ({}): no recipients for alarm", task.getId(), task.getName());
            return;
        }
        if (!pushNotifier.isAvailable()) {
            log.warn("Push transport not available, alarms of task {} postponed", task.getId());
            summary.incrementSkipped();
            return;
        }

        int restMax = task.getRestMax() == null ? 0 : Math.max(0, task.getRestMax());
        Instant next = restMax > 1 ? now.plus(delayLedger.restInterval(task.getRestTime())) : null;

        for (UserAccount user : recipients) {
            try {
                AlarmNotification alarm = new AlarmNotification();
                alarm.setTaskId(task.getId());
                alarm.setUsersId(user.getId());
                alarm.setNext(next);
                alarm.setRestMax(restMax);
                alarm.setNotificationCount(0);
                alarm.setRead(false);
                alarm.setCreatedAt(now);

                boolean delivered = sendAlarm(task, user, alarm, now);
                alarm.setNotificationCount(1);
                alarmNotificationRepository.save(alarm);
                if (delivered) {
                    summary.incrementAlarmNotifications();
                } else {
                    summary.incrementSkipped();
                }
            } catch (Exception e) {
                log.error("Error initializing alarm of task {} for user {}: {}", task.getId(), user.getId(), e.getMessage(), e);
                summary.incrementSkipped();
            }
        }
        log.info("Task {} ({}): alarm series started for {} recipient(s), rest_max={}", task.getId(), task.getName(), recipients.size(), restMax);
    }

    private boolean isCurrentRecipient(Task task, TaskStep step, UserAccount user) {
        if (step == TaskStep.PENDING) {
            return recipientResolver.isAssigned(task, user.getId());
        }
        if (step == TaskStep.IN_PROGRESS) {
            return recipientResolver.isController(task, user);
        }
        return false;
    }

    private void stopAlarms(Task task) {
        List<AlarmNotification> pending = alarmNotificationRepository.findByTaskIdAndNextNotNull(task.getId());
        pending.forEach(alarm -> alarm.setNext(null));
        alarmNotificationRepository.saveAll(pending);
        log.info("Task {} completed, {} pending alarm(s) stopped", task.getId(), pending.size());
    }

    /**
     * Sends the alarm the series is due for and records it in the row's
     * description. The caller advances the count.
     */
    private boolean sendAlarm(Task task, UserAccount user, AlarmNotification alarm, Instant now) {
        int number = alarm.getNotificationCount() + 1;
        int restMax = alarm.getRestMax();
        boolean last = restMax > 0 && number >= restMax;
        String timeRemaining = RemainingTimeFormatter.format(now, deadlineCalculator.closureDeadline(task, now));

        String title;
        String body;
        if (last) {
            title = "LAST ALARM: Task Alarm: " + task.getName();
            body = "LAST ALARM: This is your final alarm notification (#" + number + " of " + restMax + "). Time remaining until task end: " + timeRemaining + ".";
        } else {
            title = "Task Alarm: " + task.getName();
            body = "This is alarm notification #" + number + (restMax > 0 ? " of " + restMax : "")
                    + ". Time remaining until task end: " + timeRemaining + "."
                    + (restMax > 0 ? " " + (restMax - number) + " notification(s) remaining." : "");
        }

        alarm.setDescription(String.join("\n",
                "Alarm notification #" + number + (restMax > 0 ? " of " + restMax : "") + ".",
                "Task: " + task.getName() + " (ID: " + task.getId() + ")",
                "User: " + user.getUserName() + " (ID: " + user.getId() + ")",
                "Time remaining until task end: " + timeRemaining));

        Map<String, String> data = PushPayloads.baseData(task, user, title, body, NotificationType.ALARM, last);
        data.put("notification_number", String.valueOf(number));
        data.put("total_notifications", String.valueOf(restMax));
        data.put("notifications_left", String.valueOf(restMax > 0 ? Math.max(restMax - number, 0) : 0));
        data.put("time_remaining", timeRemaining);

        try {
            pushNotifier.send(PushPayloads.message(user, title, body, data));
            log.info("Alarm #{} sent to user {} for task {} (last={})", number, user.getId(), task.getId(), last);
            return true;
        } catch (PushDeliveryException e) {
            log.error("Failed to send alarm #{} to user {} for task {}: {}", number, user.getId(), task.getId(), e.getMessage(), e);
            return false;
        }
    }

}
