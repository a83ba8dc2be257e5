package microservices.taskmanager.timeout.service;

import java.time.Instant;

import microservices.taskmanager.timeout.exception.TaskTimeoutException;
import microservices.taskmanager.timeout.model.RestGrant;
import microservices.taskmanager.timeout.model.ScanSummary;

public interface TaskTimeoutService {

    /**
     * Runs one full sweep: alarms, delay reminders and timeout repeats that are
     * due, then the timeout check of every active task. Never throws; failures
     * are reported in the summary.
     */
    ScanSummary checkTaskTimeouts(Instant now);

    /**
     * An assignee asks for one more rest after the timeout fired. The task's
     * notified marker is cleared so the timeout fires again once every rest
     * on it has run out.
     *
     * @throws TaskTimeoutException when the task does not exist, the user is
     * not assigned, no timeout was sent yet or no rest is left
     */
    RestGrant requestRest(String taskId, Long userId, Instant now);

}
