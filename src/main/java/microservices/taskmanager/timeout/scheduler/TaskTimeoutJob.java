package microservices.taskmanager.timeout.scheduler;

import java.time.Clock;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.model.ScanSummary;
import microservices.taskmanager.timeout.service.TaskTimeoutService;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;

/**
 * Cron trigger for the timeout sweep. ShedLock keeps a single instance running
 * it at a time across the cluster.
 */
@Component
@Slf4j
public class TaskTimeoutJob {

    private final TaskTimeoutService taskTimeoutService;
    private final Clock clock;

    public TaskTimeoutJob(TaskTimeoutService taskTimeoutService, Clock clock) {
        this.taskTimeoutService = taskTimeoutService;
        this.clock = clock;
    }

    @Scheduled(cron = "${task-timeout.scheduling.check-cron:0 * * * * *}")
    @SchedulerLock(name = "checkTaskTimeouts", lockAtMostFor = "${task-timeout.scheduling.lock-at-most-for:PT5M}")
    public void checkTaskTimeouts() {
        ScanSummary summary = taskTimeoutService.checkTaskTimeouts(clock.instant());
        if (summary.isSuccess()) {
            log.info("Scheduled timeout check completed\n{}", summary.getOutput());
        } else {
            log.error("Scheduled timeout check failed with exit code {}\n{}", summary.getExitCode(), summary.getOutput());
        }
    }

}
