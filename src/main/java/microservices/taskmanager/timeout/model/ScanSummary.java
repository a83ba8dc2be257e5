package microservices.taskmanager.timeout.model;

import lombok.Getter;

/**
 * Outcome of one sweep. Exit code 0 means the sweep ran to completion, even
 * if single tasks were skipped on error.
 */
@Getter
public class ScanSummary {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;

    private int notified;
    private int skipped;
    private int delayAlarms;
    private int alarmNotifications;
    private int timeoutRepeats;
    private int considered;
    private int exitCode = EXIT_OK;
    private String failure;

    public void incrementNotified() {
        notified++;
    }

    public void incrementSkipped() {
        skipped++;
    }

    public void incrementDelayAlarms() {
        delayAlarms++;
    }

    public void incrementAlarmNotifications() {
        alarmNotifications++;
    }

    public void incrementTimeoutRepeats() {
        timeoutRepeats++;
    }

    public void incrementConsidered() {
        considered++;
    }

    public void fail(String reason) {
        exitCode = EXIT_FAILED;
        failure = reason;
    }

    public boolean isSuccess() {
        return exitCode == EXIT_OK;
    }

    public String getOutput() {
        StringBuilder output = new StringBuilder();
        if (failure != null) {
            output.append("Scan failed: ").append(failure).append('\n');
        }
        output.append("Summary:\n");
        output.append("  - New start time notifications sent: ").append(notified).append('\n');
        output.append("  - Alarm notifications sent: ").append(alarmNotifications).append('\n');
        output.append("  - Delay repeat alarms sent: ").append(delayAlarms).append('\n');
        output.append("  - Timeout repeat notifications sent: ").append(timeoutRepeats).append('\n');
        output.append("  - Skipped/Errors: ").append(skipped).append('\n');
        output.append("  - Tasks considered: ").append(considered).append('\n');
        return output.toString();
    }
}
