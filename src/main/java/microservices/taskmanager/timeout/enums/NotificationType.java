package microservices.taskmanager.timeout.enums;

/**
 * Values of the notification_type data key read by the mobile client.
 */
public enum NotificationType {
    START_TIME("start_time"),
    DELAY_REPEAT_ALARM("delay_repeat_alarm"),
    TIMEOUT_REPEAT("timeout_repeat"),
    ALARM("alarm");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
