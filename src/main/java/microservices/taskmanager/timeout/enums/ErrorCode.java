package microservices.taskmanager.timeout.enums;

public enum ErrorCode {
    DELAY_LEDGER_FAILURE("DELAY_LEDGER_FAILURE"),
    UNAUTHORIZED("UNAUTHORIZED"),
    TASK_NOT_FOUND("TASK_NOT_FOUND"),
    NOT_ASSIGNED("NOT_ASSIGNED"),
    TIMEOUT_NOT_NOTIFIED("TIMEOUT_NOT_NOTIFIED"),
    REST_LIMIT_REACHED("REST_LIMIT_REACHED");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
