package microservices.taskmanager.timeout.exception;

import microservices.taskmanager.timeout.enums.ErrorCode;

public class TaskTimeoutException extends RuntimeException {

    private final ErrorCode errorCode;

    public TaskTimeoutException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public TaskTimeoutException(String message, Throwable cause, ErrorCode errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
