package microservices.taskmanager.timeout.notifier;

public class PushDeliveryException extends Exception {

    public PushDeliveryException(String message) {
        super(message);
    }

    public PushDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
