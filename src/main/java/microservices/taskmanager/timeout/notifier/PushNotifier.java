package microservices.taskmanager.timeout.notifier;

/**
 * Delivery of a message to a device token.
 */
public interface PushNotifier {

    /**
     * @return false when the transport is not configured or could not be initialized
     */
    boolean isAvailable();

    /**
     * @return the provider's message id
     */
    String send(PushMessage message) throws PushDeliveryException;

}
