package microservices.taskmanager.timeout.notifier;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * One push to one device. Data values are opaque to this service and passed
 * through to the client app.
 */
@Getter
@Builder
public class PushMessage {
    private String token;
    private String title;
    private String body;
    @Builder.Default
    private Map<String, String> data = Map.of();
}
