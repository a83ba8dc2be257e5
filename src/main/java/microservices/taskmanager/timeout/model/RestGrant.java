package microservices.taskmanager.timeout.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A rest granted on request. restMax is what remains after this one.
 */
@Getter
@AllArgsConstructor
@ToString
public class RestGrant {

    private final String delayId;

    private final int restMax;

    private final boolean lastTime;
}
