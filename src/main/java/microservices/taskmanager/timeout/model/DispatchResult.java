package microservices.taskmanager.timeout.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class DispatchResult {

    private final int successCount;

    private final int failedCount;

    public static DispatchResult empty() {
        return new DispatchResult(0, 0);
    }
}
