package microservices.taskmanager.timeout.enums;

import java.util.Arrays;
import java.util.Optional;

public enum TaskStep {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed");

    private final String value;

    TaskStep(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<TaskStep> from(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(step -> step.value.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
