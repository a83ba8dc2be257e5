package microservices.taskmanager.timeout.util;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Parsing for the HH:mm[:ss] values stored on tasks. Anything unparseable
 * comes back empty.
 */
public final class ScheduleTimes {

    private ScheduleTimes() {
    }

    public static Optional<LocalTime> parseTimeOfDay(String value) {
        int[] parts = split(value);
        if (parts == null || parts[0] > 23 || parts[1] > 59 || parts[2] > 59) {
            return Optional.empty();
        }
        return Optional.of(LocalTime.of(parts[0], parts[1], parts[2]));
    }

    /**
     * A rest time or a BEFORE_CLOSURE offset. Hours are not capped at 23.
     */
    public static Optional<Duration> parseDuration(String value) {
        int[] parts = split(value);
        if (parts == null || parts[1] > 59 || parts[2] > 59) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofHours(parts[0]).plusMinutes(parts[1]).plusSeconds(parts[2]));
    }

    private static int[] split(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String[] tokens = value.trim().split(":");
        if (tokens.length < 2 || tokens.length > 3) {
            return null;
        }
        int[] parts = new int[3];
        try {
            for (int i = 0; i < tokens.length; i++) {
                // tolerate a trailing fraction, e.g. "08:30:00.000000"
                String token = i == 2 ? tokens[i].split("\\.")[0] : tokens[i];
                parts[i] = Integer.parseInt(token.trim());
                if (parts[i] < 0) {
                    return null;
                }
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return parts;
    }

}
