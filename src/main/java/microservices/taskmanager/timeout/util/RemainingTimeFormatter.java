package microservices.taskmanager.timeout.util;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Human readable distance between now and a task's closure, used only in
 * notification text.
 */
public final class RemainingTimeFormatter {

    public static final String UNKNOWN = "unknown";

    private RemainingTimeFormatter() {
    }

    public static String format(Instant now, Optional<Instant> closure) {
        if (closure.isEmpty()) {
            return UNKNOWN;
        }
        Duration remaining = Duration.between(now, closure.get());
        if (remaining.isNegative()) {
            return "overdue by " + describe(remaining.negated());
        }
        return describe(remaining);
    }

    static String describe(Duration duration) {
        long days = duration.toDays();
        int hours = duration.toHoursPart();
        int minutes = duration.toMinutesPart();
        List<String> parts = new ArrayList<>();
        if (days > 0) {
            parts.add(plural(days, "day"));
        }
        if (hours > 0) {
            parts.add(plural(hours, "hour"));
        }
        if (minutes > 0 && days == 0) {
            parts.add(plural(minutes, "minute"));
        }
        if (parts.isEmpty()) {
            return "less than a minute";
        }
        return String.join(" ", parts);
    }

    private static String plural(long amount, String unit) {
        return amount + " " + unit + (amount == 1 ? "" : "s");
    }

}
