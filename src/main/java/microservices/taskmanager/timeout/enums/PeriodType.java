package microservices.taskmanager.timeout.enums;

import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recurrence granularity of a task. Stored either bare ("weekly") or wrapped
 * ("periodic (weekly)").
 */
public enum PeriodType {
    NONE(ChronoUnit.DAYS, 1),
    DAILY(ChronoUnit.DAYS, 1),
    WEEKLY(ChronoUnit.WEEKS, 1),
    MONTHLY(ChronoUnit.MONTHS, 1),
    TRIMESTERLY(ChronoUnit.MONTHS, 3),
    SEMESTERLY(ChronoUnit.MONTHS, 6),
    YEARLY(ChronoUnit.MONTHS, 12);

    private static final Pattern PERIODIC = Pattern.compile("periodic\\s*\\(\\s*([a-z]+)\\s*\\)");

    private final ChronoUnit unit;
    private final int step;

    PeriodType(ChronoUnit unit, int step) {
        this.unit = unit;
        this.step = step;
    }

    public ChronoUnit getUnit() {
        return unit;
    }

    public int getStep() {
        return step;
    }

    /**
     * Cycles of this type restart every day from today, whatever the period start.
     */
    public boolean isAnchoredToToday() {
        return this == NONE || this == DAILY;
    }

    public static PeriodType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = PERIODIC.matcher(value);
        if (matcher.find()) {
            value = matcher.group(1);
        }
        for (PeriodType type : values()) {
            if (type.name().toLowerCase(Locale.ROOT).equals(value)) {
                return type;
            }
        }
        return NONE;
    }
}
