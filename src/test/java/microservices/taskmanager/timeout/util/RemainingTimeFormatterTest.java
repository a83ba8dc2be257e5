package microservices.taskmanager.timeout.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class RemainingTimeFormatterTest {

    private static final Instant NOW = Instant.parse("2026-03-11T09:00:00Z");

    @Test
    void format_ShouldDescribeTimeUntilClosure() {
        assertEquals("8 hours", RemainingTimeFormatter.format(NOW, Optional.of(Instant.parse("2026-03-11T17:00:00Z"))));
        assertEquals("2 hours 5 minutes", RemainingTimeFormatter.format(NOW, Optional.of(Instant.parse("2026-03-11T11:05:00Z"))));
        assertEquals("1 day 1 hour", RemainingTimeFormatter.format(NOW, Optional.of(Instant.parse("2026-03-12T10:30:00Z"))));
    }

    @Test
    void format_PastClosure_ShouldSayOverdue() {
        assertEquals("overdue by 10 minutes", RemainingTimeFormatter.format(NOW, Optional.of(Instant.parse("2026-03-11T08:50:00Z"))));
    }

    @Test
    void format_NoClosure_ShouldBeUnknown() {
        assertEquals(RemainingTimeFormatter.UNKNOWN, RemainingTimeFormatter.format(NOW, Optional.empty()));
        assertEquals("less than a minute", RemainingTimeFormatter.format(NOW, Optional.of(NOW.plusSeconds(20))));
    }

}
