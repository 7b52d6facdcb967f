package org.javai.gitpulse.api;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Timestamps as the API writes them, e.g. {@code 2024-03-01T12:00:00Z}.
 */
public final class GitHubDates {

    private GitHubDates() {
    }

    /**
     * @return the parsed instant, or null when the text is null, blank or not an ISO-8601 instant
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Whole days elapsed between {@code instant} and now, rounded down.
     */
    public static long daysSince(Instant instant, Clock clock) {
        return Duration.between(instant, clock.instant()).toDays();
    }
}
