package com.azure.simpleRuntime.http.retry;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses the {@code Retry-After} header, which is either a number of seconds or an HTTP-date.
 * Parsed delays never exceed {@link #CEILING}.
 */
public final class RetryAfter {
    public static final String HEADER = "Retry-After";

    /** Longest delay a server can ask for. */
    public static final Duration CEILING = Duration.ofDays(1);

    private static final BigInteger CEILING_SECONDS = BigInteger.valueOf(CEILING.getSeconds());

    private RetryAfter() {
    }

    public static Optional<Duration> parse(String value) {
        return parse(value, Clock.systemUTC());
    }

    static Optional<Duration> parse(String value, Clock clock) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();

        if (trimmed.matches("\\d+")) {
            BigInteger seconds = new BigInteger(trimmed);
            return Optional.of(seconds.compareTo(CEILING_SECONDS) >= 0 ? CEILING : Duration.ofSeconds(seconds.longValue()));
        }

        try {
            ZonedDateTime retryAt = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration delay = Duration.between(ZonedDateTime.now(clock), retryAt);
            if (delay.isNegative()) {
                return Optional.of(Duration.ZERO);
            }
            return Optional.of(delay.compareTo(CEILING) > 0 ? CEILING : delay);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
