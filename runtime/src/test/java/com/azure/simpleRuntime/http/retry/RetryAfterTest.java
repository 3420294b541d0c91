package com.azure.simpleRuntime.http.retry;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RetryAfterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void parsesSeconds() {
        assertEquals(Optional.of(Duration.ofSeconds(17)), RetryAfter.parse(" 17 "));
        assertEquals(Optional.of(Duration.ZERO), RetryAfter.parse("0"));
    }

    @Test
    void parsesHttpDateRelativeToNow() {
        assertEquals(Optional.of(Duration.ofSeconds(90)), RetryAfter.parse("Fri, 1 Mar 2024 12:01:30 GMT", CLOCK));
        assertEquals(Optional.of(Duration.ZERO), RetryAfter.parse("Fri, 1 Mar 2024 11:00:00 GMT", CLOCK));
    }

    @Test
    void ignoresMissingOrMalformedValues() {
        assertEquals(Optional.empty(), RetryAfter.parse(null));
        assertEquals(Optional.empty(), RetryAfter.parse(""));
        assertEquals(Optional.empty(), RetryAfter.parse("soon"));
        assertEquals(Optional.empty(), RetryAfter.parse("-5"));
    }

    @Test
    void hugeDelaysAreCutToTheCeiling() {
        assertEquals(Optional.of(RetryAfter.CEILING), RetryAfter.parse("9223372036854775807"));
        assertEquals(Optional.of(RetryAfter.CEILING), RetryAfter.parse("123456789012345678901234567890"));
        assertEquals(Optional.of(RetryAfter.CEILING), RetryAfter.parse("31 Dec 9999 23:59:59 GMT", CLOCK));
        assertEquals(Optional.of(Duration.ofSeconds(86399)), RetryAfter.parse("86399"));
    }
}
