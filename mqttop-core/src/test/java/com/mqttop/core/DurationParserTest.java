package com.mqttop.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationParserTest {

    @Test
    void testSingleUnit() {
        assertEquals(Duration.ofMillis(500), DurationParser.parse("500ms"));
        assertEquals(Duration.ofSeconds(5), DurationParser.parse("5s"));
        assertEquals(Duration.ofMinutes(1), DurationParser.parse("1m"));
        assertEquals(Duration.ofHours(2), DurationParser.parse("2h"));
        assertEquals(Duration.ofNanos(300_000), DurationParser.parse("300us"));
        assertEquals(Duration.ofNanos(300_000), DurationParser.parse("300µs"));
        assertEquals(Duration.ofNanos(42), DurationParser.parse("42ns"));
    }

    @Test
    void testCompoundAndFractional() {
        assertEquals(Duration.ofSeconds(90), DurationParser.parse("1m30s"));
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1.5s"));
        assertEquals(Duration.ofMinutes(90).plusMillis(250), DurationParser.parse("1h30m250ms"));
        assertEquals(Duration.ofMillis(500), DurationParser.parse(".5s"));
        assertEquals(Duration.ofSeconds(-2), DurationParser.parse("-2s"));
        assertEquals(Duration.ZERO, DurationParser.parse("0"));
    }

    @Test
    void testIsoFallback() {
        assertEquals(Duration.ofSeconds(5), DurationParser.parse("PT5S"));
        assertEquals(Duration.ofMinutes(2), DurationParser.parse(" PT2M "));
    }

    @Test
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("5x"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("1m30"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse(null));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("9999999999h"));
    }
}
