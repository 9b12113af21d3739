package com.tsa.interval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DurationFormat.
 */
class DurationFormatTest {

    @Test
    @DisplayName("Default pattern shows days, hours and minutes")
    void defaultPattern() {
        assertEquals("1 d 2 h 3 min", DurationFormat.format(Duration.ofDays(1).plusHours(2).plusMinutes(3)));
        assertEquals("0 d 0 h 0 min", DurationFormat.format(Duration.ZERO));
    }

    @Test
    @DisplayName("Custom pattern may include seconds")
    void customPattern() {
        Duration duration = Duration.ofHours(49).plusSeconds(75);
        assertEquals("2/1/1/15", DurationFormat.format(duration, "{days}/{hours}/{minutes}/{seconds}"));
    }
}
