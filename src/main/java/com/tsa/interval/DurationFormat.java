package com.tsa.interval;

import java.time.Duration;

/**
 * Formats durations with {@code {days}}, {@code {hours}}, {@code {minutes}}
 * and {@code {seconds}} placeholders.
 */
public final class DurationFormat {

    public static final String DEFAULT_PATTERN = "{days} d {hours} h {minutes} min";

    private DurationFormat() {
    }

    public static String format(Duration duration) {
        return format(duration, DEFAULT_PATTERN);
    }

    /**
     * @param duration non-negative duration
     * @param pattern  pattern with placeholders; hours, minutes and seconds are
     *                 the remainders after the larger units
     */
    public static String format(Duration duration, String pattern) {
        long seconds = duration.getSeconds();
        long days = seconds / 86_400;
        long hours = (seconds % 86_400) / 3_600;
        long minutes = (seconds % 3_600) / 60;
        long secs = seconds % 60;
        return pattern
                .replace("{days}", Long.toString(days))
                .replace("{hours}", Long.toString(hours))
                .replace("{minutes}", Long.toString(minutes))
                .replace("{seconds}", Long.toString(secs));
    }
}
