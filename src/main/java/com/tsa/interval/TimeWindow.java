package com.tsa.interval;

import com.tsa.exception.ConfigurationException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open analysis window {@code [from, until)}.
 *
 * @param from  inclusive start
 * @param until exclusive end, strictly after {@code from}
 */
public record TimeWindow(LocalDateTime from, LocalDateTime until) {

    public TimeWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(until, "until");
        if (!from.isBefore(until)) {
            throw new ConfigurationException("Start of time range must be before its end, got "
                    + from + " - " + until);
        }
    }

    public Duration duration() {
        return Duration.between(from, until);
    }

    /**
     * Part of the interval inside this window, or null if they do not overlap.
     */
    public ValidityInterval clip(ValidityInterval interval) {
        LocalDateTime start = interval.from().isBefore(from) ? from : interval.from();
        LocalDateTime end = interval.until().isAfter(until) ? until : interval.until();
        if (!start.isBefore(end)) {
            return null;
        }
        if (start.equals(interval.from()) && end.equals(interval.until())) {
            return interval;
        }
        return new ValidityInterval(start, end, interval.value());
    }

    @Override
    public String toString() {
        return "[" + from + ", " + until + ")";
    }
}
