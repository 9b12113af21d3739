package com.tsa.interval;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A half-open range {@code [from, until)} during which a block had one known value.
 *
 * @param from  inclusive start
 * @param until exclusive end, not before {@code from}
 * @param value block value in the range
 */
public record ValidityInterval(LocalDateTime from, LocalDateTime until, boolean value) {

    public ValidityInterval {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(until, "until");
        if (until.isBefore(from)) {
            throw new IllegalArgumentException("Interval ends before it starts: " + from + " - " + until);
        }
    }

    public Duration duration() {
        return Duration.between(from, until);
    }

    public boolean isEmpty() {
        return from.equals(until);
    }

    @Override
    public String toString() {
        return "[" + from + ", " + until + ")=" + value;
    }
}
