package com.tsa.interval;

import com.tsa.expression.TruthValue;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Folds evaluated slices into a {@link Summary}.
 */
public final class SummaryAggregator {

    private SummaryAggregator() {
    }

    /**
     * @param window analysis window the slices tile
     * @param slices slices with master values set
     * @throws IllegalStateException if the slice durations do not add up to the window
     */
    public static Summary summarize(TimeWindow window, List<PartitionSlice> slices) {
        Duration total = window.duration();
        Duration covered = Duration.ZERO;
        Duration valid = Duration.ZERO;
        Duration invalid = Duration.ZERO;
        LocalDateTime dataFrom = null;
        LocalDateTime dataUntil = null;

        for (PartitionSlice slice : slices) {
            Duration d = slice.duration();
            covered = covered.plus(d);
            if (slice.master() == TruthValue.TRUE) {
                valid = valid.plus(d);
            } else if (slice.master() == TruthValue.FALSE) {
                invalid = invalid.plus(d);
            }
            if (slice.hasData()) {
                if (dataFrom == null) {
                    dataFrom = slice.from();
                }
                dataUntil = slice.until();
            }
        }

        if (!covered.equals(total)) {
            throw new IllegalStateException("Slices cover " + covered + " of a " + total + " window " + window);
        }

        Duration nodata = total.minus(valid).minus(invalid);
        return new Summary(total, valid, invalid, nodata, dataFrom, dataUntil, slices.size());
    }
}
