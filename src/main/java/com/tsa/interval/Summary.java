package com.tsa.interval;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Valid, invalid and no-data time of one condition over its analysis window.
 * {@code valid + invalid + nodata == total}.
 *
 * @param total      window length
 * @param valid      time the condition was true
 * @param invalid    time the condition was false
 * @param nodata     time the condition could not be determined
 * @param dataFrom   start of the first slice where any block had data, null if none
 * @param dataUntil  end of the last slice where any block had data, null if none
 * @param sliceCount number of partition slices
 */
public record Summary(Duration total,
                      Duration valid,
                      Duration invalid,
                      Duration nodata,
                      LocalDateTime dataFrom,
                      LocalDateTime dataUntil,
                      int sliceCount) {

    public double validPercentage() {
        return percentage(valid);
    }

    public double invalidPercentage() {
        return percentage(invalid);
    }

    public double nodataPercentage() {
        return percentage(nodata);
    }

    private double percentage(Duration part) {
        return part.toMillis() * 100.0 / total.toMillis();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "valid %s (%.1f %%), invalid %s (%.1f %%), no data %s (%.1f %%)",
                DurationFormat.format(valid), validPercentage(),
                DurationFormat.format(invalid), invalidPercentage(),
                DurationFormat.format(nodata), nodataPercentage());
    }
}
