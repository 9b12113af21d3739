package com.tsa.interval;

import com.tsa.expression.TruthValue;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One segment of the analysis window in which every block keeps one value.
 *
 * @param from        inclusive start
 * @param until       exclusive end
 * @param blockValues value per block alias, in block order
 * @param master      value of the whole condition
 */
public record PartitionSlice(LocalDateTime from,
                             LocalDateTime until,
                             Map<String, TruthValue> blockValues,
                             TruthValue master) {

    public PartitionSlice {
        blockValues = Collections.unmodifiableMap(new LinkedHashMap<>(blockValues));
    }

    public Duration duration() {
        return Duration.between(from, until);
    }

    /**
     * Whether any block has a known value in this slice.
     */
    public boolean hasData() {
        return blockValues.values().stream().anyMatch(TruthValue::isKnown);
    }

    public TruthValue valueOf(String alias) {
        return blockValues.getOrDefault(alias, TruthValue.UNKNOWN);
    }

    public PartitionSlice withMaster(TruthValue value) {
        return new PartitionSlice(from, until, blockValues, value);
    }
}
