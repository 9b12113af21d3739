package com.tsa.core;

import com.tsa.condition.Condition;
import com.tsa.expression.TruthValue;
import com.tsa.interval.PartitionSlice;
import com.tsa.interval.Summary;
import com.tsa.interval.ValidityInterval;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluated timeline and summary of one condition.
 */
public final class ConditionResult {

    private final Condition condition;
    private final List<PartitionSlice> slices;
    private final Summary summary;

    public ConditionResult(Condition condition, List<PartitionSlice> slices, Summary summary) {
        this.condition = condition;
        this.slices = List.copyOf(slices);
        this.summary = summary;
    }

    public Condition getCondition() {
        return condition;
    }

    public List<PartitionSlice> getSlices() {
        return slices;
    }

    public Summary getSummary() {
        return summary;
    }

    /**
     * Master values as intervals, adjacent equal values merged and unknown
     * slices left out. This is what secondary blocks referring to this
     * condition see.
     */
    public List<ValidityInterval> toIntervals() {
        List<ValidityInterval> intervals = new ArrayList<>();
        for (PartitionSlice slice : slices) {
            if (!slice.master().isKnown()) {
                continue;
            }
            boolean value = slice.master() == TruthValue.TRUE;
            if (!intervals.isEmpty()) {
                ValidityInterval last = intervals.get(intervals.size() - 1);
                if (last.value() == value && last.until().equals(slice.from())) {
                    intervals.set(intervals.size() - 1, new ValidityInterval(last.from(), slice.until(), value));
                    continue;
                }
            }
            intervals.add(new ValidityInterval(slice.from(), slice.until(), value));
        }
        return intervals;
    }

    @Override
    public String toString() {
        return condition.getId() + ": " + summary;
    }
}
