package com.tsa.interval;

import com.tsa.exception.StoreException;
import com.tsa.expression.TruthValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Joins the interval timelines of several blocks into the finest common
 * partition of an analysis window.
 * <p>
 * Every interval start and end inside the window, plus the window ends, is a
 * slice boundary. In each slice a block takes the value of the interval that
 * covers the slice, or {@link TruthValue#UNKNOWN} if none does. The slices
 * tile the window without gaps. Master values are left unknown for the
 * expression evaluator to fill in.
 */
public class IntervalReconciler {

    private static final Logger log = LoggerFactory.getLogger(IntervalReconciler.class);

    /**
     * Partition the window.
     *
     * @param window           analysis window
     * @param intervalsByAlias intervals per block alias; iteration order is kept in the slices
     * @return ordered slices covering the whole window
     * @throws StoreException if the intervals of one block overlap
     */
    public List<PartitionSlice> partition(TimeWindow window, Map<String, List<ValidityInterval>> intervalsByAlias) {
        Map<String, List<ValidityInterval>> timelines = new LinkedHashMap<>();
        TreeSet<LocalDateTime> boundaries = new TreeSet<>();
        boundaries.add(window.from());
        boundaries.add(window.until());

        for (Map.Entry<String, List<ValidityInterval>> entry : intervalsByAlias.entrySet()) {
            List<ValidityInterval> timeline = prepare(window, entry.getKey(), entry.getValue());
            for (ValidityInterval interval : timeline) {
                boundaries.add(interval.from());
                boundaries.add(interval.until());
            }
            timelines.put(entry.getKey(), timeline);
        }

        Map<String, Integer> cursors = new LinkedHashMap<>();
        timelines.keySet().forEach(alias -> cursors.put(alias, 0));

        List<PartitionSlice> slices = new ArrayList<>(boundaries.size() - 1);
        Iterator<LocalDateTime> it = boundaries.iterator();
        LocalDateTime start = it.next();
        while (it.hasNext()) {
            LocalDateTime end = it.next();
            Map<String, TruthValue> values = new LinkedHashMap<>();
            for (Map.Entry<String, List<ValidityInterval>> entry : timelines.entrySet()) {
                values.put(entry.getKey(), valueAt(entry.getValue(), cursors, entry.getKey(), start));
            }
            slices.add(new PartitionSlice(start, end, values, TruthValue.UNKNOWN));
            start = end;
        }

        log.debug("Partitioned {} into {} slices over {} blocks", window, slices.size(), timelines.size());
        return slices;
    }

    /**
     * Sort, clip to the window, drop empty intervals and reject overlaps.
     */
    private List<ValidityInterval> prepare(TimeWindow window, String alias, List<ValidityInterval> intervals) {
        List<ValidityInterval> sorted = new ArrayList<>(intervals == null ? List.of() : intervals);
        sorted.sort(Comparator.comparing(ValidityInterval::from));

        List<ValidityInterval> result = new ArrayList<>(sorted.size());
        for (ValidityInterval interval : sorted) {
            ValidityInterval clipped = window.clip(interval);
            if (clipped == null) {
                continue;
            }
            if (!result.isEmpty()) {
                ValidityInterval previous = result.get(result.size() - 1);
                if (previous.until().isAfter(clipped.from())) {
                    throw new StoreException("Overlapping intervals for block " + alias + ": "
                            + previous + " and " + clipped);
                }
            }
            result.add(clipped);
        }
        return result;
    }

    /**
     * Value of the timeline at {@code time}. Slices are visited in order, so
     * the cursor only moves forward.
     */
    private static TruthValue valueAt(List<ValidityInterval> timeline, Map<String, Integer> cursors,
                                      String alias, LocalDateTime time) {
        int cursor = cursors.get(alias);
        while (cursor < timeline.size() && !timeline.get(cursor).until().isAfter(time)) {
            cursor++;
        }
        cursors.put(alias, cursor);

        if (cursor < timeline.size() && !timeline.get(cursor).from().isAfter(time)) {
            return TruthValue.of(timeline.get(cursor).value());
        }
        return TruthValue.UNKNOWN;
    }
}
