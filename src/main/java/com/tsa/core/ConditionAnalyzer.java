package com.tsa.core;

import com.tsa.condition.Block;
import com.tsa.condition.Condition;
import com.tsa.condition.ConditionId;
import com.tsa.condition.PrimaryBlock;
import com.tsa.condition.SecondaryBlock;
import com.tsa.exception.StoreException;
import com.tsa.exception.UnresolvedReferenceException;
import com.tsa.expression.ExpressionEvaluator;
import com.tsa.interval.DurationFormat;
import com.tsa.interval.IntervalReconciler;
import com.tsa.interval.PartitionSlice;
import com.tsa.interval.Summary;
import com.tsa.interval.SummaryAggregator;
import com.tsa.interval.TimeWindow;
import com.tsa.interval.ValidityInterval;
import com.tsa.store.IntervalQuery;
import com.tsa.store.ObservationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Evaluates one condition over an analysis window.
 * <p>
 * Primary blocks get their intervals from the observation store, secondary
 * blocks from the result of the referenced condition. The block timelines
 * are partitioned, the alias expression is evaluated per slice and the
 * slices are summarized.
 */
public class ConditionAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConditionAnalyzer.class);

    public static final Duration DEFAULT_GAP_TOLERANCE = Duration.ofMinutes(30);

    private final ObservationStore store;
    private final IntervalReconciler reconciler;
    private final ExpressionEvaluator evaluator;
    private final Duration gapTolerance;

    public ConditionAnalyzer(ObservationStore store) {
        this(store, DEFAULT_GAP_TOLERANCE);
    }

    public ConditionAnalyzer(ObservationStore store, Duration gapTolerance) {
        this(store, new IntervalReconciler(), new ExpressionEvaluator(), gapTolerance);
    }

    public ConditionAnalyzer(ObservationStore store,
                             IntervalReconciler reconciler,
                             ExpressionEvaluator evaluator,
                             Duration gapTolerance) {
        this.store = store;
        this.reconciler = reconciler;
        this.evaluator = evaluator;
        this.gapTolerance = gapTolerance;
    }

    /**
     * Evaluate a condition.
     *
     * @param condition condition to evaluate
     * @param window    analysis window
     * @param resolved  results of already evaluated conditions, null for unknown ids
     * @return slices and summary
     * @throws StoreException               if block data cannot be fetched
     * @throws UnresolvedReferenceException if a secondary block refers to a condition without result
     */
    public ConditionResult analyze(Condition condition, TimeWindow window,
                                   Function<ConditionId, ConditionResult> resolved) {
        Map<String, List<ValidityInterval>> intervals = new LinkedHashMap<>();
        for (Block block : condition.getBlocks()) {
            intervals.put(block.alias(), intervalsOf(condition, block, window, resolved));
        }

        List<PartitionSlice> slices = reconciler.partition(window, intervals);
        List<PartitionSlice> evaluated = evaluator.evaluate(condition.getExpression(), slices);
        Summary summary = SummaryAggregator.summarize(window, evaluated);

        log.info("Condition {}: valid {}, invalid {}, no data {} in {} slices",
                condition.getId(),
                DurationFormat.format(summary.valid()),
                DurationFormat.format(summary.invalid()),
                DurationFormat.format(summary.nodata()),
                summary.sliceCount());
        return new ConditionResult(condition, evaluated, summary);
    }

    private List<ValidityInterval> intervalsOf(Condition condition, Block block, TimeWindow window,
                                               Function<ConditionId, ConditionResult> resolved) {
        if (block instanceof SecondaryBlock secondary) {
            ConditionId ref = secondary.referencedConditionId();
            ConditionResult result = resolved.apply(ref);
            if (result == null) {
                throw new UnresolvedReferenceException("Block " + block.alias() + " of " + condition.getId()
                        + " refers to condition " + ref + " which has no result");
            }
            return result.toIntervals();
        }

        PrimaryBlock primary = (PrimaryBlock) block;
        OptionalInt stationId = primary.stationNumber();
        if (stationId.isEmpty()) {
            throw new StoreException("Block " + block.alias() + " of " + condition.getId()
                    + ": station " + primary.station() + " has no station number");
        }
        int sensorId = store.resolveSensorId(primary.sensor().value());
        IntervalQuery query = new IntervalQuery(stationId.getAsInt(), sensorId, primary.operator(),
                primary.value(), window, gapTolerance);
        return store.getIntervals(query);
    }
}
