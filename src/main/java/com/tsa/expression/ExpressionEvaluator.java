package com.tsa.expression;

import com.tsa.interval.PartitionSlice;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Evaluates alias expressions over partition slices.
 * <p>
 * Block values are combined with AND, OR and NOT only; comparisons were
 * already resolved into block values by the observation store.
 */
public class ExpressionEvaluator {

    /**
     * Evaluate an expression against block values.
     *
     * @param expression alias expression tree
     * @param values     truth value per alias
     * @return resulting truth value
     */
    public TruthValue evaluate(Expression expression, Map<String, TruthValue> values) {
        return expression.evaluate(values);
    }

    /**
     * Set the master value of every slice.
     *
     * @param expression alias expression tree
     * @param slices     slices from the interval reconciler
     * @return new slices in the same order, master values set
     */
    public List<PartitionSlice> evaluate(Expression expression, List<PartitionSlice> slices) {
        List<PartitionSlice> result = new ArrayList<>(slices.size());
        for (PartitionSlice slice : slices) {
            result.add(slice.withMaster(expression.evaluate(slice.blockValues())));
        }
        return result;
    }
}
