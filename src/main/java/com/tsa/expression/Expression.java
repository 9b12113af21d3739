package com.tsa.expression;

import java.util.Map;

/**
 * A boolean expression over block aliases, evaluated with three-valued logic.
 */
public interface Expression {

    /**
     * Evaluate this expression against block values.
     *
     * @param values truth value per block alias; missing aliases count as unknown
     * @return resulting truth value
     */
    TruthValue evaluate(Map<String, TruthValue> values);

    /**
     * Get the expression type.
     */
    ExpressionType getType();
}
