package com.tsa.expression.impl;

import com.tsa.expression.Expression;
import com.tsa.expression.ExpressionType;
import com.tsa.expression.TruthValue;

import java.util.List;
import java.util.Map;

/**
 * Logical AND - false if any operand is false, unknown if any is unknown otherwise.
 */
public class AndExpression implements Expression {

    private final List<Expression> operands;

    public AndExpression(List<Expression> operands) {
        this.operands = List.copyOf(operands);
    }

    @Override
    public TruthValue evaluate(Map<String, TruthValue> values) {
        TruthValue result = TruthValue.TRUE;
        for (Expression operand : operands) {
            result = result.and(operand.evaluate(values));
            if (result == TruthValue.FALSE) {
                return result;
            }
        }
        return result;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.AND;
    }

    public List<Expression> getOperands() {
        return operands;
    }

    @Override
    public String toString() {
        return "AND(" + operands + ")";
    }
}
