package com.tsa.expression.impl;

import com.tsa.expression.Expression;
import com.tsa.expression.ExpressionType;
import com.tsa.expression.TruthValue;

import java.util.List;
import java.util.Map;

/**
 * Logical OR - true if any operand is true, unknown if any is unknown otherwise.
 */
public class OrExpression implements Expression {

    private final List<Expression> operands;

    public OrExpression(List<Expression> operands) {
        this.operands = List.copyOf(operands);
    }

    @Override
    public TruthValue evaluate(Map<String, TruthValue> values) {
        TruthValue result = TruthValue.FALSE;
        for (Expression operand : operands) {
            result = result.or(operand.evaluate(values));
            if (result == TruthValue.TRUE) {
                return result;
            }
        }
        return result;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.OR;
    }

    public List<Expression> getOperands() {
        return operands;
    }

    @Override
    public String toString() {
        return "OR(" + operands + ")";
    }
}
