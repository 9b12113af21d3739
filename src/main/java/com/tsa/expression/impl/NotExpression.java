package com.tsa.expression.impl;

import com.tsa.expression.Expression;
import com.tsa.expression.ExpressionType;
import com.tsa.expression.TruthValue;

import java.util.Map;

/**
 * Logical NOT - negates the operand, unknown stays unknown.
 */
public class NotExpression implements Expression {

    private final Expression operand;

    public NotExpression(Expression operand) {
        this.operand = operand;
    }

    @Override
    public TruthValue evaluate(Map<String, TruthValue> values) {
        return operand.evaluate(values).not();
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.NOT;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return "NOT(" + operand + ")";
    }
}
