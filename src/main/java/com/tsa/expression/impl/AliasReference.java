package com.tsa.expression.impl;

import com.tsa.expression.Expression;
import com.tsa.expression.ExpressionType;
import com.tsa.expression.TruthValue;

import java.util.Map;

/**
 * Value of one block, looked up by alias.
 */
public class AliasReference implements Expression {

    private final String alias;

    public AliasReference(String alias) {
        this.alias = alias;
    }

    @Override
    public TruthValue evaluate(Map<String, TruthValue> values) {
        return values.getOrDefault(alias, TruthValue.UNKNOWN);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.ALIAS;
    }

    public String getAlias() {
        return alias;
    }

    @Override
    public String toString() {
        return alias;
    }
}
