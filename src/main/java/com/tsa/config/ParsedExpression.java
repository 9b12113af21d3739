package com.tsa.config;

import com.tsa.config.expression.Token;

import java.util.List;

/**
 * A condition string after tokenizing and grammar validation.
 *
 * @param text   normalized condition text
 * @param tokens validated tokens in input order
 */
public record ParsedExpression(String text, List<Token> tokens) {

    public ParsedExpression {
        tokens = List.copyOf(tokens);
    }
}
