package com.tsa.condition;

import com.tsa.config.expression.Token;

import java.util.List;

/**
 * Writes a token sequence back as a string: {@code and}/{@code or} get a
 * space on both sides, {@code not} a space after it, parentheses none.
 */
public final class AliasExpressionBuilder {

    private AliasExpressionBuilder() {
    }

    /**
     * @param tokens validated tokens whose leaves carry block aliases
     * @return alias expression, e.g. {@code (c4_0 and not c4_1) or c4_2}
     */
    public static String build(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            switch (token.type()) {
                case AND_OR -> sb.append(' ').append(token.text()).append(' ');
                case NOT -> sb.append(token.text()).append(' ');
                case OPEN_PAREN, CLOSE_PAREN, LEAF -> sb.append(token.text());
            }
        }
        return sb.toString();
    }
}
