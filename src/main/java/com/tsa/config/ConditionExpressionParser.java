package com.tsa.config;

import com.tsa.config.expression.ExpressionTokenizer;
import com.tsa.config.expression.GrammarValidator;
import com.tsa.config.expression.Token;

import java.util.List;

/**
 * Facade for turning raw condition strings into validated token sequences.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: and, or, not (case-insensitive)</li>
 *   <li>Parentheses for grouping</li>
 *   <li>Leaves: {@code station#sensor op value} with op one of =, &lt;&gt;, &gt;, &lt;, &gt;=, &lt;=, in,
 *       {@code site#alias} or a bare {@code alias}</li>
 * </ul>
 */
public final class ConditionExpressionParser {

    private ConditionExpressionParser() {
    }

    /**
     * Tokenize and validate a condition string.
     *
     * @param condition raw condition string
     * @return normalized text and tokens
     * @throws com.tsa.exception.ConditionSyntaxException if the condition is malformed
     */
    public static ParsedExpression parse(String condition) {
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(condition);
        List<Token> tokens = tokenizer.tokenize();

        GrammarValidator.validate(tokens);
        return new ParsedExpression(tokenizer.getInput(), tokens);
    }
}
