package com.tsa.expression;

import com.tsa.config.expression.ExpressionTokenizer;
import com.tsa.config.expression.GrammarValidator;
import com.tsa.config.expression.Token;
import com.tsa.config.expression.TokenType;
import com.tsa.exception.ConditionSyntaxException;
import com.tsa.expression.impl.AliasReference;
import com.tsa.expression.impl.AndExpression;
import com.tsa.expression.impl.NotExpression;
import com.tsa.expression.impl.OrExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for alias expressions.
 * Converts tokens into an {@link Expression} tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: NOT > AND > OR, as in SQL):
 * <pre>
 * expression := or
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' primary | primary
 * primary    := '(' expression ')' | alias
 * </pre>
 */
public final class AliasExpressionParser {

    private static final String AND = "and";
    private static final String OR = "or";

    private final List<Token> tokens;
    private int index;

    public AliasExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse an alias expression string such as {@code c4_0 and not (c4_1 or c4_2)}.
     */
    public static Expression parse(String aliasExpression) {
        List<Token> tokens = new ExpressionTokenizer(aliasExpression).tokenize();
        GrammarValidator.validate(tokens);
        return new AliasExpressionParser(tokens).parse();
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root expression
     */
    public Expression parse() {
        Expression result = parseOr();
        if (!isAtEnd()) {
            throw error("Unexpected \"" + peek().text() + "\"");
        }
        return result;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        List<Expression> operands = new ArrayList<>();
        operands.add(left);

        while (matchKeyword(OR)) {
            operands.add(parseAnd());
        }

        return operands.size() == 1 ? left : new OrExpression(operands);
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        List<Expression> operands = new ArrayList<>();
        operands.add(left);

        while (matchKeyword(AND)) {
            operands.add(parseNot());
        }

        return operands.size() == 1 ? left : new AndExpression(operands);
    }

    private Expression parseNot() {
        if (match(TokenType.NOT)) {
            return new NotExpression(parsePrimary());
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        if (match(TokenType.OPEN_PAREN)) {
            Expression expr = parseOr();
            expect(TokenType.CLOSE_PAREN);
            return expr;
        }
        Token alias = consume(TokenType.LEAF, "Expected alias");
        return new AliasReference(alias.text());
    }

    private boolean matchKeyword(String keyword) {
        if (check(TokenType.AND_OR) && peek().text().equals(keyword)) {
            index++;
            return true;
        }
        return false;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            index++;
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return tokens.get(index++);
        }
        throw error(message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        index++;
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().type() == type;
    }

    private boolean isAtEnd() {
        return index >= tokens.size();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private ConditionSyntaxException error(String message) {
        int position = isAtEnd() ? -1 : peek().position();
        return new ConditionSyntaxException("Invalid alias expression at token " + index + ": " + message, position);
    }
}
