package com.tsa.config.expression;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keywords, operators and separators of the condition grammar.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Logical keywords mapped to token types. Matched after lower-casing.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", TokenType.AND_OR,
            "or", TokenType.AND_OR,
            "not", TokenType.NOT
    );

    /**
     * Binary operators of a primary block, each written as a separate word.
     */
    public static final List<String> COMPARISON_OPERATORS = List.of("=", "<>", ">", "<", ">=", "<=", "in");

    /**
     * Symbolic comparison operators, longest first so that {@code >=} wins over {@code >}.
     */
    public static final Pattern SYMBOLIC_OPERATOR = Pattern.compile("\\s*(<>|>=|<=|=|<|>)\\s*");

    /**
     * The {@code in} operator followed by the opening parenthesis of its tuple.
     */
    public static final Pattern IN_TUPLE = Pattern.compile("\\bin\\s*\\(");

    public static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static final String IN_OPERATOR = "in";

    /**
     * Delimiter characters.
     */
    public static final class Delimiters {
        public static final char OPEN_PAREN = '(';
        public static final char CLOSE_PAREN = ')';
        public static final char SITE_SEPARATOR = '#';
        public static final char SPACE = ' ';

        private Delimiters() {
        }
    }
}
