package com.tsa.config.expression;

import com.tsa.exception.ConditionSyntaxException;
import com.tsa.identifier.IdentifierNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;

import static com.tsa.config.expression.ExpressionConfig.*;

/**
 * Tokenizer for condition strings.
 * <p>
 * The raw string is normalized first: trimmed, lower-cased, umlauts folded,
 * comparison operators outside {@code in} tuples surrounded by single spaces
 * and whitespace runs collapsed. Tokens are then split on parentheses and on the words
 * {@code and}, {@code or} and {@code not}. Everything between those is one
 * leaf. A parenthesized tuple directly after the {@code in} operator stays
 * part of its leaf.
 */
public final class ExpressionTokenizer {

    private final String raw;
    private final String input;
    private final int length;
    private int pos;

    private final StringBuilder leaf = new StringBuilder();
    private int leafStart = -1;

    public ExpressionTokenizer(String raw) {
        this.raw = raw == null ? "" : raw;
        this.input = normalize(this.raw);
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Normalized form of a condition string, as seen by the tokenizer.
     */
    public static String normalize(String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        value = IdentifierNormalizer.eliminateUmlauts(value);
        value = spaceOperatorsOutsideTuples(value);
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    /**
     * Tuple members are values, so an {@code =} inside {@code ('a=b')} is left as written.
     */
    private static String spaceOperatorsOutsideTuples(String value) {
        StringBuilder result = new StringBuilder();
        Matcher tuple = IN_TUPLE.matcher(value);
        int pos = 0;
        while (tuple.find(pos)) {
            result.append(SYMBOLIC_OPERATOR.matcher(value.substring(pos, tuple.end())).replaceAll(" $1 "));
            int end = value.indexOf(Delimiters.CLOSE_PAREN, tuple.end());
            if (end < 0) {
                // unclosed tuple is reported by tokenize()
                result.append(value.substring(tuple.end()));
                return result.toString();
            }
            result.append(value, tuple.end(), end + 1);
            pos = end + 1;
        }
        result.append(SYMBOLIC_OPERATOR.matcher(value.substring(pos)).replaceAll(" $1 "));
        return result.toString();
    }

    /**
     * The normalized input that token positions refer to.
     */
    public String getInput() {
        return input;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens
     * @throws ConditionSyntaxException if parentheses are unbalanced or an
     *                                  {@code in} tuple is not closed
     */
    public List<Token> tokenize() {
        checkBalance();

        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (c == Delimiters.SPACE) {
                advance();
                continue;
            }

            int start = pos;

            if (c == Delimiters.OPEN_PAREN) {
                if (leafEndsWithInOperator()) {
                    leaf.append(Delimiters.SPACE).append(readTuple());
                    continue;
                }
                flushLeaf(tokens);
                advance();
                tokens.add(new Token(TokenType.OPEN_PAREN, "(", start));
            } else if (c == Delimiters.CLOSE_PAREN) {
                flushLeaf(tokens);
                advance();
                tokens.add(new Token(TokenType.CLOSE_PAREN, ")", start));
            } else {
                String word = readWord();
                TokenType keyword = KEYWORDS.get(word);
                if (keyword != null) {
                    flushLeaf(tokens);
                    tokens.add(new Token(keyword, word, start));
                } else {
                    appendToLeaf(word, start);
                }
            }
        }

        flushLeaf(tokens);
        return tokens;
    }

    private void checkBalance() {
        int open = 0;
        int close = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == Delimiters.OPEN_PAREN) {
                open++;
            } else if (c == Delimiters.CLOSE_PAREN) {
                close++;
            }
        }
        if (open != close) {
            throw new ConditionSyntaxException("Should be as many \"(\" as \")\" characters in the condition, now "
                    + open + " \"(\" and " + close + " \")\"", -1);
        }
    }

    private String readWord() {
        int start = pos;
        while (!isAtEnd() && !isWordEnd(peek())) {
            advance();
        }
        return input.substring(start, pos);
    }

    private String readTuple() {
        int start = pos;
        int end = input.indexOf(Delimiters.CLOSE_PAREN, start);
        if (end < 0) {
            throw new ConditionSyntaxException("Tuple after \"in\" is not closed with \")\"", start);
        }
        pos = end + 1;
        return input.substring(start, pos);
    }

    private boolean leafEndsWithInOperator() {
        if (leaf.length() == 0) {
            return false;
        }
        String text = leaf.toString();
        return text.equals(IN_OPERATOR) || text.endsWith(Delimiters.SPACE + IN_OPERATOR);
    }

    private void appendToLeaf(String word, int start) {
        if (leaf.length() == 0) {
            leafStart = start;
        } else {
            leaf.append(Delimiters.SPACE);
        }
        leaf.append(word);
    }

    private void flushLeaf(List<Token> tokens) {
        if (leaf.length() > 0) {
            tokens.add(new Token(TokenType.LEAF, leaf.toString(), leafStart));
            leaf.setLength(0);
            leafStart = -1;
        }
    }

    private static boolean isWordEnd(char c) {
        return c == Delimiters.SPACE || c == Delimiters.OPEN_PAREN || c == Delimiters.CLOSE_PAREN;
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private void advance() {
        pos++;
    }
}
