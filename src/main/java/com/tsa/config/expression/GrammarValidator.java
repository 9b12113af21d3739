package com.tsa.config.expression;

import com.tsa.exception.ConditionSyntaxException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates the order of condition tokens.
 * <p>
 * Take the left token from the rows and the next token from the columns:
 * <pre>
 *              open_paren  close_paren  and_or  not  leaf
 * open_paren   OK          -            -       OK   OK
 * close_paren  -           OK           OK      -    -
 * and_or       OK          -            -       OK   OK
 * not          OK          -            -       -    OK
 * leaf         -           OK           OK      -    -
 * </pre>
 * A condition may start with {@code open_paren}, {@code not} or a leaf and
 * end with {@code close_paren} or a leaf.
 */
public final class GrammarValidator {

    private static final Set<TokenType> ALLOWED_FIRST =
            EnumSet.of(TokenType.OPEN_PAREN, TokenType.NOT, TokenType.LEAF);

    private static final Set<TokenType> ALLOWED_LAST =
            EnumSet.of(TokenType.CLOSE_PAREN, TokenType.LEAF);

    private static final Map<TokenType, Set<TokenType>> ALLOWED_NEXT = new EnumMap<>(TokenType.class);

    static {
        ALLOWED_NEXT.put(TokenType.OPEN_PAREN, EnumSet.of(TokenType.OPEN_PAREN, TokenType.NOT, TokenType.LEAF));
        ALLOWED_NEXT.put(TokenType.CLOSE_PAREN, EnumSet.of(TokenType.CLOSE_PAREN, TokenType.AND_OR));
        ALLOWED_NEXT.put(TokenType.AND_OR, EnumSet.of(TokenType.OPEN_PAREN, TokenType.NOT, TokenType.LEAF));
        ALLOWED_NEXT.put(TokenType.NOT, EnumSet.of(TokenType.OPEN_PAREN, TokenType.LEAF));
        ALLOWED_NEXT.put(TokenType.LEAF, EnumSet.of(TokenType.CLOSE_PAREN, TokenType.AND_OR));
    }

    private GrammarValidator() {
    }

    /**
     * Check the token sequence against the adjacency table.
     *
     * @param tokens tokens in input order
     * @throws ConditionSyntaxException on the first violation
     */
    public static void validate(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new ConditionSyntaxException("Condition is empty", 0);
        }

        Token first = tokens.get(0);
        if (!ALLOWED_FIRST.contains(first.type())) {
            throw new ConditionSyntaxException("\"" + first.text() + "\" cannot be first element in condition",
                    first.text(), null, first.position());
        }

        for (int i = 0; i < tokens.size() - 1; i++) {
            Token left = tokens.get(i);
            Token right = tokens.get(i + 1);
            if (!ALLOWED_NEXT.get(left.type()).contains(right.type())) {
                throw new ConditionSyntaxException("Cannot have \"" + left.text() + "\" before \"" + right.text() + "\"",
                        left.text(), right.text(), right.position());
            }
        }

        Token last = tokens.get(tokens.size() - 1);
        if (!ALLOWED_LAST.contains(last.type())) {
            throw new ConditionSyntaxException("\"" + last.text() + "\" cannot be last element in condition",
                    last.text(), null, last.position());
        }
    }
}
