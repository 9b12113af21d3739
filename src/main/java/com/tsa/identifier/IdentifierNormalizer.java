package com.tsa.identifier;

import com.tsa.exception.IdentifierException;

import java.util.Locale;
import java.util.Map;

/**
 * Converts free-text names into {@link Identifier}s.
 * <p>
 * Steps, in order: trim, lowercase, fold {@code ä} and {@code ö} to
 * {@code a} and {@code o}, replace inner spaces with underscores. The result
 * is rejected if it is empty, starts with a digit, exceeds the policy's
 * maximum length, contains anything but ASCII letters, digits and
 * underscores, or is a reserved word.
 */
public class IdentifierNormalizer {

    private static final Map<Character, Character> UMLAUTS = Map.of(
            'ä', 'a',
            'Ä', 'A',
            'ö', 'o',
            'Ö', 'O'
    );

    private final IdentifierPolicy policy;

    public IdentifierNormalizer() {
        this(IdentifierPolicy.defaults());
    }

    public IdentifierNormalizer(IdentifierPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Identifier policy is required");
        }
        this.policy = policy;
    }

    public IdentifierPolicy getPolicy() {
        return policy;
    }

    /**
     * Normalize a name into an identifier.
     *
     * @param text free-text name
     * @return canonical identifier
     * @throws IdentifierException if the name cannot be normalized
     */
    public Identifier normalize(String text) {
        String original = text == null ? "" : text.trim();
        if (original.isEmpty()) {
            throw new IdentifierException(IdentifierException.Reason.EMPTY,
                    "String is empty", original, 0);
        }

        String value = eliminateUmlauts(original.toLowerCase(Locale.ROOT)).replace(' ', '_');

        if (Character.isDigit(value.charAt(0))) {
            throw new IdentifierException(IdentifierException.Reason.LEADING_DIGIT,
                    "String starts with digit", original, 0);
        }

        if (value.length() > policy.maxLength()) {
            throw new IdentifierException(IdentifierException.Reason.TOO_LONG,
                    "String too long, maximum is " + policy.maxLength() + " characters",
                    original, policy.maxLength());
        }

        for (int i = 0; i < value.length(); i++) {
            if (!isIdentifierChar(value.charAt(i))) {
                throw new IdentifierException(IdentifierException.Reason.INVALID_CHARACTER,
                        "String contains an invalid character", original, i);
            }
        }

        if (policy.reservedWords().contains(value)) {
            throw new IdentifierException(IdentifierException.Reason.RESERVED,
                    "String is a reserved name", original, 0);
        }

        return new Identifier(value);
    }

    /**
     * Check a composed identifier (such as a condition id) against the
     * reserved words without renormalizing it.
     */
    public void checkNotReserved(String composed) {
        if (policy.reservedWords().contains(composed)) {
            throw new IdentifierException(IdentifierException.Reason.RESERVED,
                    "Cannot use a reserved relation name as identifier", composed, 0);
        }
    }

    /**
     * Fold {@code ä}, {@code Ä}, {@code ö} and {@code Ö}; no other transliteration.
     */
    public static String eliminateUmlauts(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(UMLAUTS.getOrDefault(c, c));
        }
        return sb.toString();
    }

    private static boolean isIdentifierChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }
}
