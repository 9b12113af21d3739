package com.tsa.config;

import com.tsa.identifier.IdentifierPolicy;

import java.util.Set;

/**
 * Condition parsing settings.
 *
 * @param maxIdentifierLength Maximum length of site, station, sensor and alias names
 * @param numericValuesOnly   Whether comparison values other than {@code in} tuples must be numeric
 * @param reservedIdentifiers Names rejected as identifiers, in addition to the store's
 */
public record ParserSettings(
        int maxIdentifierLength,
        boolean numericValuesOnly,
        Set<String> reservedIdentifiers
) {
    public ParserSettings {
        reservedIdentifiers = reservedIdentifiers == null ? Set.of() : Set.copyOf(reservedIdentifiers);
    }

    public static ParserSettings defaults() {
        return new ParserSettings(IdentifierPolicy.DEFAULT_MAX_LENGTH, true, Set.of());
    }

    /**
     * Identifier policy with these settings' reserved names and the given ones.
     */
    public IdentifierPolicy toPolicy(Set<String> storeReserved) {
        return new IdentifierPolicy(maxIdentifierLength, reservedIdentifiers).withReservedWords(storeReserved);
    }
}
