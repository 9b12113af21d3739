package com.tsa.identifier;

import java.util.HashSet;
import java.util.Set;

/**
 * Limits applied when normalizing names.
 *
 * @param maxLength     maximum identifier length
 * @param reservedWords names that collide with storage relations and are rejected
 */
public record IdentifierPolicy(int maxLength, Set<String> reservedWords) {

    /**
     * Relation names of the observation database.
     */
    public static final Set<String> DEFAULT_RESERVED_WORDS = Set.of(
            "stations", "statobs", "sensors", "seobs", "laskennallinen_anturi", "tiesaa_asema");

    public static final int DEFAULT_MAX_LENGTH = 40;
    public static final int POSTGRES_MAX_LENGTH = 63;

    public IdentifierPolicy {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
        }
        reservedWords = reservedWords == null ? Set.of() : Set.copyOf(reservedWords);
    }

    /**
     * 40 characters, leaving room for identifiers concatenated from several names.
     */
    public static IdentifierPolicy defaults() {
        return new IdentifierPolicy(DEFAULT_MAX_LENGTH, DEFAULT_RESERVED_WORDS);
    }

    /**
     * The PostgreSQL identifier limit of 63 characters.
     */
    public static IdentifierPolicy postgres() {
        return new IdentifierPolicy(POSTGRES_MAX_LENGTH, DEFAULT_RESERVED_WORDS);
    }

    /**
     * Copy of this policy with additional reserved words, e.g. those reported
     * by the observation store.
     */
    public IdentifierPolicy withReservedWords(Set<String> additional) {
        Set<String> merged = new HashSet<>(reservedWords);
        if (additional != null) {
            merged.addAll(additional);
        }
        return new IdentifierPolicy(maxLength, merged);
    }
}
