package com.tsa.identifier;

import java.util.Objects;

/**
 * A canonical lowercase name: ASCII letters, digits and underscores,
 * not starting with a digit. Only {@link IdentifierNormalizer} creates
 * identifiers from free text.
 *
 * @param value the canonical name
 */
public record Identifier(String value) implements Comparable<Identifier> {

    public Identifier {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public int compareTo(Identifier other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
