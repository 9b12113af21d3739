package com.tsa.condition;

import com.tsa.identifier.Identifier;

import java.util.Objects;

/**
 * Identifies a condition by its site and master alias.
 *
 * @param site  site identifier, e.g. {@code ylojarvi_etelaan_1}
 * @param alias master alias, e.g. {@code c4}
 */
public record ConditionId(Identifier site, Identifier alias) {

    public ConditionId {
        Objects.requireNonNull(site, "site");
        Objects.requireNonNull(alias, "alias");
    }

    /**
     * Create an id from names that are already canonical.
     */
    public static ConditionId of(String site, String alias) {
        return new ConditionId(new Identifier(site), new Identifier(alias));
    }

    /**
     * Key used in collections and as a relation name: {@code site_alias}.
     */
    public String key() {
        return site.value() + "_" + alias.value();
    }

    @Override
    public String toString() {
        return key();
    }
}
