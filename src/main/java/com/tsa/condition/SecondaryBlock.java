package com.tsa.condition;

import com.tsa.identifier.Identifier;

/**
 * Block reusing the result of another condition, written as
 * {@code site#alias} or just {@code alias} for a condition of the same site.
 *
 * @param alias           block alias
 * @param rawText         normalized leaf text
 * @param referencedSite  site of the referenced condition
 * @param referencedAlias master alias of the referenced condition
 */
public record SecondaryBlock(String alias,
                             String rawText,
                             Identifier referencedSite,
                             Identifier referencedAlias) implements Block {

    @Override
    public BlockType getType() {
        return BlockType.SECONDARY;
    }

    public ConditionId referencedConditionId() {
        return new ConditionId(referencedSite, referencedAlias);
    }
}
