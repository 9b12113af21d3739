package com.tsa.condition;

import com.tsa.expression.Expression;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A compiled condition: unique blocks in order of first appearance and the
 * boolean expression over their aliases.
 * <p>
 * Immutable. A condition is secondary if any of its blocks refers to another
 * condition.
 */
public final class Condition {

    private final ConditionId id;
    private final String rawCondition;
    private final String normalizedCondition;
    private final List<Block> blocks;
    private final String aliasExpression;
    private final Expression expression;
    private final int sourceRow;

    Condition(ConditionId id,
              String rawCondition,
              String normalizedCondition,
              List<Block> blocks,
              String aliasExpression,
              Expression expression,
              int sourceRow) {
        this.id = id;
        this.rawCondition = rawCondition;
        this.normalizedCondition = normalizedCondition;
        this.blocks = List.copyOf(blocks);
        this.aliasExpression = aliasExpression;
        this.expression = expression;
        this.sourceRow = sourceRow;
    }

    public ConditionId getId() {
        return id;
    }

    public String getSite() {
        return id.site().value();
    }

    public String getMasterAlias() {
        return id.alias().value();
    }

    /**
     * Condition string as given.
     */
    public String getRawCondition() {
        return rawCondition;
    }

    /**
     * Condition string lower-cased with whitespace and operators normalized.
     */
    public String getCondition() {
        return normalizedCondition;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public String getAliasExpression() {
        return aliasExpression;
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean isSecondary() {
        return blocks.stream().anyMatch(Block::isSecondary);
    }

    /**
     * Row of the input the condition was read from, or -1 if unknown.
     */
    public int getSourceRow() {
        return sourceRow;
    }

    /**
     * @throws NoSuchElementException if no block has the alias
     */
    public Block block(String alias) {
        return blocks.stream()
                .filter(b -> b.alias().equals(alias))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No block with alias '" + alias + "' in " + id));
    }

    /**
     * @throws IndexOutOfBoundsException if there is no block at the index
     */
    public Block block(int index) {
        return blocks.get(index);
    }

    public List<PrimaryBlock> primaryBlocks() {
        return blocks.stream()
                .filter(b -> !b.isSecondary())
                .map(PrimaryBlock.class::cast)
                .toList();
    }

    public List<SecondaryBlock> secondaryBlocks() {
        return blocks.stream()
                .filter(Block::isSecondary)
                .map(SecondaryBlock.class::cast)
                .toList();
    }

    /**
     * Station numbers needed by the primary blocks, ascending.
     */
    public SortedSet<Integer> stationNumbers() {
        SortedSet<Integer> numbers = new TreeSet<>();
        for (PrimaryBlock block : primaryBlocks()) {
            block.stationNumber().ifPresent(numbers::add);
        }
        return Collections.unmodifiableSortedSet(numbers);
    }

    /**
     * Conditions whose results the secondary blocks reuse.
     */
    public Set<ConditionId> referencedConditions() {
        Set<ConditionId> ids = new LinkedHashSet<>();
        for (SecondaryBlock block : secondaryBlocks()) {
            ids.add(block.referencedConditionId());
        }
        return Collections.unmodifiableSet(ids);
    }

    @Override
    public String toString() {
        return (isSecondary() ? "Secondary" : "Primary") + " Condition " + id + ":\n"
                + "    " + normalizedCondition + "\n"
                + "    ALIAS: " + aliasExpression;
    }
}
