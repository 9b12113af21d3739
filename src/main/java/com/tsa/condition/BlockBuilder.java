package com.tsa.condition;

import com.tsa.config.expression.Token;
import com.tsa.exception.BlockException;
import com.tsa.identifier.Identifier;
import com.tsa.identifier.IdentifierNormalizer;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;

import static com.tsa.config.expression.ExpressionConfig.COMPARISON_OPERATORS;
import static com.tsa.config.expression.ExpressionConfig.Delimiters;
import static com.tsa.config.expression.ExpressionConfig.IN_TUPLE;

/**
 * Turns leaf tokens into blocks.
 * <p>
 * A leaf may contain at most one {@code #} and at most one binary operator:
 * <ul>
 *   <li>no {@code #}, no operator: secondary block of the parent site</li>
 *   <li>{@code #}, no operator: secondary block {@code site#alias}</li>
 *   <li>{@code #} and operator: primary block {@code station#sensor op value}</li>
 *   <li>operator without {@code #}: error</li>
 * </ul>
 */
public class BlockBuilder {

    private final IdentifierNormalizer normalizer;
    private final boolean numericValuesOnly;

    /**
     * @param normalizer        normalizer for station, sensor, site and alias names
     * @param numericValuesOnly whether values of operators other than {@code in}
     *                          must be numeric literals
     */
    public BlockBuilder(IdentifierNormalizer normalizer, boolean numericValuesOnly) {
        this.normalizer = normalizer;
        this.numericValuesOnly = numericValuesOnly;
    }

    public boolean isNumericValuesOnly() {
        return numericValuesOnly;
    }

    /**
     * Build a block from a leaf token.
     *
     * @param leaf       leaf token
     * @param parentSite site of the condition the leaf belongs to
     * @param alias      alias to give the block
     * @return primary or secondary block
     * @throws BlockException                           if the leaf is malformed
     * @throws com.tsa.exception.IdentifierException if a name in the leaf is invalid
     */
    public Block build(Token leaf, Identifier parentSite, String alias) {
        String text = leaf.text();
        String head = textBeforeTuple(text);
        List<String> words = Arrays.asList(head.split(" "));

        long hashes = head.chars().filter(c -> c == Delimiters.SITE_SEPARATOR).count();
        if (hashes > 1) {
            throw new BlockException("Too many \"#\"s, only one or zero allowed", text, leaf.position());
        }

        long operators = words.stream().filter(COMPARISON_OPERATORS::contains).count();
        if (operators > 1) {
            throw new BlockException("Too many binary operators, only one or zero allowed", text, leaf.position());
        }

        if (hashes == 0 && operators == 0) {
            return new SecondaryBlock(alias, text, parentSite, normalizer.normalize(text));
        }

        if (hashes == 0) {
            throw new BlockException("No \"#\" given, should be of format "
                    + "[station]#[sensor] [binary operator] [value]", text, leaf.position());
        }

        int hashIndex = text.indexOf(Delimiters.SITE_SEPARATOR);
        String before = text.substring(0, hashIndex);
        String after = text.substring(hashIndex + 1);

        if (operators == 0) {
            return new SecondaryBlock(alias, text, normalizer.normalize(before), normalizer.normalize(after));
        }

        return buildPrimary(leaf, alias, before, after);
    }

    private PrimaryBlock buildPrimary(Token leaf, String alias, String stationText, String comparison) {
        String text = leaf.text();
        List<String> words = Arrays.asList(comparison.trim().split(" "));

        int opIndex = -1;
        for (int i = 0; i < words.size(); i++) {
            if (COMPARISON_OPERATORS.contains(words.get(i))) {
                opIndex = i;
                break;
            }
        }
        if (opIndex < 0) {
            throw new BlockException("Binary operator must come after \"#\", should be of format "
                    + "[station]#[sensor] [binary operator] [value]", text, leaf.position());
        }

        Identifier station = normalizer.normalize(stationText);
        Identifier sensor = normalizer.normalize(String.join(" ", words.subList(0, opIndex)));
        Operator operator = Operator.fromSymbol(words.get(opIndex))
                .orElseThrow(() -> new BlockException("Unknown binary operator", text, leaf.position()));
        String value = String.join(" ", words.subList(opIndex + 1, words.size()));

        if (value.isEmpty()) {
            throw new BlockException("Binary operator \"" + operator + "\" must be followed by a value",
                    text, leaf.position());
        }

        if (operator == Operator.IN) {
            if (!value.startsWith("(") || !value.endsWith(")")) {
                throw new BlockException("Binary operator \"in\" must be followed by "
                        + "a tuple enclosed with parentheses \"()\"", text, leaf.position());
            }
        } else if (numericValuesOnly && !isNumeric(value)) {
            throw new BlockException("Value after \"" + operator + "\" must be numeric", text, leaf.position());
        }

        return new PrimaryBlock(alias, text, station, sensor, operator, value);
    }

    /**
     * The leaf up to the tuple of an {@code in} operator, or the whole leaf.
     */
    static String textBeforeTuple(String text) {
        Matcher tuple = IN_TUPLE.matcher(text);
        return tuple.find() ? text.substring(0, tuple.end() - 1) : text;
    }

    static boolean isNumeric(String value) {
        try {
            new BigDecimal(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
