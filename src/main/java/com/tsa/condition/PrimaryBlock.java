package com.tsa.condition;

import com.tsa.identifier.Identifier;

import java.util.OptionalInt;

/**
 * Block comparing one sensor of one station against a value,
 * e.g. {@code s1122#kitka3_luku >= 0.30}.
 *
 * @param alias    block alias
 * @param rawText  normalized leaf text
 * @param station  station identifier, e.g. {@code s1122}
 * @param sensor   sensor name
 * @param operator comparison operator
 * @param value    value text; a parenthesized tuple for {@link Operator#IN}
 */
public record PrimaryBlock(String alias,
                           String rawText,
                           Identifier station,
                           Identifier sensor,
                           Operator operator,
                           String value) implements Block {

    @Override
    public BlockType getType() {
        return BlockType.PRIMARY;
    }

    /**
     * Station number made of the digits in the station identifier,
     * {@code s1122} gives 1122. Empty if the identifier has no digits.
     */
    public OptionalInt stationNumber() {
        String digits = station.value().replaceAll("\\D", "");
        if (digits.isEmpty() || digits.length() > 9) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(digits));
    }
}
