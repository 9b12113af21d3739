package com.tsa.condition;

import com.tsa.config.expression.Token;
import com.tsa.config.expression.TokenType;
import com.tsa.exception.BlockException;
import com.tsa.exception.ErrorKind;
import com.tsa.exception.IdentifierException;
import com.tsa.identifier.Identifier;
import com.tsa.identifier.IdentifierNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BlockBuilder.
 */
class BlockBuilderTest {

    private static final Identifier SITE = new Identifier("ylojarvi_etelaan_1");

    private BlockBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new BlockBuilder(new IdentifierNormalizer(), true);
    }

    private static Token leaf(String text) {
        return new Token(TokenType.LEAF, text, 3);
    }

    // =====================================================================
    // Primary blocks
    // =====================================================================

    @Test
    @DisplayName("Station, sensor, operator and value are split out")
    void buildsPrimaryBlock() {
        Block block = builder.build(leaf("s1122#kitka3_luku >= 0.30"), SITE, "c4_0");

        PrimaryBlock primary = assertInstanceOf(PrimaryBlock.class, block);
        assertEquals("c4_0", primary.alias());
        assertEquals("s1122", primary.station().value());
        assertEquals("kitka3_luku", primary.sensor().value());
        assertEquals(Operator.GREATER_THAN_OR_EQUALS, primary.operator());
        assertEquals("0.30", primary.value());
        assertEquals(1122, primary.stationNumber().getAsInt());
        assertFalse(primary.isSecondary());
    }

    @ParameterizedTest
    @DisplayName("Every comparison operator is recognized")
    @CsvSource({
            "'s1#x = 1', EQUALS",
            "'s1#x <> 1', NOT_EQUALS",
            "'s1#x > 1', GREATER_THAN",
            "'s1#x < 1', LESS_THAN",
            "'s1#x >= 1', GREATER_THAN_OR_EQUALS",
            "'s1#x <= 1', LESS_THAN_OR_EQUALS",
            "'s1#x in (1, 2)', IN"
    })
    void recognizesOperators(String text, Operator expected) {
        PrimaryBlock block = (PrimaryBlock) builder.build(leaf(text), SITE, "a_0");
        assertEquals(expected, block.operator());
    }

    @Test
    @DisplayName("Multi-word sensor names are normalized")
    void normalizesSensorName() {
        PrimaryBlock block = (PrimaryBlock) builder.build(leaf("s1#tienpinnan tila = 1"), SITE, "a_0");
        assertEquals("tienpinnan_tila", block.sensor().value());
    }

    @Test
    @DisplayName("Tuple of in is kept as value text")
    void keepsInTuple() {
        PrimaryBlock block = (PrimaryBlock) builder.build(leaf("s1#tila in (1, 2, 3)"), SITE, "a_0");
        assertEquals("(1, 2, 3)", block.value());
    }

    @Test
    @DisplayName("Station without digits has no station number")
    void stationWithoutDigits() {
        PrimaryBlock block = (PrimaryBlock) builder.build(leaf("asema#x = 1"), SITE, "a_0");
        assertTrue(block.stationNumber().isEmpty());
    }

    // =====================================================================
    // Secondary blocks
    // =====================================================================

    @Test
    @DisplayName("Bare alias refers to a condition of the parent site")
    void buildsSameSiteReference() {
        SecondaryBlock block = assertInstanceOf(SecondaryBlock.class, builder.build(leaf("d1"), SITE, "c4_2"));

        assertEquals(SITE, block.referencedSite());
        assertEquals("d1", block.referencedAlias().value());
        assertEquals("ylojarvi_etelaan_1_d1", block.referencedConditionId().key());
        assertTrue(block.isSecondary());
    }

    @Test
    @DisplayName("site#alias refers to a condition of another site")
    void buildsOtherSiteReference() {
        SecondaryBlock block = (SecondaryBlock) builder.build(leaf("tampere pohjoiseen#c2"), SITE, "c4_0");

        assertEquals("tampere_pohjoiseen", block.referencedSite().value());
        assertEquals("c2", block.referencedAlias().value());
    }

    // =====================================================================
    // Malformed leaves
    // =====================================================================

    @Test
    @DisplayName("More than one # is rejected")
    void rejectsTooManyHashes() {
        BlockException e = assertThrows(BlockException.class,
                () -> builder.build(leaf("a#b#c = 1"), SITE, "a_0"));

        assertEquals(ErrorKind.BLOCK, e.getKind());
        assertEquals("a#b#c = 1", e.getLeaf());
        assertEquals(3, e.getPosition());
        assertTrue(e.getMessage().startsWith("Too many \"#\"s"));
    }

    @Test
    @DisplayName("More than one operator is rejected")
    void rejectsTooManyOperators() {
        BlockException e = assertThrows(BlockException.class,
                () -> builder.build(leaf("s1#x > 1 < 2"), SITE, "a_0"));
        assertTrue(e.getMessage().startsWith("Too many binary operators"));
    }

    @Test
    @DisplayName("Operator without # is rejected")
    void rejectsOperatorWithoutHash() {
        BlockException e = assertThrows(BlockException.class,
                () -> builder.build(leaf("kitka3_luku >= 0.3"), SITE, "a_0"));
        assertTrue(e.getMessage().startsWith("No \"#\" given"));
    }

    @Test
    @DisplayName("Operator before # is rejected")
    void rejectsOperatorBeforeHash() {
        BlockException e = assertThrows(BlockException.class,
                () -> builder.build(leaf("x = 1 s1#y"), SITE, "a_0"));
        assertTrue(e.getMessage().startsWith("Binary operator must come after \"#\""));
    }

    @Test
    @DisplayName("Missing value is rejected")
    void rejectsMissingValue() {
        BlockException e = assertThrows(BlockException.class,
                () -> builder.build(leaf("s1#x >="), SITE, "a_0"));
        assertTrue(e.getMessage().startsWith("Binary operator \">=\" must be followed by a value"));
    }

    @Test
    @DisplayName("in without parenthesized tuple is rejected")
    void rejectsInWithoutTuple() {
        BlockException e = assertThrows(BlockException.class,
                () -> builder.build(leaf("s1#x in 1, 2"), SITE, "a_0"));
        assertTrue(e.getMessage().contains("tuple enclosed with parentheses"));
    }

    @Test
    @DisplayName("Non-numeric value is rejected when values must be numeric")
    void rejectsNonNumericValue() {
        BlockException e = assertThrows(BlockException.class,
                () -> builder.build(leaf("s1#tila = kuiva"), SITE, "a_0"));
        assertTrue(e.getMessage().startsWith("Value after \"=\" must be numeric"));
    }

    @Test
    @DisplayName("Non-numeric value is accepted when the numeric rule is off")
    void acceptsNonNumericValueWhenRelaxed() {
        BlockBuilder relaxed = new BlockBuilder(new IdentifierNormalizer(), false);
        PrimaryBlock block = (PrimaryBlock) relaxed.build(leaf("s1#tila = kuiva"), SITE, "a_0");

        assertEquals("kuiva", block.value());
        assertFalse(relaxed.isNumericValuesOnly());
    }

    @Test
    @DisplayName("Invalid sensor name surfaces as identifier error")
    void rejectsInvalidSensorName() {
        assertThrows(IdentifierException.class, () -> builder.build(leaf("s1#kitka-luku = 1"), SITE, "a_0"));
    }

    @ParameterizedTest
    @DisplayName("Numeric literal check")
    @CsvSource({"0.30, true", "-5, true", "1e3, true", "abc, false", "'1,5', false"})
    void numericCheck(String value, boolean expected) {
        assertEquals(expected, BlockBuilder.isNumeric(value));
    }
}
