package com.tsa.identifier;

import com.tsa.exception.ErrorKind;
import com.tsa.exception.IdentifierException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IdentifierNormalizer.
 */
class IdentifierNormalizerTest {

    private IdentifierNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new IdentifierNormalizer(IdentifierPolicy.defaults());
    }

    // =====================================================================
    // Accepted names
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Names are trimmed, lower-cased, umlaut-folded and underscored")
    @CsvSource({
            "'Ylöjärvi etelään 1', ylojarvi_etelaan_1",
            "'  C4  ', c4",
            "S1122, s1122",
            "KITKA3_LUKU, kitka3_luku",
            "'Ä Ö', a_o",
            "_private, _private"
    })
    void normalizesNames(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input).value());
    }

    @Test
    @DisplayName("Identifier of exactly the maximum length is accepted")
    void acceptsMaximumLength() {
        String name = "a".repeat(IdentifierPolicy.DEFAULT_MAX_LENGTH);
        assertEquals(name, normalizer.normalize(name).value());
    }

    @Test
    @DisplayName("Postgres policy allows 63 characters")
    void postgresPolicyAllowsLongerNames() {
        IdentifierNormalizer postgres = new IdentifierNormalizer(IdentifierPolicy.postgres());
        String name = "b".repeat(63);

        assertEquals(name, postgres.normalize(name).value());
        assertThrows(IdentifierException.class, () -> postgres.normalize(name + "b"));
    }

    // =====================================================================
    // Rejected names
    // =====================================================================

    @Test
    @DisplayName("Empty and blank names are rejected")
    void rejectsEmpty() {
        IdentifierException e = assertThrows(IdentifierException.class, () -> normalizer.normalize("   "));
        assertEquals(IdentifierException.Reason.EMPTY, e.getReason());
        assertEquals(ErrorKind.IDENTIFIER, e.getKind());

        assertThrows(IdentifierException.class, () -> normalizer.normalize(null));
    }

    @Test
    @DisplayName("Leading digit is rejected at index 0")
    void rejectsLeadingDigit() {
        IdentifierException e = assertThrows(IdentifierException.class, () -> normalizer.normalize("1122"));
        assertEquals(IdentifierException.Reason.LEADING_DIGIT, e.getReason());
        assertEquals(0, e.getIndex());
        assertTrue(e.getMessage().startsWith("String starts with digit"));
    }

    @Test
    @DisplayName("Too long name points at the first character over the limit")
    void rejectsTooLong() {
        String name = "x".repeat(IdentifierPolicy.DEFAULT_MAX_LENGTH + 1);
        IdentifierException e = assertThrows(IdentifierException.class, () -> normalizer.normalize(name));

        assertEquals(IdentifierException.Reason.TOO_LONG, e.getReason());
        assertEquals(IdentifierPolicy.DEFAULT_MAX_LENGTH, e.getIndex());
        assertTrue(e.getMessage().contains("maximum is 40 characters"));
    }

    @Test
    @DisplayName("Invalid character is reported with a pointer line")
    void rejectsInvalidCharacter() {
        IdentifierException e = assertThrows(IdentifierException.class, () -> normalizer.normalize("kitka-luku"));

        assertEquals(IdentifierException.Reason.INVALID_CHARACTER, e.getReason());
        assertEquals(5, e.getIndex());
        assertEquals("kitka-luku", e.getText());
        assertEquals("~~~~~^", e.getPointer());
        assertEquals("String contains an invalid character:\nkitka-luku\n~~~~~^", e.getMessage());
    }

    @Test
    @DisplayName("Only ä and ö are transliterated")
    void rejectsOtherNonAscii() {
        IdentifierException e = assertThrows(IdentifierException.class, () -> normalizer.normalize("åsa"));
        assertEquals(IdentifierException.Reason.INVALID_CHARACTER, e.getReason());
        assertEquals(0, e.getIndex());
    }

    @ParameterizedTest
    @DisplayName("Reserved relation names are rejected case-insensitively")
    @CsvSource({"stations", "Statobs", "SENSORS", "seobs", "tiesaa_asema"})
    void rejectsReserved(String name) {
        IdentifierException e = assertThrows(IdentifierException.class, () -> normalizer.normalize(name));
        assertEquals(IdentifierException.Reason.RESERVED, e.getReason());
    }

    @Test
    @DisplayName("Extra reserved words from the store are honored")
    void rejectsStoreReservedWords() {
        IdentifierNormalizer custom = new IdentifierNormalizer(
                IdentifierPolicy.defaults().withReservedWords(Set.of("obs_main")));

        assertThrows(IdentifierException.class, () -> custom.normalize("obs_main"));
        assertThrows(IdentifierException.class, () -> custom.normalize("stations"));
        assertEquals("obs_other", custom.normalize("obs_other").value());
    }

    @Test
    @DisplayName("Composed identifiers are checked against reserved words")
    void checksComposedIdentifier() {
        assertThrows(IdentifierException.class, () -> normalizer.checkNotReserved("statobs"));
        assertDoesNotThrow(() -> normalizer.checkNotReserved("ylojarvi_c4"));
    }

    @Test
    @DisplayName("Policy rejects non-positive maximum length")
    void policyRejectsNonPositiveLength() {
        assertThrows(IllegalArgumentException.class, () -> new IdentifierPolicy(0, Set.of()));
    }
}
