package com.tsa.config.expression;

import com.tsa.exception.ConditionSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GrammarValidator.
 */
class GrammarValidatorTest {

    private static List<Token> tokens(String condition) {
        return new ExpressionTokenizer(condition).tokenize();
    }

    @ParameterizedTest
    @DisplayName("Well-formed conditions pass")
    @ValueSource(strings = {
            "a",
            "not a",
            "(a)",
            "a and b or c",
            "not (a or b) and c",
            "((a and b) or (not c))",
            "s1#x >= 1 and not s2#y in (1, 2)"
    })
    void acceptsWellFormed(String condition) {
        assertDoesNotThrow(() -> GrammarValidator.validate(tokens(condition)));
    }

    @Test
    @DisplayName("Empty token list is rejected")
    void rejectsEmpty() {
        ConditionSyntaxException e = assertThrows(ConditionSyntaxException.class,
                () -> GrammarValidator.validate(List.of()));
        assertEquals("Condition is empty", e.getMessage());
    }

    @Test
    @DisplayName("Condition cannot start with and/or")
    void rejectsLeadingOperator() {
        ConditionSyntaxException e = assertThrows(ConditionSyntaxException.class,
                () -> GrammarValidator.validate(tokens("and a")));
        assertEquals("\"and\" cannot be first element in condition", e.getMessage());
    }

    @Test
    @DisplayName("Condition cannot end with not")
    void rejectsTrailingNot() {
        ConditionSyntaxException e = assertThrows(ConditionSyntaxException.class,
                () -> GrammarValidator.validate(tokens("a and not")));
        assertEquals("\"not\" cannot be last element in condition", e.getMessage());
    }

    @Test
    @DisplayName("Condition cannot end with and/or")
    void rejectsTrailingOperator() {
        ConditionSyntaxException e = assertThrows(ConditionSyntaxException.class,
                () -> GrammarValidator.validate(tokens("a or")));
        assertEquals("\"or\" cannot be last element in condition", e.getMessage());
    }

    @Test
    @DisplayName("Bad adjacency is reported with the position of the right token")
    void rejectsBadAdjacency() {
        ConditionSyntaxException e = assertThrows(ConditionSyntaxException.class,
                () -> GrammarValidator.validate(tokens("a and or b")));

        assertEquals("Cannot have \"and\" before \"or\"", e.getMessage());
        assertEquals(6, e.getPosition());
    }

    @ParameterizedTest
    @DisplayName("Disallowed neighbors are rejected")
    @ValueSource(strings = {
            "a (b)",
            "(a) b",
            "() a",
            "not not a",
            "a not b",
            "(and a)",
            "(a or) b"
    })
    void rejectsDisallowedNeighbors(String condition) {
        assertThrows(ConditionSyntaxException.class, () -> GrammarValidator.validate(tokens(condition)));
    }
}
