package com.tsa.condition;

import com.tsa.config.expression.ExpressionTokenizer;
import com.tsa.config.expression.Token;
import com.tsa.config.expression.TokenType;
import com.tsa.exception.BlockException;
import com.tsa.exception.ConditionSyntaxException;
import com.tsa.exception.IdentifierException;
import com.tsa.expression.ExpressionType;
import com.tsa.expression.TruthValue;
import com.tsa.expression.impl.OrExpression;
import com.tsa.identifier.IdentifierPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConditionCompiler.
 */
class ConditionCompilerTest {

    private static final String SITE = "Ylöjärvi etelään 1";
    private static final String CONDITION =
            "s1122#kitka3_luku >= 0.30 AND (s1115#nakyvyys_metria >= 600 OR NOT d1)";

    private ConditionCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new ConditionCompiler();
    }

    // =====================================================================
    // Compilation
    // =====================================================================

    @Test
    @DisplayName("Condition is compiled into blocks and an alias expression")
    void compilesCondition() {
        Condition condition = compiler.compile(SITE, "C4", CONDITION, 7);

        assertEquals("ylojarvi_etelaan_1_c4", condition.getId().key());
        assertEquals("ylojarvi_etelaan_1", condition.getSite());
        assertEquals("c4", condition.getMasterAlias());
        assertEquals(CONDITION, condition.getRawCondition());
        assertEquals("s1122#kitka3_luku >= 0.30 and (s1115#nakyvyys_metria >= 600 or not d1)",
                condition.getCondition());
        assertEquals("c4_0 and (c4_1 or not c4_2)", condition.getAliasExpression());
        assertEquals(7, condition.getSourceRow());

        assertEquals(3, condition.getBlocks().size());
        assertEquals(2, condition.primaryBlocks().size());
        assertEquals(1, condition.secondaryBlocks().size());
        assertTrue(condition.isSecondary());
        assertEquals(List.of(1115, 1122), List.copyOf(condition.stationNumbers()));
        assertEquals(Set.of(ConditionId.of("ylojarvi_etelaan_1", "d1")), condition.referencedConditions());
    }

    @Test
    @DisplayName("Blocks are numbered in order of first appearance")
    void numbersBlocksInOrder() {
        Condition condition = compiler.compile(SITE, "c4", CONDITION);

        assertEquals("s1122#kitka3_luku >= 0.30", condition.block("c4_0").rawText());
        assertEquals("s1115#nakyvyys_metria >= 600", condition.block("c4_1").rawText());
        assertEquals("d1", condition.block(2).rawText());
        assertThrows(NoSuchElementException.class, () -> condition.block("c4_3"));
    }

    @Test
    @DisplayName("Identical leaves become one block")
    void deduplicatesIdenticalLeaves() {
        Condition condition = compiler.compile("site", "c", "a1#x > 1 and A1#X>1");

        assertEquals(1, condition.getBlocks().size());
        assertEquals("c_0 and c_0", condition.getAliasExpression());
    }

    @Test
    @DisplayName("Condition without references is primary")
    void primaryCondition() {
        Condition condition = compiler.compile("site", "d1", "s1115#kitka3_luku < 0.30");

        assertFalse(condition.isSecondary());
        assertTrue(condition.referencedConditions().isEmpty());
        assertTrue(condition.toString().startsWith("Primary Condition site_d1:"));
    }

    @Test
    @DisplayName("Substituting blocks back into the alias expression gives the normalized condition")
    void aliasExpressionRoundTrip() {
        Condition condition = compiler.compile(SITE, "c4", CONDITION);

        List<Token> substituted = new ArrayList<>();
        for (Token token : new ExpressionTokenizer(condition.getAliasExpression()).tokenize()) {
            substituted.add(token.isLeaf()
                    ? new Token(TokenType.LEAF, condition.block(token.text()).rawText(), token.position())
                    : token);
        }

        assertEquals(condition.getCondition(), AliasExpressionBuilder.build(substituted));
    }

    @Test
    @DisplayName("Compiled expression evaluates over block values")
    void evaluatesCompiledExpression() {
        Condition condition = compiler.compile(SITE, "c4", CONDITION);

        assertEquals(TruthValue.TRUE, condition.getExpression().evaluate(
                Map.of("c4_0", TruthValue.TRUE, "c4_1", TruthValue.FALSE, "c4_2", TruthValue.FALSE)));
        assertEquals(TruthValue.FALSE, condition.getExpression().evaluate(
                Map.of("c4_0", TruthValue.FALSE, "c4_1", TruthValue.UNKNOWN, "c4_2", TruthValue.UNKNOWN)));
        assertEquals(TruthValue.UNKNOWN, condition.getExpression().evaluate(
                Map.of("c4_0", TruthValue.TRUE, "c4_1", TruthValue.FALSE, "c4_2", TruthValue.UNKNOWN)));
    }

    @Test
    @DisplayName("AND binds tighter than OR")
    void andBindsTighterThanOr() {
        Condition condition = compiler.compile("site", "c", "a or b and c");

        OrExpression or = assertInstanceOf(OrExpression.class, condition.getExpression());
        assertEquals(ExpressionType.ALIAS, or.getOperands().get(0).getType());
        assertEquals(ExpressionType.AND, or.getOperands().get(1).getType());
    }

    // =====================================================================
    // Rejected rows
    // =====================================================================

    @Test
    @DisplayName("Syntax errors are reported")
    void rejectsSyntaxError() {
        assertThrows(ConditionSyntaxException.class, () -> compiler.compile("site", "c", "a#x > 1 and"));
        assertThrows(ConditionSyntaxException.class, () -> compiler.compile("site", "c", "(a#x > 1"));
    }

    @Test
    @DisplayName("Leading and, unbalanced parentheses and bare in tuple are rejected")
    void rejectsMalformedConditions() {
        assertThrows(ConditionSyntaxException.class, () -> compiler.compile("site", "c", "and a#x>1"));
        assertThrows(ConditionSyntaxException.class, () -> compiler.compile("site", "c", "(a#x>1"));
        assertThrows(BlockException.class, () -> compiler.compile("site", "c", "s1#x in 1,2,3"));
    }

    @Test
    @DisplayName("Repeated leaf written without spaces is one block")
    void deduplicatesCompactLeaves() {
        Condition condition = compiler.compile("site", "c", "a#x>1 and a#x>1");

        assertEquals(1, condition.getBlocks().size());
        assertEquals("a#x > 1", condition.block(0).rawText());
    }

    @Test
    @DisplayName("Malformed leaves are reported")
    void rejectsBlockError() {
        assertThrows(BlockException.class, () -> compiler.compile("site", "c", "kitka > 1"));
    }

    @Test
    @DisplayName("Invalid and reserved names are reported")
    void rejectsIdentifiers() {
        assertThrows(IdentifierException.class, () -> compiler.compile("stations", "c", "a"));
        assertThrows(IdentifierException.class, () -> compiler.compile("site", "1c", "a"));
        assertThrows(IdentifierException.class, () -> compiler.compile("tiesaa", "asema", "a"));
    }

    @Test
    @DisplayName("Relaxed compiler accepts text values")
    void relaxedCompilerAcceptsTextValues() {
        ConditionCompiler relaxed = new ConditionCompiler(IdentifierPolicy.defaults(), false);
        Condition condition = relaxed.compile("site", "c", "s1#tila = kuiva or s1#tila in ('m', 'l')");

        assertEquals(2, condition.primaryBlocks().size());
        assertEquals(Operator.IN, condition.primaryBlocks().get(1).operator());
    }

    @Test
    @DisplayName("Tuple members may contain operator characters")
    void acceptsOperatorCharactersInTuple() {
        ConditionCompiler relaxed = new ConditionCompiler(IdentifierPolicy.defaults(), false);
        Condition condition = relaxed.compile("site", "c", "s1#tila in ('a=b', 'c')");

        PrimaryBlock block = condition.primaryBlocks().get(0);
        assertEquals(Operator.IN, block.operator());
        assertEquals("('a=b', 'c')", block.value());
        assertEquals("s1#tila in ('a=b', 'c')", condition.getCondition());
    }
}
