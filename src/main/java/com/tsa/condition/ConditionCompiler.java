package com.tsa.condition;

import com.tsa.config.ConditionExpressionParser;
import com.tsa.config.ParsedExpression;
import com.tsa.config.expression.Token;
import com.tsa.config.expression.TokenType;
import com.tsa.expression.AliasExpressionParser;
import com.tsa.expression.Expression;
import com.tsa.identifier.Identifier;
import com.tsa.identifier.IdentifierNormalizer;
import com.tsa.identifier.IdentifierPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles {@code (site, alias, condition)} rows into {@link Condition}s.
 * <p>
 * Leaves with identical normalized text become one block. Blocks are
 * numbered from 0 in order of first appearance: {@code c4_0}, {@code c4_1}...
 */
public class ConditionCompiler {

    private static final Logger log = LoggerFactory.getLogger(ConditionCompiler.class);

    private final IdentifierNormalizer normalizer;
    private final BlockBuilder blockBuilder;

    public ConditionCompiler() {
        this(IdentifierPolicy.defaults(), true);
    }

    public ConditionCompiler(IdentifierPolicy policy, boolean numericValuesOnly) {
        this.normalizer = new IdentifierNormalizer(policy);
        this.blockBuilder = new BlockBuilder(normalizer, numericValuesOnly);
    }

    public Condition compile(String site, String masterAlias, String rawCondition) {
        return compile(site, masterAlias, rawCondition, -1);
    }

    /**
     * Compile one condition.
     *
     * @param site         site name
     * @param masterAlias  condition alias within the site
     * @param rawCondition condition string
     * @param sourceRow    input row for diagnostics, -1 if none
     * @return compiled condition
     * @throws com.tsa.exception.TsaException with kind SYNTAX, IDENTIFIER or BLOCK
     *                                        if the row cannot be compiled
     */
    public Condition compile(String site, String masterAlias, String rawCondition, int sourceRow) {
        Identifier siteId = normalizer.normalize(site);
        Identifier aliasId = normalizer.normalize(masterAlias);
        ConditionId id = new ConditionId(siteId, aliasId);
        normalizer.checkNotReserved(id.key());

        ParsedExpression parsed = ConditionExpressionParser.parse(rawCondition);

        Map<String, Block> blocksByText = new LinkedHashMap<>();
        List<Token> aliasTokens = new ArrayList<>(parsed.tokens().size());
        for (Token token : parsed.tokens()) {
            if (!token.isLeaf()) {
                aliasTokens.add(token);
                continue;
            }
            Block block = blocksByText.get(token.text());
            if (block == null) {
                String alias = aliasId.value() + "_" + blocksByText.size();
                block = blockBuilder.build(token, siteId, alias);
                blocksByText.put(token.text(), block);
                log.debug("Condition {}: block {} = '{}'", id, alias, token.text());
            }
            aliasTokens.add(new Token(TokenType.LEAF, block.alias(), token.position()));
        }

        String aliasExpression = AliasExpressionBuilder.build(aliasTokens);
        Expression expression = new AliasExpressionParser(aliasTokens).parse();

        Condition condition = new Condition(id, rawCondition, parsed.text(),
                new ArrayList<>(blocksByText.values()), aliasExpression, expression, sourceRow);
        log.debug("Compiled {}", condition);
        return condition;
    }
}
