package com.tsa.config;

import java.util.List;

/**
 * Root configuration of an analysis run.
 *
 * @param name        Analysis name
 * @param version     Configuration version
 * @param parser      Condition parsing settings
 * @param evaluation  Evaluation settings
 * @param collections Condition collections to analyze
 */
public record TsaConfig(
        String name,
        String version,
        ParserSettings parser,
        EvaluationSettings evaluation,
        List<CollectionConfig> collections
) {
    public TsaConfig {
        collections = collections == null ? List.of() : List.copyOf(collections);
    }

    /**
     * Get collection by title.
     */
    public CollectionConfig getCollection(String title) {
        return collections.stream()
                .filter(c -> c.title().equals(title))
                .findFirst()
                .orElse(null);
    }

    /**
     * Create a minimal configuration for testing.
     */
    public static TsaConfig minimal() {
        return new TsaConfig(
                "test-analysis",
                "1.0",
                ParserSettings.defaults(),
                EvaluationSettings.defaults(),
                List.of()
        );
    }
}
