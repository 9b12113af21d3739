package com.tsa.core;

import com.tsa.condition.ConditionCompiler;
import com.tsa.config.CollectionConfig;
import com.tsa.config.ConditionRow;
import com.tsa.config.TsaConfig;
import com.tsa.exception.ConfigurationException;
import com.tsa.exception.ErrorKind;
import com.tsa.exception.TsaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An analysis run over several condition collections.
 */
public class Analysis {

    private static final Logger log = LoggerFactory.getLogger(Analysis.class);

    private final String name;
    private final Map<String, CondCollection> collections = new LinkedHashMap<>();
    private final ErrorCollection errors;

    public Analysis(String name) {
        this.name = name;
        this.errors = new ErrorCollection("ANALYSIS <" + name + ">");
    }

    /**
     * Build collections from configuration. Incomplete rows and rows that do
     * not compile are skipped and recorded in the collection's errors.
     */
    public static Analysis fromConfig(TsaConfig config, ConditionCompiler compiler) {
        Analysis analysis = new Analysis(config.name());
        for (CollectionConfig collectionConfig : config.collections()) {
            CondCollection collection = new CondCollection(collectionConfig.title(),
                    collectionConfig.timeFrom(), collectionConfig.timeUntil(), compiler);
            for (ConditionRow row : collectionConfig.conditions()) {
                String missing = row.missingField();
                if (missing != null) {
                    String message = "Field '" + missing + "' is empty: condition row ignored";
                    log.warn("{}: row {}: {}", collection.getErrors().getContext(), row.row(), message);
                    collection.getErrors().add(ErrorKind.CONFIGURATION, "row " + row.row(), row.row(), message);
                    continue;
                }
                collection.addCondition(row.site(), row.alias(), row.condition(), row.row());
            }
            analysis.addCollection(collection);
        }
        log.info("Analysis {}: {} collections", analysis.getName(), analysis.collections.size());
        return analysis;
    }

    /**
     * @throws ConfigurationException if a collection with the same title exists
     */
    public void addCollection(CondCollection collection) {
        if (collections.containsKey(collection.getTitle())) {
            throw new ConfigurationException("Collection '" + collection.getTitle() + "' already exists");
        }
        collections.put(collection.getTitle(), collection);
        log.info("Added {}", collection);
    }

    /**
     * Evaluate every collection. A collection that fails as a whole is
     * skipped and recorded in {@link #getErrors()}.
     */
    public List<CollectionResult> run(CondCollectionEvaluator evaluator) {
        List<CollectionResult> results = new ArrayList<>();
        for (CondCollection collection : collections.values()) {
            try {
                results.add(evaluator.evaluate(collection));
            } catch (RuntimeException e) {
                log.error("Skipping {} due to fatal error", collection, e);
                ErrorKind kind = e instanceof TsaException tsa ? tsa.getKind() : ErrorKind.INTERNAL;
                errors.add(kind, "Skipping " + collection + " due to fatal error: " + e.getMessage());
            }
        }
        return results;
    }

    public String getName() {
        return name;
    }

    public CondCollection getCollection(String title) {
        return collections.get(title);
    }

    public List<CondCollection> getCollections() {
        return List.copyOf(collections.values());
    }

    public ErrorCollection getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty() || collections.values().stream().anyMatch(c -> !c.getErrors().isEmpty());
    }

    /**
     * Error messages grouped by analysis and collection; contexts without errors are left out.
     */
    public Map<String, List<String>> errorTree() {
        Map<String, List<String>> tree = new LinkedHashMap<>();
        addBranch(tree, errors);
        for (CondCollection collection : collections.values()) {
            addBranch(tree, collection.getErrors());
        }
        return tree;
    }

    private static void addBranch(Map<String, List<String>> tree, ErrorCollection errorCollection) {
        if (errorCollection.isEmpty()) {
            return;
        }
        tree.put(errorCollection.getContext(),
                errorCollection.entries().stream().map(ErrorCollection.Entry::toString).toList());
    }
}
