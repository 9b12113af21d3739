package com.tsa.core;

import com.tsa.condition.Condition;
import com.tsa.condition.ConditionId;
import com.tsa.exception.DependencyCycleException;
import com.tsa.exception.StoreException;
import com.tsa.exception.TsaException;
import com.tsa.exception.UnresolvedReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Evaluates all conditions of a collection.
 * <p>
 * Conditions run in dependency waves: a condition starts only after every
 * condition it refers to has a result. Conditions of one wave run
 * concurrently on the executor. A failing condition is recorded in the
 * collection's errors, and conditions depending on it are skipped with an
 * unresolved reference error; other results stay valid.
 */
public class CondCollectionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(CondCollectionEvaluator.class);

    private final ConditionAnalyzer analyzer;
    private final ExecutorService executor;

    public CondCollectionEvaluator(ConditionAnalyzer analyzer, ExecutorService executor) {
        this.analyzer = analyzer;
        this.executor = executor;
    }

    public CollectionResult evaluate(CondCollection collection) {
        log.info("Started analysis for {}", collection);
        ErrorCollection errors = collection.getErrors();
        List<Condition> conditions = collection.getConditions();
        DependencyGraph graph = DependencyGraph.of(conditions);

        Map<ConditionId, ConditionResult> results = new ConcurrentHashMap<>();
        Set<ConditionId> failed = ConcurrentHashMap.newKeySet();

        if (graph.hasCycles()) {
            DependencyCycleException cycle = new DependencyCycleException(
                    graph.getCycleMembers().stream().map(ConditionId::key).toList());
            for (ConditionId id : graph.getCycleMembers()) {
                log.error("{}: {}", id, cycle.getMessage());
                record(errors, collection.getCondition(id), cycle);
                failed.add(id);
            }
        }

        int waveNumber = 0;
        for (List<ConditionId> wave : graph.getWaves()) {
            waveNumber++;
            log.debug("{}: wave {} with {} conditions", collection.getTitle(), waveNumber, wave.size());

            Map<ConditionId, Future<ConditionResult>> running = new LinkedHashMap<>();
            for (ConditionId id : wave) {
                Condition condition = collection.getCondition(id);
                UnresolvedReferenceException unresolved = checkReferences(graph, condition, failed);
                if (unresolved != null) {
                    log.warn("{}: {}", id, unresolved.getMessage());
                    record(errors, condition, unresolved);
                    failed.add(id);
                    continue;
                }
                running.put(id, executor.submit(
                        () -> analyzer.analyze(condition, collection.getWindow(), results::get)));
            }

            for (Map.Entry<ConditionId, Future<ConditionResult>> entry : running.entrySet()) {
                ConditionId id = entry.getKey();
                try {
                    results.put(id, entry.getValue().get());
                } catch (ExecutionException e) {
                    TsaException failure = asTsaException(e.getCause());
                    log.error("{}: evaluation failed: {}", id, failure.getMessage(), e.getCause());
                    record(errors, collection.getCondition(id), failure);
                    failed.add(id);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    running.values().forEach(f -> f.cancel(true));
                    throw new IllegalStateException("Interrupted while evaluating " + collection, e);
                }
            }
        }

        for (ConditionId id : graph.getBlocked()) {
            UnresolvedReferenceException unresolved = new UnresolvedReferenceException(
                    "Condition " + id + " depends on conditions that refer to each other in a cycle");
            log.warn("{}: {}", id, unresolved.getMessage());
            record(errors, collection.getCondition(id), unresolved);
        }

        Map<ConditionId, ConditionResult> ordered = new LinkedHashMap<>();
        for (Condition condition : conditions) {
            ConditionResult result = results.get(condition.getId());
            if (result != null) {
                ordered.put(condition.getId(), result);
            }
        }

        log.info("END OF ANALYSIS for collection {}: {}/{} conditions evaluated, {} errors",
                collection.getTitle(), ordered.size(), conditions.size(), errors.size());
        return new CollectionResult(collection, ordered);
    }

    private static UnresolvedReferenceException checkReferences(DependencyGraph graph, Condition condition,
                                                                Set<ConditionId> failed) {
        Set<ConditionId> missing = graph.missingReferences(condition.getId());
        if (!missing.isEmpty()) {
            return new UnresolvedReferenceException("Condition " + condition.getId()
                    + " refers to conditions not in the collection: " + keys(missing));
        }
        Set<ConditionId> failedDependencies = graph.dependenciesOf(condition.getId()).stream()
                .filter(failed::contains)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!failedDependencies.isEmpty()) {
            return new UnresolvedReferenceException("Condition " + condition.getId()
                    + " refers to conditions that could not be evaluated: " + keys(failedDependencies));
        }
        return null;
    }

    private static String keys(Set<ConditionId> ids) {
        return ids.stream().map(ConditionId::key).collect(Collectors.joining(", "));
    }

    private static TsaException asTsaException(Throwable cause) {
        if (cause instanceof TsaException tsa) {
            return tsa;
        }
        return new StoreException("Unexpected failure: " + cause, cause);
    }

    private static void record(ErrorCollection errors, Condition condition, TsaException e) {
        errors.add(e, condition.getId().key(), condition.getSourceRow());
    }
}
