package com.tsa.core;

import com.tsa.condition.Condition;
import com.tsa.condition.ConditionId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluation order of conditions that refer to each other through secondary blocks.
 * <p>
 * Conditions are grouped into waves: a condition is in the first wave after
 * all conditions it refers to. Conditions within one wave are independent.
 * Conditions on a reference cycle, and conditions depending on one, are in
 * no wave. References to conditions outside the graph are ignored here and
 * listed by {@link #missingReferences(ConditionId)}.
 */
public final class DependencyGraph {

    private final Map<ConditionId, Set<ConditionId>> dependencies = new LinkedHashMap<>();
    private final Map<ConditionId, Set<ConditionId>> missing = new LinkedHashMap<>();
    private final List<List<ConditionId>> waves = new ArrayList<>();
    private final Set<ConditionId> cycleMembers = new LinkedHashSet<>();
    private final Set<ConditionId> blocked = new LinkedHashSet<>();

    private DependencyGraph() {
    }

    public static DependencyGraph of(Collection<Condition> conditions) {
        DependencyGraph graph = new DependencyGraph();
        for (Condition condition : conditions) {
            graph.dependencies.put(condition.getId(), new LinkedHashSet<>());
            graph.missing.put(condition.getId(), new LinkedHashSet<>());
        }
        for (Condition condition : conditions) {
            for (ConditionId ref : condition.referencedConditions()) {
                if (graph.dependencies.containsKey(ref)) {
                    graph.dependencies.get(condition.getId()).add(ref);
                } else {
                    graph.missing.get(condition.getId()).add(ref);
                }
            }
        }
        graph.sort();
        return graph;
    }

    private void sort() {
        Map<ConditionId, Integer> pending = new LinkedHashMap<>();
        Map<ConditionId, List<ConditionId>> dependents = new LinkedHashMap<>();
        for (Map.Entry<ConditionId, Set<ConditionId>> entry : dependencies.entrySet()) {
            pending.put(entry.getKey(), entry.getValue().size());
            for (ConditionId dependency : entry.getValue()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(entry.getKey());
            }
        }

        List<ConditionId> wave = new ArrayList<>();
        pending.forEach((id, count) -> {
            if (count == 0) {
                wave.add(id);
            }
        });

        Set<ConditionId> placed = new HashSet<>();
        while (!wave.isEmpty()) {
            waves.add(List.copyOf(wave));
            placed.addAll(wave);
            List<ConditionId> next = new ArrayList<>();
            for (ConditionId id : wave) {
                for (ConditionId dependent : dependents.getOrDefault(id, List.of())) {
                    int count = pending.merge(dependent, -1, Integer::sum);
                    if (count == 0) {
                        next.add(dependent);
                    }
                }
            }
            wave.clear();
            wave.addAll(next);
        }

        for (ConditionId id : dependencies.keySet()) {
            if (placed.contains(id)) {
                continue;
            }
            if (reaches(id, id, placed)) {
                cycleMembers.add(id);
            } else {
                blocked.add(id);
            }
        }
    }

    /**
     * Whether {@code target} can be reached from {@code start} over unplaced conditions.
     */
    private boolean reaches(ConditionId start, ConditionId target, Set<ConditionId> placed) {
        Deque<ConditionId> stack = new ArrayDeque<>(dependencies.get(start));
        Set<ConditionId> seen = new HashSet<>();
        while (!stack.isEmpty()) {
            ConditionId id = stack.pop();
            if (id.equals(target)) {
                return true;
            }
            if (placed.contains(id) || !seen.add(id)) {
                continue;
            }
            stack.addAll(dependencies.get(id));
        }
        return false;
    }

    /**
     * Waves in evaluation order; every condition depends only on conditions of earlier waves.
     */
    public List<List<ConditionId>> getWaves() {
        return Collections.unmodifiableList(waves);
    }

    /**
     * Conditions that lie on a reference cycle.
     */
    public Set<ConditionId> getCycleMembers() {
        return Collections.unmodifiableSet(cycleMembers);
    }

    /**
     * Conditions that are not on a cycle but depend on one.
     */
    public Set<ConditionId> getBlocked() {
        return Collections.unmodifiableSet(blocked);
    }

    public Set<ConditionId> dependenciesOf(ConditionId id) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(id, Set.of()));
    }

    /**
     * References of a condition to conditions that are not in the graph.
     */
    public Set<ConditionId> missingReferences(ConditionId id) {
        return Collections.unmodifiableSet(missing.getOrDefault(id, Set.of()));
    }

    public boolean hasCycles() {
        return !cycleMembers.isEmpty();
    }
}
