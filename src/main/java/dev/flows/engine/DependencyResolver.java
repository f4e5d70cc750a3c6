package dev.flows.engine;

import dev.flows.model.StepDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the step dependency graph, rejects unknown dependencies and cycles, and groups steps
 * into waves that can run concurrently.
 *
 * <p>All iteration follows the order in which steps were declared, so the computed order and
 * waves are deterministic for a given definition.
 */
public final class DependencyResolver {

    private final Map<String, StepDefinition> steps = new LinkedHashMap<>();
    private final Map<String, List<String>> dependents = new LinkedHashMap<>();
    private final Map<String, Integer> indegree = new LinkedHashMap<>();

    /**
     * @throws FlowValidationException if a step id repeats or a dependency names no step
     */
    public DependencyResolver(List<StepDefinition> steps) {
        for (StepDefinition step : steps) {
            if (this.steps.putIfAbsent(step.id(), step) != null) {
                throw FlowValidationException.duplicateStep(step.id());
            }
            dependents.put(step.id(), new ArrayList<>());
            indegree.put(step.id(), 0);
        }
        for (StepDefinition step : steps) {
            for (String dependencyId : step.dependsOn()) {
                if (!this.steps.containsKey(dependencyId)) {
                    throw FlowValidationException.unknownDependency(step.id(), dependencyId);
                }
                dependents.get(dependencyId).add(step.id());
                indegree.merge(step.id(), 1, Integer::sum);
            }
        }
    }

    /**
     * Kahn's algorithm, seeded and drained in declaration order.
     *
     * @throws FlowValidationException with kind {@code CYCLE_DETECTED} if the graph has a cycle
     */
    public List<String> topologicalSort() {
        detectCycles();

        Map<String, Integer> remaining = new LinkedHashMap<>(indegree);
        Deque<String> queue = new ArrayDeque<>();
        remaining.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });

        List<String> order = new ArrayList<>(steps.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (String next : dependents.get(current)) {
                if (remaining.merge(next, -1, Integer::sum) == 0) {
                    queue.add(next);
                }
            }
        }

        if (order.size() != steps.size()) {
            throw FlowValidationException.cycleDetected(List.of());
        }
        return order;
    }

    /**
     * Group steps into waves. Wave 0 holds the steps without dependencies; every later wave
     * holds all remaining steps whose dependencies are satisfied by earlier waves. Within a
     * wave, steps keep their topological order.
     */
    public List<List<String>> groupIntoWaves() {
        List<String> order = topologicalSort();
        List<List<String>> waves = new ArrayList<>();
        Set<String> placed = new HashSet<>();

        while (placed.size() < steps.size()) {
            List<String> wave = new ArrayList<>();
            for (String stepId : order) {
                if (!placed.contains(stepId) && placed.containsAll(steps.get(stepId).dependsOn())) {
                    wave.add(stepId);
                }
            }
            if (wave.isEmpty()) {
                throw new IllegalStateException("Unable to determine execution waves");
            }
            placed.addAll(wave);
            waves.add(List.copyOf(wave));
        }
        return List.copyOf(waves);
    }

    /** Steps that list {@code stepId} in their {@code dependsOn}, in declaration order. */
    public List<String> dependentsOf(String stepId) {
        return List.copyOf(dependents.getOrDefault(stepId, List.of()));
    }

    private void detectCycles() {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        List<String> path = new ArrayList<>();
        for (String stepId : steps.keySet()) {
            if (!visited.contains(stepId)) {
                visit(stepId, visited, onStack, path);
            }
        }
    }

    private void visit(String node, Set<String> visited, Set<String> onStack, List<String> path) {
        visited.add(node);
        onStack.add(node);
        path.add(node);

        for (String next : dependents.get(node)) {
            if (!visited.contains(next)) {
                visit(next, visited, onStack, path);
            } else if (onStack.contains(next)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                throw FlowValidationException.cycleDetected(cycle);
            }
        }

        onStack.remove(node);
        path.remove(path.size() - 1);
    }
}
