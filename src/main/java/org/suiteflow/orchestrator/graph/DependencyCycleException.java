package org.suiteflow.orchestrator.graph;

import org.suiteflow.orchestrator.model.DependencyGraph;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the dependency graph contains at least one cycle. Every detected cycle is listed.
 */
public class DependencyCycleException extends RuntimeException {

    private final transient DependencyGraph graph;

    public DependencyCycleException(DependencyGraph graph) {
        super("Circular dependencies detected: " + describe(graph.getCycles()));
        this.graph = graph;
    }

    public List<List<String>> getCycles() {
        return graph.getCycles();
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    static String describe(List<List<String>> cycles) {
        return cycles.stream()
                .map(cycle -> String.join(" -> ", cycle) + " -> " + cycle.get(0))
                .collect(Collectors.joining(", "));
    }
}
