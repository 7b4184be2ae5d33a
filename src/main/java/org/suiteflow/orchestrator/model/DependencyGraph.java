package org.suiteflow.orchestrator.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency graph of one suite run. Node statuses are the only mutable part.
 */
public class DependencyGraph {

    private final Map<String, DependencyNode> nodes;
    private final List<String> executionOrder;
    private final List<List<String>> cycles;

    public DependencyGraph(Map<String, DependencyNode> nodes, List<String> executionOrder, List<List<String>> cycles) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.executionOrder = List.copyOf(executionOrder);
        List<List<String>> copies = new ArrayList<>();
        for (List<String> cycle : cycles) {
            copies.add(List.copyOf(cycle));
        }
        this.cycles = Collections.unmodifiableList(copies);
    }

    public Map<String, DependencyNode> getNodes() {
        return nodes;
    }

    public Collection<DependencyNode> nodeList() {
        return nodes.values();
    }

    public DependencyNode getNode(String testName) {
        DependencyNode node = nodes.get(testName);
        if (node == null) {
            throw new IllegalArgumentException("Unknown test: '" + testName + "'");
        }
        return node;
    }

    public boolean contains(String testName) {
        return nodes.containsKey(testName);
    }

    public List<String> getExecutionOrder() {
        return executionOrder;
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    public List<List<String>> getCycles() {
        return cycles;
    }

    public int size() {
        return nodes.size();
    }
}
