package org.suiteflow.orchestrator.graph;

import lombok.extern.slf4j.Slf4j;
import org.suiteflow.orchestrator.model.DependencyGraph;
import org.suiteflow.orchestrator.model.DependencyNode;
import org.suiteflow.orchestrator.model.TestDefinition;
import org.suiteflow.orchestrator.registry.TestRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Turns a {@link TestRegistry} into a {@link DependencyGraph}.
 *
 * <ol>
 *     <li>one node per definition, every dependency name must resolve</li>
 *     <li>dependents are filled in by inverting the dependency edges</li>
 *     <li>cycles are found with a three-colour depth-first search, all of them in one pass</li>
 *     <li>the execution order is a Kahn topological sort; among nodes that are ready at the
 *     same time the higher priority goes first, then declaration order</li>
 * </ol>
 *
 * The builder keeps no state, building twice from the same registry gives the same graph.
 */
@Slf4j
public class DependencyGraphBuilder {

    private enum Color {
        WHITE,
        GRAY,
        BLACK
    }

    /**
     * Builds the graph. A graph with cycles is returned with {@code hasCycles() == true}
     * and an empty execution order; use {@link #buildAcyclic(TestRegistry)} to fail on it.
     *
     * @throws OrchestratorConfigurationException if names are duplicated or blank,
     *                                            a body is missing or a dependency is unknown
     */
    public DependencyGraph build(TestRegistry registry) {
        validate(registry);

        Map<String, DependencyNode> nodes = new LinkedHashMap<>();
        for (TestDefinition definition : registry.definitions()) {
            nodes.put(definition.getName(), new DependencyNode(definition));
        }

        for (DependencyNode node : nodes.values()) {
            for (String dependency : node.getDependencies()) {
                nodes.get(dependency).addDependent(node.getTestName());
            }
        }

        List<List<String>> cycles = detectCycles(nodes);
        if (!cycles.isEmpty()) {
            DependencyGraph graph = new DependencyGraph(nodes, List.of(), cycles);
            log.error("Circular dependencies detected: {}", DependencyCycleException.describe(cycles));
            return graph;
        }

        List<String> executionOrder = generateExecutionOrder(nodes);
        log.info("Dependency graph built with {} tests", nodes.size());
        log.info("Execution order: {}", String.join(" -> ", executionOrder));
        return new DependencyGraph(nodes, executionOrder, List.of());
    }

    /**
     * Like {@link #build(TestRegistry)}, but a cyclic graph is a failure.
     *
     * @throws DependencyCycleException carrying every detected cycle
     */
    public DependencyGraph buildAcyclic(TestRegistry registry) {
        DependencyGraph graph = build(registry);
        if (graph.hasCycles()) {
            throw new DependencyCycleException(graph);
        }
        return graph;
    }

    private void validate(TestRegistry registry) {
        List<String> problems = new ArrayList<>();

        if (registry.blankNameCount() > 0) {
            problems.add(registry.blankNameCount() + " test(s) declared without a name");
        }
        for (String duplicate : new LinkedHashSet<>(registry.duplicateNames())) {
            problems.add("Duplicate test name: \"" + duplicate + "\"");
        }
        for (TestDefinition definition : registry.definitions()) {
            if (definition.getBody() == null) {
                problems.add("Test \"" + definition.getName() + "\" has no test body");
            }
            for (String dependency : definition.getDependencyNames()) {
                if (!registry.contains(dependency)) {
                    problems.add("Test \"" + definition.getName() + "\" depends on \""
                            + dependency + "\" which is not registered");
                }
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration error: {}", problem));
            throw new OrchestratorConfigurationException(problems);
        }
    }

    private List<List<String>> detectCycles(Map<String, DependencyNode> nodes) {
        Map<String, Color> colors = new HashMap<>();
        nodes.keySet().forEach(name -> colors.put(name, Color.WHITE));

        Map<String, Integer> declarationIndex = declarationIndex(nodes);
        Set<List<String>> cycles = new LinkedHashSet<>();

        for (String testName : nodes.keySet()) {
            if (colors.get(testName) == Color.WHITE) {
                visit(testName, nodes, colors, new ArrayList<>(), cycles, declarationIndex);
            }
        }
        return new ArrayList<>(cycles);
    }

    private void visit(String testName,
                       Map<String, DependencyNode> nodes,
                       Map<String, Color> colors,
                       List<String> path,
                       Set<List<String>> cycles,
                       Map<String, Integer> declarationIndex) {
        colors.put(testName, Color.GRAY);
        path.add(testName);

        for (String dependency : nodes.get(testName).getDependencies()) {
            Color color = colors.get(dependency);
            if (color == Color.GRAY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycles.add(canonical(cycle, declarationIndex));
            } else if (color == Color.WHITE) {
                visit(dependency, nodes, colors, path, cycles, declarationIndex);
            }
        }

        path.remove(path.size() - 1);
        colors.put(testName, Color.BLACK);
    }

    /**
     * Rotates a cycle so that it starts with its earliest declared test, keeping the direction.
     */
    private static List<String> canonical(List<String> cycle, Map<String, Integer> declarationIndex) {
        int start = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (declarationIndex.get(cycle.get(i)) < declarationIndex.get(cycle.get(start))) {
                start = i;
            }
        }
        List<String> rotated = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((start + i) % cycle.size()));
        }
        return List.copyOf(rotated);
    }

    private List<String> generateExecutionOrder(Map<String, DependencyNode> nodes) {
        Map<String, Integer> declarationIndex = declarationIndex(nodes);
        Map<String, Integer> unresolved = new HashMap<>();
        for (DependencyNode node : nodes.values()) {
            unresolved.put(node.getTestName(), node.getDependencies().size());
        }

        Comparator<DependencyNode> readyOrder = Comparator
                .comparing(DependencyNode::getPriority)
                .thenComparing(node -> declarationIndex.get(node.getTestName()));
        PriorityQueue<DependencyNode> ready = new PriorityQueue<>(readyOrder);
        for (DependencyNode node : nodes.values()) {
            if (!node.hasDependencies()) {
                ready.add(node);
            }
        }

        List<String> executionOrder = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            DependencyNode next = ready.poll();
            executionOrder.add(next.getTestName());
            for (String dependent : next.getDependents()) {
                int remaining = unresolved.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(nodes.get(dependent));
                }
            }
        }

        if (executionOrder.size() != nodes.size()) {
            throw new IllegalStateException("Topological sort left " + (nodes.size() - executionOrder.size())
                    + " test(s) unscheduled in an acyclic graph");
        }
        return executionOrder;
    }

    private static Map<String, Integer> declarationIndex(Map<String, DependencyNode> nodes) {
        Map<String, Integer> index = new HashMap<>();
        int i = 0;
        for (String name : nodes.keySet()) {
            index.put(name, i++);
        }
        return index;
    }
}
