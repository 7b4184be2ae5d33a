package org.suiteflow.orchestrator.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Graph node derived from a {@link TestDefinition}. Everything but {@code status}
 * is fixed once the graph has been built; dependents are filled in by the builder.
 */
@Getter
public class DependencyNode {

    private final String testName;
    private final TestPriority priority;
    private final List<String> dependencies;
    private final List<String> requiredDependencies;
    private final List<String> dependents = new ArrayList<>();
    private final TestDefinition definition;
    private NodeStatus status = NodeStatus.PENDING;

    public DependencyNode(TestDefinition definition) {
        this.definition = definition;
        this.testName = definition.getName();
        this.priority = definition.getPriority() != null ? definition.getPriority() : TestPriority.MEDIUM;
        this.dependencies = List.copyOf(definition.getDependencyNames());

        List<String> required = new ArrayList<>();
        for (TestDependency dependency : definition.getDependencies()) {
            if (dependency.isRequired() && !required.contains(dependency.getTestName())) {
                required.add(dependency.getTestName());
            }
        }
        this.requiredDependencies = List.copyOf(required);
    }

    public List<String> getDependents() {
        return Collections.unmodifiableList(dependents);
    }

    public boolean isRunRegardless() {
        return definition.isRunRegardless();
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /**
     * Reverse edge, filled in by the graph builder once all nodes exist.
     */
    public void addDependent(String dependent) {
        if (!dependents.contains(dependent)) {
            dependents.add(dependent);
        }
    }

    /**
     * Moves the node forward in its lifecycle.
     *
     * @throws IllegalStateException if the transition would go backwards or repeat a final state
     */
    public void transitionTo(NodeStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal status transition for test '" + testName + "': " + status + " -> " + next);
        }
        this.status = next;
    }
}
