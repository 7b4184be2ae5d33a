package org.suiteflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

@Value
@JsonPropertyOrder({"testName", "priority", "dependencies", "dependents", "status"})
public class NodeSnapshot {

    String testName;
    TestPriority priority;
    List<String> dependencies;
    List<String> dependents;
    NodeStatus status;

    public static NodeSnapshot of(DependencyNode node) {
        return new NodeSnapshot(
                node.getTestName(),
                node.getPriority(),
                List.copyOf(node.getDependencies()),
                List.copyOf(node.getDependents()),
                node.getStatus());
    }
}
