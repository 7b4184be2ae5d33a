package org.suiteflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view handed to reporters (HTML, chat notifications, persistence).
 * The JSON shape of this class is the contract with those consumers; keep it stable.
 */
@Value
@Builder
@JsonPropertyOrder({"executionOrder", "hasCycles", "cycles", "nodes", "executionResults", "priorityStats"})
public class OrchestratorSnapshot {

    List<String> executionOrder;

    @JsonProperty("hasCycles")
    boolean hasCycles;

    List<List<String>> cycles;

    List<NodeSnapshot> nodes;

    List<ExecutionResult> executionResults;

    PriorityExecutionStats priorityStats;

    public Optional<ExecutionResult> result(String testName) {
        return executionResults.stream()
                .filter(result -> result.getTestName().equals(testName))
                .findFirst();
    }

    public Optional<NodeSnapshot> node(String testName) {
        return nodes.stream()
                .filter(node -> node.getTestName().equals(testName))
                .findFirst();
    }
}
