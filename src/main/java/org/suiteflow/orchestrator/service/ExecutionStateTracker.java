package org.suiteflow.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import org.suiteflow.orchestrator.model.DependencyGraph;
import org.suiteflow.orchestrator.model.DependencyNode;
import org.suiteflow.orchestrator.model.ExecutionResult;
import org.suiteflow.orchestrator.model.NodeStatus;
import org.suiteflow.orchestrator.model.TestOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status and results of every test of one run. Statuses live on the graph nodes and only move forward;
 * results are kept in the order the tests concluded.
 */
@Slf4j
public class ExecutionStateTracker {

    private final DependencyGraph graph;
    private final Map<String, ExecutionResult> results = new LinkedHashMap<>();
    private final Map<String, String> rootCauses = new HashMap<>();
    private final Map<String, Instant> startTimes = new HashMap<>();

    public ExecutionStateTracker(DependencyGraph graph) {
        this.graph = graph;
    }

    public NodeStatus statusOf(String testName) {
        return graph.getNode(testName).getStatus();
    }

    public void markRunning(String testName) {
        graph.getNode(testName).transitionTo(NodeStatus.RUNNING);
        startTimes.put(testName, Instant.now());
    }

    /**
     * Records the final outcome of a test.
     *
     * @param durationMs elapsed body time, ignored for skips
     * @throws IllegalStateException if the test is not in a state the outcome can follow
     */
    public ExecutionResult conclude(String testName, TestOutcome outcome, long durationMs, String screenshotPath) {
        DependencyNode node = graph.getNode(testName);
        NodeStatus status = outcome.toStatus();
        node.transitionTo(status);

        Instant end = Instant.now();
        Instant start = startTimes.getOrDefault(testName, end);
        boolean skipped = outcome.getKind() == TestOutcome.Kind.SKIPPED;

        ExecutionResult result = ExecutionResult.builder()
                .testName(testName)
                .status(status)
                .duration(skipped ? 0 : Math.max(0, durationMs))
                .priority(node.getPriority())
                .dependencies(List.copyOf(node.getDependencies()))
                .reason(outcome.getReason())
                .error(outcome.getError())
                .screenshotPath(screenshotPath)
                .startTime(start)
                .endTime(end)
                .build();
        results.put(testName, result);

        if (skipped) {
            rootCauses.put(testName, outcome.getRootCause() != null ? outcome.getRootCause() : testName);
        } else if (status == NodeStatus.FAILED) {
            rootCauses.put(testName, testName);
        }

        log.debug("Test result recorded: \"{}\" - {}", testName, status.getValue());
        return result;
    }

    /**
     * The failed test a non-passing test traces back to: itself when it failed,
     * the recorded root cause when it was skipped.
     */
    public String rootCauseOf(String testName) {
        return rootCauses.getOrDefault(testName, testName);
    }

    public Optional<ExecutionResult> result(String testName) {
        return Optional.ofNullable(results.get(testName));
    }

    public List<ExecutionResult> results() {
        return List.copyOf(results.values());
    }

    public List<String> pendingTests() {
        List<String> pending = new ArrayList<>();
        for (String testName : graph.getExecutionOrder()) {
            if (statusOf(testName) == NodeStatus.PENDING) {
                pending.add(testName);
            }
        }
        return pending;
    }

    public int count(NodeStatus status) {
        int count = 0;
        for (DependencyNode node : graph.nodeList()) {
            if (node.getStatus() == status) {
                count++;
            }
        }
        return count;
    }

    public DependencyGraph getGraph() {
        return graph;
    }
}
