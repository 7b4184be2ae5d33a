package org.suiteflow.orchestrator.service;

import org.suiteflow.orchestrator.model.DependencyGraph;
import org.suiteflow.orchestrator.model.ExecutionResult;
import org.suiteflow.orchestrator.model.NodeSnapshot;
import org.suiteflow.orchestrator.model.OrchestratorSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the reporter snapshot. Nothing here formats or sends data.
 */
public class ReporterAdapter {

    private final PriorityAggregator aggregator;

    public ReporterAdapter(PriorityAggregator aggregator) {
        this.aggregator = aggregator;
    }

    public OrchestratorSnapshot snapshot(ExecutionStateTracker tracker) {
        return snapshot(tracker.getGraph(), tracker.results());
    }

    /**
     * Snapshot of a graph that never ran, e.g. one rejected for cycles.
     */
    public OrchestratorSnapshot snapshot(DependencyGraph graph) {
        return snapshot(graph, List.of());
    }

    private OrchestratorSnapshot snapshot(DependencyGraph graph, List<ExecutionResult> results) {
        List<NodeSnapshot> nodes = new ArrayList<>(graph.size());
        graph.nodeList().forEach(node -> nodes.add(NodeSnapshot.of(node)));

        return OrchestratorSnapshot.builder()
                .executionOrder(graph.getExecutionOrder())
                .hasCycles(graph.hasCycles())
                .cycles(graph.getCycles())
                .nodes(List.copyOf(nodes))
                .executionResults(List.copyOf(results))
                .priorityStats(aggregator.aggregate(results, graph.nodeList()))
                .build();
    }
}
