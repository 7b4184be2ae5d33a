package org.suiteflow.orchestrator.service;

import org.suiteflow.orchestrator.model.DependencyGraph;
import org.suiteflow.orchestrator.model.DependencyNode;
import org.suiteflow.orchestrator.model.ExecutionResult;
import org.suiteflow.orchestrator.model.NodeStatus;
import org.suiteflow.orchestrator.model.PriorityExecutionStats;
import org.suiteflow.orchestrator.model.SuiteSummary;

import java.util.Collection;

/**
 * Derives statistics from execution results. Works on partial runs as well;
 * tests that have not concluded are not counted.
 */
public class PriorityAggregator {

    public PriorityExecutionStats aggregate(Collection<ExecutionResult> results, Collection<DependencyNode> nodes) {
        int chains = 0;
        for (DependencyNode node : nodes) {
            if (node.hasDependencies()) {
                chains++;
            }
        }
        return PriorityExecutionStats.of(results, chains);
    }

    public SuiteSummary summarize(String suiteName, DependencyGraph graph,
                                  Collection<ExecutionResult> results, boolean aborted) {
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        for (ExecutionResult result : results) {
            switch (result.getStatus()) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                default -> throw new IllegalStateException("Result with non-final status: " + result);
            }
        }
        int pending = (int) graph.nodeList().stream()
                .filter(node -> node.getStatus() == NodeStatus.PENDING)
                .count();

        return SuiteSummary.builder()
                .suiteName(suiteName)
                .total(graph.size())
                .passed(passed)
                .failed(failed)
                .skipped(skipped)
                .pending(pending)
                .aborted(aborted)
                .build();
    }
}
