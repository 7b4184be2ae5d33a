package org.suiteflow.orchestrator.model;

import lombok.Value;
import org.suiteflow.orchestrator.context.SuiteRunContext;

import java.util.Optional;

/**
 * What {@code TestOrchestrator.run} hands back: run context, reporter snapshot and summary.
 */
@Value
public class SuiteRunResult {

    SuiteRunContext runContext;
    OrchestratorSnapshot snapshot;
    SuiteSummary summary;

    public String getRunId() {
        return runContext.getRunId();
    }

    public Optional<ExecutionResult> result(String testName) {
        return snapshot.result(testName);
    }

    public NodeStatus statusOf(String testName) {
        return snapshot.node(testName)
                .map(NodeSnapshot::getStatus)
                .orElseThrow(() -> new IllegalArgumentException("Unknown test: '" + testName + "'"));
    }
}
