package org.suiteflow.orchestrator.graph;

import java.util.List;

/**
 * Suite declaration is unusable (duplicate or blank names, unknown dependencies, missing bodies).
 * All problems found in one pass are carried together.
 */
public class OrchestratorConfigurationException extends RuntimeException {

    private final List<String> problems;

    public OrchestratorConfigurationException(List<String> problems) {
        super("Invalid test suite configuration (" + problems.size() + " problem(s)): "
                + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
