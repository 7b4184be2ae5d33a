package org.suiteflow.orchestrator.context;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Output locations of one suite run. Each run gets its own runId and directory tree
 * below the results base path.
 */
public final class SuiteRunContext {

    private final String runId;
    private final Path outputBase;

    private SuiteRunContext(String runId, Path outputBase) {
        this.runId = runId;
        this.outputBase = outputBase;
    }

    public static SuiteRunContext create(String runId) {
        return create(runId, resolveBasePath());
    }

    public static SuiteRunContext create(String runId, Path basePath) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        return new SuiteRunContext(runId, basePath.resolve(runId));
    }

    /**
     * Resolves the base path for test results.
     * On OpenShift: /app/test-results (set via TEST_RESULTS_PATH env var)
     * Locally: test-results (relative to project root, not inside target/)
     */
    static Path resolveBasePath() {
        String envPath = System.getenv("TEST_RESULTS_PATH");
        if (envPath != null && !envPath.isBlank()) {
            return Paths.get(envPath);
        }
        String sysProp = System.getProperty("test.results.path");
        if (sysProp != null && !sysProp.isBlank()) {
            return Paths.get(sysProp);
        }
        return Paths.get("test-results");
    }

    public String getRunId() {
        return runId;
    }

    public Path getOutputBase() {
        return outputBase;
    }

    public Path getScreenshotsDir() {
        return outputBase.resolve("screenshots");
    }

    public Path getResultsDir() {
        return outputBase.resolve("orchestrator-results");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SuiteRunContext)) return false;
        SuiteRunContext that = (SuiteRunContext) o;
        return runId.equals(that.runId) && outputBase.equals(that.outputBase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, outputBase);
    }

    @Override
    public String toString() {
        return "SuiteRunContext{runId='" + runId + "', outputBase=" + outputBase + "}";
    }
}
