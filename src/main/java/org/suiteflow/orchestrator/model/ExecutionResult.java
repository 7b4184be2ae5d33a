package org.suiteflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Result of one orchestrated test.
 * {@code reason} is only set for SKIPPED, {@code error} only for FAILED.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"testName", "status", "duration", "priority", "dependencies", "reason", "error",
        "screenshotPath", "startTime", "endTime"})
public class ExecutionResult {

    public static final String DEPENDENCY_FAILED_PREFIX = "Dependency failed";

    String testName;
    NodeStatus status;
    long duration;
    TestPriority priority;
    List<String> dependencies;
    String reason;
    String error;
    String screenshotPath;
    Instant startTime;
    Instant endTime;

    public boolean isDependencySkip() {
        return status == NodeStatus.SKIPPED
                && reason != null
                && reason.startsWith(DEPENDENCY_FAILED_PREFIX);
    }

    public static String dependencyFailedReason(String failedTestName) {
        return DEPENDENCY_FAILED_PREFIX + ": " + failedTestName;
    }
}
