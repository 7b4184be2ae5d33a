package org.suiteflow.orchestrator.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Closed set of outcomes a test slot can end in. The scheduler switches over {@link Kind}
 * instead of using exceptions to tell failures from skips.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TestOutcome {

    public enum Kind {
        PASSED,
        FAILED,
        SKIPPED
    }

    Kind kind;
    String error;
    String reason;
    String rootCause;

    public static TestOutcome passed() {
        return new TestOutcome(Kind.PASSED, null, null, null);
    }

    public static TestOutcome failed(String error) {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("A failed outcome needs an error message");
        }
        return new TestOutcome(Kind.FAILED, error, null, null);
    }

    public static TestOutcome skipped(String reason, String rootCause) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A skipped outcome needs a reason");
        }
        return new TestOutcome(Kind.SKIPPED, null, reason, rootCause);
    }

    public static TestOutcome dependencySkip(String failedTestName) {
        return skipped(ExecutionResult.dependencyFailedReason(failedTestName), failedTestName);
    }

    public NodeStatus toStatus() {
        return switch (kind) {
            case PASSED -> NodeStatus.PASSED;
            case FAILED -> NodeStatus.FAILED;
            case SKIPPED -> NodeStatus.SKIPPED;
        };
    }
}
