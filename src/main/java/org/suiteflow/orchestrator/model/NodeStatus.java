package org.suiteflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a single test inside one suite run.
 * Transitions only move forward: PENDING -> RUNNING -> {PASSED, FAILED},
 * or PENDING -> SKIPPED.
 */
public enum NodeStatus {

    PENDING,
    RUNNING,
    PASSED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == PASSED || this == FAILED || this == SKIPPED;
    }

    public boolean canTransitionTo(NodeStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == SKIPPED;
            case RUNNING -> next == PASSED || next == FAILED;
            default -> false;
        };
    }
}
