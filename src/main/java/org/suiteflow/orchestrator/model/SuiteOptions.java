package org.suiteflow.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Suite-level switches.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SuiteOptions {

    @Builder.Default
    private String suiteName = "Orchestrated Test Suite";

    /** One browser page for the whole suite instead of one per test. */
    @Builder.Default
    private boolean useSharedPage = true;

    @Builder.Default
    private boolean continueOnFailure = false;

    @Builder.Default
    private boolean sequential = true;

    @Builder.Default
    private LogLevel logLevel = LogLevel.DETAILED;
}
