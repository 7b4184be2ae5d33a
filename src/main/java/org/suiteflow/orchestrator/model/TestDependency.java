package org.suiteflow.orchestrator.model;

import lombok.Value;

/**
 * Reference from one test to another it has to run after.
 * A non-required dependency only constrains the order; its outcome never skips the dependent.
 */
@Value
public class TestDependency {

    String testName;
    boolean required;

    public static TestDependency required(String testName) {
        return new TestDependency(testName, true);
    }

    public static TestDependency optional(String testName) {
        return new TestDependency(testName, false);
    }
}
