package org.suiteflow.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declaration of one orchestrated test: name, dependencies, priority, tags and body.
 * Immutable once built.
 */
@Value
@Builder(toBuilder = true)
public class TestDefinition {

    String name;

    @Singular
    List<TestDependency> dependencies;

    @Builder.Default
    TestPriority priority = TestPriority.MEDIUM;

    @Singular
    Set<String> tags;

    TestBody body;

    /** Runs the body even if dependencies failed or were skipped. */
    boolean runRegardless;

    /** Optional upper bound for the body; {@code null} means no limit. */
    Duration timeout;

    String description;

    /**
     * Names of all declared dependencies, in declaration order, without duplicates.
     */
    public List<String> getDependencyNames() {
        Set<String> names = new LinkedHashSet<>();
        for (TestDependency dependency : dependencies) {
            names.add(dependency.getTestName());
        }
        return new ArrayList<>(names);
    }

    public static class TestDefinitionBuilder {

        public TestDefinitionBuilder dependsOn(String... testNames) {
            for (String testName : testNames) {
                dependency(TestDependency.required(testName));
            }
            return this;
        }

        public TestDefinitionBuilder optionallyDependsOn(String... testNames) {
            for (String testName : testNames) {
                dependency(TestDependency.optional(testName));
            }
            return this;
        }
    }
}
