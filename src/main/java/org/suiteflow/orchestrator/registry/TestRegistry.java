package org.suiteflow.orchestrator.registry;

import lombok.extern.slf4j.Slf4j;
import org.suiteflow.orchestrator.model.TestDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the declared tests of one suite, in declaration order.
 * One instance per suite; it is handed to the graph builder explicitly.
 *
 * Duplicate names are not rejected here but remembered, so that the graph builder
 * can report them together with every other configuration problem.
 */
@Slf4j
public class TestRegistry {

    private final Map<String, TestDefinition> definitions = new LinkedHashMap<>();
    private final List<String> duplicateNames = new ArrayList<>();
    private final List<TestDefinition> rejected = new ArrayList<>();

    public TestRegistry register(TestDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition must not be null");
        }
        String name = definition.getName();
        if (name == null || name.isBlank()) {
            rejected.add(definition);
            return this;
        }
        if (definitions.containsKey(name)) {
            duplicateNames.add(name);
            return this;
        }
        definitions.put(name, definition);

        log.debug("Registered test: \"{}\" with priority: {}", name, definition.getPriority() != null ? definition.getPriority().getValue() : "medium");
        if (!definition.getDependencies().isEmpty()) {
            log.debug("  Dependencies: {}", String.join(", ", definition.getDependencyNames()));
        }
        return this;
    }

    public TestRegistry registerAll(Collection<TestDefinition> tests) {
        tests.forEach(this::register);
        return this;
    }

    public static TestRegistry of(TestDefinition... tests) {
        TestRegistry registry = new TestRegistry();
        for (TestDefinition test : tests) {
            registry.register(test);
        }
        return registry;
    }

    public Optional<TestDefinition> get(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    /**
     * Definitions in declaration order.
     */
    public List<TestDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    public List<String> duplicateNames() {
        return Collections.unmodifiableList(duplicateNames);
    }

    /**
     * Number of definitions rejected because their name was blank.
     */
    public int blankNameCount() {
        return rejected.size();
    }

    public int size() {
        return definitions.size();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }
}
