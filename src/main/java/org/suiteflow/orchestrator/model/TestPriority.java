package org.suiteflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Priority buckets of orchestrated tests. Constant order is the execution tie-break:
 * HIGHEST first, LOW last.
 */
public enum TestPriority {

    HIGHEST,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TestPriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unsupported priority: '" + value + "'. Use one of: highest, high, medium, low", e);
        }
    }
}
