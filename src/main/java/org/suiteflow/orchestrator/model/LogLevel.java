package org.suiteflow.orchestrator.model;

import java.util.Locale;

/**
 * Verbosity of orchestrator messages. A message is written at INFO when its level
 * is at or below the configured one, at DEBUG otherwise.
 */
public enum LogLevel {

    MINIMAL,
    DETAILED,
    VERBOSE;

    public boolean includes(LogLevel messageLevel) {
        return messageLevel.ordinal() <= ordinal();
    }

    public static LogLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DETAILED;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
