package org.suiteflow.orchestrator.service;

import org.slf4j.Logger;
import org.suiteflow.orchestrator.model.LogLevel;

/**
 * Writes orchestrator messages at INFO when the suite's log level covers them, at DEBUG otherwise.
 */
class SuiteLogger {

    private final Logger delegate;
    private final LogLevel configured;

    SuiteLogger(Logger delegate, LogLevel configured) {
        this.delegate = delegate;
        this.configured = configured != null ? configured : LogLevel.DETAILED;
    }

    void log(LogLevel level, String format, Object... args) {
        if (configured.includes(level)) {
            delegate.info(format, args);
        } else {
            delegate.debug(format, args);
        }
    }

    void minimal(String format, Object... args) {
        log(LogLevel.MINIMAL, format, args);
    }

    void detailed(String format, Object... args) {
        log(LogLevel.DETAILED, format, args);
    }

    void verbose(String format, Object... args) {
        log(LogLevel.VERBOSE, format, args);
    }
}
