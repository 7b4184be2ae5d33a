package org.suiteflow.orchestrator.context;

/**
 * A browser session could not be opened.
 */
public class SessionAcquisitionException extends RuntimeException {

    public SessionAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
