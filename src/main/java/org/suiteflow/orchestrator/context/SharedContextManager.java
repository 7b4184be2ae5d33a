package org.suiteflow.orchestrator.context;

import lombok.extern.slf4j.Slf4j;
import org.suiteflow.browser.BrowserSession;
import org.suiteflow.browser.BrowserSessionFactory;

/**
 * Owns the browser session(s) of one suite run.
 *
 * <p>Shared mode: the session is opened lazily on the first {@link #acquire(String)} and
 * handed to every test; {@link #close()} releases it exactly once. Isolated mode: every
 * acquire opens a fresh session that is closed together with its lease.</p>
 *
 * <p>Use with try-with-resources so the shared session is released on every exit path,
 * including an aborted suite.</p>
 */
@Slf4j
public class SharedContextManager implements AutoCloseable {

    private final BrowserSessionFactory sessionFactory;
    private final boolean shared;
    private BrowserSession sharedSession;
    private int sessionsOpened;
    private boolean closed;

    public SharedContextManager(BrowserSessionFactory sessionFactory, boolean shared) {
        if (sessionFactory == null) {
            throw new IllegalArgumentException("sessionFactory must not be null");
        }
        this.sessionFactory = sessionFactory;
        this.shared = shared;
    }

    /**
     * Session for the given test.
     *
     * @throws SessionAcquisitionException if the session cannot be opened
     * @throws IllegalStateException       if the manager was already closed
     */
    public SessionLease acquire(String testName) {
        if (closed) {
            throw new IllegalStateException("Session manager already closed, cannot serve test '" + testName + "'");
        }
        if (!shared) {
            return new SessionLease(open(testName), false);
        }
        if (sharedSession == null) {
            sharedSession = open(testName);
            log.info("Shared browser session opened for first test \"{}\"", testName);
        } else if (sharedSession.isClosed()) {
            log.warn("Shared page was closed by an earlier test, \"{}\" gets the closed session", testName);
        } else {
            log.debug("Reusing shared browser session for \"{}\"", testName);
        }
        return new SessionLease(sharedSession, true);
    }

    private BrowserSession open(String testName) {
        try {
            BrowserSession session = sessionFactory.open();
            if (session == null) {
                throw new IllegalStateException("Session factory returned no session");
            }
            sessionsOpened++;
            return session;
        } catch (RuntimeException e) {
            throw new SessionAcquisitionException(
                    "Failed to open browser session for test '" + testName + "': " + e.getMessage(), e);
        }
    }

    public boolean isShared() {
        return shared;
    }

    public boolean isSharedSessionOpen() {
        return sharedSession != null && !closed;
    }

    /**
     * Number of sessions opened so far (at most one in shared mode).
     */
    public int getSessionsOpened() {
        return sessionsOpened;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (sharedSession != null) {
            closeSession(sharedSession);
            log.info("Shared browser session released");
        }
    }

    static void closeSession(BrowserSession session) {
        try {
            session.close();
        } catch (Exception e) {
            log.warn("Failed to close browser session", e);
        }
    }
}
