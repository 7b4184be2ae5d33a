package org.suiteflow.orchestrator.context;

import org.suiteflow.browser.BrowserSession;

/**
 * Session handed to one test. Closing the lease closes an isolated session and leaves a shared one alone.
 */
public final class SessionLease implements AutoCloseable {

    private final BrowserSession session;
    private final boolean shared;

    SessionLease(BrowserSession session, boolean shared) {
        this.session = session;
        this.shared = shared;
    }

    public BrowserSession getSession() {
        return session;
    }

    public boolean isShared() {
        return shared;
    }

    @Override
    public void close() {
        if (!shared) {
            SharedContextManager.closeSession(session);
        }
    }
}
