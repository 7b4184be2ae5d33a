package org.suiteflow.browser;

import com.microsoft.playwright.Page;

/**
 * One browser page with everything needed to keep it alive. Closing releases the whole session.
 */
public interface BrowserSession extends AutoCloseable {

    Page getPage();

    boolean isClosed();

    /**
     * Full-page PNG of the current page.
     */
    byte[] screenshot();

    @Override
    void close();
}
