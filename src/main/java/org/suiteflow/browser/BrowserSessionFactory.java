package org.suiteflow.browser;

/**
 * Opens new browser sessions. Called once per suite in shared mode, once per test otherwise.
 */
@FunctionalInterface
public interface BrowserSessionFactory {

    BrowserSession open();
}
