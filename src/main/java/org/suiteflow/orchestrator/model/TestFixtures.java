package org.suiteflow.orchestrator.model;

import com.microsoft.playwright.Page;
import lombok.Value;
import org.suiteflow.browser.BrowserSession;
import org.suiteflow.orchestrator.context.SuiteRunContext;

/**
 * Everything a test body gets handed: its own name, the browser session
 * (shared across the suite or isolated per test) and the run context.
 */
@Value
public class TestFixtures {

    String testName;
    BrowserSession session;
    SuiteRunContext runContext;
    boolean sharedSession;

    public Page getPage() {
        return session.getPage();
    }
}
