package org.suiteflow.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import lombok.extern.slf4j.Slf4j;

/**
 * Playwright-backed session. Owns the Playwright driver, the browser, its context and the page,
 * and closes them in reverse order.
 */
@Slf4j
public class PlaywrightBrowserSession implements BrowserSession {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private boolean closed;

    public PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    @Override
    public Page getPage() {
        return page;
    }

    @Override
    public boolean isClosed() {
        return closed || page.isClosed();
    }

    @Override
    public byte[] screenshot() {
        return page.screenshot(new Page.ScreenshotOptions().setFullPage(true));
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeQuietly("page", page::close);
        closeQuietly("browser context", context::close);
        closeQuietly("browser", browser::close);
        closeQuietly("playwright", playwright::close);
    }

    private static void closeQuietly(String what, Runnable closer) {
        try {
            closer.run();
        } catch (Exception e) {
            log.warn("Failed to close {}", what, e);
        }
    }
}
