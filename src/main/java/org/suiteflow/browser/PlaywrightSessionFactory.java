package org.suiteflow.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import lombok.extern.slf4j.Slf4j;
import org.suiteflow.config.BrowserConfig;

import java.nio.file.Path;

/**
 * Launches a fresh Playwright browser per session according to {@link BrowserConfig}.
 */
@Slf4j
public class PlaywrightSessionFactory implements BrowserSessionFactory {

    private final BrowserConfig config;

    public PlaywrightSessionFactory(BrowserConfig config) {
        this.config = config;
    }

    public PlaywrightSessionFactory() {
        this(BrowserConfig.fromConfig());
    }

    @Override
    public BrowserSession open() {
        BrowserKind kind = BrowserKind.fromName(config.getBrowser());
        Playwright playwright = Playwright.create();
        try {
            BrowserType browserType = switch (kind) {
                case FIREFOX -> playwright.firefox();
                case CHROMIUM -> playwright.chromium();
                case WEBKIT -> playwright.webkit();
            };

            Browser browser = browserType.launch(launchOptions());
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                    .setViewportSize(config.getViewportWidth(), config.getViewportHeight())
                    .setIgnoreHTTPSErrors(true));
            Page page = context.newPage();

            log.info("Opened {} session (headless={})", kind.name().toLowerCase(), config.isHeadless());
            return new PlaywrightBrowserSession(playwright, browser, context, page);
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    BrowserType.LaunchOptions launchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions().setHeadless(config.isHeadless());

        // empty -> Playwright uses its bundled browser
        String executablePath = config.getExecutablePath();
        if (executablePath != null && !executablePath.isBlank()) {
            options.setExecutablePath(Path.of(executablePath));
        }

        // e.g. --no-zygote for OpenShift seccomp
        if (!config.getExtraArgs().isEmpty()) {
            options.setArgs(config.getExtraArgs());
        }
        return options;
    }
}
