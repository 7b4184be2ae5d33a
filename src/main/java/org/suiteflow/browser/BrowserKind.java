package org.suiteflow.browser;

import java.util.Locale;

public enum BrowserKind {

    CHROMIUM,
    FIREFOX,
    WEBKIT;

    public static BrowserKind fromName(String browserTypeAsString) {
        String normalized = (browserTypeAsString == null ? "chromium" : browserTypeAsString.trim())
                .toLowerCase(Locale.ROOT);

        return switch (normalized) {
            case "firefox" -> FIREFOX;
            case "chromium", "chrome", "" -> CHROMIUM;
            case "webkit" -> WEBKIT;
            default -> throw new IllegalArgumentException(
                    "Unsupported browser type: '" + browserTypeAsString + "'. " +
                            "Use one of: Chromium, Firefox, Webkit"
            );
        };
    }
}
