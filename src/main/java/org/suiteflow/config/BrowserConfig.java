package org.suiteflow.config;

import lombok.Builder;
import lombok.Value;
import org.suiteflow.utils.ConfigReader;

import java.util.ArrayList;
import java.util.List;

/**
 * Browser-Einstellungen fuer neue Sessions.
 *
 * Dev:  browser.executable.path zeigt auf einen lokalen Browser, z.B. C:/Program Files/Mozilla Firefox/firefox.exe
 * Prod: leer oder per Env-Var BROWSER_EXECUTABLE_PATH gesetzt.
 * Leerer Pfad bedeutet: Playwright nutzt seinen eingebetteten Browser-Download.
 */
@Value
@Builder
public class BrowserConfig {

    @Builder.Default
    String browser = "chromium";

    @Builder.Default
    boolean headless = true;

    @Builder.Default
    String executablePath = "";

    @Builder.Default
    List<String> extraArgs = List.of();

    @Builder.Default
    int viewportWidth = 1920;

    @Builder.Default
    int viewportHeight = 1080;

    public static BrowserConfig fromConfig() {
        return BrowserConfig.builder()
                .browser(ConfigReader.get("browser", "chromium"))
                .headless(ConfigReader.getBoolean("browser.headless", true))
                .executablePath(ConfigReader.get("browser.executable.path", ""))
                .extraArgs(parseArgs(ConfigReader.get("browser.extra.args", "")))
                .viewportWidth(ConfigReader.getInt("browser.viewport.width", 1920))
                .viewportHeight(ConfigReader.getInt("browser.viewport.height", 1080))
                .build();
    }

    /**
     * Splits a comma or whitespace separated argument list, dropping blanks.
     */
    static List<String> parseArgs(String raw) {
        List<String> args = new ArrayList<>();
        if (raw == null) {
            return args;
        }
        for (String part : raw.split("[,\\s]+")) {
            if (!part.isBlank()) {
                args.add(part.trim());
            }
        }
        return List.copyOf(args);
    }
}
