package org.suiteflow.hooks;

import lombok.extern.slf4j.Slf4j;
import org.suiteflow.browser.BrowserSession;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Slf4j
public final class TakeScreenshots {

    private TakeScreenshots() {}

    /**
     * Erstellt einen Full-Page-Screenshot und legt ihn unter {@code screenshotsDir} ab.
     * Fehler werden nur geloggt, das Testergebnis bleibt davon unberuehrt.
     *
     * @return Pfad der Datei, leer wenn die Seite geschlossen ist oder der Screenshot fehlschlug
     */
    public static Optional<Path> captureScreenshot(BrowserSession session, String name, Path screenshotsDir) {
        if (session == null || session.isClosed()) {
            log.info("Page closed - screenshot not available for \"{}\"", name);
            return Optional.empty();
        }

        try {
            byte[] screenshot = session.screenshot();

            Files.createDirectories(screenshotsDir);
            String fileName = "failure-" + sanitize(name) + "_" + System.currentTimeMillis() + ".png";
            Path target = screenshotsDir.resolve(fileName);
            Files.write(target, screenshot);

            log.info("Screenshot captured: {}", target);
            return Optional.of(target);
        } catch (Exception e) {
            log.warn("Fehler beim Erstellen des Screenshots fuer \"{}\": {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    static String sanitize(String name) {
        String cleaned = name == null ? "" : name.replaceAll("[^A-Za-z0-9._-]+", "_");
        return cleaned.isEmpty() ? "test" : cleaned;
    }
}
