package org.suiteflow.utils;

import io.github.cdimascio.dotenv.Dotenv;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.util.Properties;

@Slf4j
public class ConfigReader {
    private static final Properties properties = new Properties();
    private static final Dotenv dotenv;

    static {
        try (InputStream is = ConfigReader.class.getClassLoader().getResourceAsStream("orchestrator.properties")) {
            if (is != null) {
                properties.load(is);
            }
        } catch (Exception e) {
            log.warn("Keine orchestrator.properties gefunden, verwende Defaults.", e);
        }

        dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
    }

    private ConfigReader() {
    }

    /**
     * Priorität:
     * 1. System Environment Variable (z.B. von OpenShift ConfigMap/Secret)
     * 2. System Property (z.B. mvn test -Dkey=value)
     * 3. .env-Datei (lokale Entwicklung, wird ignoriert wenn nicht vorhanden)
     * 4. Properties Datei (orchestrator.properties)
     * 5. Default Wert
     */
    public static String get(String key, String defaultValue) {
        // 1. Echte Umgebungsvariable (CI/CD)
        String envValue = System.getenv(toEnvKey(key));
        if (envValue != null) return envValue;

        // 2. System Property (-Dkey=value)
        String sysProp = System.getProperty(key);
        if (sysProp != null) return sysProp;

        // 3. .env-Datei
        String dotenvValue = dotenv.get(toEnvKey(key), null);
        if (dotenvValue != null) return dotenvValue;

        // 4. orchestrator.properties + Default
        return properties.getProperty(key, defaultValue);
    }

    public static boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' is not a number: '" + value + "'", e);
        }
    }

    static String toEnvKey(String key) {
        return key.toUpperCase().replace(".", "_");
    }
}
