package org.suiteflow.config;

import org.suiteflow.orchestrator.model.LogLevel;
import org.suiteflow.orchestrator.model.SuiteOptions;
import org.suiteflow.utils.ConfigReader;

/**
 * Reads suite options from the environment, system properties, .env or orchestrator.properties.
 */
public final class OrchestratorConfig {

    private OrchestratorConfig() {}

    public static SuiteOptions suiteOptions(String suiteName) {
        return SuiteOptions.builder()
                .suiteName(suiteName)
                .useSharedPage(ConfigReader.getBoolean("orchestrator.useSharedPage", true))
                .continueOnFailure(ConfigReader.getBoolean("orchestrator.continueOnFailure", false))
                .sequential(ConfigReader.getBoolean("orchestrator.sequential", true))
                .logLevel(LogLevel.fromValue(ConfigReader.get("orchestrator.logLevel", "detailed")))
                .build();
    }
}
