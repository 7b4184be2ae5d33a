package org.suiteflow.orchestrator.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.suiteflow.orchestrator.model.OrchestratorSnapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Persists reporter snapshots as JSON so that HTML/notification tooling can pick them up
 * after the run. Consumes snapshots only; the orchestrator itself does not know about it.
 */
@Slf4j
public class OrchestratorResultsWriter {

    private final ObjectMapper objectMapper;

    public OrchestratorResultsWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(OrchestratorSnapshot snapshot) throws JsonProcessingException {
        return objectMapper.writeValueAsString(snapshot);
    }

    /**
     * Writes {@code orchestrator-results-<suite>.json} into the given directory, replacing an older file.
     */
    public Path write(OrchestratorSnapshot snapshot, String suiteName, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve("orchestrator-results-" + slug(suiteName) + ".json");
        Files.writeString(target, toJson(snapshot));
        log.info("Orchestrator results saved to: {}", target);
        return target;
    }

    static String slug(String suiteName) {
        if (suiteName == null || suiteName.isBlank()) {
            return "default";
        }
        String slug = suiteName.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        return slug.isEmpty() ? "default" : slug;
    }
}
