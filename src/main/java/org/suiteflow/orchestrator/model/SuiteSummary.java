package org.suiteflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Zusammenfassung eines Suite-Laufs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuiteSummary {

    private String suiteName;
    private int total;
    private int passed;
    private int failed;
    private int skipped;
    private int pending;
    private boolean aborted;

    public double getPassRate() {
        int concluded = passed + failed + skipped;
        if (concluded == 0) {
            return 0.0;
        }
        return passed * 100.0 / concluded;
    }
}
