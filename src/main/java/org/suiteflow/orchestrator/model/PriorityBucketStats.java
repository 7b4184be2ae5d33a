package org.suiteflow.orchestrator.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Counters of one priority bucket.
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PACKAGE)
@AllArgsConstructor
public class PriorityBucketStats {

    private int total;
    private int passed;
    private int failed;
    private int skipped;

    void count(NodeStatus status) {
        total++;
        switch (status) {
            case PASSED -> passed++;
            case FAILED -> failed++;
            case SKIPPED -> skipped++;
            default -> throw new IllegalArgumentException("Not a final status: " + status);
        }
    }
}
