package org.suiteflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-priority counters plus the suite-wide dependency counters.
 * Always derived from execution results via {@link #of(Collection, int)}; read-only once built.
 */
@Getter
@JsonPropertyOrder({"highest", "high", "medium", "low", "totalDependencySkips", "dependencyChains"})
public class PriorityExecutionStats {

    @JsonIgnore
    @Getter(AccessLevel.NONE)
    private final Map<TestPriority, PriorityBucketStats> buckets = new EnumMap<>(TestPriority.class);
    private int totalDependencySkips;
    private int dependencyChains;

    PriorityExecutionStats() {
        for (TestPriority priority : TestPriority.values()) {
            buckets.put(priority, new PriorityBucketStats());
        }
    }

    public PriorityBucketStats bucket(TestPriority priority) {
        return buckets.get(priority);
    }

    public PriorityBucketStats getHighest() {
        return bucket(TestPriority.HIGHEST);
    }

    public PriorityBucketStats getHigh() {
        return bucket(TestPriority.HIGH);
    }

    public PriorityBucketStats getMedium() {
        return bucket(TestPriority.MEDIUM);
    }

    public PriorityBucketStats getLow() {
        return bucket(TestPriority.LOW);
    }

    @JsonIgnore
    public int getTotal() {
        return buckets.values().stream().mapToInt(PriorityBucketStats::getTotal).sum();
    }

    public static PriorityExecutionStats of(Collection<ExecutionResult> results, int dependencyChains) {
        PriorityExecutionStats stats = new PriorityExecutionStats();
        results.forEach(stats::record);
        stats.dependencyChains = dependencyChains;
        return stats;
    }

    void record(ExecutionResult result) {
        TestPriority priority = result.getPriority() != null ? result.getPriority() : TestPriority.MEDIUM;
        buckets.get(priority).count(result.getStatus());
        if (result.isDependencySkip()) {
            totalDependencySkips++;
        }
    }
}
