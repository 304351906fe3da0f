package com.prwatch.sync.orchestrator;

import java.util.List;

/**
 * Aggregated summary of a sync cycle.
 *
 * @param results             per-subject outcomes, in fetch order
 * @param reviewRequestCount  size of the merged review request list, 0 when none configured
 * @param interrupted         whether the cycle was cut short by an interrupt
 * @param totalDurationMs     wall time of the cycle
 */
public record SyncSummary(
        List<SubjectResult> results,
        int reviewRequestCount,
        boolean interrupted,
        long totalDurationMs
) {

    public int successCount() {
        return (int) results.stream().filter(SubjectResult::success).count();
    }

    public int failureCount() {
        return (int) results.stream().filter(r -> !r.success()).count();
    }

    public boolean hasFailures() {
        return interrupted || results.stream().anyMatch(r -> !r.success());
    }

    public int totalPullRequests() {
        return results.stream()
                .filter(SubjectResult::success)
                .mapToInt(SubjectResult::pullRequestCount)
                .sum();
    }
}
