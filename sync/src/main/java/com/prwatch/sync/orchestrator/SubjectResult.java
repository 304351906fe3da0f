package com.prwatch.sync.orchestrator;

/**
 * Holds the outcome of fetching one subject during a cycle.
 */
public record SubjectResult(
        String subjectKey,
        int pullRequestCount,
        boolean success,
        String errorMessage,
        long durationMs
) {

    public static SubjectResult success(String subjectKey, int count, long durationMs) {
        return new SubjectResult(subjectKey, count, true, null, durationMs);
    }

    public static SubjectResult failure(String subjectKey, String error, long durationMs) {
        return new SubjectResult(subjectKey, 0, false, error, durationMs);
    }
}
