package com.prwatch.sync.orchestrator;

/**
 * Cache keys for sync subjects. Authored pull requests are keyed by the plain
 * username, review requests by {@code requested:<name>}.
 */
public final class SubjectKeys {

    public static final String REQUESTED_PREFIX = "requested:";

    private SubjectKeys() {
    }

    public static String forUser(String username) {
        return username;
    }

    public static String forReviewRequests(String name) {
        return REQUESTED_PREFIX + name;
    }
}
