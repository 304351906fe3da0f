package com.prwatch.sync.model;

import java.util.Optional;

/**
 * Review states reported by GitHub's pull request reviews endpoint.
 */
public enum ReviewState {
    COMMENTED,
    PENDING,
    CHANGES_REQUESTED,
    APPROVED;

    /**
     * Maps the API's state string to a known state. States outside this set
     * (e.g. {@code DISMISSED}) yield empty.
     */
    public static Optional<ReviewState> fromApi(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ReviewState state : values()) {
            if (state.name().equals(value)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
