package com.prwatch.sync.model;

/**
 * Where the configured "me" identity stands on a pull request, with the
 * marker character the display layer prints for it.
 */
public enum MyReviewStatus {
    APPROVED("v"),
    COMMENTED("@"),
    CHANGES_REQUESTED("X"),
    NONE(" "),
    DISABLED("");

    private final String marker;

    MyReviewStatus(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }
}
