package com.prwatch.sync.client;

import java.io.IOException;

/**
 * A GitHub request that failed for good: a non-retryable status, a transport
 * error, or a rate limit that outlasted its retries.
 */
public class GitHubRequestException extends IOException {

    /** Used when the failure happened before any status was received. */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public GitHubRequestException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GitHubRequestException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
