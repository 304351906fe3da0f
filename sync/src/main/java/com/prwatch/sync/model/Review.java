package com.prwatch.sync.model;

import java.time.Instant;

/**
 * A single review on a pull request.
 * Parsed from: {@code <pull request api url>/reviews}
 *
 * @param reviewer    login of the reviewer
 * @param state       review verdict
 * @param submittedAt submission time, {@code null} for reviews that were never submitted
 */
public record Review(
        String reviewer,
        ReviewState state,
        Instant submittedAt
) {}
