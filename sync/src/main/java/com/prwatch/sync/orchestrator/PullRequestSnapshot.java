package com.prwatch.sync.orchestrator;

import com.prwatch.sync.model.PullRequest;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Normalized pull requests of one subject as of {@code fetchedAt} (UTC).
 */
public record PullRequestSnapshot(
        List<PullRequest> pullRequests,
        LocalDateTime fetchedAt
) {}
