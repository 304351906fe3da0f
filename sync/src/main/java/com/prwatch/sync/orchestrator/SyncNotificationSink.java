package com.prwatch.sync.orchestrator;

import com.prwatch.sync.model.PullRequest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Display side of the sync engine. Receives every state change of a cycle;
 * all calls come from the thread running the cycle.
 */
public interface SyncNotificationSink {

    /** Replaces the status line; an empty string clears it. */
    void reportStatus(String text);

    /** A cycle started; every subject is about to be refreshed. */
    void markAllUpdating();

    void setUserPullRequests(String username, List<PullRequest> pullRequests, LocalDateTime fetchedAt);

    /** Merged, deduplicated review requests for "me" and "my team". */
    void setReviewRequested(List<PullRequest> pullRequests);

    /**
     * Registers a tracked user before the first cycle, with whatever the cache
     * held for them.
     */
    void addUser(String username, Optional<PullRequestSnapshot> cached);
}
