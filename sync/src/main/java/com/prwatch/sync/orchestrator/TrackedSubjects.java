package com.prwatch.sync.orchestrator;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Who a sync cycle fetches for: the tracked authors, plus the optional "me"
 * and "my team" identities whose review requests are aggregated.
 *
 * <p>All subjects share one cache key namespace, so construction rejects
 * anything that would make two subjects map to the same key.</p>
 *
 * @param usernames tracked authors, fetched in this order
 * @param me        login whose review requests are fetched, or {@code null}
 * @param team      team ({@code org/team-slug}) whose review requests are fetched, or {@code null}
 */
public record TrackedSubjects(List<String> usernames, String me, String team) {

    public TrackedSubjects {
        usernames = usernames != null ? List.copyOf(usernames) : List.of();
        Set<String> seen = new HashSet<>();
        for (String username : usernames) {
            if (username.isBlank()) {
                throw new IllegalArgumentException("Tracked usernames must not be blank");
            }
            if (username.startsWith(SubjectKeys.REQUESTED_PREFIX)) {
                throw new IllegalArgumentException("Username '" + username
                        + "' collides with the review request key prefix '" + SubjectKeys.REQUESTED_PREFIX + "'");
            }
            if (!seen.add(username)) {
                throw new IllegalArgumentException("Username '" + username + "' is tracked twice");
            }
        }
        if (me != null && me.equals(team)) {
            throw new IllegalArgumentException("'me' and 'my team' must differ, both are '" + me + "'");
        }
    }

    public boolean hasReviewRequestSubjects() {
        return me != null || team != null;
    }
}
