package com.prwatch.sync.orchestrator;

import com.prwatch.sync.model.MyReviewStatus;
import com.prwatch.sync.model.PullRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Headless display: writes every sync notification to the log, one line per
 * pull request.
 *
 * <p>Line format: {@code [v|2] [ready|widgets] - Add caching  2024 02 08},
 * where the first marker is the "me" review status (omitted when no "me" is
 * configured) and the number is the approval count.</p>
 */
public class LoggingNotificationSink implements SyncNotificationSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationSink.class);

    private static final DateTimeFormatter CREATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy MM dd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter FETCHED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy.MM.dd. HH:mm");

    private final String me;

    /**
     * @param me login used for the review status marker, or {@code null}
     */
    public LoggingNotificationSink(String me) {
        this.me = me;
    }

    @Override
    public void reportStatus(String text) {
        if (!text.isEmpty()) {
            logger.info("[status] {}", text);
        }
    }

    @Override
    public void markAllUpdating() {
        logger.info("Updating all subjects...");
    }

    @Override
    public void setUserPullRequests(String username, List<PullRequest> pullRequests, LocalDateTime fetchedAt) {
        printGroup(username + " " + FETCHED_AT_FORMAT.format(fetchedAt), pullRequests);
    }

    @Override
    public void setReviewRequested(List<PullRequest> pullRequests) {
        printGroup("Review requested", pullRequests);
    }

    @Override
    public void addUser(String username, Optional<PullRequestSnapshot> cached) {
        if (cached.isEmpty()) {
            logger.info("{}: nothing cached yet", username);
            return;
        }
        PullRequestSnapshot snapshot = cached.get();
        printGroup(username + " " + FETCHED_AT_FORMAT.format(snapshot.fetchedAt()) + " (cached)",
                snapshot.pullRequests());
    }

    private void printGroup(String title, List<PullRequest> pullRequests) {
        logger.info("--- {} ({} open) ---", title, pullRequests.size());
        for (PullRequest pr : pullRequests) {
            logger.info("  {}  {}", formatLine(pr, me), pr.url());
        }
    }

    static String formatLine(PullRequest pr, String me) {
        MyReviewStatus status = pr.reviewStatusFor(me);
        String approvals = status == MyReviewStatus.DISABLED
                ? String.valueOf(pr.numApprovals())
                : status.marker() + "|" + pr.numApprovals();
        String created = pr.createdAt() != null ? CREATED_AT_FORMAT.format(pr.createdAt()) : "";
        return "[" + approvals + "] [" + (pr.draft() ? "draft" : "ready") + "|" + pr.repository() + "] - "
                + pr.title() + "  " + created;
    }
}
