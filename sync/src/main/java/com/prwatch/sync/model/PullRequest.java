package com.prwatch.sync.model;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A normalized open pull request as returned by the issue search endpoint,
 * with its reviews attached.
 *
 * <p>Identity is the {@code url}: two instances with the same url are equal
 * regardless of their other fields. Result sets from different queries are
 * deduplicated on that basis.</p>
 *
 * @param title      pull request title
 * @param author     login of the author
 * @param url        web url of the pull request
 * @param draft      whether the pull request is a draft
 * @param repository repository name, without owner
 * @param createdAt  creation time, {@code null} when the payload had none
 * @param reviews    reviews in the order the API returned them
 */
public record PullRequest(
        String title,
        String author,
        String url,
        boolean draft,
        String repository,
        Instant createdAt,
        List<Review> reviews
) {

    public PullRequest {
        Objects.requireNonNull(url, "url must not be null");
        reviews = reviews != null ? List.copyOf(reviews) : List.of();
    }

    public int numApprovals() {
        return (int) reviews.stream()
                .filter(r -> r.state() == ReviewState.APPROVED)
                .count();
    }

    /**
     * Status of the latest submitted review by {@code me}. Reviews without a
     * submission time are ignored; any state other than approved or commented
     * counts as changes requested.
     *
     * @param me login to look for, or {@code null} when no "me" identity is configured
     */
    public MyReviewStatus reviewStatusFor(String me) {
        if (me == null) {
            return MyReviewStatus.DISABLED;
        }
        String login = me.toLowerCase(Locale.ROOT);
        Review latest = null;
        for (Review review : reviews) {
            if (review.submittedAt() == null || review.reviewer() == null
                    || !review.reviewer().toLowerCase(Locale.ROOT).equals(login)) {
                continue;
            }
            if (latest == null || review.submittedAt().isAfter(latest.submittedAt())) {
                latest = review;
            }
        }
        if (latest == null) {
            return MyReviewStatus.NONE;
        }
        return switch (latest.state()) {
            case APPROVED -> MyReviewStatus.APPROVED;
            case COMMENTED -> MyReviewStatus.COMMENTED;
            default -> MyReviewStatus.CHANGES_REQUESTED;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PullRequest other && url.equals(other.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }

    @Override
    public String toString() {
        return "PullRequest[title=" + title + ", author=" + author + ", url=" + url + "]";
    }
}
