package com.prwatch.sync.query;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Builds issue-search queries for open pull requests created within the last
 * {@code daysBack} days, optionally restricted to one organization.
 *
 * <p>Clauses are joined with {@code +}, e.g.
 * {@code author:octocat+type:pr+is:open+created:2024-02-03..2024-02-10+org:acme}.</p>
 */
public class SearchQueryBuilder {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final String org;
    private final int daysBack;
    private final Clock clock;

    public SearchQueryBuilder(String org, int daysBack) {
        this(org, daysBack, Clock.systemDefaultZone());
    }

    public SearchQueryBuilder(String org, int daysBack, Clock clock) {
        if (daysBack < 0) {
            throw new IllegalArgumentException("daysBack must not be negative: " + daysBack);
        }
        this.org = org;
        this.daysBack = daysBack;
        this.clock = clock;
    }

    /** Open pull requests authored by {@code username}. */
    public String authoredBy(String username) {
        return compose("author:" + username);
    }

    /** Open pull requests whose review was requested from {@code username}. */
    public String reviewRequestedFrom(String username) {
        return compose("review-requested:" + username);
    }

    /** Open pull requests whose review was requested from {@code team} ({@code org/team-slug}). */
    public String teamReviewRequestedFrom(String team) {
        return compose("team-review-requested:" + team);
    }

    /**
     * Calendar-date window {@code <today - daysBack>..<today>}.
     */
    public String dateFilter() {
        LocalDate end = LocalDate.now(clock);
        LocalDate start = end.minusDays(daysBack);
        return DATE_FORMAT.format(start) + ".." + DATE_FORMAT.format(end);
    }

    private String compose(String subjectClause) {
        StringBuilder query = new StringBuilder(subjectClause)
                .append("+type:pr")
                .append("+is:open")
                .append("+created:").append(dateFilter());
        if (org != null && !org.isBlank()) {
            query.append("+org:").append(org);
        }
        return query.toString();
    }
}
