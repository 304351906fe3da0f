package com.prwatch.sync.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.prwatch.sync.cache.CacheWriteException;
import com.prwatch.sync.cache.PullRequestCache;
import com.prwatch.sync.client.GitHubSearchClient;
import com.prwatch.sync.model.PullRequest;
import com.prwatch.sync.model.PullRequestParser;
import com.prwatch.sync.query.SearchQueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Coordinates a sync cycle: authored pull requests per tracked user, then the
 * review requests for "me" and "my team", merged and deduplicated.
 *
 * <p>Every request of a cycle is issued sequentially on the calling thread.
 * GitHub's rate limit is one budget for the whole token, so parallel fetches
 * would only exhaust it sooner.</p>
 *
 * <p>A failing subject is reported and skipped; the cycle always moves on to
 * the next one. Only successful fetches are written to the cache.</p>
 */
public class SyncOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final TrackedSubjects subjects;
    private final SearchQueryBuilder queries;
    private final Supplier<GitHubSearchClient> clientFactory;
    private final PullRequestCache cache;
    private final SyncNotificationSink sink;
    private final ReviewCollector reviewCollector;
    private final Clock clock;

    private final AtomicBoolean updating = new AtomicBoolean(false);

    /**
     * @param clientFactory opens one client session per cycle; the session is closed when the cycle ends
     * @param cache         the pull request cache, or {@code null} to run without one
     */
    public SyncOrchestrator(TrackedSubjects subjects, SearchQueryBuilder queries,
                            Supplier<GitHubSearchClient> clientFactory, PullRequestCache cache,
                            SyncNotificationSink sink) {
        this(subjects, queries, clientFactory, cache, sink, new ReviewCollector(), Clock.systemUTC());
    }

    // Visible for testing
    SyncOrchestrator(TrackedSubjects subjects, SearchQueryBuilder queries,
                     Supplier<GitHubSearchClient> clientFactory, PullRequestCache cache,
                     SyncNotificationSink sink, ReviewCollector reviewCollector, Clock clock) {
        this.subjects = subjects;
        this.queries = queries;
        this.clientFactory = clientFactory;
        this.cache = cache;
        this.sink = sink;
        this.reviewCollector = reviewCollector;
        this.clock = clock;
    }

    /**
     * Hands the cached state of every subject to the sink, before the first
     * live cycle.
     */
    public void seedFromCache() {
        for (String username : subjects.usernames()) {
            sink.addUser(username, cachedSnapshot(SubjectKeys.forUser(username)));
        }

        if (cache == null || !subjects.hasReviewRequestSubjects()) {
            return;
        }
        Optional<PullRequestSnapshot> forMe = subjects.me() != null
                ? cachedSnapshot(SubjectKeys.forReviewRequests(subjects.me()))
                : Optional.empty();
        Optional<PullRequestSnapshot> forTeam = subjects.team() != null
                ? cachedSnapshot(SubjectKeys.forReviewRequests(subjects.team()))
                : Optional.empty();
        if (forMe.isPresent() || forTeam.isPresent()) {
            sink.setReviewRequested(mergeReviewRequests(
                    forMe.map(PullRequestSnapshot::pullRequests).orElse(List.of()),
                    forTeam.map(PullRequestSnapshot::pullRequests).orElse(List.of())));
        }
    }

    /**
     * Runs one full cycle unless one is already in flight.
     *
     * @return the cycle summary, or empty if the request was ignored because a
     *         cycle is already running
     */
    public Optional<SyncSummary> runCycle() {
        if (!updating.compareAndSet(false, true)) {
            logger.info("Sync cycle already in progress, ignoring refresh request");
            return Optional.empty();
        }

        long runStart = System.currentTimeMillis();
        logger.info("Starting sync cycle for {} users (me: {}, team: {})",
                subjects.usernames().size(), subjects.me(), subjects.team());

        List<SubjectResult> results = new ArrayList<>();
        int reviewRequestCount = 0;
        boolean interrupted = false;

        try (GitHubSearchClient client = clientFactory.get()) {
            sink.markAllUpdating();

            for (String username : subjects.usernames()) {
                FetchOutcome outcome = fetchSubject(client, SubjectKeys.forUser(username),
                        "PRs for " + username, queries.authoredBy(username));
                results.add(outcome.result());
                sink.setUserPullRequests(username, outcome.pullRequests(), outcome.fetchedAt());
            }

            if (subjects.hasReviewRequestSubjects()) {
                List<PullRequest> forMe = List.of();
                List<PullRequest> forTeam = List.of();

                if (subjects.me() != null) {
                    FetchOutcome outcome = fetchSubject(client, SubjectKeys.forReviewRequests(subjects.me()),
                            "review requests for " + subjects.me(), queries.reviewRequestedFrom(subjects.me()));
                    results.add(outcome.result());
                    forMe = outcome.pullRequests();
                }
                if (subjects.team() != null) {
                    FetchOutcome outcome = fetchSubject(client, SubjectKeys.forReviewRequests(subjects.team()),
                            "review requests for " + subjects.team(),
                            queries.teamReviewRequestedFrom(subjects.team()));
                    results.add(outcome.result());
                    forTeam = outcome.pullRequests();
                }

                List<PullRequest> merged = mergeReviewRequests(forMe, forTeam);
                reviewRequestCount = merged.size();
                sink.setReviewRequested(merged);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
            logger.warn("Sync cycle interrupted after {} subjects", results.size());
        } finally {
            updating.set(false);
            sink.reportStatus("");
        }

        SyncSummary summary = new SyncSummary(results, reviewRequestCount, interrupted,
                System.currentTimeMillis() - runStart);
        logSummary(summary);
        return Optional.of(summary);
    }

    public boolean isUpdating() {
        return updating.get();
    }

    // -------------------------------------------------------------------------
    // Per-subject fetch
    // -------------------------------------------------------------------------

    private FetchOutcome fetchSubject(GitHubSearchClient client, String subjectKey, String description,
                                      String query) throws InterruptedException {
        long stepStart = System.currentTimeMillis();
        sink.reportStatus("Fetching " + description + "...");
        logger.info("Fetching {} (query: {})", description, query);

        List<JsonNode> items;
        try {
            items = client.search(query, sink::reportStatus);
        } catch (IOException e) {
            logger.error("Failed to fetch {}", description, e);
            sink.reportStatus("Failed to fetch " + description + ": " + e.getMessage());
            return new FetchOutcome(List.of(), now(),
                    SubjectResult.failure(subjectKey, e.getMessage(), System.currentTimeMillis() - stepStart));
        }

        reviewCollector.attachReviews(client, subjectKey, items);

        LocalDateTime fetchedAt = now();
        persist(subjectKey, items, fetchedAt);

        List<PullRequest> pullRequests = PullRequestParser.parseAll(items);
        logger.info("Fetched {} pull requests for {}", pullRequests.size(), subjectKey);
        return new FetchOutcome(pullRequests, fetchedAt,
                SubjectResult.success(subjectKey, pullRequests.size(), System.currentTimeMillis() - stepStart));
    }

    private void persist(String subjectKey, List<JsonNode> items, LocalDateTime fetchedAt) {
        if (cache == null) {
            return;
        }
        try {
            cache.save(subjectKey, items, fetchedAt);
        } catch (CacheWriteException e) {
            logger.error("Could not persist cache entry {}, keeping it in memory only", subjectKey, e);
            sink.reportStatus("Cache write failed: " + e.getMessage());
        }
    }

    private Optional<PullRequestSnapshot> cachedSnapshot(String subjectKey) {
        if (cache == null) {
            return Optional.empty();
        }
        return cache.load(subjectKey)
                .map(cached -> new PullRequestSnapshot(
                        PullRequestParser.parseAll(cached.prs()), cached.timestamp()));
    }

    /**
     * Concatenates both lists, keeping the first occurrence of every url.
     */
    static List<PullRequest> mergeReviewRequests(List<PullRequest> forMe, List<PullRequest> forTeam) {
        Set<PullRequest> merged = new LinkedHashSet<>(forMe);
        merged.addAll(forTeam);
        return List.copyOf(merged);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).withNano(0);
    }

    private void logSummary(SyncSummary summary) {
        logger.info("=== Sync Summary ===");
        logger.info("Total duration: {}ms", summary.totalDurationMs());
        logger.info("Subjects: {} ({} successful, {} failed), pull requests: {}, review requests: {}",
                summary.results().size(), summary.successCount(), summary.failureCount(),
                summary.totalPullRequests(), summary.reviewRequestCount());

        if (summary.hasFailures()) {
            logger.warn("Sync cycle completed with {} failures{}", summary.failureCount(),
                    summary.interrupted() ? " (interrupted)" : "");
            summary.results().stream()
                    .filter(r -> !r.success())
                    .forEach(r -> logger.warn("  FAILED: {} - {}", r.subjectKey(), r.errorMessage()));
        }
    }

    private record FetchOutcome(List<PullRequest> pullRequests, LocalDateTime fetchedAt, SubjectResult result) {}
}
