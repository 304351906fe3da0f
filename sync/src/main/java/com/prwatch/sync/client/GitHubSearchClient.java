package com.prwatch.sync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * GitHub issue-search client that absorbs both kinds of rate limiting.
 *
 * <p>Primary limit (403 with {@code X-RateLimit-Remaining: 0}): the reset time
 * is known, so the client sleeps until {@code X-RateLimit-Reset} plus a small
 * buffer and retries exactly once. If that retry hits the secondary limit, the
 * secondary backoff below takes over.</p>
 *
 * <p>Secondary limit (403 whose message mentions "secondary rate limit"): no
 * reset time is given, so the client retries with exponential backoff starting
 * at 60 seconds, up to {@value #MAX_ATTEMPTS} attempts in total.</p>
 *
 * <p>Waits are reported to a {@link StatusReporter} at least every
 * {@value #STATUS_INTERVAL_SECONDS} seconds.</p>
 *
 * <p>One instance is one session. After {@link #close()} every request fails
 * with {@link IllegalStateException}.</p>
 */
public class GitHubSearchClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(GitHubSearchClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.github.com";

    static final long PRIMARY_RESET_BUFFER_SECONDS = 5;
    static final long INITIAL_BACKOFF_SECONDS = 60;
    static final int MAX_ATTEMPTS = 5; // first request + 4 retries: 60s, 120s, 240s, 480s
    static final long STATUS_INTERVAL_SECONDS = 5;
    static final String SECONDARY_LIMIT_MARKER = "secondary rate limit";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String token;
    private final String baseUrl;
    private final Sleeper sleeper;
    private final Clock clock;

    private volatile boolean closed;

    public GitHubSearchClient(String token) {
        this(token, DEFAULT_BASE_URL, defaultHttpClient());
    }

    public GitHubSearchClient(String token, String baseUrl, OkHttpClient httpClient) {
        this(token, baseUrl, httpClient, Sleeper.threadSleep(), Clock.systemUTC());
    }

    // Visible for testing
    GitHubSearchClient(String token, String baseUrl, OkHttpClient httpClient,
                       Sleeper sleeper, Clock clock) {
        this.token = token;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.sleeper = sleeper;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Runs an issue search and returns its {@code items}.
     * Endpoint: GET /search/issues?q={query}
     *
     * @param query    {@code +}-joined search clauses, see {@code SearchQueryBuilder}
     * @param reporter receives progress text, including rate-limit countdowns
     * @return the raw search items, empty if the response had none
     * @throws GitHubRequestException if the search failed or rate limiting outlasted the retries
     */
    public List<JsonNode> search(String query, StatusReporter reporter)
            throws IOException, InterruptedException {
        ensureOpen();
        Request request = buildRequest(baseUrl + "/search/issues?q=" + query);

        ApiResponse response;
        try {
            response = execute(request);
        } catch (IOException e) {
            reporter.report("Error during request: " + e.getMessage());
            throw new GitHubRequestException("Request to " + request.url() + " failed",
                    GitHubRequestException.NO_STATUS, e);
        }

        if (response.code() == 200) {
            return parseItems(response, request);
        }
        Long resetEpoch = primaryLimitReset(response);
        if (resetEpoch != null) {
            return retryAfterPrimaryReset(request, resetEpoch, reporter);
        }
        if (isSecondaryRateLimit(response)) {
            return retryWithBackoff(request, reporter);
        }
        throw failure(request, response, reporter);
    }

    /**
     * Fetches the reviews of one pull request.
     * Endpoint: GET {pullRequestApiUrl}/reviews
     *
     * <p>Any failure yields an empty list, including a url that is not a valid
     * http(s) url; a missing review list is not worth failing a whole subject for.</p>
     */
    public List<JsonNode> fetchReviews(String pullRequestApiUrl) {
        ensureOpen();
        HttpUrl reviewsUrl = HttpUrl.parse(pullRequestApiUrl + "/reviews");
        if (reviewsUrl == null) {
            logger.warn("Skipping reviews for invalid pull request url '{}'", pullRequestApiUrl);
            return List.of();
        }
        Request request = buildRequest(reviewsUrl.toString());
        try {
            ApiResponse response = execute(request);
            if (response.code() != 200) {
                logger.warn("Reviews request {} returned {}", request.url(), response.code());
                return List.of();
            }
            JsonNode root = objectMapper.readTree(response.body());
            if (root == null || !root.isArray()) {
                logger.warn("Reviews response from {} is not an array", request.url());
                return List.of();
            }
            List<JsonNode> reviews = new ArrayList<>(root.size());
            root.forEach(reviews::add);
            return reviews;
        } catch (IOException e) {
            logger.warn("Failed to fetch reviews from {}: {}", request.url(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Ends this session. The underlying {@link OkHttpClient} may be shared, so
     * only its idle connections are released.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            httpClient.connectionPool().evictAll();
            logger.debug("GitHub client session closed");
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // -------------------------------------------------------------------------
    // Rate limit handling
    // -------------------------------------------------------------------------

    private List<JsonNode> retryAfterPrimaryReset(Request request, long resetEpochSeconds,
                                                  StatusReporter reporter)
            throws IOException, InterruptedException {
        long nowEpoch = clock.instant().getEpochSecond();
        long waitSeconds = Math.max(resetEpochSeconds - nowEpoch + PRIMARY_RESET_BUFFER_SECONDS, 0);
        logger.warn("Primary rate limit exhausted for {}. Pausing for {}s until reset.",
                request.url(), waitSeconds);

        sleepReporting(waitSeconds, reporter, "Primary rate limit hit. Sleeping for %d seconds");

        ApiResponse retry;
        try {
            retry = execute(request);
        } catch (IOException e) {
            reporter.report("Error during request: " + e.getMessage());
            throw new GitHubRequestException("Retry after primary rate limit failed for " + request.url(),
                    GitHubRequestException.NO_STATUS, e);
        }
        if (retry.code() == 200) {
            return parseItems(retry, request);
        }
        if (isSecondaryRateLimit(retry)) {
            return retryWithBackoff(request, reporter);
        }
        throw failure(request, retry, reporter);
    }

    private List<JsonNode> retryWithBackoff(Request request, StatusReporter reporter)
            throws IOException, InterruptedException {
        long backoffSeconds = INITIAL_BACKOFF_SECONDS;

        for (int attempt = 2; attempt <= MAX_ATTEMPTS; attempt++) {
            logger.warn("Secondary rate limit hit for {}. Retrying in {}s (attempt {}/{})",
                    request.url(), backoffSeconds, attempt, MAX_ATTEMPTS);
            sleepReporting(backoffSeconds, reporter, "Secondary rate limit hit. Sleeping for %d seconds.");

            ApiResponse response = null;
            try {
                response = execute(request);
            } catch (IOException e) {
                logger.warn("Request to {} failed during secondary rate limit backoff", request.url(), e);
                reporter.report("[ERR] Request failed during secondary rate limit backoff: " + e.getMessage());
            }

            if (response != null) {
                if (response.code() == 200) {
                    return parseItems(response, request);
                }
                if (response.code() == 422) {
                    reporter.report("[ERR] Validation failed. Reason: " + message(response));
                } else if (response.code() != 403) {
                    reporter.report("Received response: " + response.code() + " " + message(response));
                }
            }
            backoffSeconds *= 2;
        }

        reporter.report("Secondary rate limit persisted, giving up after " + MAX_ATTEMPTS + " attempts");
        throw new GitHubRequestException("Exhausted " + MAX_ATTEMPTS + " attempts for " + request.url()
                + " under secondary rate limit", 403);
    }

    /**
     * Returns the reset epoch of a primary rate limit response, or {@code null}
     * if the response is not one.
     */
    Long primaryLimitReset(ApiResponse response) {
        if (response.code() != 403) {
            return null;
        }
        Long remaining = parseLong(response.rateLimitRemaining());
        Long reset = parseLong(response.rateLimitReset());
        if (remaining == null || remaining != 0 || reset == null) {
            return null;
        }
        return reset;
    }

    boolean isSecondaryRateLimit(ApiResponse response) {
        return response.code() == 403 && message(response).contains(SECONDARY_LIMIT_MARKER);
    }

    /**
     * Sleeps for {@code totalSeconds} in slices of at most
     * {@value #STATUS_INTERVAL_SECONDS} seconds, reporting the remaining time
     * before each slice.
     */
    void sleepReporting(long totalSeconds, StatusReporter reporter, String format)
            throws InterruptedException {
        long remaining = totalSeconds;
        while (remaining > 0) {
            long slice = Math.min(remaining, STATUS_INTERVAL_SECONDS);
            reporter.report(String.format(format, remaining));
            sleeper.sleep(Duration.ofSeconds(slice));
            remaining -= slice;
        }
    }

    // -------------------------------------------------------------------------
    // HTTP plumbing
    // -------------------------------------------------------------------------

    Request buildRequest(String url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28")
                .build();
    }

    ApiResponse execute(Request request) throws IOException {
        ensureOpen();
        try (Response response = httpClient.newCall(request).execute()) {
            logResponse(request.url().toString(), response);
            ResponseBody body = response.body();
            return new ApiResponse(
                    response.code(),
                    body != null ? body.string() : "",
                    response.header("X-RateLimit-Remaining"),
                    response.header("X-RateLimit-Reset"));
        }
    }

    private List<JsonNode> parseItems(ApiResponse response, Request request) throws GitHubRequestException {
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new GitHubRequestException("Malformed search response from " + request.url(),
                    response.code(), e);
        }
        List<JsonNode> items = new ArrayList<>();
        if (root != null) {
            root.path("items").forEach(items::add);
        }
        logger.debug("Search {} returned {} items", request.url(), items.size());
        return items;
    }

    private GitHubRequestException failure(Request request, ApiResponse response, StatusReporter reporter) {
        String message = message(response);
        reporter.report("Error during request: " + response.code() + " " + message);
        return new GitHubRequestException("GitHub API error: " + response.code() + " for " + request.url()
                + (message.isEmpty() ? "" : " (" + message + ")"), response.code());
    }

    /**
     * The {@code message} field of a JSON error body, or the raw body when it
     * is not JSON.
     */
    String message(ApiResponse response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root != null && root.hasNonNull("message")) {
                return root.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            logger.debug("Error body from GitHub is not JSON");
        }
        return body.trim();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("GitHub client session is closed; open a new client for each cycle");
        }
    }

    private static Long parseLong(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void logResponse(String url, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.info("GitHub API {} {} | rate-limit-remaining: {}",
                response.code(), url, remaining != null ? remaining : "n/a");
    }

    // -------------------------------------------------------------------------
    // Internal result holder
    // -------------------------------------------------------------------------

    record ApiResponse(int code, String body, String rateLimitRemaining, String rateLimitReset) {}
}
