package com.prwatch.sync.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GitHubSearchClient} covering both rate-limit paths,
 * non-retryable failures, review fetching and session handling.
 */
class GitHubSearchClientTest {

    private static final Instant NOW = Instant.parse("2024-02-10T12:00:00Z");
    private static final String QUERY = "author:testuser+type:pr+is:open+created:2024-02-03..2024-02-10";
    private static final String SECONDARY_BODY =
            "{\"message\": \"You have exceeded a secondary rate limit. Please wait a few minutes.\"}";

    private MockWebServer server;
    private GitHubSearchClient client;
    private final List<Duration> sleeps = new ArrayList<>();
    private final List<String> statuses = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(5, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();

        client = new GitHubSearchClient("test-token", server.url("/").toString(), httpClient,
                sleeps::add, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private long totalSleptSeconds() {
        return sleeps.stream().mapToLong(Duration::getSeconds).sum();
    }

    private static MockResponse secondaryLimited() {
        return new MockResponse()
                .setResponseCode(403)
                .setHeader("X-RateLimit-Remaining", "4000")
                .setBody(SECONDARY_BODY);
    }

    // =========================================================================
    // Plain search
    // =========================================================================

    @Test
    @DisplayName("Search returns items and sends the query with GitHub headers")
    void search_success() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("X-RateLimit-Remaining", "29")
                .setBody("{\"total_count\": 1, \"items\": [{\"title\": \"Add cache\"}]}"));

        List<JsonNode> items = client.search(QUERY, statuses::add);

        assertEquals(1, items.size());
        assertEquals("Add cache", items.get(0).path("title").asText());

        RecordedRequest recorded = server.takeRequest();
        assertEquals("/search/issues?q=" + QUERY, recorded.getPath());
        assertEquals("Bearer test-token", recorded.getHeader("Authorization"));
        assertEquals("application/vnd.github+json", recorded.getHeader("Accept"));
        assertEquals("2022-11-28", recorded.getHeader("X-GitHub-Api-Version"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Search without an items field returns an empty list")
    void search_missingItems() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"total_count\": 0}"));

        assertTrue(client.search(QUERY, statuses::add).isEmpty());
    }

    @Test
    @DisplayName("Malformed 200 body is a request failure")
    void search_malformedBody() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{not json"));

        assertThrows(GitHubRequestException.class, () -> client.search(QUERY, statuses::add));
    }

    // =========================================================================
    // Primary rate limit
    // =========================================================================

    @Test
    @DisplayName("Primary limit: sleeps until reset plus buffer, then returns the retry's items")
    void primaryLimit_roundTrip() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(403)
                .setHeader("X-RateLimit-Remaining", "0")
                .setHeader("X-RateLimit-Reset", String.valueOf(NOW.getEpochSecond() + 1))
                .setBody("{\"message\": \"API rate limit exceeded\"}"));
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"items\": [\"one\", \"two\"]}"));

        List<JsonNode> items = client.search(QUERY, statuses::add);

        assertEquals(List.of(TextNode.valueOf("one"), TextNode.valueOf("two")), items);
        assertEquals(2, server.getRequestCount());
        assertEquals(6, totalSleptSeconds(), "1s until reset plus the 5s buffer");
        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(1)), sleeps);
        assertEquals(List.of(
                "Primary rate limit hit. Sleeping for 6 seconds",
                "Primary rate limit hit. Sleeping for 1 seconds"), statuses);
    }

    @Test
    @DisplayName("Primary limit: a failed retry is not retried again")
    void primaryLimit_singleRetryOnly() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse()
                    .setResponseCode(403)
                    .setHeader("X-RateLimit-Remaining", "0")
                    .setHeader("X-RateLimit-Reset", String.valueOf(NOW.getEpochSecond() + 10))
                    .setBody("{\"message\": \"API rate limit exceeded\"}"));
        }

        GitHubRequestException ex = assertThrows(GitHubRequestException.class,
                () -> client.search(QUERY, statuses::add));

        assertEquals(403, ex.getStatusCode());
        assertEquals(2, server.getRequestCount());
        assertEquals(15, totalSleptSeconds());
    }

    @Test
    @DisplayName("Primary limit whose reset lies well in the past retries without sleeping")
    void primaryLimit_resetInPast() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(403)
                .setHeader("X-RateLimit-Remaining", "0")
                .setHeader("X-RateLimit-Reset", String.valueOf(NOW.getEpochSecond() - 60))
                .setBody("{}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"items\": []}"));

        assertTrue(client.search(QUERY, statuses::add).isEmpty());
        assertTrue(sleeps.isEmpty());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    @DisplayName("Primary limit: a secondary limit on the retry continues with exponential backoff")
    void primaryLimit_thenSecondaryBackoff() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(403)
                .setHeader("X-RateLimit-Remaining", "0")
                .setHeader("X-RateLimit-Reset", String.valueOf(NOW.getEpochSecond() + 1))
                .setBody("{\"message\": \"API rate limit exceeded\"}"));
        server.enqueue(secondaryLimited());
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"items\": [\"ok\"]}"));

        List<JsonNode> items = client.search(QUERY, statuses::add);

        assertEquals(List.of(TextNode.valueOf("ok")), items);
        assertEquals(3, server.getRequestCount());
        assertEquals(66, totalSleptSeconds(), "6s primary wait plus the first 60s backoff");
        assertTrue(statuses.contains("Secondary rate limit hit. Sleeping for 60 seconds."));
    }

    // =========================================================================
    // Secondary rate limit
    // =========================================================================

    @Test
    @DisplayName("Secondary limit: backoff doubles from 60s until the request succeeds")
    void secondaryLimit_backoffDoubling() throws Exception {
        server.enqueue(secondaryLimited());
        server.enqueue(secondaryLimited());
        server.enqueue(secondaryLimited());
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"items\": [\"pr\"]}"));

        List<JsonNode> items = client.search(QUERY, statuses::add);

        assertEquals(List.of(TextNode.valueOf("pr")), items);
        assertEquals(4, server.getRequestCount());
        assertEquals(60 + 120 + 240, totalSleptSeconds());
        assertTrue(statuses.contains("Secondary rate limit hit. Sleeping for 60 seconds."));
        assertTrue(statuses.contains("Secondary rate limit hit. Sleeping for 120 seconds."));
        assertTrue(statuses.contains("Secondary rate limit hit. Sleeping for 240 seconds."));
        assertFalse(statuses.contains("Secondary rate limit hit. Sleeping for 480 seconds."));
        assertTrue(sleeps.stream().allMatch(d -> d.getSeconds() <= 5),
                "Status must be refreshed at least every 5 seconds");
    }

    @Test
    @DisplayName("Secondary limit: five limited responses exhaust the retries")
    void secondaryLimit_exhausted() {
        for (int i = 0; i < 5; i++) {
            server.enqueue(secondaryLimited());
        }
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"items\": []}"));

        GitHubRequestException ex = assertThrows(GitHubRequestException.class,
                () -> client.search(QUERY, statuses::add));

        assertEquals(403, ex.getStatusCode());
        assertEquals(5, server.getRequestCount(), "No attempt after the fifth");
        assertEquals(60 + 120 + 240 + 480, totalSleptSeconds());
    }

    @Test
    @DisplayName("Secondary limit: a 422 retry is reported and counted as an attempt")
    void secondaryLimit_validationFailure() throws Exception {
        server.enqueue(secondaryLimited());
        server.enqueue(new MockResponse()
                .setResponseCode(422)
                .setBody("{\"message\": \"Validation Failed\"}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"items\": []}"));

        assertTrue(client.search(QUERY, statuses::add).isEmpty());

        assertTrue(statuses.contains("[ERR] Validation failed. Reason: Validation Failed"));
        assertEquals(3, server.getRequestCount());
        assertEquals(60 + 120, totalSleptSeconds());
    }

    @Test
    @DisplayName("Secondary limit: other statuses are reported and counted as an attempt")
    void secondaryLimit_otherStatus() throws Exception {
        server.enqueue(secondaryLimited());
        server.enqueue(new MockResponse()
                .setResponseCode(502)
                .setBody("{\"message\": \"Server Error\"}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"items\": []}"));

        assertTrue(client.search(QUERY, statuses::add).isEmpty());

        assertTrue(statuses.contains("Received response: 502 Server Error"));
        assertEquals(60 + 120, totalSleptSeconds());
    }

    @Test
    @DisplayName("Secondary limit: a transport failure is reported and counted as an attempt")
    void secondaryLimit_transportFailure() throws Exception {
        server.enqueue(secondaryLimited());
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AFTER_REQUEST));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"items\": []}"));

        assertTrue(client.search(QUERY, statuses::add).isEmpty());

        assertTrue(statuses.stream().anyMatch(s -> s.startsWith("[ERR] Request failed during secondary")));
        assertEquals(60 + 120, totalSleptSeconds());
    }

    // =========================================================================
    // Non-retryable failures
    // =========================================================================

    @Test
    @DisplayName("Non-retryable status fails immediately with the status reported")
    void nonRetryableError_failsWithoutRetry() {
        server.enqueue(new MockResponse()
                .setResponseCode(404)
                .setBody("{\"message\": \"Not Found\"}"));

        GitHubRequestException ex = assertThrows(GitHubRequestException.class,
                () -> client.search(QUERY, statuses::add));

        assertEquals(404, ex.getStatusCode());
        assertEquals(1, server.getRequestCount());
        assertEquals(List.of("Error during request: 404 Not Found"), statuses);
    }

    @Test
    @DisplayName("403 that is neither primary nor secondary limit is not retried")
    void forbidden_notRetried() {
        server.enqueue(new MockResponse()
                .setResponseCode(403)
                .setHeader("X-RateLimit-Remaining", "4000")
                .setBody("{\"message\": \"Resource not accessible by integration\"}"));

        assertThrows(GitHubRequestException.class, () -> client.search(QUERY, statuses::add));
        assertEquals(1, server.getRequestCount());
        assertTrue(sleeps.isEmpty());
    }

    // =========================================================================
    // Reviews
    // =========================================================================

    @Test
    @DisplayName("fetchReviews requests the reviews sub-resource")
    void fetchReviews_success() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("[{\"user\": {\"login\": \"alice\"}, \"state\": \"APPROVED\", "
                        + "\"submitted_at\": \"2024-02-09T10:00:00Z\"}]"));

        List<JsonNode> reviews = client.fetchReviews(server.url("/repos/acme/widgets/pulls/7").toString());

        assertEquals(1, reviews.size());
        assertEquals("alice", reviews.get(0).path("user").path("login").asText());
        assertEquals("/repos/acme/widgets/pulls/7/reviews", server.takeRequest().getPath());
    }

    @Test
    @DisplayName("fetchReviews yields an empty list on error status or malformed body")
    void fetchReviews_failureIsEmpty() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"not\": \"an array\"}"));

        String url = server.url("/repos/acme/widgets/pulls/7").toString();
        assertTrue(client.fetchReviews(url).isEmpty());
        assertTrue(client.fetchReviews(url).isEmpty());
    }

    @Test
    @DisplayName("fetchReviews yields an empty list without a request for a url that is not http(s)")
    void fetchReviews_invalidUrlIsEmpty() {
        assertTrue(client.fetchReviews("not a url").isEmpty());
        assertTrue(client.fetchReviews("").isEmpty());
        assertEquals(0, server.getRequestCount());
    }

    // =========================================================================
    // Session and helpers
    // =========================================================================

    @Test
    @DisplayName("Requests after close fail fast")
    void closedSession_failsFast() {
        client.close();

        assertTrue(client.isClosed());
        assertThrows(IllegalStateException.class, () -> client.search(QUERY, statuses::add));
        assertThrows(IllegalStateException.class, () -> client.fetchReviews("http://localhost/pr"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    @DisplayName("sleepReporting sleeps in slices of at most five seconds")
    void sleepReporting_slices() throws Exception {
        client.sleepReporting(12, statuses::add, "%d left");

        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(2)), sleeps);
        assertEquals(List.of("12 left", "7 left", "2 left"), statuses);
    }

    @Test
    @DisplayName("message falls back to the raw body when it is not JSON")
    void message_rawBody() {
        var response = new GitHubSearchClient.ApiResponse(500, "  upstream timeout ", null, null);

        assertEquals("upstream timeout", client.message(response));
    }
}
