package com.prwatch.sync.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw issue-search items (with an attached {@code reviews} array) into
 * {@link PullRequest} values. Missing optional fields fall back to defaults,
 * so parsing never fails on a partial payload.
 */
public final class PullRequestParser {

    private static final Logger logger = LoggerFactory.getLogger(PullRequestParser.class);

    private PullRequestParser() {
    }

    public static List<PullRequest> parseAll(List<JsonNode> items) {
        List<PullRequest> pullRequests = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            parse(item).ifPresent(pullRequests::add);
        }
        return pullRequests;
    }

    /**
     * Parses one search item. Items that are not objects, or that carry no
     * {@code html_url}, yield empty since the url is the pull request's identity.
     */
    public static Optional<PullRequest> parse(JsonNode item) {
        if (item == null || !item.isObject()) {
            return Optional.empty();
        }
        String url = item.path("html_url").asText("");
        if (url.isBlank()) {
            logger.debug("Skipping search item without html_url: {}", item.path("title").asText(""));
            return Optional.empty();
        }

        return Optional.of(new PullRequest(
                item.path("title").asText(""),
                item.path("user").path("login").asText(""),
                url,
                item.path("draft").asBoolean(false),
                repositoryName(item.path("repository_url").asText("")),
                parseInstant(item.path("created_at")),
                parseReviews(item.path("reviews"))));
    }

    static List<Review> parseReviews(JsonNode reviewsNode) {
        if (!reviewsNode.isArray()) {
            return List.of();
        }
        List<Review> reviews = new ArrayList<>();
        for (JsonNode node : reviewsNode) {
            Optional<ReviewState> state = ReviewState.fromApi(node.path("state").asText(null));
            if (state.isEmpty()) {
                continue;
            }
            reviews.add(new Review(
                    node.path("user").path("login").asText(""),
                    state.get(),
                    parseInstant(node.path("submitted_at"))));
        }
        return reviews;
    }

    /**
     * Last path segment of a repository api url,
     * e.g. {@code https://api.github.com/repos/octo/widgets -> widgets}.
     */
    static String repositoryName(String repositoryUrl) {
        if (repositoryUrl.isEmpty()) {
            return "";
        }
        String trimmed = repositoryUrl.endsWith("/")
                ? repositoryUrl.substring(0, repositoryUrl.length() - 1)
                : repositoryUrl;
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    private static Instant parseInstant(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable timestamp '{}'", node.asText());
            return null;
        }
    }
}
