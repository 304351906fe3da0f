package com.prwatch.sync.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prwatch.sync.client.GitHubSearchClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Attaches reviews to raw search items, one request per pull request, in the
 * order the search returned them. The reviews land in a {@code reviews} array
 * on the item itself so they are cached together with it.
 */
public class ReviewCollector {

    private static final Logger logger = LoggerFactory.getLogger(ReviewCollector.class);

    static final String REVIEWS_FIELD = "reviews";

    /**
     * @return number of reviews attached across all items
     */
    public int attachReviews(GitHubSearchClient client, String subjectKey, List<JsonNode> items) {
        int totalReviews = 0;

        for (JsonNode item : items) {
            if (!(item instanceof ObjectNode pr)) {
                continue;
            }
            String pullRequestApiUrl = pr.path("pull_request").path("url").asText("");
            ArrayNode reviews = JsonNodeFactory.instance.arrayNode();

            if (pullRequestApiUrl.isBlank()) {
                logger.debug("Search item {} has no pull_request.url, skipping reviews",
                        pr.path("html_url").asText("?"));
            } else {
                reviews.addAll(client.fetchReviews(pullRequestApiUrl));
            }

            pr.set(REVIEWS_FIELD, reviews);
            totalReviews += reviews.size();
        }

        logger.info("Attached {} reviews for {} across {} PRs", totalReviews, subjectKey, items.size());
        return totalReviews;
    }
}
