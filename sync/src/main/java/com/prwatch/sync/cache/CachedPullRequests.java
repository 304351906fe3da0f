package com.prwatch.sync.cache;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One cache entry: the raw search items of a subject as of its last
 * successful fetch. Items are kept as fetched, reviews attached, and are
 * normalized only when read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"timestamp", "prs"})
public record CachedPullRequests(
        @JsonProperty("timestamp")
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = PullRequestCache.TIMESTAMP_PATTERN)
        LocalDateTime timestamp,
        @JsonProperty("prs") List<JsonNode> prs
) {

    public CachedPullRequests {
        prs = prs != null ? List.copyOf(prs) : List.of();
    }
}
