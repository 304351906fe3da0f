package com.prwatch.sync.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JSON file cache of fetched pull requests, one entry per subject key.
 *
 * <p>File layout:
 * <pre>
 * {
 *   "octocat": { "timestamp": "2024-02-10 12:00:00", "prs": [ ... ] },
 *   "requested:octocat": { ... }
 * }
 * </pre>
 *
 * <p>The whole map is held in memory and rewritten on every change. Writes go
 * to a temporary file that is then moved over the cache file, so a reader never
 * sees a partially written cache.</p>
 *
 * <p>Not thread-safe; the sync cycle is its only user.</p>
 */
public class PullRequestCache {

    private static final Logger logger = LoggerFactory.getLogger(PullRequestCache.class);

    static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";

    private static final TypeReference<LinkedHashMap<String, CachedPullRequests>> CACHE_TYPE =
            new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, CachedPullRequests> entries;

    private PullRequestCache(Path file, ObjectMapper objectMapper, Clock clock,
                             Map<String, CachedPullRequests> entries) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.entries = entries;
    }

    /**
     * Opens the cache stored at {@code file}. A missing or unreadable file
     * gives an empty cache; it is created on the first save.
     */
    public static PullRequestCache open(Path file) {
        return open(file, Clock.systemUTC());
    }

    public static PullRequestCache open(Path file, Clock clock) {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
        Map<String, CachedPullRequests> entries = readEntries(file, objectMapper);
        logger.info("Opened pull request cache {} with {} entries", file, entries.size());
        return new PullRequestCache(file, objectMapper, clock, entries);
    }

    private static Map<String, CachedPullRequests> readEntries(Path file, ObjectMapper objectMapper) {
        try {
            LinkedHashMap<String, CachedPullRequests> loaded =
                    objectMapper.readValue(file.toFile(), CACHE_TYPE);
            if (loaded == null) {
                return new LinkedHashMap<>();
            }
            loaded.values().removeIf(entry -> entry == null || entry.timestamp() == null);
            return loaded;
        } catch (JsonProcessingException e) {
            logger.warn("Cache file {} is malformed, starting with an empty cache: {}",
                    file, e.getOriginalMessage());
        } catch (IOException e) {
            if (Files.notExists(file)) {
                logger.debug("Cache file {} does not exist yet", file);
            } else {
                logger.warn("Cache file {} could not be read, starting with an empty cache", file, e);
            }
        }
        return new LinkedHashMap<>();
    }

    // -------------------------------------------------------------------------
    // Operations
    // -------------------------------------------------------------------------

    public Optional<CachedPullRequests> load(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Replaces the entry for {@code key} and persists the cache. The timestamp
     * is stored at second precision, the resolution of the file format, so a
     * later {@link #load} returns it without its fraction of a second.
     *
     * @throws CacheWriteException if the file could not be written; the new
     *                             entry is kept in memory regardless
     */
    public void save(String key, List<JsonNode> prs, LocalDateTime timestamp) {
        entries.put(key, new CachedPullRequests(timestamp.withNano(0), prs));
        persist();
        logger.debug("Cached {} pull requests for {}", prs.size(), key);
    }

    /**
     * Removes every entry whose timestamp lies strictly before
     * {@code now - retention}, then persists the cache.
     *
     * @return number of entries removed
     * @throws CacheWriteException if the file could not be written
     */
    public int cleanup(Duration retention) {
        LocalDateTime threshold = LocalDateTime.now(clock).minus(retention);
        int removed = 0;
        Iterator<Map.Entry<String, CachedPullRequests>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CachedPullRequests> entry = it.next();
            if (entry.getValue().timestamp().isBefore(threshold)) {
                logger.debug("Evicting cache entry {} from {}", entry.getKey(), entry.getValue().timestamp());
                it.remove();
                removed++;
            }
        }
        persist();
        logger.info("Cache cleanup removed {} entries older than {} days", removed, retention.toDays());
        return removed;
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Path getFile() {
        return file;
    }

    // -------------------------------------------------------------------------
    // Persistence
    // -------------------------------------------------------------------------

    private void persist() {
        Path target = file.toAbsolutePath();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), entries);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new CacheWriteException("Failed to write cache file " + target, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary cache file {}", tmp, e);
        }
    }
}
