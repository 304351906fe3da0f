package com.prwatch.sync.orchestrator;

import com.prwatch.sync.cache.CacheWriteException;
import com.prwatch.sync.cache.PullRequestCache;
import com.prwatch.sync.client.GitHubSearchClient;
import com.prwatch.sync.config.AppConfig;
import com.prwatch.sync.query.SearchQueryBuilder;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for pr-watch.
 * Loads configuration, prepares the cache, shows cached state, then runs sync
 * cycles on startup and, if configured, on a fixed refresh interval.
 *
 * <p>Usage:
 * <pre>
 *   java -jar pr-watch-sync.jar          # keep refreshing every REFRESH_INTERVAL_MINUTES
 *   java -jar pr-watch-sync.jar --once   # one cycle, exit code 1 if any subject failed
 * </pre>
 */
public class SyncApp {

    private static final Logger logger = LoggerFactory.getLogger(SyncApp.class);

    public static void main(String[] args) {
        boolean once = parseOnce(args);
        logger.info("Starting pr-watch (mode: {})", once ? "ONCE" : "WATCH");

        try {
            AppConfig config = new AppConfig();
            PullRequestCache cache = openCache(config);

            TrackedSubjects subjects = new TrackedSubjects(
                    config.getGithubUsernames(), config.getGithubMe(), config.getGithubTeam());
            SearchQueryBuilder queries = new SearchQueryBuilder(config.getGithubOrg(), config.getDaysBack());
            OkHttpClient httpClient = GitHubSearchClient.defaultHttpClient();

            SyncOrchestrator orchestrator = new SyncOrchestrator(subjects, queries,
                    () -> new GitHubSearchClient(config.getGithubToken(), GitHubSearchClient.DEFAULT_BASE_URL,
                            httpClient),
                    cache, new LoggingNotificationSink(config.getGithubMe()));
            orchestrator.seedFromCache();

            if (once) {
                Optional<SyncSummary> summary = orchestrator.runCycle();
                boolean failed = summary.map(SyncSummary::hasFailures).orElse(true);
                logger.info("pr-watch finished {}.", failed ? "with failures" : "successfully");
                System.exit(failed ? 1 : 0);
            }

            if (config.isFetchOnStartup()) {
                orchestrator.runCycle();
            }

            int interval = config.getRefreshIntervalMinutes();
            if (interval <= 0) {
                logger.info("No refresh interval configured, exiting.");
                System.exit(0);
            }
            watch(orchestrator, interval);

        } catch (Exception e) {
            logger.error("Fatal error in pr-watch", e);
            System.exit(1);
        }
    }

    static boolean parseOnce(String[] args) {
        for (String arg : args) {
            if ("--once".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Opens the cache and purges expired entries. Caching is disabled when no
     * file is configured or its directory does not exist.
     */
    static PullRequestCache openCache(AppConfig config) {
        Path file = config.getCacheFile();
        if (file == null) {
            logger.info("CACHE_FILE not set, caching disabled");
            return null;
        }
        Path dir = file.toAbsolutePath().getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            logger.warn("Cache directory {} does not exist, caching disabled", dir);
            return null;
        }

        PullRequestCache cache = PullRequestCache.open(file);
        try {
            cache.cleanup(config.getCacheRetention());
        } catch (CacheWriteException e) {
            logger.error("Cache cleanup could not be persisted, continuing with in-memory cache", e);
        }
        return cache;
    }

    /**
     * Runs cycles on one scheduler thread, so requests stay sequential. A tick
     * that arrives while a cycle is still running is skipped by the orchestrator.
     */
    private static void watch(SyncOrchestrator orchestrator, int intervalMinutes) throws InterruptedException {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "pr-watch-sync");
            thread.setDaemon(false);
            return thread;
        });
        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdownNow, "pr-watch-shutdown"));

        logger.info("Refreshing every {} minutes", intervalMinutes);
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                orchestrator.runCycle();
            } catch (RuntimeException e) {
                logger.error("Sync cycle failed", e);
            }
        }, intervalMinutes, intervalMinutes, TimeUnit.MINUTES);

        scheduler.awaitTermination(Long.MAX_VALUE, TimeUnit.DAYS);
    }
}
