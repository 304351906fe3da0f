package com.prwatch.sync.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Validates required and
 * numeric variables on startup.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final int DEFAULT_DAYS_BACK = 14;
    static final int DEFAULT_CACHE_RETENTION_DAYS = 10;

    private final String githubToken;
    private final String githubOrg;
    private final List<String> githubUsernames;
    private final String githubMe;
    private final String githubTeam;
    private final int daysBack;
    private final Path cacheFile;
    private final int cacheRetentionDays;
    private final boolean fetchOnStartup;
    private final int refreshIntervalMinutes;

    public AppConfig() {
        this(environmentWithDotenvFallback());
        logger.info("Configuration loaded: usernames={}, org={}, me={}, team={}, daysBack={}, cacheFile={}",
                githubUsernames, githubOrg, githubMe, githubTeam, daysBack, cacheFile);
    }

    /**
     * Constructor for testing: resolves every key through {@code source}.
     */
    public AppConfig(Function<String, String> source) {
        List<String> problems = new ArrayList<>();

        this.githubToken = trimToNull(source.apply("GITHUB_TOKEN"));
        this.githubOrg = trimToNull(source.apply("GITHUB_ORG"));
        this.githubUsernames = parseList(source.apply("GITHUB_USERNAMES"));
        this.githubMe = trimToNull(source.apply("GITHUB_ME"));
        this.githubTeam = trimToNull(source.apply("GITHUB_TEAM"));
        this.daysBack = parseInt(source, "DAYS_BACK", DEFAULT_DAYS_BACK, 1, problems);
        String cachePath = trimToNull(source.apply("CACHE_FILE"));
        this.cacheFile = cachePath != null ? Path.of(cachePath) : null;
        this.cacheRetentionDays = parseInt(source, "CACHE_RETENTION_DAYS", DEFAULT_CACHE_RETENTION_DAYS, 1, problems);
        this.fetchOnStartup = parseBoolean(source, "FETCH_ON_STARTUP", true, problems);
        this.refreshIntervalMinutes = parseInt(source, "REFRESH_INTERVAL_MINUTES", 0, 0, problems);

        validate(problems);
    }

    private void validate(List<String> problems) {
        StringBuilder missing = new StringBuilder();
        if (githubToken == null) missing.append("GITHUB_TOKEN ");
        if (githubUsernames.isEmpty() && githubMe == null && githubTeam == null) {
            missing.append("GITHUB_USERNAMES|GITHUB_ME|GITHUB_TEAM ");
        }

        if (!missing.isEmpty()) {
            problems.add(0, "Missing required environment variables: " + missing.toString().trim());
        }
        if (!problems.isEmpty()) {
            throw new IllegalStateException(String.join("; ", problems));
        }
    }

    private static Function<String, String> environmentWithDotenvFallback() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return key -> resolve(dotenv, key);
    }

    private static String resolve(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return dotenv.get(key);
    }

    private static int parseInt(Function<String, String> source, String key, int defaultValue,
                                int min, List<String> problems) {
        String value = trimToNull(source.apply(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < min) {
                problems.add(key + " must be at least " + min + " but was " + parsed);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            problems.add(key + " is not a number: " + value);
            return defaultValue;
        }
    }

    private static boolean parseBoolean(Function<String, String> source, String key, boolean defaultValue,
                                        List<String> problems) {
        String value = trimToNull(source.apply(key));
        if (value == null) {
            return defaultValue;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1":
                return true;
            case "false", "no", "0":
                return false;
            default:
                problems.add(key + " is not a boolean: " + value);
                return defaultValue;
        }
    }

    private static List<String> parseList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public String getGithubToken() {
        return githubToken;
    }

    /** Organization filter, or {@code null} to search everywhere. */
    public String getGithubOrg() {
        return githubOrg;
    }

    public List<String> getGithubUsernames() {
        return githubUsernames;
    }

    public String getGithubMe() {
        return githubMe;
    }

    public String getGithubTeam() {
        return githubTeam;
    }

    public int getDaysBack() {
        return daysBack;
    }

    /** Cache file location, or {@code null} when caching is disabled. */
    public Path getCacheFile() {
        return cacheFile;
    }

    public Duration getCacheRetention() {
        return Duration.ofDays(cacheRetentionDays);
    }

    public boolean isFetchOnStartup() {
        return fetchOnStartup;
    }

    public int getRefreshIntervalMinutes() {
        return refreshIntervalMinutes;
    }
}
