package com.repopulse.syncer.config;

import com.repopulse.syncer.client.GitHubApiClient;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Environment variables win over
 * the .env file. Validates all variables on startup and reports every
 * problem at once.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String DATABASE_URL = "DATABASE_URL";
    static final String DATABASE_USER = "DATABASE_USER";
    static final String DATABASE_PASSWORD = "DATABASE_PASSWORD";
    static final String GITHUB_TOKEN = "GITHUB_TOKEN";
    static final String GITHUB_API_URL = "GITHUB_API_URL";
    static final String GITHUB_MAX_RETRIES = "GITHUB_MAX_RETRIES";
    static final String SKIP_RANK_UPDATE = "SKIP_RANK_UPDATE";
    static final String SKIP_REPO_UPDATE = "SKIP_REPO_UPDATE";
    static final String UPDATE_MIN_ID = "UPDATE_MIN_ID";
    static final String UPDATE_MAX_ID = "UPDATE_MAX_ID";
    static final String NEW_REPO_LIMIT = "NEW_REPO_LIMIT";
    static final String NEW_REPO_SINCE = "NEW_REPO_SINCE";
    static final String SYNC_WORKERS = "SYNC_WORKERS";

    private final String databaseUrl;
    private final String databaseUser;
    private final String databasePassword;
    private final String githubToken;
    private final String githubApiUrl;
    private final int githubMaxRetries;
    private final SyncOptions syncOptions;

    public AppConfig() {
        this(dotenvLookup(Dotenv.configure().ignoreIfMissing().load()));

        logger.info("Configuration loaded: database={}, githubToken={}, options={}",
                redact(databaseUrl), githubToken != null ? "set" : "not set", syncOptions);
    }

    /**
     * Constructor for testing. Reads values from the given map only.
     */
    public AppConfig(Map<String, String> values) {
        this(values::get);
    }

    private AppConfig(Function<String, String> lookup) {
        StringBuilder problems = new StringBuilder();

        this.databaseUrl = blankToNull(lookup.apply(DATABASE_URL));
        if (databaseUrl == null) {
            problems.append("Missing required environment variable ").append(DATABASE_URL).append("; ");
        }
        this.databaseUser = blankToNull(lookup.apply(DATABASE_USER));
        this.databasePassword = blankToNull(lookup.apply(DATABASE_PASSWORD));
        this.githubToken = blankToNull(lookup.apply(GITHUB_TOKEN));

        String apiUrl = blankToNull(lookup.apply(GITHUB_API_URL));
        this.githubApiUrl = apiUrl != null ? apiUrl : GitHubApiClient.DEFAULT_BASE_URL;
        long retries = parseLong(lookup, GITHUB_MAX_RETRIES, 0, problems);
        if (retries > 10) {
            problems.append(GITHUB_MAX_RETRIES).append(" must not exceed 10; ");
        }
        this.githubMaxRetries = (int) Math.min(retries, 10);

        boolean skipRank = parseBoolean(lookup, SKIP_RANK_UPDATE, problems);
        boolean skipRepo = parseBoolean(lookup, SKIP_REPO_UPDATE, problems);
        long minId = parseLong(lookup, UPDATE_MIN_ID, 0, problems);
        long maxId = parseLong(lookup, UPDATE_MAX_ID, Long.MAX_VALUE, problems);
        long limit = parseLong(lookup, NEW_REPO_LIMIT, Long.MAX_VALUE, problems);
        long since = parseLong(lookup, NEW_REPO_SINCE, SyncOptions.DEFAULT_NEW_REPO_SINCE, problems);
        long workers = parseLong(lookup, SYNC_WORKERS, 1, problems);

        if (minId > maxId) {
            problems.append(UPDATE_MIN_ID).append(" must not exceed ").append(UPDATE_MAX_ID).append("; ");
        }
        if (workers < 1 || workers > 64) {
            problems.append(SYNC_WORKERS).append(" must be between 1 and 64; ");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid configuration: " + problems.toString().trim());
        }

        this.syncOptions = new SyncOptions(skipRank, skipRepo, minId, maxId, limit, since, (int) workers);
    }

    private static Function<String, String> dotenvLookup(Dotenv dotenv) {
        return key -> {
            String envValue = System.getenv(key);
            if (envValue != null && !envValue.isBlank()) {
                return envValue;
            }
            return dotenv.get(key);
        };
    }

    /**
     * Parses a non-negative integer variable, falling back to {@code defaultValue} when unset.
     */
    private static long parseLong(Function<String, String> lookup, String key, long defaultValue,
                                  StringBuilder problems) {
        String raw = blankToNull(lookup.apply(key));
        if (raw == null) {
            return defaultValue;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < 0) {
                problems.append(key).append(" must not be negative; ");
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            problems.append(key).append(" is not an integer: ").append(raw).append("; ");
            return defaultValue;
        }
    }

    private static boolean parseBoolean(Function<String, String> lookup, String key, StringBuilder problems) {
        String raw = blankToNull(lookup.apply(key));
        if (raw == null) {
            return false;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes":
                return true;
            case "false", "0", "no":
                return false;
            default:
                problems.append(key).append(" is not a boolean: ").append(raw).append("; ");
                return false;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Strips credentials embedded in a JDBC URL query for logging.
     */
    static String redact(String url) {
        if (url == null) {
            return null;
        }
        return url.replaceAll("(?i)(password=)[^&;]*", "$1REDACTED");
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public String getDatabaseUser() {
        return databaseUser;
    }

    public String getDatabasePassword() {
        return databasePassword;
    }

    /**
     * @return the GitHub token, or {@code null} for unauthenticated access
     */
    public String getGithubToken() {
        return githubToken;
    }

    public String getGithubApiUrl() {
        return githubApiUrl;
    }

    public int getGithubMaxRetries() {
        return githubMaxRetries;
    }

    public SyncOptions getSyncOptions() {
        return syncOptions;
    }
}
