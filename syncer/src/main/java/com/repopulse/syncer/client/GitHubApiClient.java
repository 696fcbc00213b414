package com.repopulse.syncer.client;

import com.repopulse.syncer.activity.ActivityAggregator;
import com.repopulse.syncer.model.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub REST API client for repository metadata, the public repository listing
 * and commit history.
 *
 * <p>Sequences returned by this client are lazy and fail fast: the first
 * request failure ends the sequence and is reported through
 * {@link FailFastSequence#failure()}. Throttling responses (429/503) are only
 * retried when the client was built with {@code maxRetries > 0}.</p>
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe, and this class holds no mutable per-request state.
 * Returned sequences are not.</p>
 */
public class GitHubApiClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.github.com";
    private static final int RATE_LIMIT_THRESHOLD = 1;
    private static final long INITIAL_BACKOFF_MS = 1_000;
    private static final long MAX_BACKOFF_MS = 60_000;
    static final int PER_PAGE = 100;

    static final Pattern LINK_LAST_PATTERN =
            Pattern.compile("<([^>]+)>;\\s*rel=\"last\"");

    private static final TypeReference<List<Commit>> COMMIT_PAGE = new TypeReference<>() {};
    private static final TypeReference<List<RepositoryListing>> LISTING_PAGE = new TypeReference<>() {};

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final String token;
    private final int maxRetries;

    /**
     * @param token      bearer token, or {@code null} for unauthenticated requests
     * @param baseUrl    API root, e.g. {@value #DEFAULT_BASE_URL}
     * @param maxRetries retries on 429/503 before giving up; 0 fails on the first one
     */
    public GitHubApiClient(String token, String baseUrl, int maxRetries, OkHttpClient httpClient) {
        this.token = token;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.maxRetries = maxRetries;
        this.httpClient = httpClient;
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
    // Public API endpoint methods
    // -------------------------------------------------------------------------

    /**
     * Fetches metadata of a single repository.
     * Endpoint: GET /repos/{owner}/{repo}
     *
     * <p>The returned snapshot carries the requested owner and name, not the
     * ones in the body, so a renamed repository keeps matching its stored row.</p>
     *
     * @throws RemoteFetchException on transport errors or an unexpected payload
     */
    public RepositorySnapshot fetchRepository(String owner, String name)
            throws RemoteFetchException, InterruptedException {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("repos")
                .addPathSegment(owner)
                .addPathSegment(name)
                .build();
        String json = executePageWithRetry(buildRequest(url)).body();
        Repository repository = parse(json, Repository.class, url);
        return toSnapshot(repository, owner, name);
    }

    /**
     * Lists public repositories created after {@code afterId}, ascending by id.
     * Endpoint: GET /repositories?since={id} (the {@code since} id itself is excluded)
     *
     * <p>Entries whose {@code owner/name} is in {@code exclude} are skipped and
     * do not count against {@code limit}. An entry whose metadata request fails
     * is skipped as well. A failed listing page ends the sequence.</p>
     *
     * @param limit maximum number of snapshots to yield, {@link Long#MAX_VALUE} for no limit
     */
    public FailFastSequence<RepositorySnapshot> fetchNewRepositories(long afterId, long limit,
                                                                     Set<String> exclude) {
        return new FailFastSequence<>() {

            private long lastId = afterId;
            private long yielded;
            private Iterator<RepositoryListing> page = Collections.emptyIterator();
            private boolean exhausted;

            @Override
            protected RepositorySnapshot computeNext() throws RemoteFetchException, InterruptedException {
                while (yielded < limit) {
                    if (!page.hasNext()) {
                        if (exhausted) {
                            return null;
                        }
                        List<RepositoryListing> listing = fetchListingPage(lastId);
                        if (listing.isEmpty()) {
                            exhausted = true;
                            return null;
                        }
                        page = listing.iterator();
                        continue;
                    }

                    RepositoryListing entry = page.next();
                    if (entry.id() == null) {
                        logger.warn("Skipping listing entry {} without an id", entry.fullName());
                        continue;
                    }
                    lastId = entry.id();
                    if (entry.owner() == null || entry.owner().login() == null || entry.name() == null) {
                        logger.warn("Skipping listing entry {} without owner or name", entry.id());
                        continue;
                    }
                    if (exclude.contains(entry.fullName())) {
                        logger.debug("Skipping already handled repository {}", entry.fullName());
                        continue;
                    }

                    try {
                        RepositorySnapshot snapshot = fetchRepository(entry.owner().login(), entry.name());
                        yielded++;
                        return snapshot;
                    } catch (RemoteFetchException e) {
                        logger.warn("Skipping repository {}: {}", entry.fullName(), e.getMessage());
                    }
                }
                return null;
            }
        };
    }

    /**
     * Fetches commits since {@code since} (inclusive) and aggregates them into
     * one {@link DailyActivity} per day, newest day first.
     * Endpoint: GET /repos/{owner}/{repo}/commits?since={date}&amp;per_page={n}&amp;page={p}
     *
     * <p>A first request with {@code per_page=1} learns the commit total from
     * the {@code rel="last"} link. No {@code Link} header on that response means
     * there is nothing to fetch.</p>
     */
    public FailFastSequence<DailyActivity> fetchCommitActivity(String owner, String name, LocalDate since) {
        return ActivityAggregator.aggregate(fetchCommits(owner, name, since));
    }

    FailFastSequence<CommitEntry> fetchCommits(String owner, String name, LocalDate since) {
        return new FailFastSequence<>() {

            private int pageCount = -1;
            private int page;
            private Iterator<Commit> current = Collections.emptyIterator();

            @Override
            protected CommitEntry computeNext() throws RemoteFetchException, InterruptedException {
                if (pageCount < 0) {
                    pageCount = countCommitPages(owner, name, since);
                    logger.debug("{}/{} has {} commit page(s) since {}", owner, name, pageCount, since);
                }
                while (true) {
                    while (current.hasNext()) {
                        CommitEntry entry = toCommitEntry(current.next());
                        if (entry != null) {
                            return entry;
                        }
                    }
                    if (page >= pageCount) {
                        return null;
                    }
                    page++;
                    HttpUrl url = commitsUrl(owner, name, since, PER_PAGE, page);
                    String json = executePageWithRetry(buildRequest(url)).body();
                    List<Commit> commits = parse(json, COMMIT_PAGE, url);
                    current = commits.iterator();
                }
            }
        };
    }

    // -------------------------------------------------------------------------
    // Endpoint helpers
    // -------------------------------------------------------------------------

    List<RepositoryListing> fetchListingPage(long since) throws RemoteFetchException, InterruptedException {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("repositories")
                .addQueryParameter("since", String.valueOf(since))
                .build();
        String json = executePageWithRetry(buildRequest(url)).body();
        return parse(json, LISTING_PAGE, url);
    }

    /**
     * Returns the number of 100-commit pages to request.
     */
    int countCommitPages(String owner, String name, LocalDate since)
            throws RemoteFetchException, InterruptedException {
        HttpUrl url = commitsUrl(owner, name, since, 1, 0);
        PageResult countPage = executePageWithRetry(buildRequest(url));
        if (countPage.linkHeader() == null) {
            return 0;
        }

        OptionalInt lastPage = parseLastPage(countPage.linkHeader());
        int total = lastPage.isPresent()
                ? lastPage.getAsInt()
                : parse(countPage.body(), COMMIT_PAGE, url).size();
        return (total + PER_PAGE - 1) / PER_PAGE;
    }

    private HttpUrl commitsUrl(String owner, String name, LocalDate since, int perPage, int page) {
        HttpUrl.Builder builder = baseUrl.newBuilder()
                .addPathSegment("repos")
                .addPathSegment(owner)
                .addPathSegment(name)
                .addPathSegment("commits")
                .addQueryParameter("since", since + "T00:00:00Z")
                .addQueryParameter("per_page", String.valueOf(perPage));
        if (page > 0) {
            builder.addQueryParameter("page", String.valueOf(page));
        }
        return builder.build();
    }

    // -------------------------------------------------------------------------
    // Payload mapping
    // -------------------------------------------------------------------------

    static RepositorySnapshot toSnapshot(Repository repository, String owner, String name)
            throws RemoteFetchException {
        if (repository == null || repository.id() == null) {
            throw RemoteFetchException.validation("Repository " + owner + "/" + name + " has no id");
        }
        requireLength("owner", owner, RepositorySnapshot.MAX_OWNER_LENGTH);
        requireLength("name", name, RepositorySnapshot.MAX_NAME_LENGTH);
        if (repository.language() != null) {
            requireLength("language", repository.language(), RepositorySnapshot.MAX_LANGUAGE_LENGTH);
        }
        return new RepositorySnapshot(
                repository.id(),
                owner,
                name,
                requireCount("stargazers_count", repository.stargazersCount()),
                requireCount("watchers_count", repository.watchersCount()),
                requireCount("forks_count", repository.forksCount()),
                requireCount("open_issues_count", repository.openIssuesCount()),
                repository.language());
    }

    /**
     * Maps a commit to its committer date and name. Returns {@code null} for a
     * commit without a parseable committer date.
     */
    static CommitEntry toCommitEntry(Commit commit) {
        if (commit == null || commit.commit() == null || commit.commit().committer() == null) {
            return null;
        }
        Commit.CommitActor committer = commit.commit().committer();
        if (committer.date() == null || committer.date().isBlank()) {
            return null;
        }
        try {
            LocalDate date = OffsetDateTime.parse(committer.date())
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDate();
            return new CommitEntry(date, committer.name());
        } catch (DateTimeParseException e) {
            logger.debug("Dropping commit {} with unparseable date {}", commit.sha(), committer.date());
            return null;
        }
    }

    private static void requireLength(String field, String value, int max) throws RemoteFetchException {
        if (value == null || value.isEmpty() || value.length() > max) {
            throw RemoteFetchException.validation(
                    "Field " + field + " must have 1.." + max + " characters, got " + value);
        }
    }

    private static int requireCount(String field, Integer value) throws RemoteFetchException {
        if (value == null || value < 0) {
            throw RemoteFetchException.validation("Field " + field + " must be a non-negative integer, got " + value);
        }
        return value;
    }

    private <T> T parse(String json, Class<T> type, HttpUrl url) throws RemoteFetchException {
        if (json == null) {
            throw RemoteFetchException.validation("Empty body from " + url);
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw RemoteFetchException.validation("Unexpected payload from " + url, e);
        }
    }

    private <T> List<T> parse(String json, TypeReference<List<T>> typeRef, HttpUrl url)
            throws RemoteFetchException {
        if (json == null) {
            throw RemoteFetchException.validation("Empty body from " + url);
        }
        try {
            List<T> items = objectMapper.readValue(json, typeRef);
            if (items == null) {
                throw RemoteFetchException.validation("Expected an array from " + url);
            }
            return items;
        } catch (JsonProcessingException e) {
            throw RemoteFetchException.validation("Unexpected payload from " + url, e);
        }
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution with retries and rate-limit handling
    // -------------------------------------------------------------------------

    /**
     * Builds a GET request with the API headers and, when configured, bearer authentication.
     */
    Request buildRequest(HttpUrl url) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28");

        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }

        return builder.build();
    }

    /**
     * Executes a request, retrying 429/503 responses with exponential backoff
     * up to {@code maxRetries} times, and pausing proactively when the rate
     * limit is exhausted.
     */
    PageResult executePageWithRetry(Request request) throws RemoteFetchException, InterruptedException {
        long backoffMs = INITIAL_BACKOFF_MS;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                int statusCode = response.code();
                logResponse(request.url().toString(), statusCode, response);

                if (statusCode == 429 || statusCode == 503) {
                    if (attempt == maxRetries) {
                        throw new RemoteFetchException(RemoteFetchException.Kind.TRANSPORT,
                                "GitHub API throttled " + request.url() + " (status " + statusCode
                                        + " after " + attempt + " retries)", statusCode);
                    }
                    long waitMs = getRetryWaitMs(response, backoffMs);
                    logger.warn("Received {} from {}. Retrying in {}ms (attempt {}/{})",
                            statusCode, request.url(), waitMs, attempt + 1, maxRetries);
                    Thread.sleep(waitMs);
                    backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
                    continue;
                }

                handleRateLimitPause(response);

                if (statusCode < 200 || statusCode >= 300) {
                    throw new RemoteFetchException(RemoteFetchException.Kind.TRANSPORT,
                            "GitHub API error: " + statusCode + " for " + request.url(), statusCode);
                }

                ResponseBody body = response.body();
                String bodyString = body != null ? body.string() : null;
                String link = response.header("Link");
                return new PageResult(bodyString, link);
            } catch (RemoteFetchException e) {
                throw e;
            } catch (IOException e) {
                throw RemoteFetchException.transport("Request to " + request.url() + " failed: " + e.getMessage(), e);
            }
        }

        throw new RemoteFetchException(RemoteFetchException.Kind.TRANSPORT,
                "Exhausted retries for " + request.url());
    }

    // -------------------------------------------------------------------------
    // Rate limit handling
    // -------------------------------------------------------------------------

    /**
     * If the rate limit is used up, sleep until the reset time.
     */
    void handleRateLimitPause(Response response) throws InterruptedException {
        String remainingHeader = response.header("X-RateLimit-Remaining");
        String resetHeader = response.header("X-RateLimit-Reset");

        if (remainingHeader == null || resetHeader == null) {
            return;
        }

        try {
            int remaining = Integer.parseInt(remainingHeader);
            if (remaining < RATE_LIMIT_THRESHOLD) {
                long resetEpoch = Long.parseLong(resetHeader);
                long nowEpoch = Instant.now().getEpochSecond();
                long sleepSeconds = Math.max(resetEpoch - nowEpoch + 1, 1);

                logger.warn("Rate limit exhausted. Pausing for {}s until reset.", sleepSeconds);
                Thread.sleep(Duration.ofSeconds(sleepSeconds).toMillis());
            }
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed rate limit headers: remaining={}, reset={}",
                    remainingHeader, resetHeader);
        }
    }

    /**
     * Determines wait time for retries. Uses Retry-After header if present,
     * otherwise falls back to exponential backoff.
     */
    long getRetryWaitMs(Response response, long backoffMs) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                return Long.parseLong(retryAfter) * 1_000;
            } catch (NumberFormatException ignored) {
                // fall through to backoff
            }
        }
        return backoffMs;
    }

    // -------------------------------------------------------------------------
    // Pagination parsing
    // -------------------------------------------------------------------------

    /**
     * Parses the page number of the "last" link from the GitHub Link header.
     *
     * <p>Example header:
     * {@code <https://api.github.com/repos/o/r/commits?per_page=1&page=2>; rel="next",
     * <https://api.github.com/repos/o/r/commits?per_page=1&page=314>; rel="last"}
     *
     * @return the last page number, or empty if the header has no usable "last" link
     */
    static OptionalInt parseLastPage(String linkHeader) {
        if (linkHeader == null || linkHeader.isEmpty()) {
            return OptionalInt.empty();
        }
        Matcher matcher = LINK_LAST_PATTERN.matcher(linkHeader);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        HttpUrl lastUrl = HttpUrl.parse(matcher.group(1));
        String page = lastUrl != null ? lastUrl.queryParameter("page") : null;
        if (page == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(page));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void logResponse(String url, int statusCode, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.info("GitHub API {} {} | rate-limit-remaining: {}",
                statusCode, url, remaining != null ? remaining : "n/a");
    }

    // -------------------------------------------------------------------------
    // Internal result holder
    // -------------------------------------------------------------------------

    record PageResult(String body, String linkHeader) {}
}
