package com.repopulse.syncer.orchestrator;

import com.repopulse.syncer.client.GitHubApiClient;
import com.repopulse.syncer.config.SyncOptions;
import com.repopulse.syncer.loader.RepositoryStore;
import com.repopulse.syncer.model.StoredRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Coordinates a synchronization run: rank snapshot -> refresh stored
 * repositories -> discover new repositories.
 *
 * <p>A repository that cannot be read from GitHub is logged and skipped; the
 * run goes on. Storage errors abort the run. The high-water mark is read
 * before any write so that repositories ingested during this run do not move
 * the starting point of this run's discovery.</p>
 */
public class SyncOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    static final String PHASE_RANKS = "rank_snapshot";
    static final String PHASE_UPDATE = "update";
    static final String PHASE_DISCOVER = "discover";

    private final RepositoryStore store;
    private final RankSnapshotter rankSnapshotter;
    private final RepositoryUpdater updater;
    private final RepositoryDiscoverer discoverer;

    public SyncOrchestrator(GitHubApiClient client, RepositoryStore store) {
        this(store, new RankSnapshotter(store), new RepositoryUpdater(client, store),
                new RepositoryDiscoverer(client, store));
    }

    // Visible for testing
    SyncOrchestrator(RepositoryStore store, RankSnapshotter rankSnapshotter,
                     RepositoryUpdater updater, RepositoryDiscoverer discoverer) {
        this.store = store;
        this.rankSnapshotter = rankSnapshotter;
        this.updater = updater;
        this.discoverer = discoverer;
    }

    /**
     * Runs the three phases in order.
     *
     * @return summary of all per-repository results
     * @throws org.springframework.dao.DataAccessException if the store fails;
     *         per-repository GitHub failures do not throw
     */
    public SyncSummary run(SyncOptions options) throws InterruptedException {
        Instant runStart = Instant.now();
        logger.info("Starting synchronization with {}", options);

        store.ensureSchema();
        long highWaterMark = store.findHighWaterMark().orElse(0L);
        List<SyncResult> results = new ArrayList<>();

        // Step 1: Snapshot ranks
        if (options.skipRankUpdate()) {
            logger.info("Rank snapshot skipped");
        } else {
            results.add(rankSnapshotter.snapshot());
        }

        // Every stored name counts as handled, whatever the update bounds.
        Set<String> handled = ConcurrentHashMap.newKeySet();
        handled.addAll(store.findAllFullNames());

        // Step 2: Refresh stored repositories
        if (options.skipRepoUpdate()) {
            logger.info("Repository refresh skipped");
        } else {
            List<StoredRepository> repositories =
                    store.findRepositories(options.updateMinId(), options.updateMaxId());
            logger.info("Refreshing {} stored repositories with {} worker(s)",
                    repositories.size(), options.workers());
            if (options.workers() > 1) {
                updateInParallel(repositories, options.workers(), results);
            } else {
                for (StoredRepository repository : repositories) {
                    results.add(updater.update(repository));
                }
            }
        }

        // Step 3: Discover new repositories
        long afterId = Math.max(options.newRepoSince(), highWaterMark);
        boolean discoveryStopped = discoverer.discover(afterId, options.newRepoLimit(), handled, results);

        SyncSummary summary = new SyncSummary(results, discoveryStopped, elapsed(runStart));
        logSummary(summary);
        return summary;
    }

    private void updateInParallel(List<StoredRepository> repositories, int workers, List<SyncResult> results)
            throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<SyncResult>> futures = new ArrayList<>(repositories.size());
            for (StoredRepository repository : repositories) {
                futures.add(pool.submit(() -> updater.update(repository)));
            }
            for (Future<SyncResult> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException runtimeException) {
                        throw runtimeException;
                    }
                    throw new IllegalStateException("Repository refresh failed", cause);
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void logSummary(SyncSummary summary) {
        logger.info("=== Synchronization Summary ===");
        logger.info("Total duration: {}ms", summary.totalDurationMs());
        logger.info("Total results: {} ({} successful, {} failed)",
                summary.results().size(), summary.successCount(), summary.failureCount());

        for (String phase : List.of(PHASE_RANKS, PHASE_UPDATE, PHASE_DISCOVER)) {
            logger.info("  {}: rows written={}, successes={}, failures={}",
                    phase, summary.rowsWrittenForPhase(phase),
                    summary.countForPhase(phase, true), summary.countForPhase(phase, false));
        }

        if (summary.discoveryStopped()) {
            logger.warn("Discovery stopped on a listing failure; the next run resumes from the stored high-water mark");
        }
        if (summary.hasFailures()) {
            logger.warn("Synchronization completed with {} failures", summary.failureCount());
            summary.results().stream()
                    .filter(r -> !r.success())
                    .forEach(r -> logger.warn("  FAILED: {} [{}]: {}",
                            r.phase(), r.repoFullName(), r.errorMessage()));
        }
    }

    private long elapsed(Instant start) {
        return Instant.now().toEpochMilli() - start.toEpochMilli();
    }
}
