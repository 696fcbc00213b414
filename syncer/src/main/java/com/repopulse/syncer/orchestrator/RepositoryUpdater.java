package com.repopulse.syncer.orchestrator;

import com.repopulse.syncer.client.GitHubApiClient;
import com.repopulse.syncer.client.RemoteFetchException;
import com.repopulse.syncer.loader.RepositoryStore;
import com.repopulse.syncer.model.DailyActivity;
import com.repopulse.syncer.model.RepositorySnapshot;
import com.repopulse.syncer.model.StoredRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;

/**
 * Refreshes one stored repository: its attributes and the activity since its
 * latest stored day.
 *
 * <p>Everything is fetched before the transaction opens. If any request
 * fails, nothing is written for the repository and it is retried in full on
 * the next run.</p>
 */
public class RepositoryUpdater {

    private static final Logger logger = LoggerFactory.getLogger(RepositoryUpdater.class);

    static final LocalDate NO_ACTIVITY_SINCE = LocalDate.EPOCH;

    private final GitHubApiClient client;
    private final RepositoryStore store;

    public RepositoryUpdater(GitHubApiClient client, RepositoryStore store) {
        this.client = client;
        this.store = store;
    }

    /**
     * @return a failed result if GitHub could not be read; storage errors propagate
     */
    public SyncResult update(StoredRepository repository) throws InterruptedException {
        long start = System.currentTimeMillis();
        String fullName = repository.fullName();

        RepositorySnapshot snapshot;
        List<DailyActivity> activity;
        try {
            snapshot = client.fetchRepository(repository.owner(), repository.name());
            // The latest stored day may be incomplete, so it is fetched again.
            LocalDate since = repository.lastActivityDate() != null
                    ? repository.lastActivityDate()
                    : NO_ACTIVITY_SINCE;
            activity = client.fetchCommitActivity(repository.owner(), repository.name(), since)
                    .toListOrThrow();
        } catch (RemoteFetchException e) {
            logger.warn("Failed to refresh repository {} {}: {}", repository.id(), fullName, e.getMessage());
            return SyncResult.failure(SyncOrchestrator.PHASE_UPDATE, fullName, e.getMessage(),
                    System.currentTimeMillis() - start);
        }

        int written = store.inTransaction(tx -> {
            int rows = tx.updateRepositoryIfChanged(repository.id(), snapshot) ? 1 : 0;
            for (DailyActivity day : activity) {
                if (tx.upsertActivity(repository.id(), day)) {
                    rows++;
                }
            }
            return rows;
        });

        logger.info("Updated repository {} https://github.com/{} ({} rows written)",
                repository.id(), fullName, written);
        return SyncResult.success(SyncOrchestrator.PHASE_UPDATE, fullName, written,
                System.currentTimeMillis() - start);
    }
}
