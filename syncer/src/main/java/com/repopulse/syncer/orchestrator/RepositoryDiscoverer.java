package com.repopulse.syncer.orchestrator;

import com.repopulse.syncer.client.FailFastSequence;
import com.repopulse.syncer.client.GitHubApiClient;
import com.repopulse.syncer.client.RemoteFetchException;
import com.repopulse.syncer.loader.InsertResult;
import com.repopulse.syncer.loader.RepositoryStore;
import com.repopulse.syncer.model.DailyActivity;
import com.repopulse.syncer.model.RepositorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Ingests repositories from the public listing that are not stored yet,
 * together with their full commit history.
 */
public class RepositoryDiscoverer {

    private static final Logger logger = LoggerFactory.getLogger(RepositoryDiscoverer.class);

    private final GitHubApiClient client;
    private final RepositoryStore store;

    public RepositoryDiscoverer(GitHubApiClient client, RepositoryStore store) {
        this.client = client;
        this.store = store;
    }

    /**
     * Walks the listing after {@code afterId}, skipping names in {@code handled}
     * and adding every ingested name to it.
     *
     * @param results receives one result per repository attempted
     * @return {@code true} if the listing ended on a failure
     */
    public boolean discover(long afterId, long limit, Set<String> handled, List<SyncResult> results)
            throws InterruptedException {
        logger.info("Discovering new repositories after id {} (limit {})", afterId,
                limit == Long.MAX_VALUE ? "none" : limit);

        FailFastSequence<RepositorySnapshot> candidates = client.fetchNewRepositories(afterId, limit, handled);
        while (candidates.hasNext()) {
            results.add(ingest(candidates.next(), handled));
        }

        if (candidates.failure().isPresent()) {
            logger.warn("Repository listing stopped early: {}", candidates.failure().get().getMessage());
            return true;
        }
        return false;
    }

    private SyncResult ingest(RepositorySnapshot snapshot, Set<String> handled)
            throws InterruptedException {
        long start = System.currentTimeMillis();
        String fullName = snapshot.fullName();

        List<DailyActivity> activity;
        try {
            activity = client.fetchCommitActivity(snapshot.owner(), snapshot.name(),
                    RepositoryUpdater.NO_ACTIVITY_SINCE).toListOrThrow();
        } catch (RemoteFetchException e) {
            logger.warn("Failed to fetch activity for new repository {}: {}", fullName, e.getMessage());
            return SyncResult.failure(SyncOrchestrator.PHASE_DISCOVER, fullName, e.getMessage(),
                    System.currentTimeMillis() - start);
        }

        int written = store.inTransaction(tx -> {
            InsertResult inserted = tx.insertRepositoryIfAbsent(snapshot);
            if (!inserted.wasInserted()) {
                logger.info("Repository {} already stored, skipping its activity", fullName);
                return 0;
            }
            int rows = 1;
            for (DailyActivity day : activity) {
                if (tx.upsertActivity(inserted.repoId(), day)) {
                    rows++;
                }
            }
            return rows;
        });
        handled.add(fullName);

        if (written > 0) {
            logger.info("Added repository https://github.com/{} ({} activity days)", fullName, written - 1);
        }
        return SyncResult.success(SyncOrchestrator.PHASE_DISCOVER, fullName, written,
                System.currentTimeMillis() - start);
    }
}
