package com.repopulse.syncer.orchestrator;

import com.repopulse.syncer.loader.RepositoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Records every stored repository's current star ranking as its previous place.
 */
public class RankSnapshotter {

    private static final Logger logger = LoggerFactory.getLogger(RankSnapshotter.class);

    private final RepositoryStore store;

    public RankSnapshotter(RepositoryStore store) {
        this.store = store;
    }

    public SyncResult snapshot() {
        long start = System.currentTimeMillis();
        logger.info("Snapshotting repository ranks...");
        int written = store.snapshotRanks();
        return SyncResult.success(SyncOrchestrator.PHASE_RANKS, "all", written,
                System.currentTimeMillis() - start);
    }
}
