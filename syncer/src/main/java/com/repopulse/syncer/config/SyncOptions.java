package com.repopulse.syncer.config;

/**
 * Per-run switches of the synchronizer.
 *
 * @param skipRankUpdate   leave the rank snapshot untouched
 * @param skipRepoUpdate   do not refresh stored repositories
 * @param updateMinId      smallest internal id refreshed (inclusive)
 * @param updateMaxId      largest internal id refreshed (inclusive)
 * @param newRepoLimit     cap on new repositories fetched, {@link Long#MAX_VALUE} for none
 * @param newRepoSince     external id after which discovery starts
 * @param workers          threads used to refresh stored repositories
 */
public record SyncOptions(
        boolean skipRankUpdate,
        boolean skipRepoUpdate,
        long updateMinId,
        long updateMaxId,
        long newRepoLimit,
        long newRepoSince,
        int workers
) {

    /**
     * Discovery floor used until a stored repository carries a larger external id.
     */
    public static final long DEFAULT_NEW_REPO_SINCE = 815_368_990L;

    public SyncOptions {
        if (updateMinId > updateMaxId) {
            throw new IllegalArgumentException(
                    "updateMinId " + updateMinId + " exceeds updateMaxId " + updateMaxId);
        }
        if (newRepoLimit < 0 || newRepoSince < 0) {
            throw new IllegalArgumentException("newRepoLimit and newRepoSince must not be negative");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
    }

    /**
     * All phases enabled, no bounds, default discovery floor, one worker.
     */
    public static SyncOptions defaults() {
        return new SyncOptions(false, false, 0, Long.MAX_VALUE, Long.MAX_VALUE, DEFAULT_NEW_REPO_SINCE, 1);
    }

    public SyncOptions withSkipRankUpdate(boolean skip) {
        return new SyncOptions(skip, skipRepoUpdate, updateMinId, updateMaxId, newRepoLimit, newRepoSince, workers);
    }

    public SyncOptions withSkipRepoUpdate(boolean skip) {
        return new SyncOptions(skipRankUpdate, skip, updateMinId, updateMaxId, newRepoLimit, newRepoSince, workers);
    }

    public SyncOptions withNewRepoLimit(long limit) {
        return new SyncOptions(skipRankUpdate, skipRepoUpdate, updateMinId, updateMaxId, limit, newRepoSince, workers);
    }

    public SyncOptions withNewRepoSince(long since) {
        return new SyncOptions(skipRankUpdate, skipRepoUpdate, updateMinId, updateMaxId, newRepoLimit, since, workers);
    }

    public SyncOptions withUpdateBounds(long minId, long maxId) {
        return new SyncOptions(skipRankUpdate, skipRepoUpdate, minId, maxId, newRepoLimit, newRepoSince, workers);
    }

    public SyncOptions withWorkers(int count) {
        return new SyncOptions(skipRankUpdate, skipRepoUpdate, updateMinId, updateMaxId, newRepoLimit, newRepoSince, count);
    }
}
