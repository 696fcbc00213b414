package com.repopulse.syncer.loader;

import com.repopulse.syncer.model.DailyActivity;
import com.repopulse.syncer.model.RepositorySnapshot;

/**
 * Write primitives available inside one repository's unit of work.
 * Each returns whether a row was actually written, and each is idempotent
 * under repeated identical input. Storage failures surface as Spring
 * {@link org.springframework.dao.DataAccessException}s.
 */
public interface StoreTransaction {

    /**
     * Overwrites the tracked attributes of repository {@code repoId} only if at
     * least one differs from {@code snapshot}.
     *
     * @return {@code true} if the row was updated
     */
    boolean updateRepositoryIfChanged(long repoId, RepositorySnapshot snapshot);

    /**
     * Inserts a new repository. A uniqueness conflict is not an error: it is
     * reported as {@link InsertResult#alreadyExisted()}.
     */
    InsertResult insertRepositoryIfAbsent(RepositorySnapshot snapshot);

    /**
     * Inserts the activity row for (repoId, date), or updates it if its commit
     * count or author set differs.
     *
     * @return {@code true} if a row was inserted or updated
     */
    boolean upsertActivity(long repoId, DailyActivity activity);
}
