package com.repopulse.syncer.loader;

import com.repopulse.syncer.model.StoredRepository;

import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Relational store of repositories, their daily activity and rank snapshots.
 */
public interface RepositoryStore {

    /**
     * Creates the tables if they do not exist yet.
     */
    void ensureSchema();

    /**
     * Merges the current star ranking into the rank snapshot table, in a
     * transaction of its own. Rows are updated only on change, inserted when
     * missing, never deleted.
     *
     * @return the number of snapshot rows written
     */
    int snapshotRanks();

    /**
     * Stored repositories whose internal id lies in {@code [minId, maxId]},
     * ordered by id, each with its latest activity date.
     */
    List<StoredRepository> findRepositories(long minId, long maxId);

    /**
     * {@code owner/name} of every stored repository.
     */
    Set<String> findAllFullNames();

    /**
     * Largest external id stored, empty if no stored row carries one.
     */
    OptionalLong findHighWaterMark();

    /**
     * Runs {@code work} in one transaction: committed if it returns, rolled
     * back if it throws. Storage failures surface as Spring
     * {@link org.springframework.dao.DataAccessException}s.
     */
    <T> T inTransaction(TransactionWork<T> work);

    @FunctionalInterface
    interface TransactionWork<T> {
        T execute(StoreTransaction transaction);
    }
}
