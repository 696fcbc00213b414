package com.repopulse.syncer.loader;

/**
 * Outcome of an insert-if-absent. A {@code null} id means a row with the same
 * identity already existed and nothing was written.
 */
public record InsertResult(Long repoId) {

    private static final InsertResult ALREADY_EXISTED = new InsertResult(null);

    public static InsertResult inserted(long repoId) {
        return new InsertResult(repoId);
    }

    public static InsertResult alreadyExisted() {
        return ALREADY_EXISTED;
    }

    public boolean wasInserted() {
        return repoId != null;
    }
}
