package com.repopulse.syncer.model;

/**
 * Validated repository metadata as observed on the remote at fetch time.
 *
 * @param githubId external id assigned by GitHub
 * @param language primary language, {@code null} when GitHub reports none
 */
public record RepositorySnapshot(
        long githubId,
        String owner,
        String name,
        int stars,
        int watchers,
        int forks,
        int openIssues,
        String language
) {

    public static final int MAX_OWNER_LENGTH = 39;
    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_LANGUAGE_LENGTH = 100;

    public String fullName() {
        return owner + "/" + name;
    }
}
