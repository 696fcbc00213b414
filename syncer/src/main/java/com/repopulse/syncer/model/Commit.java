package com.repopulse.syncer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object representing a GitHub commit.
 * Maps from the nested GitHub API response: /repos/{owner}/{repo}/commits
 *
 * <p>Only the committer is mapped: GitHub sorts the listing by committed date,
 * and the committer is the one who actually landed the change.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Commit(
        @JsonProperty("sha") String sha,
        @JsonProperty("commit") CommitDetail commit
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommitDetail(
            @JsonProperty("committer") CommitActor committer
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommitActor(
            @JsonProperty("name") String name,
            @JsonProperty("email") String email,
            @JsonProperty("date") String date
    ) {}
}
