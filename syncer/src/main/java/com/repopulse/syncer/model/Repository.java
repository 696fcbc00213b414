package com.repopulse.syncer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object representing a GitHub repository.
 * Maps from: /repos/{owner}/{repo}
 *
 * <p>Counts are boxed so that a missing field can be told apart from zero
 * during validation.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Repository(
        @JsonProperty("id") Long id,
        @JsonProperty("name") String name,
        @JsonProperty("owner") Owner owner,
        @JsonProperty("stargazers_count") Integer stargazersCount,
        @JsonProperty("watchers_count") Integer watchersCount,
        @JsonProperty("forks_count") Integer forksCount,
        @JsonProperty("open_issues_count") Integer openIssuesCount,
        @JsonProperty("language") String language
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Owner(
            @JsonProperty("login") String login
    ) {}
}
