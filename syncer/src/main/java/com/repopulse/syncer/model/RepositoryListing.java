package com.repopulse.syncer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Minimal repository entry from the public listing.
 * Maps from: /repositories?since={id}
 *
 * The listing carries no counts, so every entry is followed up with a
 * full metadata request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositoryListing(
        @JsonProperty("id") Long id,
        @JsonProperty("name") String name,
        @JsonProperty("owner") Repository.Owner owner
) {

    public String fullName() {
        return (owner != null ? owner.login() : null) + "/" + name;
    }
}
