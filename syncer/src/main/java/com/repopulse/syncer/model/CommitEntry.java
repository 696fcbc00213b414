package com.repopulse.syncer.model;

import java.time.LocalDate;

/**
 * A single commit reduced to what activity aggregation needs.
 *
 * @param date   committer date (UTC)
 * @param author committer name, may be {@code null}
 */
public record CommitEntry(LocalDate date, String author) {}
