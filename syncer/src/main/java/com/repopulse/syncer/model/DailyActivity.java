package com.repopulse.syncer.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Commit activity of one repository on one day.
 *
 * <p>Authors are names written in commits, not GitHub logins. The set may be
 * empty when no commit of the day carried a usable name.</p>
 */
public record DailyActivity(
        LocalDate date,
        int commits,
        Set<String> authors
) {

    public static final int MAX_AUTHOR_NAME_LENGTH = 100;

    public DailyActivity {
        if (commits <= 0) {
            throw new IllegalArgumentException("commits must be positive, got " + commits);
        }
        authors = Collections.unmodifiableSet(new TreeSet<>(authors));
    }

    /**
     * Authors in natural order, the form in which they are persisted.
     */
    public List<String> sortedAuthors() {
        return new ArrayList<>(authors);
    }
}
