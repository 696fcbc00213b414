package com.repopulse.syncer.activity;

import com.repopulse.syncer.client.FailFastSequence;
import com.repopulse.syncer.client.RemoteFetchException;
import com.repopulse.syncer.model.CommitEntry;
import com.repopulse.syncer.model.DailyActivity;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Groups a commit stream into one {@link DailyActivity} per date.
 *
 * <p>The input must be ordered by date descending with commits of the same date
 * contiguous, which is how GitHub lists commits. Only that order lets a date be
 * emitted as soon as the next date shows up. The precondition is checked with
 * an {@code assert}, so it is verified in tests and trusted in production.</p>
 *
 * <p>If the source ends with a failure, the date still being accumulated is
 * incomplete and is dropped; the failure is passed on.</p>
 */
public final class ActivityAggregator {

    private ActivityAggregator() {}

    /**
     * Lazily aggregates {@code commits}. Consuming the result consumes the source.
     */
    public static FailFastSequence<DailyActivity> aggregate(FailFastSequence<CommitEntry> commits) {
        return new FailFastSequence<>() {

            private LocalDate currentDate;
            private int count;
            private Set<String> authors = new HashSet<>();

            @Override
            protected DailyActivity computeNext() throws RemoteFetchException {
                while (commits.hasNext()) {
                    CommitEntry commit = commits.next();
                    LocalDate date = commit.date();
                    DailyActivity completed = null;

                    if (currentDate == null) {
                        currentDate = date;
                    } else if (!date.equals(currentDate)) {
                        assert date.isBefore(currentDate)
                                : "commits out of order: " + date + " after " + currentDate;
                        completed = new DailyActivity(currentDate, count, authors);
                        currentDate = date;
                        count = 0;
                        authors = new HashSet<>();
                    }

                    count++;
                    if (isAcceptedAuthor(commit.author())) {
                        authors.add(commit.author());
                    }

                    if (completed != null) {
                        return completed;
                    }
                }

                if (commits.failure().isPresent()) {
                    throw commits.failure().get();
                }
                if (count > 0) {
                    DailyActivity last = new DailyActivity(currentDate, count, authors);
                    count = 0;
                    return last;
                }
                return null;
            }
        };
    }

    static boolean isAcceptedAuthor(String author) {
        return author != null
                && !author.isBlank()
                && author.length() <= DailyActivity.MAX_AUTHOR_NAME_LENGTH;
    }
}
