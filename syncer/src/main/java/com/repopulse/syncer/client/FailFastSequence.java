package com.repopulse.syncer.client;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Lazy sequence of remote items that stops at the first fetch failure.
 *
 * <p>Items produced before the failure stay delivered; the failure itself is
 * kept and exposed through {@link #failure()} once iteration has ended, so the
 * caller decides whether partial results are worth keeping.</p>
 *
 * <p>Not thread-safe. Subclasses implement {@link #computeNext()}.</p>
 */
public abstract class FailFastSequence<T> implements Iterator<T> {

    private T next;
    private boolean done;
    private RemoteFetchException failure;

    /**
     * Produces the next item, or {@code null} when the sequence is exhausted.
     */
    protected abstract T computeNext() throws RemoteFetchException, InterruptedException;

    @Override
    public final boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (done) {
            return false;
        }
        try {
            next = computeNext();
        } catch (RemoteFetchException e) {
            failure = e;
            next = null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = RemoteFetchException.transport("Interrupted while fetching", e);
            next = null;
        }
        if (next == null) {
            done = true;
        }
        return next != null;
    }

    @Override
    public final T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T item = next;
        next = null;
        return item;
    }

    /**
     * @return the failure that ended this sequence, empty if it ran to exhaustion
     *         or has not ended yet
     */
    public Optional<RemoteFetchException> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Consumes all remaining items.
     *
     * @throws RemoteFetchException if the sequence ended with a failure; the
     *                              items read so far are discarded
     */
    public List<T> toListOrThrow() throws RemoteFetchException {
        List<T> items = new ArrayList<>();
        while (hasNext()) {
            items.add(next());
        }
        if (failure != null) {
            throw failure;
        }
        return items;
    }
}
