package com.di.chunkpilot.agent.sampler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A single-pass input whose head was consumed for sampling, presented again as one sequence:
 * the fixed head buffer followed by the untouched remainder. Items pulled from the remainder
 * are handed straight through and never retained, so memory stays bounded by the head.
 *
 * <p>Traversable once, like the input it wraps.
 */
public final class ChainedDataset<T> implements Iterable<T> {

    private final List<T> head;
    private final Iterator<T> remaining;
    private boolean traversed;

    ChainedDataset(List<T> head, Iterator<T> remaining) {
        this.head = Collections.unmodifiableList(new ArrayList<>(head));
        this.remaining = remaining;
    }

    /** Items buffered from the source; the sampled head. */
    public int bufferedCount() {
        return head.size();
    }

    public synchronized boolean isExhausted() {
        return !remaining.hasNext();
    }

    /**
     * @throws IllegalStateException on a second call; the remainder cannot be replayed
     */
    @Override
    public synchronized Iterator<T> iterator() {
        if (traversed) {
            throw new IllegalStateException("Single-pass dataset was already traversed");
        }
        traversed = true;
        Iterator<T> buffered = head.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return buffered.hasNext() || remaining.hasNext();
            }

            @Override
            public T next() {
                if (buffered.hasNext()) {
                    return buffered.next();
                }
                if (!remaining.hasNext()) {
                    throw new NoSuchElementException();
                }
                return remaining.next();
            }
        };
    }
}
