package com.company.apimonitoring.analysis;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Rolling sample history with a fixed capacity. Oldest entries are evicted first.
 * <p>
 * Samples are appended in timestamp order and anything not newer than the last appended
 * sample is skipped, so re-analysing an overlapping window does not duplicate history.
 */
public class BoundedHistory<T> {

    private final int capacity;
    private final Function<T, Instant> timestampOf;
    private final Deque<T> entries = new ArrayDeque<>();
    private Instant newest;

    public BoundedHistory(int capacity, Function<T, Instant> timestampOf) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.timestampOf = timestampOf;
    }

    public synchronized int append(Collection<T> samples) {
        int added = 0;
        for (T sample : samples) {
            Instant ts = timestampOf.apply(sample);
            if (ts == null || (newest != null && !ts.isAfter(newest))) {
                continue;
            }
            entries.addLast(sample);
            newest = ts;
            added++;
            while (entries.size() > capacity) {
                entries.removeFirst();
            }
        }
        return added;
    }

    public synchronized List<T> snapshot() {
        return new ArrayList<>(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
        newest = null;
    }

    public int getCapacity() {
        return capacity;
    }
}
