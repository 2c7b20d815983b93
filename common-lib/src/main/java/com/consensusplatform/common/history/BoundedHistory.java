package com.consensusplatform.common.history;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity, insertion-ordered history. Appending beyond capacity evicts the oldest
 * entry.
 *
 * <p>Thread-safe: every method synchronises on the instance. Reads return copies, so
 * callers can iterate without holding the lock.
 */
public final class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> entries;

    public BoundedHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public synchronized void add(T entry) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(entry);
    }

    /** Every retained entry, oldest first. */
    public synchronized List<T> snapshot() {
        return List.copyOf(entries);
    }

    /** Up to {@code n} most recent entries, oldest first. */
    public synchronized List<T> latest(int n) {
        List<T> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - n);
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public int capacity() {
        return capacity;
    }
}
