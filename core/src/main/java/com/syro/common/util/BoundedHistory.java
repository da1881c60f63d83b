package com.syro.common.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Fixed-capacity circular buffer. Appending to a full buffer overwrites the
 * oldest element. All access is synchronized on the instance, which is enough
 * for the append-mostly histories kept by the dispatcher.
 */
public class BoundedHistory<T> {
    private final Object[] buffer;
    private int head = 0; // index of the oldest element
    private int size = 0;
    private long totalAppended = 0;
    private long evicted = 0;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.buffer = new Object[capacity];
    }

    public synchronized void add(T element) {
        if (size == buffer.length) {
            buffer[head] = element;
            head = (head + 1) % buffer.length;
            evicted++;
        } else {
            buffer[(head + size) % buffer.length] = element;
            size++;
        }
        totalAppended++;
    }

    /**
     * Oldest first.
     */
    public synchronized List<T> snapshot() {
        return filter(e -> true, 0);
    }

    /**
     * Matching elements, oldest first. A positive {@code limit} keeps only the
     * newest {@code limit} matches.
     */
    @SuppressWarnings("unchecked")
    public synchronized List<T> filter(Predicate<? super T> predicate, int limit) {
        List<T> out = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            T element = (T) buffer[(head + i) % buffer.length];
            if (predicate.test(element)) out.add(element);
        }
        if (limit > 0 && out.size() > limit) {
            return new ArrayList<>(out.subList(out.size() - limit, out.size()));
        }
        return out;
    }

    public synchronized void clear() {
        for (int i = 0; i < buffer.length; i++) buffer[i] = null;
        head = 0;
        size = 0;
    }

    public synchronized int size() { return size; }
    public int capacity() { return buffer.length; }
    public synchronized long getTotalAppended() { return totalAppended; }
    public synchronized long getEvicted() { return evicted; }
}
