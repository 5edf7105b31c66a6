package com.agentbacktest.common.history;

import com.agentbacktest.common.exception.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fixed-capacity, append-only sequence. Once full, every append overwrites the oldest item.
 *
 * <p>Backs every growing collection of the engine (transaction log, portfolio history,
 * closed positions, per-symbol market and decision memory) so memory stays bounded
 * for arbitrarily long runs.
 *
 * <p>Safe for one writer and many readers: reads return copies taken under a read lock.
 * Null items are rejected by {@link #append(Object)} with a {@link NullPointerException}.
 *
 * @param <T> item type, nulls rejected
 */
public final class BoundedHistory<T> {

    private final Object[] items;
    private int head;   // index of the oldest item
    private int size;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @throws InvalidConfigurationException if {@code capacity <= 0}
     */
    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new InvalidConfigurationException("BoundedHistory capacity must be positive, was " + capacity);
        }
        this.items = new Object[capacity];
    }

    /**
     * Adds {@code item} as the newest entry, evicting the oldest one when full.
     *
     * @throws NullPointerException if {@code item} is null; the history is left unchanged
     */
    public void append(T item) {
        Objects.requireNonNull(item, "item");
        lock.writeLock().lock();
        try {
            int tail = (head + size) % items.length;
            items[tail] = item;
            if (size < items.length) {
                size++;
            } else {
                head = (head + 1) % items.length;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Current contents, oldest first. */
    public List<T> all() {
        return last(Integer.MAX_VALUE);
    }

    /**
     * The last {@code min(n, size)} items, oldest first. {@code n <= 0} yields an empty list.
     */
    @SuppressWarnings("unchecked")
    public List<T> last(int n) {
        if (n <= 0) return Collections.emptyList();
        lock.readLock().lock();
        try {
            int count = Math.min(n, size);
            List<T> out = new ArrayList<>(count);
            int start = head + size - count;
            for (int i = 0; i < count; i++) {
                out.add((T) items[(start + i) % items.length]);
            }
            return Collections.unmodifiableList(out);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Most recently appended item. */
    @SuppressWarnings("unchecked")
    public Optional<T> latest() {
        lock.readLock().lock();
        try {
            if (size == 0) return Optional.empty();
            return Optional.of((T) items[(head + size - 1) % items.length]);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return items.length;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            Arrays.fill(items, null);
            head = 0;
            size = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
