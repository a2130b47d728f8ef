package com.promptsmith.infrastructure.orchestrator;

import com.promptsmith.domain.prompt.model.HistoryEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Bounded FIFO of completed orchestrations. Appends are serialized; readers get immutable snapshots.
 */
@Slf4j
public class HistoryStore {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    public HistoryStore() {
        this(DEFAULT_CAPACITY);
    }

    public HistoryStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Adds to the tail, evicting from the head while over capacity.
     *
     * @return size after the append
     */
    public int append(HistoryEntry entry) {
        Objects.requireNonNull(entry, "entry");
        rw.writeLock().lock();
        try {
            entries.addLast(entry);
            int evicted = 0;
            while (entries.size() > capacity) {
                entries.removeFirst();
                evicted++;
            }
            if (evicted > 0) {
                log.debug("[History] Evicted {} oldest entries (capacity={})", evicted, capacity);
            }
            return entries.size();
        } finally {
            rw.writeLock().unlock();
        }
    }

    public List<HistoryEntry> query(Predicate<? super HistoryEntry> predicate) {
        rw.readLock().lock();
        try {
            return entries.stream().filter(predicate).toList();
        } finally {
            rw.readLock().unlock();
        }
    }

    public List<HistoryEntry> snapshot() {
        return query(e -> true);
    }

    public long count(Predicate<? super HistoryEntry> predicate) {
        rw.readLock().lock();
        try {
            return entries.stream().filter(predicate).count();
        } finally {
            rw.readLock().unlock();
        }
    }

    public int size() {
        rw.readLock().lock();
        try {
            return entries.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        rw.writeLock().lock();
        try {
            entries.clear();
        } finally {
            rw.writeLock().unlock();
        }
        log.info("[History] Cleared");
    }
}
