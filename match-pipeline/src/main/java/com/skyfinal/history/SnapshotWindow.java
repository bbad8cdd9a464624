package com.skyfinal.history;

import com.skyfinal.state.Snapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring buffer of the most recent snapshots.
 *
 * Once full, each append overwrites the oldest slot, so the capacity bound
 * holds at all times rather than being trimmed after the fact.
 */
public class SnapshotWindow {

    private final Snapshot[] slots;
    private int head;   // index of the oldest element
    private int size;

    public SnapshotWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.slots = new Snapshot[capacity];
    }

    /**
     * Appends a snapshot, evicting the oldest when full.
     *
     * @return the evicted snapshot, or null if nothing was evicted
     */
    public synchronized Snapshot add(Snapshot snapshot) {
        if (size < slots.length) {
            slots[(head + size) % slots.length] = snapshot;
            size++;
            return null;
        }
        Snapshot evicted = slots[head];
        slots[head] = snapshot;
        head = (head + 1) % slots.length;
        return evicted;
    }

    /**
     * Returns all held snapshots, oldest first.
     */
    public synchronized List<Snapshot> toList() {
        return latest(size);
    }

    /**
     * Returns up to {@code limit} of the newest snapshots, oldest first.
     */
    public synchronized List<Snapshot> latest(int limit) {
        int count = Math.min(Math.max(limit, 0), size);
        List<Snapshot> result = new ArrayList<>(count);
        for (int i = size - count; i < size; i++) {
            result.add(slots[(head + i) % slots.length]);
        }
        return result;
    }

    public synchronized Snapshot newest() {
        return size == 0 ? null : slots[(head + size - 1) % slots.length];
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }
}
