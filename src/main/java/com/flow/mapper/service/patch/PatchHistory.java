package com.flow.mapper.service.patch;

import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.model.ProcessFlow;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded undo buffer of (snapshot before patch, applied patch) pairs.
 * When full, the oldest entry is dropped.
 */
public class PatchHistory {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();

    public PatchHistory() {
        this(DEFAULT_CAPACITY);
    }

    public PatchHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void record(ProcessFlow before, FlowPatch patch) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(new HistoryEntry(before, patch));
    }

    /**
     * Removes the most recent entry.
     *
     * @return the snapshot taken before the most recent patch, empty when there is nothing to undo
     */
    public Optional<ProcessFlow> pop() {
        var last = entries.pollLast();
        return last == null ? Optional.empty() : Optional.of(last.before());
    }

    /**
     * Oldest first.
     */
    public List<HistoryEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        entries.clear();
    }

    public record HistoryEntry(ProcessFlow before, FlowPatch patch) {
    }
}
