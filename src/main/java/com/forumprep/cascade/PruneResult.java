package com.forumprep.cascade;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts of removed elements (subtree roots only) per reason.
 */
public final class PruneResult {

    private final Map<PruneReason, Integer> removedByReason;
    private final int passes;

    public PruneResult(Map<PruneReason, Integer> removedByReason, int passes) {
        EnumMap<PruneReason, Integer> copy = new EnumMap<>(PruneReason.class);
        copy.putAll(removedByReason);
        this.removedByReason = Collections.unmodifiableMap(copy);
        this.passes = passes;
    }

    public int getRemovedCount() {
        int total = 0;
        for (int count : removedByReason.values()) {
            total += count;
        }
        return total;
    }

    public int getRemovedCount(PruneReason reason) {
        return removedByReason.getOrDefault(reason, 0);
    }

    public Map<PruneReason, Integer> getRemovedByReason() {
        return removedByReason;
    }

    public int getPasses() {
        return passes;
    }

    @Override
    public String toString() {
        return "PruneResult{removed=" + removedByReason + ", passes=" + passes + "}";
    }
}
