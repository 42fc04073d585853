package com.forumprep.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Winning declaration per property for one element. Iteration follows
 * first-insertion order so serialization is reproducible.
 */
public final class ComputedStyle {

    private final Map<String, WinningEntry> entries = new LinkedHashMap<>();

    /**
     * Unconditionally sets the entry, used when seeding from the inline style.
     */
    public void put(String property, WinningEntry entry) {
        entries.put(property, entry);
    }

    /**
     * Stores the candidate only if it is strictly preferred over the current entry.
     *
     * @return true if the candidate became the winner
     */
    public boolean merge(String property, WinningEntry candidate) {
        WinningEntry current = entries.get(property);
        if (current == null || candidate.isPreferredOver(current)) {
            entries.put(property, candidate);
            return true;
        }
        return false;
    }

    public boolean contains(String property) {
        return entries.containsKey(property);
    }

    public WinningEntry get(String property) {
        return entries.get(property);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Map<String, WinningEntry> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Serializes to {@code prop: value[ !important]; prop: value}.
     */
    public String toStyleAttribute() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, WinningEntry> e : entries.entrySet()) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(e.getKey()).append(": ").append(e.getValue().getValue());
            if (e.getValue().isDeclaredImportant()) {
                sb.append(" !important");
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ComputedStyle{" + toStyleAttribute() + "}";
    }
}
