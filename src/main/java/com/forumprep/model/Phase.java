package com.forumprep.model;

import java.util.Locale;

/**
 * Processing phases, declared in the order they run.
 */
public enum Phase {

    LINK_CSS("Inline external CSS"),
    INLINE_CSS("Apply CSS to elements"),
    REMOVE_INVISIBLE("Remove invisible elements");

    private final String displayName;

    Phase(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Reporting-friendly name (snake_case)
     */
    public String getReportName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
