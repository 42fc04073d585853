package com.forumprep.cascade;

/**
 * Why an element was judged invisible
 */
public enum PruneReason {

    DISPLAY_NONE("display: none"),
    VISIBILITY_HIDDEN("visibility: hidden"),
    EMPTY_WITHOUT_SIZE("empty and no intrinsic/explicit size");

    private final String description;

    PruneReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}
