package com.forumprep.model;

/**
 * Kinds of tokens a simple selector breaks down into
 */
public enum SelectorTokenType {

    ID("ID"),
    CLASS("Class"),
    ATTRIBUTE("Attribute"),
    PSEUDO_CLASS("Pseudo-class"),
    PSEUDO_ELEMENT("Pseudo-element"),
    TYPE("Type"),
    UNIVERSAL("Universal"),
    COMBINATOR("Combinator");

    private final String displayName;

    SelectorTokenType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Human-readable name (for logs)
     */
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
