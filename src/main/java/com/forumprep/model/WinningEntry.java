package com.forumprep.model;

import java.util.Comparator;

/**
 * The declaration currently winning one property on one element.
 */
public final class WinningEntry {

    /**
     * Where the winning value came from
     */
    public enum Origin {
        INLINE,
        RULE,
        INHERITED
    }

    /** Source index given to inline declarations: after every collected rule. */
    public static final int INLINE_SOURCE_INDEX = Integer.MAX_VALUE;

    /** Source index given to inherited values: before every collected rule. */
    public static final int INHERITED_SOURCE_INDEX = -1;

    /**
     * Cascade order: important first, then specificity, then later source index.
     */
    public static final Comparator<WinningEntry> PRECEDENCE =
            Comparator.comparing(WinningEntry::isImportant)
                    .thenComparing(WinningEntry::getSpecificity)
                    .thenComparingInt(WinningEntry::getSourceIndex);

    private final String value;
    private final Specificity specificity;
    private final boolean important;
    private final int sourceIndex;
    private final Origin origin;
    private final boolean declaredImportant;

    public WinningEntry(String value, Specificity specificity, boolean important, int sourceIndex,
                        Origin origin, boolean declaredImportant) {
        this.value = value;
        this.specificity = specificity;
        this.important = important;
        this.sourceIndex = sourceIndex;
        this.origin = origin;
        this.declaredImportant = declaredImportant;
    }

    /**
     * Inline declarations are promoted to important with specificity (1,0,0).
     */
    public static WinningEntry inline(Declaration declaration) {
        return new WinningEntry(declaration.getValue(), Specificity.INLINE, true,
                INLINE_SOURCE_INDEX, Origin.INLINE, declaration.isImportant());
    }

    public static WinningEntry fromRule(Declaration declaration, StyleRule rule) {
        return new WinningEntry(declaration.getValue(), rule.getSpecificity(), declaration.isImportant(),
                rule.getSourceIndex(), Origin.RULE, declaration.isImportant());
    }

    public static WinningEntry inherited(String value) {
        return new WinningEntry(value, Specificity.ZERO, false,
                INHERITED_SOURCE_INDEX, Origin.INHERITED, false);
    }

    public boolean isPreferredOver(WinningEntry other) {
        return PRECEDENCE.compare(this, other) > 0;
    }

    public String getValue() { return value; }
    public Specificity getSpecificity() { return specificity; }
    public boolean isImportant() { return important; }
    public int getSourceIndex() { return sourceIndex; }
    public Origin getOrigin() { return origin; }

    /**
     * Whether the author wrote {@code !important}; this is what gets serialized,
     * independent of the precedence flag.
     */
    public boolean isDeclaredImportant() { return declaredImportant; }

    @Override
    public String toString() {
        return String.format("WinningEntry{value='%s', specificity=%s, important=%s, sourceIndex=%d, origin=%s}",
                value, specificity, important, sourceIndex, origin);
    }
}
