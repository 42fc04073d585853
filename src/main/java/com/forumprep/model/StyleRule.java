package com.forumprep.model;

import java.util.List;

/**
 * A collected rule for one selector, ready for the cascade.
 * {@code sourceIndex} is unique per collection run and grows with document order.
 */
public final class StyleRule {

    private final String selectorText;
    private final List<Declaration> declarations;
    private final Specificity specificity;
    private final int sourceIndex;

    public StyleRule(String selectorText, List<Declaration> declarations,
                     Specificity specificity, int sourceIndex) {
        this.selectorText = selectorText;
        this.declarations = List.copyOf(declarations);
        this.specificity = specificity;
        this.sourceIndex = sourceIndex;
    }

    public String getSelectorText() { return selectorText; }
    public List<Declaration> getDeclarations() { return declarations; }
    public Specificity getSpecificity() { return specificity; }
    public int getSourceIndex() { return sourceIndex; }

    @Override
    public String toString() {
        return String.format("StyleRule{selector='%s', specificity=%s, sourceIndex=%d, declarations=%s}",
                selectorText, specificity, sourceIndex, declarations);
    }
}
