package com.forumprep.model;

import java.util.Collections;
import java.util.List;

/**
 * A style rule as it comes out of the stylesheet parser: selector text
 * (possibly a comma separated group) and its declaration block.
 */
public final class RawRule {

    private final String selectorText;
    private final List<Declaration> declarations;

    public RawRule(String selectorText, List<Declaration> declarations) {
        this.selectorText = selectorText;
        this.declarations = Collections.unmodifiableList(List.copyOf(declarations));
    }

    public String getSelectorText() { return selectorText; }
    public List<Declaration> getDeclarations() { return declarations; }

    @Override
    public String toString() {
        return selectorText + " " + declarations;
    }
}
