package com.forumprep.cascade;

import com.forumprep.model.StyleRule;

import java.util.List;

/**
 * Output of one rule collection run.
 */
public final class CollectedRules {

    private final List<StyleRule> rules;
    private final int stylesheetCount;
    private final int failedStylesheetCount;
    private final int skippedDynamicRuleCount;

    public CollectedRules(List<StyleRule> rules, int stylesheetCount,
                          int failedStylesheetCount, int skippedDynamicRuleCount) {
        this.rules = List.copyOf(rules);
        this.stylesheetCount = stylesheetCount;
        this.failedStylesheetCount = failedStylesheetCount;
        this.skippedDynamicRuleCount = skippedDynamicRuleCount;
    }

    /** Rules in ascending source index order. */
    public List<StyleRule> getRules() { return rules; }
    public int getStylesheetCount() { return stylesheetCount; }
    public int getFailedStylesheetCount() { return failedStylesheetCount; }
    public int getSkippedDynamicRuleCount() { return skippedDynamicRuleCount; }

    @Override
    public String toString() {
        return String.format("CollectedRules{rules=%d, stylesheets=%d, failed=%d, skippedDynamic=%d}",
                rules.size(), stylesheetCount, failedStylesheetCount, skippedDynamicRuleCount);
    }
}
