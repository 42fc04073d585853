package com.forumprep.cascade;

import com.forumprep.core.CssParseException;
import com.forumprep.core.CssParser;
import com.forumprep.core.SelectorMatcher;
import com.forumprep.model.ComputedStyle;
import com.forumprep.model.Declaration;
import com.forumprep.model.StyleRule;
import com.forumprep.model.WinningEntry;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resolves one winning declaration per property for a single element.
 * <p>
 * Inline declarations are seeded first and promoted to important with specificity
 * (1,0,0). Every matching rule is then merged in: important beats non-important,
 * then higher specificity, then higher source index; exact ties keep the earlier entry.
 * No state survives between calls, so elements may be resolved in any order.
 */
public class CascadeResolver {
    private static final Logger logger = LoggerFactory.getLogger(CascadeResolver.class);

    private final CssParser cssParser;
    private final SelectorMatcher selectorMatcher;

    public CascadeResolver(CssParser cssParser, SelectorMatcher selectorMatcher) {
        this.cssParser = cssParser;
        this.selectorMatcher = selectorMatcher;
    }

    public ComputedStyle resolve(Element element, List<StyleRule> rules) {
        ComputedStyle style = new ComputedStyle();

        if (element.hasAttr("style")) {
            try {
                for (Declaration declaration : cssParser.parseInlineStyle(element.attr("style"))) {
                    // later duplicates inside one style attribute override earlier ones
                    style.put(declaration.getProperty(), WinningEntry.inline(declaration));
                }
            } catch (CssParseException e) {
                logger.warn("Ignoring malformed inline style on <{}>: {}", element.normalName(), e.getMessage());
            }
        }

        for (StyleRule rule : rules) {
            if (!selectorMatcher.matches(rule.getSelectorText(), element)) {
                continue;
            }
            for (Declaration declaration : rule.getDeclarations()) {
                style.merge(declaration.getProperty(), WinningEntry.fromRule(declaration, rule));
            }
        }

        return style;
    }
}
