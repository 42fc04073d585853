package com.forumprep.cascade;

import com.forumprep.core.CssParseException;
import com.forumprep.core.CssParser;
import com.forumprep.model.Declaration;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Removes elements that cannot affect the rendered layout: explicitly hidden
 * ones, and empty ones without an intrinsic or explicit size. Works on the
 * serialized {@code style} attributes, so it runs after the cascade has been
 * written back. Candidates are collected first and deleted afterwards.
 */
public class InvisibilityPruner {
    private static final Logger logger = LoggerFactory.getLogger(InvisibilityPruner.class);

    private static final Set<String> SIZE_PROPERTIES = Set.of("width", "height", "min-width", "min-height");
    private static final Pattern COLON_SPACING = Pattern.compile("\\s*:\\s*");

    private final CssParser cssParser;
    private final Set<String> intrinsicSizeTags;
    private final Set<String> zeroSizeValues;
    private final boolean repeatUntilStable;

    public InvisibilityPruner(CssParser cssParser, Set<String> intrinsicSizeTags,
                              Set<String> zeroSizeValues, boolean repeatUntilStable) {
        this.cssParser = cssParser;
        this.intrinsicSizeTags = intrinsicSizeTags;
        this.zeroSizeValues = zeroSizeValues;
        this.repeatUntilStable = repeatUntilStable;
    }

    public PruneResult prune(Document document) {
        Map<PruneReason, Integer> removed = new EnumMap<>(PruneReason.class);
        int passes = 0;
        int removedThisPass;
        do {
            passes++;
            removedThisPass = prunePass(document, removed);
        } while (repeatUntilStable && removedThisPass > 0);

        PruneResult result = new PruneResult(removed, passes);
        logger.debug("Pruning finished: {}", result);
        return result;
    }

    private int prunePass(Document document, Map<PruneReason, Integer> removed) {
        List<Element> doomed = new ArrayList<>();

        Deque<Element> stack = new ArrayDeque<>();
        pushChildren(stack, document);
        while (!stack.isEmpty()) {
            Element el = stack.pop();
            PruneReason reason = evaluate(el);
            if (reason != null) {
                doomed.add(el);
                removed.merge(reason, 1, Integer::sum);
                logger.debug("Removing element ({}): <{}>", reason, el.normalName());
                continue;
            }
            pushChildren(stack, el);
        }

        for (Element el : doomed) {
            el.remove();
        }
        return doomed.size();
    }

    // reverse push keeps document order when popping
    private static void pushChildren(Deque<Element> stack, Element parent) {
        List<Element> children = parent.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    /**
     * @return the first matching reason, or null if the element stays
     */
    public PruneReason evaluate(Element el) {
        String style = el.attr("style");
        String normalized = COLON_SPACING.matcher(style.toLowerCase(Locale.ROOT)).replaceAll(": ");

        if (normalized.contains("display: none")) {
            return PruneReason.DISPLAY_NONE;
        }
        if (normalized.contains("visibility: hidden")) {
            return PruneReason.VISIBILITY_HIDDEN;
        }
        if (el.childNodeSize() == 0
                && !intrinsicSizeTags.contains(el.normalName())
                && !hasExplicitSize(el, style)) {
            return PruneReason.EMPTY_WITHOUT_SIZE;
        }
        return null;
    }

    private boolean hasExplicitSize(Element el, String style) {
        if (style.isEmpty()) {
            return false;
        }
        List<Declaration> declarations;
        try {
            declarations = cssParser.parseInlineStyle(style);
        } catch (CssParseException e) {
            logger.debug("Treating malformed style on <{}> as unsized: {}", el.normalName(), e.getMessage());
            return false;
        }
        for (Declaration declaration : declarations) {
            if (SIZE_PROPERTIES.contains(declaration.getProperty())
                    && !zeroSizeValues.contains(declaration.getValue().trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
