package com.forumprep.impl.dom;

import com.forumprep.core.SelectorMatcher;
import org.jsoup.nodes.Element;
import org.jsoup.select.Evaluator;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selector matching backed by jsoup's selector engine. Each selector is compiled
 * once; selectors jsoup rejects are remembered as unmatchable and reported once.
 */
public class JsoupSelectorMatcher implements SelectorMatcher {
    private static final Logger logger = LoggerFactory.getLogger(JsoupSelectorMatcher.class);

    private final Map<String, Optional<Evaluator>> compiled = new ConcurrentHashMap<>();

    @Override
    public boolean matches(String selectorText, Element element) {
        if (selectorText == null || element == null) {
            return false;
        }
        Optional<Evaluator> evaluator = compiled.computeIfAbsent(selectorText, JsoupSelectorMatcher::compile);
        return evaluator.isPresent() && element.is(evaluator.get());
    }

    /**
     * @return true if jsoup accepted the selector
     */
    public boolean isSupported(String selectorText) {
        return compiled.computeIfAbsent(selectorText, JsoupSelectorMatcher::compile).isPresent();
    }

    private static Optional<Evaluator> compile(String selectorText) {
        try {
            return Optional.of(QueryParser.parse(selectorText));
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            logger.warn("Selector '{}' is not supported by the matcher and will match nothing: {}",
                    selectorText, e.getMessage());
            return Optional.empty();
        }
    }
}
