package com.forumprep.cascade;

import com.forumprep.core.CssParseException;
import com.forumprep.core.CssParser;
import com.forumprep.model.RawRule;
import com.forumprep.model.StyleRule;
import com.forumprep.util.CssTextUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Gathers style rules from every stylesheet in document order and numbers them.
 * Rules that depend on runtime state ({@code :hover}, {@code :focus}, ...) are dropped.
 */
public class RuleCollector {
    private static final Logger logger = LoggerFactory.getLogger(RuleCollector.class);

    private final CssParser cssParser;
    private final SpecificityCalculator specificityCalculator;
    private final Set<String> staticPseudoClasses;

    public RuleCollector(CssParser cssParser, SpecificityCalculator specificityCalculator,
                         Set<String> staticPseudoClasses) {
        this.cssParser = cssParser;
        this.specificityCalculator = specificityCalculator;
        this.staticPseudoClasses = staticPseudoClasses;
    }

    /**
     * Collects the rules of every {@code <style>} element, then detaches all of them
     * from the document, including those whose content could not be parsed.
     */
    public CollectedRules collect(Document document) {
        List<Element> styleElements = new ArrayList<>(document.select("style"));
        List<String> sources = new ArrayList<>(styleElements.size());
        for (Element style : styleElements) {
            sources.add(style.data());
        }

        CollectedRules collected = collect(sources);

        for (Element style : styleElements) {
            style.remove();
        }
        logger.debug("Detached {} style elements", styleElements.size());
        return collected;
    }

    /**
     * @param sources stylesheet texts in document order
     */
    public CollectedRules collect(List<String> sources) {
        List<StyleRule> rules = new ArrayList<>();
        int nextSourceIndex = 0;
        int failed = 0;
        int skipped = 0;

        for (int sheet = 0; sheet < sources.size(); sheet++) {
            List<RawRule> rawRules;
            try {
                rawRules = cssParser.parseStylesheet(sources.get(sheet));
            } catch (CssParseException e) {
                logger.warn("Could not parse stylesheet #{}, it contributes no rules: {}", sheet, e.getMessage());
                failed++;
                continue;
            }

            for (RawRule raw : rawRules) {
                String selectorText = raw.getSelectorText();
                if (!isStaticallyResolvable(selectorText)) {
                    logger.debug("Skipping dynamic pseudo-class selector: {}", selectorText);
                    skipped++;
                    continue;
                }

                for (String part : CssTextUtils.splitTopLevel(selectorText, ',')) {
                    String selector = part.trim();
                    if (selector.isEmpty()) {
                        continue;
                    }
                    rules.add(new StyleRule(selector, raw.getDeclarations(),
                            specificityCalculator.calculate(selector), nextSourceIndex++));
                }
            }
        }

        CollectedRules collected = new CollectedRules(rules, sources.size(), failed, skipped);
        logger.debug("Collected {}", collected);
        return collected;
    }

    /**
     * A selector is static when every pseudo-class or pseudo-element it names,
     * outside attribute brackets and strings, is in the allow-list.
     */
    public boolean isStaticallyResolvable(String selectorText) {
        int len = selectorText.length();
        int bracketDepth = 0;
        int i = 0;
        while (i < len) {
            char c = selectorText.charAt(i);
            if (c == '\\' && i + 1 < len) {
                i += 2;
                continue;
            }
            if (c == '"' || c == '\'') {
                i = CssTextUtils.skipQuoted(selectorText, i);
                continue;
            }
            if (c == '[') {
                bracketDepth++;
            } else if (c == ']' && bracketDepth > 0) {
                bracketDepth--;
            } else if (c == ':' && bracketDepth == 0) {
                int nameStart = i + 1;
                if (nameStart < len && selectorText.charAt(nameStart) == ':') {
                    nameStart++;
                }
                int nameEnd = nameStart;
                while (nameEnd < len && isNameChar(selectorText.charAt(nameEnd))) {
                    nameEnd++;
                }
                String name = selectorText.substring(nameStart, nameEnd).toLowerCase(Locale.ROOT);
                if (!staticPseudoClasses.contains(name)) {
                    return false;
                }
                i = nameEnd;
                continue;
            }
            i++;
        }
        return true;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_';
    }
}
