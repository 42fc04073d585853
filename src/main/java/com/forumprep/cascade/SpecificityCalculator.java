package com.forumprep.cascade;

import com.forumprep.core.CssParseException;
import com.forumprep.core.SelectorTokenizer;
import com.forumprep.model.SelectorToken;
import com.forumprep.model.Specificity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Computes the (a, b, c) specificity of a single selector.
 */
public class SpecificityCalculator {
    private static final Logger logger = LoggerFactory.getLogger(SpecificityCalculator.class);

    // CSS2 pseudo-elements written with a single colon still count as pseudo-elements
    private static final Set<String> LEGACY_PSEUDO_ELEMENTS = Set.of(
            "first-line", "first-letter", "before", "after"
    );

    private final SelectorTokenizer tokenizer;

    public SpecificityCalculator(SelectorTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * @param selectorText a single selector, not a comma separated group
     * @return the specificity; never null, even for selectors the tokenizer rejects
     */
    public Specificity calculate(String selectorText) {
        List<SelectorToken> tokens;
        try {
            tokens = tokenizer.tokenize(selectorText);
        } catch (CssParseException e) {
            logger.warn("Could not tokenize selector '{}' for specificity, using heuristic: {}",
                    selectorText, e.getMessage());
            return heuristic(selectorText);
        }

        int a = 0;
        int b = 0;
        int c = 0;
        for (SelectorToken token : tokens) {
            switch (token.getType()) {
                case ID -> a++;
                case CLASS, ATTRIBUTE -> b++;
                case PSEUDO_CLASS -> {
                    if (LEGACY_PSEUDO_ELEMENTS.contains(token.getValue())) {
                        c++;
                    } else {
                        b++;
                    }
                }
                case TYPE, PSEUDO_ELEMENT -> c++;
                case UNIVERSAL, COMBINATOR -> {
                }
            }
        }

        if (a + b + c == 0) {
            logger.debug("Selector '{}' has no counting tokens, using heuristic", selectorText);
            return heuristic(selectorText);
        }
        return new Specificity(a, b, c);
    }

    /**
     * Syntactic guess used when the selector cannot be tokenized, so the rule
     * still takes part in the cascade.
     */
    static Specificity heuristic(String selectorText) {
        String text = selectorText == null ? "" : selectorText;
        if (text.indexOf('#') >= 0) {
            return new Specificity(1, 0, 0);
        }
        if (text.indexOf('.') >= 0 || text.indexOf('[') >= 0 || text.indexOf(':') >= 0) {
            return new Specificity(0, 1, 0);
        }
        return new Specificity(0, 0, 1);
    }
}
