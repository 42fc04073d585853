package com.forumprep.impl.css;

import com.forumprep.core.CssParseException;
import com.forumprep.core.SelectorTokenizer;
import com.forumprep.model.SelectorToken;
import com.forumprep.model.SelectorTokenType;
import com.helger.css.decl.CSSSelector;
import com.helger.css.decl.CSSSelectorAttribute;
import com.helger.css.decl.CSSStyleRule;
import com.helger.css.decl.ECSSSelectorCombinator;
import com.helger.css.decl.ICSSSelectorMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tokenizes a single selector from the members ph-css parses it into, e.g.
 * {@code div.note > a[href]:nth-child(2)::before}. Descendant whitespace is
 * dropped; explicit combinators are kept as tokens. Functional pseudo-classes
 * such as {@code :not(...)} become one token carrying only their name.
 */
public class PhCssSelectorTokenizer implements SelectorTokenizer {
    private static final Logger logger = LoggerFactory.getLogger(PhCssSelectorTokenizer.class);

    @Override
    public List<SelectorToken> tokenize(String selectorText) {
        if (selectorText == null || selectorText.trim().isEmpty()) {
            throw new CssParseException("Selector cannot be null or empty");
        }

        String text = selectorText.trim();
        CSSStyleRule rule = PhCssReader.readSingleStyleRule(text + " {}");
        if (rule == null) {
            throw new CssParseException("Malformed selector '" + text + "'");
        }
        if (rule.getSelectorCount() != 1) {
            throw new CssParseException("Expected a single selector but got a group: '" + text + "'");
        }

        CSSSelector selector = rule.getAllSelectors().get(0);
        List<SelectorToken> tokens = new ArrayList<>(selector.getMemberCount());
        for (ICSSSelectorMember member : selector.getAllMembers()) {
            SelectorToken token = toToken(member);
            if (token != null) {
                tokens.add(token);
            }
        }

        logger.trace("Tokenized selector '{}' into {}", text, tokens);
        return tokens;
    }

    private static SelectorToken toToken(ICSSSelectorMember member) {
        String css = PhCssReader.write(member).trim();

        if (member instanceof ECSSSelectorCombinator) {
            // the descendant combinator writes as blank
            return css.isEmpty() ? null : new SelectorToken(SelectorTokenType.COMBINATOR, css);
        }
        if (member instanceof CSSSelectorAttribute) {
            return new SelectorToken(SelectorTokenType.ATTRIBUTE, stripBrackets(css));
        }
        if (css.startsWith("::")) {
            return new SelectorToken(SelectorTokenType.PSEUDO_ELEMENT, pseudoName(css.substring(2)));
        }
        if (css.startsWith(":")) {
            return new SelectorToken(SelectorTokenType.PSEUDO_CLASS, pseudoName(css.substring(1)));
        }
        if (css.startsWith("#")) {
            return new SelectorToken(SelectorTokenType.ID, css.substring(1));
        }
        if (css.startsWith(".")) {
            return new SelectorToken(SelectorTokenType.CLASS, css.substring(1));
        }

        // namespace prefixes contribute nothing
        String name = css.substring(css.indexOf('|') + 1);
        if (name.equals("*")) {
            return new SelectorToken(SelectorTokenType.UNIVERSAL, "*");
        }
        return new SelectorToken(SelectorTokenType.TYPE, name.toLowerCase(Locale.ROOT));
    }

    private static String pseudoName(String text) {
        int paren = text.indexOf('(');
        String name = paren < 0 ? text : text.substring(0, paren);
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static String stripBrackets(String css) {
        String inner = css;
        if (inner.startsWith("[")) {
            inner = inner.substring(1);
        }
        if (inner.endsWith("]")) {
            inner = inner.substring(0, inner.length() - 1);
        }
        return inner.trim();
    }
}
