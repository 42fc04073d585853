package com.forumprep.cascade;

import com.forumprep.core.CssParseException;
import com.forumprep.core.CssParser;
import com.forumprep.model.ComputedStyle;
import com.forumprep.model.Declaration;
import com.forumprep.model.WinningEntry;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fills inheritable properties the cascade left unset from the nearest ancestor
 * whose serialized {@code style} attribute defines them. Ancestors must already
 * carry their resolved style, i.e. elements are processed in document order.
 * Nothing is fabricated when no ancestor defines a property.
 */
public class InheritancePropagator {
    private static final Logger logger = LoggerFactory.getLogger(InheritancePropagator.class);

    private final CssParser cssParser;
    private final Set<String> inheritableProperties;

    public InheritancePropagator(CssParser cssParser, Set<String> inheritableProperties) {
        this.cssParser = cssParser;
        this.inheritableProperties = inheritableProperties;
    }

    /**
     * @return number of properties inherited
     */
    public int propagate(Element element, ComputedStyle style) {
        Set<String> missing = new LinkedHashSet<>();
        for (String property : inheritableProperties) {
            if (!style.contains(property)) {
                missing.add(property);
            }
        }
        if (missing.isEmpty()) {
            return 0;
        }

        int inherited = 0;
        Element ancestor = element.parent();
        while (ancestor != null && !(ancestor instanceof Document) && !missing.isEmpty()) {
            String styleAttr = ancestor.attr("style");
            if (!styleAttr.isEmpty()) {
                List<Declaration> declarations;
                try {
                    declarations = cssParser.parseInlineStyle(styleAttr);
                } catch (CssParseException e) {
                    logger.debug("Skipping malformed style on ancestor <{}>: {}", ancestor.normalName(), e.getMessage());
                    ancestor = ancestor.parent();
                    continue;
                }

                for (String property : List.copyOf(missing)) {
                    String value = lastValue(declarations, property);
                    if (value != null) {
                        style.merge(property, WinningEntry.inherited(value));
                        missing.remove(property);
                        inherited++;
                    }
                }
            }
            ancestor = ancestor.parent();
        }
        return inherited;
    }

    private static String lastValue(List<Declaration> declarations, String property) {
        String value = null;
        for (Declaration declaration : declarations) {
            if (declaration.getProperty().equals(property)) {
                value = declaration.getValue();
            }
        }
        return value;
    }
}
