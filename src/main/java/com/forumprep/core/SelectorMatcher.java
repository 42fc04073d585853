package com.forumprep.core;

import org.jsoup.nodes.Element;

/**
 * Authoritative selector matching. The cascade never interprets selectors itself.
 */
public interface SelectorMatcher {

    /**
     * @return true if {@code element} matches {@code selectorText}; a selector the
     *         matcher cannot handle matches nothing
     */
    boolean matches(String selectorText, Element element);
}
