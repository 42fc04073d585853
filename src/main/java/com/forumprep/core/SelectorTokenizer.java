package com.forumprep.core;

import com.forumprep.model.SelectorToken;

import java.util.List;

/**
 * Splits a single selector (no top-level commas) into tokens.
 */
public interface SelectorTokenizer {

    /**
     * @throws CssParseException if the selector cannot be tokenized
     */
    List<SelectorToken> tokenize(String selectorText);
}
