package com.forumprep.core;

import com.forumprep.model.Declaration;
import com.forumprep.model.RawRule;

import java.util.List;

/**
 * Turns CSS source text into rules and declarations.
 */
public interface CssParser {

    /**
     * Parse the content of a {@code <style>} block. At-rules are skipped. A malformed
     * rule or declaration is dropped on its own; the rest of the sheet still counts.
     *
     * @param css stylesheet text
     * @return style rules in source order
     * @throws CssParseException if the sheet is malformed and nothing in it is usable
     */
    List<RawRule> parseStylesheet(String css);

    /**
     * Parse the value of a {@code style} attribute.
     *
     * @param style attribute text
     * @return declarations in source order, duplicates included; malformed ones are dropped
     * @throws CssParseException if the attribute is malformed and no declaration is usable
     */
    List<Declaration> parseInlineStyle(String style);
}
