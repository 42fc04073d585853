package com.forumprep.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Low-level helpers shared by the CSS readers.
 */
public final class CssTextUtils {

    private CssTextUtils() {
    }

    /**
     * Split on {@code separator} outside of strings, parentheses and brackets.
     * Escaped characters never split.
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        int len = text.length();
        while (i < len) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < len) {
                i += 2;
                continue;
            }
            if (c == '"' || c == '\'') {
                i = skipQuoted(text, i);
                continue;
            }
            if (c == '(' || c == '[') {
                depth++;
            } else if ((c == ')' || c == ']') && depth > 0) {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        parts.add(text.substring(start));
        return parts;
    }

    /**
     * @param open index of the opening quote
     * @return index just past the closing quote, or the text length if the string is never closed
     */
    public static int skipQuoted(String text, int open) {
        char quote = text.charAt(open);
        int i = open + 1;
        int len = text.length();
        while (i < len) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return len;
    }

    /**
     * Index of the first {@code target} outside strings, or -1.
     */
    public static int indexOfTopLevel(String text, char target) {
        int i = 0;
        int len = text.length();
        while (i < len) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < len) {
                i += 2;
                continue;
            }
            if (c == '"' || c == '\'') {
                i = skipQuoted(text, i);
                continue;
            }
            if (c == target) {
                return i;
            }
            i++;
        }
        return -1;
    }
}
