package com.forumprep.core;

/**
 * Raised when a stylesheet, a selector or an inline style attribute cannot be parsed.
 * Callers recover locally; a single malformed source never aborts a pass.
 */
public class CssParseException extends RuntimeException {

    public CssParseException(String message) {
        super(message);
    }

    public CssParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
