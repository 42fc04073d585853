package com.forumprep.impl.css;

import com.helger.css.ECSSVersion;
import com.helger.css.ICSSWriteable;
import com.helger.css.decl.CSSDeclarationList;
import com.helger.css.decl.CSSStyleRule;
import com.helger.css.decl.CascadingStyleSheet;
import com.helger.css.reader.errorhandler.CollectingCSSParseErrorHandler;
import com.helger.css.reader.CSSReader;
import com.helger.css.reader.CSSReaderDeclarationList;
import com.helger.css.writer.CSSWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Thin strict front end over ph-css: a read either succeeds without any
 * reported error or yields null, so callers can fall back to a finer grain.
 */
final class PhCssReader {
    private static final Logger logger = LoggerFactory.getLogger(PhCssReader.class);

    private static final ECSSVersion VERSION = ECSSVersion.CSS30;
    private static final CSSWriterSettings WRITER_SETTINGS = new CSSWriterSettings(VERSION, false);

    private PhCssReader() {
    }

    /**
     * @return the single style rule {@code css} consists of, or null if it is
     * malformed, an at-rule, or holds more than one rule
     */
    static CSSStyleRule readSingleStyleRule(String css) {
        CollectingCSSParseErrorHandler errors = new CollectingCSSParseErrorHandler();
        List<String> fatal = new ArrayList<>(1);
        CascadingStyleSheet sheet;
        try {
            sheet = CSSReader.readFromString(css, VERSION, errors, ex -> fatal.add(ex.getMessage()));
        } catch (RuntimeException e) {
            logger.debug("ph-css rejected rule '{}': {}", css, e.getMessage());
            return null;
        }
        if (sheet == null || errors.hasParseErrors() || !fatal.isEmpty()) {
            logger.debug("ph-css rejected rule '{}': {}", css, describe(errors, fatal));
            return null;
        }
        if (sheet.getAllRules().size() != 1 || sheet.getStyleRuleCount() != 1) {
            return null;
        }
        return sheet.getAllStyleRules().get(0);
    }

    /**
     * @return the parsed declaration list, or null if ph-css reported any error
     */
    static CSSDeclarationList readDeclarations(String css) {
        CollectingCSSParseErrorHandler errors = new CollectingCSSParseErrorHandler();
        List<String> fatal = new ArrayList<>(1);
        CSSDeclarationList declarations;
        try {
            declarations = CSSReaderDeclarationList.readFromString(css, VERSION, errors,
                    ex -> fatal.add(ex.getMessage()));
        } catch (RuntimeException e) {
            logger.debug("ph-css rejected declarations '{}': {}", css, e.getMessage());
            return null;
        }
        if (declarations == null || errors.hasParseErrors() || !fatal.isEmpty()) {
            logger.debug("ph-css rejected declarations '{}': {}", css, describe(errors, fatal));
            return null;
        }
        return declarations;
    }

    static String write(ICSSWriteable node) {
        return node.getAsCSSString(WRITER_SETTINGS, 0);
    }

    private static String describe(CollectingCSSParseErrorHandler errors, List<String> fatal) {
        if (!fatal.isEmpty()) {
            return fatal.get(0);
        }
        if (errors.hasParseErrors()) {
            return errors.getAllParseErrors().get(0).getErrorMessage();
        }
        return "no result";
    }
}
