package com.forumprep.impl.css;

import com.forumprep.core.CssParseException;
import com.forumprep.core.CssParser;
import com.forumprep.model.Declaration;
import com.forumprep.model.RawRule;
import com.forumprep.util.CssTextUtils;
import com.helger.css.decl.CSSDeclaration;
import com.helger.css.decl.CSSDeclarationList;
import com.helger.css.decl.CSSStyleRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link CssParser} backed by ph-css.
 * <p>
 * A stylesheet is cut into top-level statements first and every statement is
 * handed to ph-css on its own, so one broken rule never costs the others. When
 * ph-css rejects a rule, its selector is checked alone and each declaration is
 * retried one by one; only the declarations ph-css still rejects are dropped.
 * A stray {@code '}'} discards the text before it, like a browser skipping to
 * the next block. A block still open at the end of the sheet is dropped.
 */
public class PhCssParser implements CssParser {
    private static final Logger logger = LoggerFactory.getLogger(PhCssParser.class);

    private static final Pattern PROPERTY_PATTERN = Pattern.compile("^-{0,2}[a-zA-Z_][a-zA-Z0-9_-]*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);

    @Override
    public List<RawRule> parseStylesheet(String css) {
        if (css == null || css.trim().isEmpty()) {
            return Collections.emptyList();
        }

        Problems problems = new Problems();
        List<RawRule> rules = new ArrayList<>();

        for (String statement : splitStatements(css, problems)) {
            if (statement.startsWith("@")) {
                logger.debug("Skipping at-rule: {}", abbreviate(statement));
                continue;
            }

            int open = CssTextUtils.indexOfTopLevel(statement, '{');
            if (open < 0) {
                problems.report("Skipping text without a declaration block: '{}'", abbreviate(statement));
                continue;
            }
            String selector = WHITESPACE.matcher(statement.substring(0, open)).replaceAll(" ").trim();
            if (selector.isEmpty()) {
                problems.report("Skipping block without selector: '{}'", abbreviate(statement));
                continue;
            }
            if (!statement.endsWith("}")) {
                problems.report("Skipping unterminated rule '{}'", abbreviate(statement));
                continue;
            }
            String body = statement.substring(open + 1, statement.length() - 1);

            List<Declaration> declarations;
            CSSStyleRule rule = PhCssReader.readSingleStyleRule(selector + " {" + body + "}");
            if (rule != null && rule.getDeclarationCount() == declarationChunks(body).size()) {
                declarations = toDeclarations(rule.getAllDeclarations(), problems);
            } else if (PhCssReader.readSingleStyleRule(selector + " {}") == null) {
                problems.report("Skipping rule with invalid selector '{}'", selector);
                continue;
            } else {
                declarations = recoverDeclarations(body, problems);
            }

            if (declarations.isEmpty()) {
                logger.debug("Dropping rule without declarations: '{}'", selector);
                continue;
            }
            rules.add(new RawRule(selector, declarations));
        }

        if (problems.count > 0) {
            if (rules.isEmpty()) {
                throw new CssParseException("No usable rule in stylesheet, " + problems.count
                        + " malformed part(s); first: " + problems.first);
            }
            logger.warn("Dropped {} malformed part(s) of a stylesheet, kept {} rules; first: {}",
                    problems.count, rules.size(), problems.first);
        }
        logger.debug("Parsed {} style rules from stylesheet of {} chars", rules.size(), css.length());
        return rules;
    }

    @Override
    public List<Declaration> parseInlineStyle(String style) {
        if (style == null || style.trim().isEmpty()) {
            return Collections.emptyList();
        }

        Problems problems = new Problems();
        CSSDeclarationList list = PhCssReader.readDeclarations(style);
        boolean clean = list != null && list.getDeclarationCount() == declarationChunks(style).size();
        List<Declaration> declarations = clean
                ? toDeclarations(list.getAllDeclarations(), problems)
                : recoverDeclarations(style, problems);

        if (declarations.isEmpty() && problems.count > 0) {
            throw new CssParseException("Malformed inline style '" + style + "': " + problems.first);
        }
        return declarations;
    }

    private static List<Declaration> recoverDeclarations(String body, Problems problems) {
        List<Declaration> declarations = new ArrayList<>();
        for (String chunk : declarationChunks(body)) {
            CSSDeclarationList single = PhCssReader.readDeclarations(chunk);
            if (single == null || single.getDeclarationCount() == 0) {
                problems.report("Dropping malformed declaration '{}'", chunk);
                continue;
            }
            declarations.addAll(toDeclarations(single.getAllDeclarations(), problems));
        }
        return declarations;
    }

    /**
     * Non-blank {@code ;}-separated parts of a declaration block, comments removed.
     * ph-css may skip a bad declaration silently, so this is what a clean read must match.
     */
    private static List<String> declarationChunks(String body) {
        List<String> chunks = new ArrayList<>();
        for (String part : CssTextUtils.splitTopLevel(COMMENT.matcher(body).replaceAll(" "), ';')) {
            String chunk = part.trim();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
        }
        return chunks;
    }

    private static List<Declaration> toDeclarations(List<CSSDeclaration> parsed, Problems problems) {
        List<Declaration> declarations = new ArrayList<>(parsed.size());
        for (CSSDeclaration declaration : parsed) {
            String property = declaration.getProperty();
            if (property == null || !PROPERTY_PATTERN.matcher(property.trim()).matches()) {
                problems.report("Dropping declaration with invalid property '{}'", property);
                continue;
            }
            String value = PhCssReader.write(declaration.getExpression()).trim();
            if (value.isEmpty()) {
                problems.report("Dropping declaration without value '{}'", property);
                continue;
            }
            declarations.add(new Declaration(property, value, declaration.isImportant()));
        }
        return declarations;
    }

    /**
     * Cuts the sheet at top-level block ends and top-level semicolons. Comments
     * and HTML comment markers are removed; strings are kept intact.
     */
    private static List<String> splitStatements(String css, Problems problems) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        int len = css.length();
        int i = 0;

        while (i < len) {
            char c = css.charAt(i);
            if (css.startsWith("/*", i)) {
                int end = css.indexOf("*/", i + 2);
                if (end < 0) {
                    problems.report("Unterminated comment at line {}", lineAt(css, i));
                    break;
                }
                current.append(' ');
                i = end + 2;
                continue;
            }
            if (c == '\\' && i + 1 < len) {
                current.append(css, i, i + 2);
                i += 2;
                continue;
            }
            if (c == '"' || c == '\'') {
                int end = CssTextUtils.skipQuoted(css, i);
                current.append(css, i, end);
                i = end;
                continue;
            }
            if (depth == 0 && css.startsWith("<!--", i)) {
                i += 4;
                continue;
            }
            if (depth == 0 && css.startsWith("-->", i)) {
                i += 3;
                continue;
            }

            if (c == '{') {
                depth++;
                current.append(c);
            } else if (c == '}') {
                if (depth == 0) {
                    problems.report("Unexpected '}' at line {}", lineAt(css, i));
                    current.setLength(0);
                } else {
                    depth--;
                    current.append(c);
                    if (depth == 0) {
                        flush(current, statements);
                    }
                }
            } else if (c == ';' && depth == 0) {
                current.append(c);
                flush(current, statements);
            } else {
                current.append(c);
            }
            i++;
        }

        flush(current, statements);
        return statements;
    }

    private static void flush(StringBuilder current, List<String> statements) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }

    private static int lineAt(String text, int index) {
        int line = 1;
        for (int i = 0; i < index && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 57) + "...";
    }

    /**
     * Malformed parts met while reading one sheet or attribute.
     */
    private static final class Problems {
        int count;
        String first;

        void report(String format, Object arg) {
            count++;
            String message = format.replace("{}", String.valueOf(arg));
            if (first == null) {
                first = message;
            }
            logger.debug(message);
        }
    }
}
