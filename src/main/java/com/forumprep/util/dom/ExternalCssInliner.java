package com.forumprep.util.dom;

import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Replaces {@code <link rel="stylesheet">} elements that point at local files
 * with {@code <style>} elements holding the file content, so the cascade sees them.
 * Links that cannot be resolved stay untouched.
 */
public class ExternalCssInliner {
    private static final Logger logger = LoggerFactory.getLogger(ExternalCssInliner.class);

    /**
     * @param baseDir directory relative hrefs are resolved against
     * @return number of stylesheets inlined
     */
    public int inline(Document document, Path baseDir) {
        List<Element> links = new ArrayList<>();
        for (Element link : document.select("link[rel]")) {
            if (isStylesheetLink(link)) {
                links.add(link);
            }
        }
        int inlined = 0;

        for (Element link : links) {
            String href = link.attr("href").trim();
            if (href.isEmpty()) {
                logger.warn("<link rel='stylesheet'> tag found without 'href' attribute");
                continue;
            }
            if (isRemote(href)) {
                logger.warn("Skipping remote stylesheet: {}", href);
                continue;
            }

            Path cssFile;
            try {
                cssFile = resolve(baseDir, stripQueryAndFragment(href));
            } catch (InvalidPathException e) {
                logger.warn("Invalid stylesheet path '{}': {}", href, e.getMessage());
                continue;
            }

            if (!Files.isRegularFile(cssFile)) {
                logger.warn("External CSS file not found: {}", cssFile);
                continue;
            }

            try {
                String css = Files.readString(cssFile, StandardCharsets.UTF_8);
                Element style = new Element("style");
                style.appendChild(new DataNode(css));
                link.replaceWith(style);
                inlined++;
                logger.info("Inlined external CSS from: {}", cssFile);
            } catch (IOException e) {
                logger.warn("Could not read or inline CSS from {}: {}", cssFile, e.getMessage());
            }
        }
        return inlined;
    }

    private static Path resolve(Path baseDir, String href) {
        Path hrefPath = Path.of(href);
        if (hrefPath.isAbsolute()) {
            return hrefPath;
        }
        Path base = baseDir != null ? baseDir : Path.of("").toAbsolutePath();
        return base.resolve(hrefPath).normalize();
    }

    private static boolean isStylesheetLink(Element link) {
        for (String rel : link.attr("rel").trim().split("\\s+")) {
            if (rel.equalsIgnoreCase("stylesheet")) {
                return true;
            }
        }
        return false;
    }

    private static boolean isRemote(String href) {
        String lower = href.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") || lower.startsWith("//")
                || lower.startsWith("data:");
    }

    private static String stripQueryAndFragment(String href) {
        String trimmed = href;
        int q = trimmed.indexOf('?');
        if (q > 0) trimmed = trimmed.substring(0, q);
        int h = trimmed.indexOf('#');
        if (h > 0) trimmed = trimmed.substring(0, h);
        return trimmed;
    }
}
