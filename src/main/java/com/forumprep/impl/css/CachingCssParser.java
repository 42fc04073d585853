package com.forumprep.impl.css;

import com.forumprep.core.CssParser;
import com.forumprep.model.Declaration;
import com.forumprep.model.RawRule;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Memoizes parsed stylesheets by their text. Documents produced from the same
 * template repeat the same {@code <style>} blocks, so batch runs parse each once.
 * Inline styles are delegated unchanged. Failures are not cached.
 */
public class CachingCssParser implements CssParser {
    private static final Logger logger = LoggerFactory.getLogger(CachingCssParser.class);

    private final CssParser delegate;
    private final Cache<String, List<RawRule>> stylesheetCache;

    public CachingCssParser(CssParser delegate, long maximumSize) {
        if (delegate == null) {
            throw new IllegalArgumentException("Delegate parser cannot be null");
        }
        this.delegate = delegate;
        this.stylesheetCache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
        logger.debug("Stylesheet cache initialized with maximum size {}", maximumSize);
    }

    @Override
    public List<RawRule> parseStylesheet(String css) {
        if (css == null) {
            return delegate.parseStylesheet(null);
        }
        return stylesheetCache.get(css, delegate::parseStylesheet);
    }

    @Override
    public List<Declaration> parseInlineStyle(String style) {
        return delegate.parseInlineStyle(style);
    }

    public CacheStats getStats() {
        return stylesheetCache.stats();
    }

    public void clear() {
        stylesheetCache.invalidateAll();
    }
}
