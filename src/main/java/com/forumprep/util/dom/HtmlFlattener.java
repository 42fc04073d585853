package com.forumprep.util.dom;

import com.forumprep.cascade.CascadeResolver;
import com.forumprep.cascade.CollectedRules;
import com.forumprep.cascade.InheritancePropagator;
import com.forumprep.cascade.InvisibilityPruner;
import com.forumprep.cascade.PruneResult;
import com.forumprep.cascade.RuleCollector;
import com.forumprep.cascade.SpecificityCalculator;
import com.forumprep.config.FlattenConfig;
import com.forumprep.core.SelectorMatcher;
import com.forumprep.core.SelectorTokenizer;
import com.forumprep.impl.css.CachingCssParser;
import com.forumprep.impl.css.PhCssParser;
import com.forumprep.impl.css.PhCssSelectorTokenizer;
import com.forumprep.impl.dom.JsoupSelectorMatcher;
import com.forumprep.model.ComputedStyle;
import com.forumprep.model.Phase;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the flattening phases over an HTML document: external stylesheet linking,
 * cascade flattening into {@code style} attributes, and invisible element pruning.
 * One instance may be reused across documents; a single document must not be
 * processed by two threads at once.
 */
public final class HtmlFlattener {
    private static final Logger logger = LoggerFactory.getLogger(HtmlFlattener.class);

    private final FlattenConfig config;
    private final CachingCssParser cssParser;
    private final RuleCollector ruleCollector;
    private final CascadeResolver cascadeResolver;
    private final InheritancePropagator inheritancePropagator;
    private final InvisibilityPruner invisibilityPruner;
    private final ExternalCssInliner externalCssInliner;

    public HtmlFlattener() {
        this(FlattenConfig.fromProperties());
    }

    public HtmlFlattener(FlattenConfig config) {
        this(config, new PhCssSelectorTokenizer(), new JsoupSelectorMatcher());
    }

    public HtmlFlattener(FlattenConfig config, SelectorTokenizer selectorTokenizer, SelectorMatcher selectorMatcher) {
        this.config = config;
        this.cssParser = new CachingCssParser(new PhCssParser(), config.getStylesheetCacheSize());
        this.ruleCollector = new RuleCollector(cssParser, new SpecificityCalculator(selectorTokenizer),
                config.getStaticPseudoClasses());
        this.cascadeResolver = new CascadeResolver(cssParser, selectorMatcher);
        this.inheritancePropagator = new InheritancePropagator(cssParser, config.getInheritableProperties());
        this.invisibilityPruner = new InvisibilityPruner(cssParser, config.getIntrinsicSizeTags(),
                config.getZeroSizeValues(), config.isRepeatPruneUntilStable());
        this.externalCssInliner = new ExternalCssInliner();
    }

    // ---------- PUBLIC API ----------

    public FlattenedHtmlResult flatten(String html) {
        return flatten(html, EnumSet.of(Phase.INLINE_CSS, Phase.REMOVE_INVISIBLE), null);
    }

    /**
     * @param phases  phases to run; they always execute in {@link Phase} declaration order
     * @param baseDir directory for resolving relative stylesheet links, may be null
     */
    public FlattenedHtmlResult flatten(String html, Set<Phase> phases, Path baseDir) {
        String input = html == null ? "" : html;
        Document doc = Jsoup.parse(input);
        doc.outputSettings().prettyPrint(false);

        int originalNodeCount = doc.getAllElements().size();
        int originalSize = input.length();

        int linked = 0;
        StyleApplication applied = StyleApplication.NONE;
        int pruned = 0;

        if (phases.contains(Phase.LINK_CSS)) {
            logger.info("--- {} ---", Phase.LINK_CSS);
            linked = externalCssInliner.inline(doc, baseDir);
        }

        if (phases.contains(Phase.INLINE_CSS)) {
            logger.info("--- {} ---", Phase.INLINE_CSS);
            applied = applyCss(doc);
        }

        if (phases.contains(Phase.REMOVE_INVISIBLE)) {
            logger.info("--- {} ---", Phase.REMOVE_INVISIBLE);
            pruned = removeInvisible(doc).getRemovedCount();
        }

        String output = doc.outerHtml();

        DomMetrics metrics = new DomMetrics(
                originalNodeCount,
                doc.getAllElements().size(),
                originalSize,
                output.length(),
                linked,
                applied.getCollected() == null ? 0 : applied.getCollected().getRules().size(),
                applied.getCollected() == null ? 0 : applied.getCollected().getSkippedDynamicRuleCount(),
                applied.getCollected() == null ? 0 : applied.getCollected().getFailedStylesheetCount(),
                applied.getElementsStyled(),
                applied.getPropertiesInherited(),
                pruned
        );

        return new FlattenedHtmlResult(output, metrics);
    }

    public String inlineExternalCss(String html, Path baseDir) {
        return flatten(html, EnumSet.of(Phase.LINK_CSS), baseDir).getHtml();
    }

    public String applyCssToElements(String html) {
        return flatten(html, EnumSet.of(Phase.INLINE_CSS), null).getHtml();
    }

    public String removeInvisibleElements(String html) {
        return flatten(html, EnumSet.of(Phase.REMOVE_INVISIBLE), null).getHtml();
    }

    /**
     * Collects all stylesheet rules (detaching the {@code <style>} elements), then
     * resolves every element in document order and writes the result to its
     * {@code style} attribute. Document order guarantees ancestors are written
     * before descendants inherit from them.
     */
    public StyleApplication applyCss(Document doc) {
        CollectedRules collected = ruleCollector.collect(doc);

        List<Element> elements = new ArrayList<>();
        for (Element el : doc.getAllElements()) {
            if (!(el instanceof Document)) {
                elements.add(el);
            }
        }

        int styled = 0;
        int inherited = 0;
        for (Element el : elements) {
            ComputedStyle style = cascadeResolver.resolve(el, collected.getRules());
            inherited += inheritancePropagator.propagate(el, style);

            if (style.isEmpty()) {
                el.removeAttr("style");
            } else {
                el.attr("style", style.toStyleAttribute());
                styled++;
            }
        }

        logger.info("Applied {} rules from {} stylesheets to {} elements ({} inherited properties)",
                collected.getRules().size(), collected.getStylesheetCount(), styled, inherited);
        return new StyleApplication(collected, styled, inherited);
    }

    public PruneResult removeInvisible(Document doc) {
        PruneResult result = invisibilityPruner.prune(doc);
        logger.info("Removed {} invisible elements", result.getRemovedCount());
        return result;
    }

    public FlattenConfig getConfig() {
        return config;
    }

    public void clearCaches() {
        cssParser.clear();
    }

    /**
     * Outcome of {@link #applyCss(Document)}.
     */
    public static final class StyleApplication {

        static final StyleApplication NONE = new StyleApplication(null, 0, 0);

        private final CollectedRules collected;
        private final int elementsStyled;
        private final int propertiesInherited;

        StyleApplication(CollectedRules collected, int elementsStyled, int propertiesInherited) {
            this.collected = collected;
            this.elementsStyled = elementsStyled;
            this.propertiesInherited = propertiesInherited;
        }

        public CollectedRules getCollected() { return collected; }
        public int getElementsStyled() { return elementsStyled; }
        public int getPropertiesInherited() { return propertiesInherited; }
    }
}
