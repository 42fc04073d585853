package com.forumprep.cascade;

import com.forumprep.impl.css.PhCssParser;
import com.forumprep.impl.css.PhCssSelectorTokenizer;
import com.forumprep.model.Declaration;
import com.forumprep.model.Specificity;
import com.forumprep.model.StyleRule;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RuleCollectorTest {

    private final RuleCollector collector = new RuleCollector(
            new PhCssParser(),
            new SpecificityCalculator(new PhCssSelectorTokenizer()),
            Set.of("nth-child", "nth-of-type"));

    @Test
    void collect_numbersRulesAcrossSheetsInOrder() {
        CollectedRules collected = collector.collect(List.of(
                ".x { color: red } p { margin: 0 }",
                ".x { color: green }"));

        List<StyleRule> rules = collected.getRules();
        assertThat(rules).extracting(StyleRule::getSelectorText).containsExactly(".x", "p", ".x");
        assertThat(rules).extracting(StyleRule::getSourceIndex).containsExactly(0, 1, 2);
        assertThat(collected.getStylesheetCount()).isEqualTo(2);
    }

    @Test
    void collect_splitsSelectorGroups() {
        List<StyleRule> rules = collector.collect(List.of("#t, h1 { color: red }")).getRules();

        assertThat(rules).extracting(StyleRule::getSelectorText).containsExactly("#t", "h1");
        assertThat(rules).extracting(StyleRule::getSpecificity)
                .containsExactly(new Specificity(1, 0, 0), new Specificity(0, 0, 1));
        assertThat(rules).extracting(StyleRule::getSourceIndex).containsExactly(0, 1);
    }

    @Test
    void collect_dropsDynamicPseudoClasses() {
        CollectedRules collected = collector.collect(List.of(
                "a:hover { color: red }"
                        + " li:nth-child(2) { color: blue }"
                        + " input:focus, p { color: green }"
                        + " tr:nth-of-type(odd) { color: gray }"
                        + " p::after { content: 'x' }"
                        + " a[href='http://x'] { color: teal }"));

        assertThat(collected.getRules()).extracting(StyleRule::getSelectorText)
                .containsExactly("li:nth-child(2)", "tr:nth-of-type(odd)", "a[href='http://x']");
        assertThat(collected.getSkippedDynamicRuleCount()).isEqualTo(3);
    }

    @Test
    void collect_unparsableSheetContributesNothing() {
        CollectedRules collected = collector.collect(List.of(
                "p { color: red }",
                "p { color: ",
                "div { color: blue }"));

        assertThat(collected.getRules()).extracting(StyleRule::getSelectorText).containsExactly("p", "div");
        assertThat(collected.getRules()).extracting(StyleRule::getSourceIndex).containsExactly(0, 1);
        assertThat(collected.getFailedStylesheetCount()).isEqualTo(1);
    }

    @Test
    void collect_badDeclarationOnlyCostsItself() {
        CollectedRules collected = collector.collect(List.of(
                ".a { color: red } .b { *zoom: 1 } .c { color: blue; bogus; margin: 0 }"));

        assertThat(collected.getRules()).extracting(StyleRule::getSelectorText).containsExactly(".a", ".c");
        assertThat(collected.getRules().get(1).getDeclarations())
                .extracting(Declaration::getProperty).containsExactly("color", "margin");
        assertThat(collected.getFailedStylesheetCount()).isZero();
    }

    @Test
    void collect_strayClosingBraceKeepsSurroundingRules() {
        CollectedRules collected = collector.collect(List.of(".a { color: red }} .b { color: blue }"));

        assertThat(collected.getRules()).extracting(StyleRule::getSelectorText).containsExactly(".a", ".b");
        assertThat(collected.getRules()).extracting(StyleRule::getSourceIndex).containsExactly(0, 1);
        assertThat(collected.getFailedStylesheetCount()).isZero();
    }

    @Test
    void collect_detachesEveryStyleElement() {
        Document doc = Jsoup.parse("<html><head><style>p{color:red}</style><style>broken{</style></head>"
                + "<body><style>div{color:blue}</style><p>x</p></body></html>");

        CollectedRules collected = collector.collect(doc);

        assertThat(collected.getRules()).extracting(StyleRule::getSelectorText).containsExactly("p", "div");
        assertThat(collected.getFailedStylesheetCount()).isEqualTo(1);
        assertThat(doc.select("style")).isEmpty();
    }

    @Test
    void isStaticallyResolvable_ignoresColonsInsideAttributes() {
        assertThat(collector.isStaticallyResolvable("a[title=\"a:hover\"]")).isTrue();
        assertThat(collector.isStaticallyResolvable("li:NTH-CHILD(3)")).isTrue();
        assertThat(collector.isStaticallyResolvable("li:not(:hover)")).isFalse();
    }
}
