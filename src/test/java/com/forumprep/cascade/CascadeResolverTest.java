package com.forumprep.cascade;

import com.forumprep.core.SelectorMatcher;
import com.forumprep.impl.css.PhCssParser;
import com.forumprep.impl.css.PhCssSelectorTokenizer;
import com.forumprep.impl.dom.JsoupSelectorMatcher;
import com.forumprep.model.ComputedStyle;
import com.forumprep.model.Declaration;
import com.forumprep.model.Specificity;
import com.forumprep.model.StyleRule;
import com.forumprep.model.WinningEntry;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;

class CascadeResolverTest {

    private final PhCssParser cssParser = new PhCssParser();
    private final RuleCollector collector = new RuleCollector(cssParser,
            new SpecificityCalculator(new PhCssSelectorTokenizer()), Set.of("nth-child", "nth-of-type"));
    private final CascadeResolver resolver = new CascadeResolver(cssParser, new JsoupSelectorMatcher());

    private List<StyleRule> rules(String css) {
        return collector.collect(List.of(css)).getRules();
    }

    private static Element element(String html, String selector) {
        return Jsoup.parse(html).selectFirst(selector);
    }

    @Test
    void resolve_laterRuleWinsOnEqualSpecificity() {
        Element el = element("<p class='x'>t</p>", "p");

        ComputedStyle style = resolver.resolve(el, rules(".x{color:red} .x{color:green}"));

        assertThat(style.get("color").getValue()).isEqualTo("green");
        assertThat(style.get("color").getSourceIndex()).isEqualTo(1);
    }

    @Test
    void resolve_higherSpecificityWinsRegardlessOfOrder() {
        Element el = element("<p id='a' class='x'>t</p>", "p");

        ComputedStyle style = resolver.resolve(el, rules("#a{color:red} .x{color:green} p{color:blue}"));

        assertThat(style.get("color").getValue()).isEqualTo("red");
        assertThat(style.get("color").getSpecificity()).isEqualTo(new Specificity(1, 0, 0));
    }

    @Test
    void resolve_importantRuleBeatsMoreSpecificRule() {
        Element el = element("<p id='a'>t</p>", "p");

        ComputedStyle style = resolver.resolve(el, rules("p{color:red !important} #a{color:blue}"));

        assertThat(style.get("color").getValue()).isEqualTo("red");
        assertThat(style.get("color").isImportant()).isTrue();
    }

    @Test
    void resolve_inlineIsPromotedToImportantWithIdSpecificity() {
        Element el = element("<div style='color: blue'>t</div>", "div");

        ComputedStyle style = resolver.resolve(el, rules("div{color:red !important}"));

        WinningEntry color = style.get("color");
        assertThat(color.getValue()).isEqualTo("blue");
        assertThat(color.isImportant()).isTrue();
        assertThat(color.getSpecificity()).isEqualTo(Specificity.INLINE);
        assertThat(color.getOrigin()).isEqualTo(WinningEntry.Origin.INLINE);
        assertThat(style.toStyleAttribute()).isEqualTo("color: blue");
    }

    @Test
    void resolve_moreSpecificImportantRuleBeatsInline() {
        Element el = element("<div id='a' class='b' style='color: blue'>t</div>", "div");

        ComputedStyle style = resolver.resolve(el, rules("#a.b{color:red !important}"));

        assertThat(style.get("color").getValue()).isEqualTo("red");
        assertThat(style.toStyleAttribute()).isEqualTo("color: red !important");
    }

    @Test
    void resolve_nonImportantRuleNeverBeatsInline() {
        Element el = element("<div id='a' class='b c' style='color: blue'>t</div>", "div");

        ComputedStyle style = resolver.resolve(el, rules("#a.b.c{color:red}"));

        assertThat(style.get("color").getValue()).isEqualTo("blue");
    }

    @Test
    void resolve_lastDuplicateInlineDeclarationWins() {
        Element el = element("<b style='color: red; color: green'>t</b>", "b");

        assertThat(resolver.resolve(el, List.of()).get("color").getValue()).isEqualTo("green");
    }

    @Test
    void resolve_malformedInlineStyleIsIgnored() {
        Element el = element("<p class='x' style='color red'>t</p>", "p");

        ComputedStyle style = resolver.resolve(el, rules(".x{margin:0}"));

        assertThat(style.contains("color")).isFalse();
        assertThat(style.get("margin").getValue()).isEqualTo("0");
    }

    @Test
    void resolve_doesNotExpandShorthands() {
        Element el = element("<p class='x'>t</p>", "p");

        ComputedStyle style = resolver.resolve(el, rules(".x{margin:0} p{margin-top:5px}"));

        assertThat(style.get("margin").getValue()).isEqualTo("0");
        assertThat(style.get("margin-top").getValue()).isEqualTo("5px");
    }

    @Test
    void resolve_onlyMatchedRulesContribute() {
        SelectorMatcher matcher = Mockito.mock(SelectorMatcher.class);
        Element el = element("<p>t</p>", "p");
        Mockito.when(matcher.matches(eq("p"), any())).thenReturn(true);
        Mockito.when(matcher.matches(eq("span"), any())).thenReturn(false);
        CascadeResolver mocked = new CascadeResolver(cssParser, matcher);

        List<StyleRule> rules = List.of(
                new StyleRule("p", List.of(new Declaration("color", "red", false)), new Specificity(0, 0, 1), 0),
                new StyleRule("span", List.of(new Declaration("color", "blue", false)), new Specificity(0, 0, 1), 1));

        ComputedStyle style = mocked.resolve(el, rules);

        assertThat(style.get("color").getValue()).isEqualTo("red");
        Mockito.verify(matcher).matches("span", el);
    }

    @Test
    void resolve_isDeterministic() {
        Element el = element("<p id='a' class='x y' style='font-weight: bold'>t</p>", "p");
        List<StyleRule> rules = rules(".x{color:red;margin:0} .y{color:green;padding:1px} #a{border:0} p{color:blue}");

        String first = resolver.resolve(el, rules).toStyleAttribute();
        String second = resolver.resolve(el, rules).toStyleAttribute();

        assertThat(first).isEqualTo("font-weight: bold; color: green; margin: 0; padding: 1px; border: 0");
        assertThat(second).isEqualTo(first);
    }
}
