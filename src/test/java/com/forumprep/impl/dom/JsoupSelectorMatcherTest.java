package com.forumprep.impl.dom;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupSelectorMatcherTest {

    private final JsoupSelectorMatcher matcher = new JsoupSelectorMatcher();

    @Test
    void matches_usesFullSelectorSemantics() {
        Document doc = Jsoup.parse("<div class='note'><p id='a'>x</p><p>y</p></div><p class='note'>z</p>");
        Element first = doc.selectFirst("#a");
        Element outside = doc.selectFirst("body > p.note");

        assertThat(matcher.matches("div.note > p", first)).isTrue();
        assertThat(matcher.matches("div.note > p", outside)).isFalse();
        assertThat(matcher.matches("p:nth-child(1)", first)).isTrue();
        assertThat(matcher.matches("body *", outside)).isTrue();
    }

    @Test
    void matches_unsupportedSelectorMatchesNothing() {
        Document doc = Jsoup.parse("<p>x</p>");
        Element p = doc.selectFirst("p");

        assertThat(matcher.matches("!!", p)).isFalse();
        assertThat(matcher.isSupported("!!")).isFalse();
        assertThat(matcher.isSupported("p")).isTrue();
    }

    @Test
    void matches_nullArgumentsNeverMatch() {
        Document doc = Jsoup.parse("<p>x</p>");
        assertThat(matcher.matches(null, doc.selectFirst("p"))).isFalse();
        assertThat(matcher.matches("p", null)).isFalse();
    }
}
