package com.forumprep.impl.css;

import com.forumprep.core.CssParseException;
import com.forumprep.model.Declaration;
import com.forumprep.model.RawRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhCssParserTest {

    private final PhCssParser parser = new PhCssParser();

    @Test
    void parseStylesheet_readsRulesInSourceOrder() {
        List<RawRule> rules = parser.parseStylesheet(
                "/* header */\n.note { color: red; FONT-WEIGHT: bold }\n  h1,\n  h2 {margin:0}");

        assertThat(rules).hasSize(2);
        assertThat(rules.get(0).getSelectorText()).isEqualTo(".note");
        assertThat(rules.get(0).getDeclarations()).containsExactly(
                new Declaration("color", "red", false),
                new Declaration("font-weight", "bold", false));
        assertThat(rules.get(1).getSelectorText()).isEqualTo("h1, h2");
    }

    @Test
    void parseStylesheet_readsImportantFlag() {
        List<RawRule> rules = parser.parseStylesheet("p { color: red !important; margin: 0 }");

        assertThat(rules.get(0).getDeclarations()).containsExactly(
                new Declaration("color", "red", true),
                new Declaration("margin", "0", false));
    }

    @Test
    void parseStylesheet_skipsAtRules() {
        List<RawRule> rules = parser.parseStylesheet(
                "@charset \"utf-8\";\n"
                        + "@media print { p { color: black } .x { display: none } }\n"
                        + "<!-- p { color: red } -->");

        assertThat(rules).hasSize(1);
        assertThat(rules.get(0).getSelectorText()).isEqualTo("p");
    }

    @Test
    void parseStylesheet_keepsBracesInsideStrings() {
        List<RawRule> rules = parser.parseStylesheet("p::after { content: \"}\" } div { margin: 0 }");

        assertThat(rules).extracting(RawRule::getSelectorText).containsExactly("p::after", "div");
    }

    @Test
    void parseStylesheet_dropsRulesWithoutDeclarations() {
        assertThat(parser.parseStylesheet("p {} div { ; }")).isEmpty();
    }

    @Test
    void parseStylesheet_blankInputYieldsNothing() {
        assertThat(parser.parseStylesheet(null)).isEmpty();
        assertThat(parser.parseStylesheet("   \n ")).isEmpty();
    }

    @Test
    void parseStylesheet_recoversFromBrokenDeclarationsAndRules() {
        List<RawRule> rules = parser.parseStylesheet(
                ".a { color: red } .b { color: blue; bogus } p color: green } .c { margin: 0 } /* open");

        assertThat(rules).extracting(RawRule::getSelectorText).containsExactly(".a", ".b", ".c");
        assertThat(rules.get(1).getDeclarations()).containsExactly(new Declaration("color", "blue", false));
    }

    @Test
    void parseStylesheet_dropsRuleWithInvalidSelector() {
        List<RawRule> rules = parser.parseStylesheet("a[href { color: red } p { color: blue }");

        assertThat(rules).extracting(RawRule::getSelectorText).containsExactly("p");
    }

    @Test
    void parseStylesheet_throwsWhenNothingIsUsable() {
        assertThatThrownBy(() -> parser.parseStylesheet("p { color: red"))
                .isInstanceOf(CssParseException.class)
                .hasMessageContaining("No usable rule");
        assertThatThrownBy(() -> parser.parseStylesheet("p color: red }"))
                .isInstanceOf(CssParseException.class);
        assertThatThrownBy(() -> parser.parseStylesheet("p { color red }"))
                .isInstanceOf(CssParseException.class);
    }

    @Test
    void parseInlineStyle_keepsDuplicatesAndNormalizesNames() {
        List<Declaration> declarations = parser.parseInlineStyle("Color: red; color: blue;  ");

        assertThat(declarations).containsExactly(
                new Declaration("color", "red", false),
                new Declaration("color", "blue", false));
    }

    @Test
    void parseInlineStyle_ignoresComments() {
        assertThat(parser.parseInlineStyle("/* x */ width: 10px /* y */"))
                .containsExactly(new Declaration("width", "10px", false));
    }

    @Test
    void parseInlineStyle_skipsOnlyTheMalformedDeclaration() {
        assertThat(parser.parseInlineStyle("color: red; oops; font-weight: bold !important"))
                .containsExactly(
                        new Declaration("color", "red", false),
                        new Declaration("font-weight", "bold", true));
    }

    @Test
    void parseInlineStyle_rejectsGarbage() {
        assertThatThrownBy(() -> parser.parseInlineStyle("color"))
                .isInstanceOf(CssParseException.class);
        assertThatThrownBy(() -> parser.parseInlineStyle("col or: red"))
                .isInstanceOf(CssParseException.class);
        assertThatThrownBy(() -> parser.parseInlineStyle("color: "))
                .isInstanceOf(CssParseException.class);
    }
}
