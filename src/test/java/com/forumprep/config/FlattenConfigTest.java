package com.forumprep.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlattenConfigTest {

    @Test
    void defaultConfig_matchesDocumentedDefaults() {
        FlattenConfig config = FlattenConfig.defaultConfig();

        assertThat(config.getInheritableProperties()).containsExactly(
                "color", "font-family", "font-size", "font-weight", "line-height", "text-align", "visibility");
        assertThat(config.getStaticPseudoClasses()).containsExactly("nth-child", "nth-of-type");
        assertThat(config.getIntrinsicSizeTags()).contains("img", "input", "br", "hr", "iframe", "embed");
        assertThat(config.getZeroSizeValues()).containsExactlyInAnyOrder("auto", "0", "0px", "0em", "0%");
        assertThat(config.isRepeatPruneUntilStable()).isFalse();
        assertThat(config.getStylesheetCacheSize()).isEqualTo(256);
    }

    @Test
    void fromProperties_bundledFileMatchesDefaults() {
        FlattenConfig bundled = FlattenConfig.fromProperties();
        FlattenConfig defaults = FlattenConfig.defaultConfig();

        assertThat(bundled.getInheritableProperties()).isEqualTo(defaults.getInheritableProperties());
        assertThat(bundled.getIntrinsicSizeTags()).isEqualTo(defaults.getIntrinsicSizeTags());
        assertThat(bundled.getStaticPseudoClasses()).isEqualTo(defaults.getStaticPseudoClasses());
    }

    @Test
    void fromProperties_overridesAndNormalizesLists() {
        Properties props = new Properties();
        props.setProperty("forumprep.cascade.inheritable-properties", " COLOR , font-size ,, ");
        props.setProperty("forumprep.prune.repeat-until-stable", "true");
        props.setProperty("forumprep.css.stylesheet-cache-size", "8");

        FlattenConfig config = FlattenConfig.fromProperties(props);

        assertThat(config.getInheritableProperties()).containsExactly("color", "font-size");
        assertThat(config.isRepeatPruneUntilStable()).isTrue();
        assertThat(config.getStylesheetCacheSize()).isEqualTo(8);
        assertThat(config.getStaticPseudoClasses()).containsExactly("nth-child", "nth-of-type");
    }

    @Test
    void fromProperties_rejectsInvalidCacheSize() {
        Properties props = new Properties();
        props.setProperty("forumprep.css.stylesheet-cache-size", "lots");

        assertThatThrownBy(() -> FlattenConfig.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stylesheet-cache-size");
    }

    @Test
    void builder_rejectsNegativeCacheSize() {
        assertThatThrownBy(() -> FlattenConfig.builder().stylesheetCacheSize(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromFile_overlaysBundledDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.properties");
        Files.writeString(file, "forumprep.prune.intrinsic-size-tags=img,svg\n");

        FlattenConfig config = FlattenConfig.fromFile(file);

        assertThat(config.getIntrinsicSizeTags()).containsExactly("img", "svg");
        assertThat(config.getInheritableProperties()).hasSize(7);
    }

    @Test
    void builder_acceptsCustomLists() {
        FlattenConfig config = FlattenConfig.builder()
                .staticPseudoClasses(List.of("first-child"))
                .zeroSizeValues(List.of("0"))
                .build();

        assertThat(config.getStaticPseudoClasses()).containsExactly("first-child");
        assertThat(config.getZeroSizeValues()).containsExactly("0");
    }

    @Test
    void fromProperties_resolvesEnvironmentPlaceholdersInsideValues() {
        Map<String, String> env = Map.of("EXTRA_PROP", "letter-spacing", "REPEAT", "true");
        Properties props = new Properties();
        props.setProperty("forumprep.cascade.inheritable-properties", "color, ${EXTRA_PROP}, ${MISSING:cursor}");
        props.setProperty("forumprep.prune.repeat-until-stable", "${REPEAT:false}");
        props.setProperty("forumprep.css.stylesheet-cache-size", "${CACHE_SIZE:32}");

        FlattenConfig config = FlattenConfig.fromProperties(props, env::get);

        assertThat(config.getInheritableProperties()).containsExactly("color", "letter-spacing", "cursor");
        assertThat(config.isRepeatPruneUntilStable()).isTrue();
        assertThat(config.getStylesheetCacheSize()).isEqualTo(32);
    }

    @Test
    void expandPlaceholders_fallsBackForBlankVariables() {
        Map<String, String> env = Map.of("BLANK", " ");

        assertThat(FlattenConfig.expandPlaceholders("${BLANK:x}-${NONE}-${NONE:$1}", env::get)).isEqualTo("x--$1");
        assertThat(FlattenConfig.expandPlaceholders("plain", env::get)).isEqualTo("plain");
    }
}
