package com.forumprep.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Configuration for the cascade flattener and the invisibility pruner, with
 * properties file support and environment variable substitution.
 */
public class FlattenConfig {
    private static final Logger logger = LoggerFactory.getLogger(FlattenConfig.class);

    public static final String DEFAULT_PROPERTIES_FILE = "forumprep-default.properties";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::([^}]*))?}");

    static final List<String> DEFAULT_INHERITABLE_PROPERTIES = List.of(
            "color", "font-family", "font-size", "font-weight", "line-height", "text-align", "visibility"
    );
    static final List<String> DEFAULT_STATIC_PSEUDO_CLASSES = List.of("nth-child", "nth-of-type");
    static final List<String> DEFAULT_INTRINSIC_SIZE_TAGS = List.of(
            "img", "input", "br", "hr", "video", "audio", "canvas", "iframe", "object", "embed"
    );
    static final List<String> DEFAULT_ZERO_SIZE_VALUES = List.of("auto", "0", "0px", "0em", "0%");

    private final Set<String> inheritableProperties;
    private final Set<String> staticPseudoClasses;
    private final Set<String> intrinsicSizeTags;
    private final Set<String> zeroSizeValues;
    private final boolean repeatPruneUntilStable;
    private final long stylesheetCacheSize;

    public static Builder builder() {
        return new Builder();
    }

    public static FlattenConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Creates FlattenConfig from the bundled defaults file
     */
    public static FlattenConfig fromProperties() {
        return fromProperties(DEFAULT_PROPERTIES_FILE);
    }

    /**
     * Creates FlattenConfig from a classpath properties file
     */
    public static FlattenConfig fromProperties(String propertiesFile) {
        return fromProperties(classpathProperties(propertiesFile));
    }

    /**
     * Creates FlattenConfig from the bundled defaults overridden by a properties file on disk
     */
    public static FlattenConfig fromFile(Path path) throws IOException {
        Properties props = classpathProperties(DEFAULT_PROPERTIES_FILE);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        return fromProperties(props);
    }

    /**
     * Creates FlattenConfig from a Properties object; missing keys keep their defaults.
     * Values may reference environment variables as {@code ${NAME}} or {@code ${NAME:fallback}}.
     */
    public static FlattenConfig fromProperties(Properties props) {
        return fromProperties(props, System::getenv);
    }

    static FlattenConfig fromProperties(Properties props, Function<String, String> environment) {
        Builder builder = builder();
        readList(props, "forumprep.cascade.inheritable-properties", environment)
                .ifPresent(builder::inheritableProperties);
        readList(props, "forumprep.cascade.static-pseudo-classes", environment)
                .ifPresent(builder::staticPseudoClasses);
        readList(props, "forumprep.prune.intrinsic-size-tags", environment)
                .ifPresent(builder::intrinsicSizeTags);
        readList(props, "forumprep.prune.zero-size-values", environment)
                .ifPresent(builder::zeroSizeValues);

        read(props, "forumprep.prune.repeat-until-stable", environment)
                .map(Boolean::parseBoolean)
                .ifPresent(builder::repeatPruneUntilStable);

        Optional<String> cacheSize = read(props, "forumprep.css.stylesheet-cache-size", environment);
        if (cacheSize.isPresent()) {
            try {
                builder.stylesheetCacheSize(Long.parseLong(cacheSize.get()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid value for forumprep.css.stylesheet-cache-size: '" + cacheSize.get() + "'", e);
            }
        }

        return builder.build();
    }

    private static Optional<List<String>> readList(Properties props, String key,
                                                   Function<String, String> environment) {
        return read(props, key, environment).map(value -> Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toList()));
    }

    private static Optional<String> read(Properties props, String key, Function<String, String> environment) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return Optional.empty();
        }
        String value = expandPlaceholders(raw, environment).trim();
        logger.trace("{} = '{}'", key, value);
        return Optional.of(value);
    }

    /**
     * Replaces every {@code ${NAME:fallback}} in {@code value}. An unset or blank
     * variable yields the fallback, or the empty string when there is none.
     */
    static String expandPlaceholders(String value, Function<String, String> environment) {
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String resolved = environment.apply(matcher.group(1));
            if (resolved == null || resolved.trim().isEmpty()) {
                resolved = matcher.group(2) == null ? "" : matcher.group(2);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static Properties classpathProperties(String resource) {
        Properties props = new Properties();
        InputStream in = FlattenConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            logger.warn("Could not find properties file on classpath: {}", resource);
            return props;
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            logger.error("Error loading properties file {}: {}", resource, e.getMessage());
        }
        return props;
    }

    public static class Builder {
        private List<String> inheritableProperties = DEFAULT_INHERITABLE_PROPERTIES;
        private List<String> staticPseudoClasses = DEFAULT_STATIC_PSEUDO_CLASSES;
        private List<String> intrinsicSizeTags = DEFAULT_INTRINSIC_SIZE_TAGS;
        private List<String> zeroSizeValues = DEFAULT_ZERO_SIZE_VALUES;
        private boolean repeatPruneUntilStable = false;
        private long stylesheetCacheSize = 256;

        public Builder inheritableProperties(List<String> inheritableProperties) {
            this.inheritableProperties = inheritableProperties;
            return this;
        }

        public Builder staticPseudoClasses(List<String> staticPseudoClasses) {
            this.staticPseudoClasses = staticPseudoClasses;
            return this;
        }

        public Builder intrinsicSizeTags(List<String> intrinsicSizeTags) {
            this.intrinsicSizeTags = intrinsicSizeTags;
            return this;
        }

        public Builder zeroSizeValues(List<String> zeroSizeValues) {
            this.zeroSizeValues = zeroSizeValues;
            return this;
        }

        public Builder repeatPruneUntilStable(boolean repeatPruneUntilStable) {
            this.repeatPruneUntilStable = repeatPruneUntilStable;
            return this;
        }

        public Builder stylesheetCacheSize(long stylesheetCacheSize) {
            this.stylesheetCacheSize = stylesheetCacheSize;
            return this;
        }

        public FlattenConfig build() {
            if (inheritableProperties == null || staticPseudoClasses == null
                    || intrinsicSizeTags == null || zeroSizeValues == null) {
                throw new IllegalArgumentException("Configuration lists cannot be null");
            }
            if (stylesheetCacheSize < 0) {
                throw new IllegalArgumentException("Stylesheet cache size cannot be negative: " + stylesheetCacheSize);
            }

            return new FlattenConfig(normalize(inheritableProperties), normalize(staticPseudoClasses),
                    normalize(intrinsicSizeTags), normalize(zeroSizeValues),
                    repeatPruneUntilStable, stylesheetCacheSize);
        }

        private static Set<String> normalize(List<String> values) {
            Set<String> out = new LinkedHashSet<>();
            for (String v : values) {
                if (v != null && !v.trim().isEmpty()) {
                    out.add(v.trim().toLowerCase(Locale.ROOT));
                }
            }
            return Collections.unmodifiableSet(out);
        }
    }

    private FlattenConfig(Set<String> inheritableProperties, Set<String> staticPseudoClasses,
                          Set<String> intrinsicSizeTags, Set<String> zeroSizeValues,
                          boolean repeatPruneUntilStable, long stylesheetCacheSize) {
        this.inheritableProperties = inheritableProperties;
        this.staticPseudoClasses = staticPseudoClasses;
        this.intrinsicSizeTags = intrinsicSizeTags;
        this.zeroSizeValues = zeroSizeValues;
        this.repeatPruneUntilStable = repeatPruneUntilStable;
        this.stylesheetCacheSize = stylesheetCacheSize;
    }

    /**
     * Properties filled from the nearest styled ancestor, in lookup order
     */
    public Set<String> getInheritableProperties() {
        return inheritableProperties;
    }

    /**
     * Pseudo-classes that can be resolved without a live browser
     */
    public Set<String> getStaticPseudoClasses() {
        return staticPseudoClasses;
    }

    public Set<String> getIntrinsicSizeTags() {
        return intrinsicSizeTags;
    }

    public Set<String> getZeroSizeValues() {
        return zeroSizeValues;
    }

    public boolean isRepeatPruneUntilStable() {
        return repeatPruneUntilStable;
    }

    public long getStylesheetCacheSize() {
        return stylesheetCacheSize;
    }

    @Override
    public String toString() {
        return String.format("FlattenConfig{inheritable=%s, staticPseudoClasses=%s, intrinsicSizeTags=%s, "
                        + "repeatPruneUntilStable=%s, stylesheetCacheSize=%d}",
                inheritableProperties, staticPseudoClasses, intrinsicSizeTags,
                repeatPruneUntilStable, stylesheetCacheSize);
    }
}
