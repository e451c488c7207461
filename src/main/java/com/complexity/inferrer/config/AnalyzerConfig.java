package com.complexity.inferrer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Tunables of the analysis pipeline.
 *
 * {@link #load()} reads {@value #RESOURCE} from the classpath and lets JVM system properties
 * with the same keys override it. Everything not configured keeps its default.
 */
public final class AnalyzerConfig {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzerConfig.class);

    public static final String RESOURCE = "complexity-inferrer.properties";

    static final String PROP_MAX_SEARCH_DEPTH = "inferrer.maxSearchDepth";
    static final String PROP_MAX_CALLEE_DEPTH = "inferrer.maxCalleeDepth";
    static final String PROP_ENABLE_PATTERNS = "inferrer.enablePatterns";
    static final String PROP_FLAG_NAMES = "inferrer.flagNames";
    static final String PROP_MIDPOINT_NAMES = "inferrer.midpointNames";
    static final String PROP_SENTINEL_NAMES = "inferrer.sentinelNames";

    public static final int DEFAULT_MAX_SEARCH_DEPTH = 10;
    public static final int DEFAULT_MAX_CALLEE_DEPTH = 10;

    private final int maxSearchDepth;
    private final int maxCalleeDepth;
    private final boolean enablePatterns;
    private final HeuristicRules heuristicRules;

    private AnalyzerConfig(Builder builder) {
        this.maxSearchDepth = builder.maxSearchDepth;
        this.maxCalleeDepth = builder.maxCalleeDepth;
        this.enablePatterns = builder.enablePatterns;
        this.heuristicRules = builder.heuristicRules;
    }

    public static AnalyzerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the classpath resource, then applies system property overrides.
     */
    public static AnalyzerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = AnalyzerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
                logger.debug("Loaded {}", RESOURCE);
            } else {
                logger.debug("{} not found on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        for (String key : List.of(PROP_MAX_SEARCH_DEPTH, PROP_MAX_CALLEE_DEPTH, PROP_ENABLE_PATTERNS,
                PROP_FLAG_NAMES, PROP_MIDPOINT_NAMES, PROP_SENTINEL_NAMES)) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    public static AnalyzerConfig fromProperties(Properties properties) {
        Builder builder = builder();
        builder.maxSearchDepth(readInt(properties, PROP_MAX_SEARCH_DEPTH, DEFAULT_MAX_SEARCH_DEPTH));
        builder.maxCalleeDepth(readInt(properties, PROP_MAX_CALLEE_DEPTH, DEFAULT_MAX_CALLEE_DEPTH));
        String patterns = properties.getProperty(PROP_ENABLE_PATTERNS);
        if (patterns != null) {
            builder.enablePatterns(Boolean.parseBoolean(patterns.trim()));
        }

        HeuristicRules rules = HeuristicRules.defaults();
        String flags = properties.getProperty(PROP_FLAG_NAMES);
        if (flags != null) {
            rules = rules.withFlagNames(HeuristicRules.rules(HeuristicRules.MatchMode.CONTAINS, split(flags)));
        }
        String midpoints = properties.getProperty(PROP_MIDPOINT_NAMES);
        if (midpoints != null) {
            rules = rules.withMidpointNames(HeuristicRules.rules(HeuristicRules.MatchMode.EQUALS, split(midpoints)));
        }
        String sentinels = properties.getProperty(PROP_SENTINEL_NAMES);
        if (sentinels != null) {
            rules = rules.withSentinelNames(HeuristicRules.rules(HeuristicRules.MatchMode.EQUALS, split(sentinels)));
        }
        return builder.heuristicRules(rules).build();
    }

    private static int readInt(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static String[] split(String csv) {
        List<String> parts = Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        return parts.toArray(new String[0]);
    }

    public int getMaxSearchDepth() {
        return maxSearchDepth;
    }

    public int getMaxCalleeDepth() {
        return maxCalleeDepth;
    }

    public boolean isEnablePatterns() {
        return enablePatterns;
    }

    public HeuristicRules getHeuristicRules() {
        return heuristicRules;
    }

    @Override
    public String toString() {
        return String.format("AnalyzerConfig{maxSearchDepth=%d, maxCalleeDepth=%d, enablePatterns=%s, %s}",
                maxSearchDepth, maxCalleeDepth, enablePatterns, heuristicRules);
    }

    public static final class Builder {
        private int maxSearchDepth = DEFAULT_MAX_SEARCH_DEPTH;
        private int maxCalleeDepth = DEFAULT_MAX_CALLEE_DEPTH;
        private boolean enablePatterns = true;
        private HeuristicRules heuristicRules = HeuristicRules.defaults();

        private Builder() {
        }

        public Builder maxSearchDepth(int depth) {
            if (depth < 1) {
                throw new IllegalArgumentException("maxSearchDepth must be positive: " + depth);
            }
            this.maxSearchDepth = depth;
            return this;
        }

        public Builder maxCalleeDepth(int depth) {
            if (depth < 1) {
                throw new IllegalArgumentException("maxCalleeDepth must be positive: " + depth);
            }
            this.maxCalleeDepth = depth;
            return this;
        }

        public Builder enablePatterns(boolean enabled) {
            this.enablePatterns = enabled;
            return this;
        }

        public Builder heuristicRules(HeuristicRules rules) {
            if (rules == null) {
                throw new IllegalArgumentException("heuristicRules must not be null");
            }
            this.heuristicRules = rules;
            return this;
        }

        public AnalyzerConfig build() {
            return new AnalyzerConfig(this);
        }
    }
}
