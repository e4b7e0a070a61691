package com.raditha.cloneindex.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads detection configuration from YAML with caller overrides.
 * <p>
 * Configuration priority: explicit overrides &gt; YAML &gt; preset &gt; defaults.
 * The settings live under the {@code duplication_detector} key:
 *
 * <pre>
 * duplication_detector:
 *   preset: strict
 *   hamming_threshold: 10
 *   similarity_threshold: 0.7
 *   use_fast_mode: true
 * </pre>
 */
public class DetectionSettings {

    private static final Logger logger = LoggerFactory.getLogger(DetectionSettings.class);

    static final String CONFIG_KEY = "duplication_detector";
    public static final String DEFAULT_RESOURCE = "clone-index.yml";

    private DetectionSettings() {
    }

    /**
     * Load configuration from the {@value #DEFAULT_RESOURCE} classpath resource,
     * falling back to {@link DetectionConfig#defaults()} when it is absent.
     */
    public static DetectionConfig loadDefault() {
        try (InputStream in = DetectionSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return DetectionConfig.defaults();
            }
            return fromYaml(new Yaml().load(in));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Load configuration from a YAML file.
     *
     * @param yamlFile file containing a {@code duplication_detector} section
     * @return complete detection configuration
     * @throws IOException if the file cannot be read
     */
    public static DetectionConfig load(Path yamlFile) throws IOException {
        try (InputStream in = Files.newInputStream(yamlFile)) {
            return fromYaml(new Yaml().load(in));
        }
    }

    /**
     * Load configuration from a YAML file, then apply overrides.
     *
     * @param yamlFile           YAML file, may be null to skip YAML
     * @param thresholdOverride  similarity threshold percentage 0-100 (0 = use YAML/default)
     * @param presetOverride     preset name (null = use YAML/default)
     * @return complete detection configuration
     * @throws IOException if the file cannot be read
     */
    public static DetectionConfig load(Path yamlFile, int thresholdOverride, String presetOverride) throws IOException {
        Map<String, Object> section = Map.of();
        if (yamlFile != null && Files.exists(yamlFile)) {
            try (InputStream in = Files.newInputStream(yamlFile)) {
                section = section(new Yaml().load(in));
            }
        }
        DetectionConfig config = fromSection(section, presetOverride);
        if (thresholdOverride != 0) {
            config = config.withSimilarityThreshold(thresholdOverride / 100.0);
        }
        return config;
    }

    /**
     * Build configuration from an already parsed YAML document.
     */
    public static DetectionConfig fromYaml(Object document) {
        return fromSection(section(document), null);
    }

    private static DetectionConfig fromSection(Map<String, Object> config, String presetOverride) {
        String preset = presetOverride != null ? presetOverride : getString(config, "preset", null);
        DetectionConfig base = preset(preset);

        Object topPercentRaw = config.get("top_percent");
        Double topPercent = base.topPercent();
        if (topPercentRaw instanceof Number n) {
            topPercent = n.doubleValue();
        }

        return new DetectionConfig(
                getInt(config, "hamming_threshold", base.hammingThreshold()),
                getDouble(config, "similarity_threshold", base.similarityThreshold()),
                getBoolean(config, "use_fast_mode", base.useFastMode()),
                getBoolean(config, "include_trivial", base.includeTrivial()),
                getBoolean(config, "include_tests", base.includeTests()),
                topPercent,
                getInt(config, "min_hamming_bound", base.minHammingBound()),
                getInt(config, "sample_size", base.sampleSize()),
                getInt(config, "max_adaptive_iterations", base.maxAdaptiveIterations()),
                getLong(config, "random_seed", base.randomSeed()));
    }

    private static DetectionConfig preset(String name) {
        if (name == null) {
            return DetectionConfig.defaults();
        }
        return switch (name) {
            case "strict" -> DetectionConfig.strict();
            case "lenient" -> DetectionConfig.lenient();
            case "default", "moderate" -> DetectionConfig.defaults();
            default -> {
                logger.warn("Unknown preset '{}', using defaults", name);
                yield DetectionConfig.defaults();
            }
        };
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Object document) {
        if (document instanceof Map<?, ?> root) {
            Object raw = root.get(CONFIG_KEY);
            if (raw instanceof Map) {
                return (Map<String, Object>) raw;
            }
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
