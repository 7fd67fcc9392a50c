package com.raditha.correlator.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads correlator configuration from the {@code identifier_correlator}
 * section of a YAML document.
 *
 * <p>Priority: preset &gt; individual keys &gt; defaults.
 */
public class CorrelatorSettings {

    private static final Logger logger = LoggerFactory.getLogger(CorrelatorSettings.class);

    static final String CONFIG_KEY = "identifier_correlator";
    static final String DEFAULT_RESOURCE = "correlator.yml";

    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private CorrelatorSettings() {
    }

    /**
     * Load configuration from a YAML file.
     *
     * @throws IOException if the file cannot be read or is not valid YAML
     */
    public static CorrelatorConfig load(Path yamlFile) throws IOException {
        try (InputStream in = Files.newInputStream(yamlFile)) {
            return load(in);
        }
    }

    /**
     * Load configuration from a YAML stream.
     *
     * @throws IOException if the stream is not valid YAML
     */
    public static CorrelatorConfig load(InputStream in) throws IOException {
        Map<String, Object> document = mapper.readValue(in, new TypeReference<Map<String, Object>>() {
        });
        return fromDocument(document);
    }

    /**
     * Load {@code correlator.yml} from the classpath, or the defaults if it is
     * not there.
     *
     * @throws IOException if the resource exists but cannot be parsed
     */
    public static CorrelatorConfig loadDefault() throws IOException {
        try (InputStream in = CorrelatorSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return CorrelatorConfig.defaults();
            }
            return load(in);
        }
    }

    /**
     * Build configuration from an already parsed YAML document.
     */
    public static CorrelatorConfig fromDocument(@Nullable Map<String, Object> document) {
        Object section = document == null ? null : document.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            return CorrelatorConfig.defaults();
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        return fromMap(config);
    }

    /**
     * Build configuration from the {@code identifier_correlator} section.
     */
    public static CorrelatorConfig fromMap(Map<String, Object> config) {
        String preset = getString(config, "preset", null);
        if (preset != null) {
            return switch (preset) {
                case "unrestricted" -> CorrelatorConfig.unrestricted();
                case "default" -> CorrelatorConfig.defaults();
                default -> {
                    logger.warn("Unknown correlator preset '{}', using defaults", preset);
                    yield CorrelatorConfig.defaults();
                }
            };
        }

        CorrelatorConfig defaults = CorrelatorConfig.defaults();
        return new CorrelatorConfig(
                getInt(config, "min_marker_length", defaults.minMarkerLength()),
                getInt(config, "marker_frequency", defaults.markerFrequency()),
                getBoolean(config, "restrict_to_hint_group", defaults.restrictToHintGroup()));
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
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

    private static @Nullable String getString(Map<String, Object> map, String key, @Nullable String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
