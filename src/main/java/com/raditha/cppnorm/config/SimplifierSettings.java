package com.raditha.cppnorm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Loads simplifier configuration from a YAML file (cppnorm.yml) with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > cppnorm.yml > defaults
 */
public class SimplifierSettings {

    private static final String CONFIG_KEY = "simplifier";
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final Map<String, Object> config;

    private SimplifierSettings(Map<String, Object> config) {
        this.config = config;
    }

    /**
     * Settings without a configuration file: only CLI values and defaults apply.
     */
    public static SimplifierSettings defaults() {
        return new SimplifierSettings(Map.of());
    }

    /**
     * Read the {@code simplifier} section of a YAML file.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public static SimplifierSettings load(Path yamlFile) throws IOException {
        Map<String, Object> root = YAML.readValue(Files.readString(yamlFile), Map.class);
        if (root == null) {
            return defaults();
        }
        Object section = root.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            return defaults();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        return new SimplifierSettings(config);
    }

    /**
     * Build the configuration, applying CLI overrides where provided.
     *
     * @param languageCLI   CLI language (null = use YAML, then the file name)
     * @param standardCLI   CLI standard (null = use YAML/default)
     * @param budgetCLI     CLI time budget in seconds (negative = use YAML/default)
     * @param debugCLI      CLI debug warnings switch (false = use YAML/default)
     * @param fileName      name of the analyzed file, used to guess the language
     * @return complete simplifier configuration
     */
    public SimplifierConfig loadConfig(String languageCLI, String standardCLI, int budgetCLI,
            boolean debugCLI, String fileName) {
        Standard standard = null;
        String standardName = standardCLI != null ? standardCLI : getString(config, "standard", null);
        if (standardName != null) {
            standard = Standard.fromString(standardName);
        }

        Language language;
        String languageName = languageCLI != null ? languageCLI : getString(config, "language", null);
        if (languageName != null) {
            language = Language.fromString(languageName);
        } else if (standard != null) {
            language = standard.language();
        } else {
            language = fileName == null ? Language.CPP : Language.fromFileName(fileName);
        }
        if (standard != null && standard.language() != language) {
            // a standard that does not fit the language of this particular file is ignored
            standard = null;
        }

        int budgetSeconds = budgetCLI >= 0 ? budgetCLI : getInt(config, "alias_time_budget_seconds", 0);
        boolean debugWarnings = debugCLI || getBoolean(config, "debug_warnings", false);

        return new SimplifierConfig(language, standard, Duration.ofSeconds(budgetSeconds), debugWarnings);
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

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
