package com.astdump.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "astdump.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final String defaultResource;

    public ConfigLoader() {
        this(DEFAULT_RESOURCE);
    }

    public ConfigLoader(String defaultResource) {
        this.defaultResource = defaultResource;
    }

    /**
     * Builds the configuration from the classpath defaults and, if given, a YAML file.
     *
     * @throws InvalidOptionsException if the explicit file is missing, unreadable or holds bad values
     */
    public AstDumpConfig load(Path configFile) {
        AstDumpConfig config = new AstDumpConfig();
        loadDefaults(config);

        if (configFile != null) {
            if (!Files.isRegularFile(configFile)) {
                throw new InvalidOptionsException("Config file not found: " + configFile);
            }
            try (InputStream in = Files.newInputStream(configFile)) {
                apply(config, readMap(in));
            } catch (IOException e) {
                throw new InvalidOptionsException("Cannot read config file " + configFile + ": " + e.getMessage(), e);
            }
            logger.debug("Loaded configuration from {}", configFile);
        }
        return config;
    }

    private void loadDefaults(AstDumpConfig config) {
        try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(defaultResource)) {
            if (resourceStream == null) {
                logger.warn("No {} found on the classpath, using built-in defaults", defaultResource);
                return;
            }
            apply(config, readMap(resourceStream));
        } catch (IOException e) {
            logger.warn("Failed to load {}, using built-in defaults: {}", defaultResource, e.getMessage());
        }
    }

    private Map<String, Object> readMap(InputStream in) throws IOException {
        Map<String, Object> values = yamlMapper.readValue(in, new TypeReference<Map<String, Object>>() {});
        return values != null ? values : Map.of();
    }

    /**
     * Copies recognized keys onto {@code config}. Unknown keys are reported and skipped.
     */
    public void apply(AstDumpConfig config, Map<String, Object> values) {
        values.forEach((key, value) -> {
            switch (key) {
                case "pretty":
                    config.setPretty(parseBoolean(key, value));
                    break;
                case "max_depth":
                case "maxDepth":
                    config.setMaxDepth(parseInt(key, value));
                    break;
                case "language_level":
                case "languageLevel":
                    config.setLanguageLevel(String.valueOf(value));
                    break;
                case "include_comments":
                case "includeComments":
                    config.setIncludeComments(parseBoolean(key, value));
                    break;
                case "literal_kinds":
                case "literalKinds":
                    config.setLiteralKinds(parseList(value));
                    break;
                case "output":
                    config.setOutput(String.valueOf(value));
                    break;
                case "output_dir":
                case "outputDir":
                    config.setOutputDir(String.valueOf(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });
    }

    private static boolean parseBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(value);
        if ("yes".equalsIgnoreCase(text) || "true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("no".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new InvalidOptionsException("Configuration key " + key + " expects a boolean, got: " + value);
    }

    private static int parseInt(String key, Object value) {
        if (value instanceof Integer i) {
            return i;
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new InvalidOptionsException("Configuration key " + key + " expects an integer, got: " + value, e);
        }
    }

    private static List<String> parseList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(String.valueOf(value));
    }
}
