package com.sourcelint.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link LintConfig} from YAML files.
 *
 * <p>If the config file is missing or invalid, returns {@link LintConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LintConfig config = ConfigLoader.load(Path.of(".sourcelint.yml"));
 * if (config.isEnabled("line_length", false)) {
 *     // rule runs
 * }
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link LintConfig#defaults()}.
     *
     * @param configPath path to {@code .sourcelint.yml}
     * @return loaded configuration or defaults if unavailable
     */
    public static LintConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return LintConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return LintConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            LintConfig config = parse(Files.readString(configPath));
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return LintConfig.defaults();
        }
    }

    /**
     * Parses YAML text into a configuration.
     *
     * @param yaml YAML document
     * @return parsed configuration; defaults for an empty document
     * @throws IOException if the text is not valid YAML or the root is not a mapping
     */
    public static LintConfig parse(String yaml) throws IOException {
        JsonNode root = YAML_MAPPER.readTree(yaml);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return LintConfig.defaults();
        }
        if (!root.isObject()) {
            throw new IOException("Configuration root must be a mapping, got: " + root.getNodeType());
        }

        Map<String, Object> ruleConfigurations = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!LintConfig.RESERVED_KEYS.contains(field.getKey()) && !field.getValue().isNull()) {
                ruleConfigurations.put(field.getKey(), toRawValue(field.getValue()));
            }
        }

        return new LintConfig(
            stringList(root, "disabled_rules"),
            stringList(root, "opt_in_rules"),
            stringList(root, "only_rules"),
            stringList(root, "included"),
            stringList(root, "excluded"),
            root.hasNonNull("reporter") ? root.get("reporter").asText() : null,
            ruleConfigurations
        );
    }

    private static List<String> stringList(JsonNode root, String key) throws IOException {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            throw new IOException("'" + key + "' must be a list of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            values.add(element.asText());
        }
        return values;
    }

    private static Object toRawValue(JsonNode node) throws JsonProcessingException {
        return YAML_MAPPER.treeToValue(node, Object.class);
    }
}
