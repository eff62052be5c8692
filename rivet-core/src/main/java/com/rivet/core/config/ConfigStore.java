package com.rivet.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.rivet.core.exception.ParseException;
import com.rivet.core.exception.RivetException;
import com.rivet.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes {@code rivet.yaml}.
 *
 * <p>Every write is a whole-document read-modify-write through a temp file and an atomic
 * move. YAML comments are not carried through a write.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConfigStore store = new ConfigStore(Path.of("rivet.yaml"));
 * store.set("app.debug", "false");
 * JsonNode debug = store.get("app.debug");  // BooleanNode false
 * }</pre>
 */
public class ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);

    static final ObjectMapper YAML_MAPPER = new ObjectMapper(YAMLFactory.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
        .stringQuotingChecker(new NumberLikeQuotingChecker())
        .build());

    private final Path configPath;

    public ConfigStore(Path configPath) {
        this.configPath = Objects.requireNonNull(configPath, "configPath must not be null");
    }

    public Path path() {
        return configPath;
    }

    /**
     * Loads the document.
     *
     * @return the parsed document, empty if the file is empty
     * @throws RivetException if the file is missing or unreadable
     * @throws ParseException if the file is not a YAML mapping
     */
    public ConfigDocument load() {
        if (!Files.isRegularFile(configPath)) {
            throw new RivetException("Configuration file not found: " + configPath);
        }
        log.debug("Loading configuration from: {}", configPath);
        JsonNode tree;
        try {
            tree = YAML_MAPPER.readTree(configPath.toFile());
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new ParseException("Invalid YAML in " + configPath.getFileName() + ": " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new RivetException("Failed to read configuration file: " + configPath, e);
        }
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return ConfigDocument.empty();
        }
        if (!tree.isObject()) {
            throw new ParseException(configPath.getFileName() + " must contain a mapping at the top level");
        }
        return new ConfigDocument((ObjectNode) tree);
    }

    /**
     * Writes the document atomically.
     *
     * @param document document to write
     * @throws RivetException if writing fails
     */
    public void save(ConfigDocument document) {
        try {
            FileUtils.writeAtomically(configPath, toYaml(document));
            log.info("Wrote configuration to: {}", configPath);
        } catch (IOException e) {
            throw new RivetException("Failed to write configuration file: " + configPath, e);
        }
    }

    /**
     * Returns the value at a dotted key.
     *
     * @param key dotted key
     * @return the node
     * @throws com.rivet.core.exception.KeyNotFoundException if the key does not exist
     */
    public JsonNode get(String key) {
        return load().get(key);
    }

    /**
     * Sets a value from its command-line text and saves.
     *
     * @param key dotted key
     * @param rawValue value as typed, coerced by {@link ConfigValueParser}
     * @return the stored value
     */
    public Object set(String key, String rawValue) {
        ConfigDocument document = load();
        Object value = ConfigValueParser.parse(rawValue);
        document.set(key, value);
        save(document);
        return value;
    }

    /**
     * Serializes a document to YAML text.
     *
     * @param document document
     * @return YAML text
     */
    public static String toYaml(ConfigDocument document) {
        try {
            return YAML_MAPPER.writeValueAsString(document.root());
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new RivetException("Failed to serialize configuration", e);
        }
    }
}
