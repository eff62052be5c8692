package com.rivet.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rivet.core.exception.KeyNotFoundException;
import com.rivet.core.exception.ParseException;
import com.rivet.core.exception.TypeConflictException;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * The project configuration as a tree of mappings, addressed by dotted keys.
 *
 * <p>Key order is kept as read, so a set followed by a save changes only the touched key.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConfigDocument config = store.load();
 * config.set("server.port", ConfigValueParser.parse("9000"));
 * config.getString("app.env");  // Optional[development]
 * }</pre>
 */
public class ConfigDocument {

    private final ObjectNode root;

    public ConfigDocument(ObjectNode root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    public static ConfigDocument empty() {
        return new ConfigDocument(JsonNodeFactory.instance.objectNode());
    }

    public ObjectNode root() {
        return root;
    }

    /**
     * Looks up the node at a dotted key.
     *
     * @param key dotted key, e.g. {@code database.connections.default.driver}
     * @return the node (scalar or mapping), empty if any segment is missing
     */
    public Optional<JsonNode> find(String key) {
        JsonNode current = root;
        for (String segment : segments(key)) {
            if (!current.isObject()) {
                return Optional.empty();
            }
            current = current.get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /**
     * Returns the node at a dotted key.
     *
     * @param key dotted key
     * @return the node
     * @throws KeyNotFoundException if the key does not exist
     */
    public JsonNode get(String key) {
        return find(key).orElseThrow(() -> new KeyNotFoundException(key));
    }

    public Optional<String> getString(String key) {
        return find(key).filter(JsonNode::isValueNode).map(JsonNode::asText);
    }

    /**
     * Sets a value, creating intermediate mappings as needed.
     *
     * @param key dotted key
     * @param value {@link Boolean}, {@link Long}, {@link Integer}, {@link Double}, {@link String} or {@link JsonNode}
     * @throws TypeConflictException if an intermediate segment holds a scalar
     */
    public void set(String key, Object value) {
        String[] segments = segments(key);
        ObjectNode current = root;
        StringJoiner path = new StringJoiner(".");
        for (int i = 0; i < segments.length - 1; i++) {
            path.add(segments[i]);
            JsonNode child = current.get(segments[i]);
            if (child == null || child.isNull()) {
                current = current.putObject(segments[i]);
            } else if (child.isObject()) {
                current = (ObjectNode) child;
            } else {
                throw new TypeConflictException(key, path.toString());
            }
        }
        current.set(segments[segments.length - 1], toNode(value));
    }

    /**
     * Flattens the tree into its leaf values.
     *
     * @return dotted key to leaf node, in document order
     */
    public Map<String, JsonNode> leaves() {
        Map<String, JsonNode> leaves = new LinkedHashMap<>();
        collect(root, "", leaves);
        return leaves;
    }

    /**
     * Formats a node for display.
     *
     * @param node scalar, sequence or mapping
     * @return text form
     */
    public static String format(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isArray()) {
            StringJoiner items = new StringJoiner(", ", "[", "]");
            node.forEach(item -> items.add(format(item)));
            return items.toString();
        }
        if (node.isObject()) {
            return "{...}";
        }
        return node.asText();
    }

    private static void collect(JsonNode node, String prefix, Map<String, JsonNode> leaves) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            if (field.getValue().isObject() && field.getValue().size() > 0) {
                collect(field.getValue(), key, leaves);
            } else {
                leaves.put(key, field.getValue());
            }
        }
    }

    private static JsonNode toNode(Object value) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof Boolean bool) {
            return nodes.booleanNode(bool);
        }
        if (value instanceof Long number) {
            return nodes.numberNode(number);
        }
        if (value instanceof Integer number) {
            return nodes.numberNode(number);
        }
        if (value instanceof Double number) {
            return nodes.numberNode(number);
        }
        return nodes.textNode(value.toString());
    }

    private static String[] segments(String key) {
        if (key == null || key.isBlank() || key.startsWith(".") || key.endsWith(".") || key.contains("..")) {
            throw new ParseException("Invalid configuration key '" + key + "'");
        }
        return key.split("\\.");
    }
}
