package org.sans.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.Contract;
import org.sans.compiler.errors.InternalCompilerError;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class Utilities {
    private Utilities() {}

    /** A custom version of assert.  We would like to use assert,
     * but it is compiled out in release.
     * @param expression  When this expression is false, this function throws. */
    @Contract("false -> fail")
    public static void enforce(boolean expression) {
        if (!expression)
            throw new InternalCompilerError("Assertion failed");
    }

    /** A custom version of assert.
     * @param expression  When this expression is false, this function throws.
     * @param message     Message for exception when expression is false */
    @Contract("false, _ -> fail")
    public static void enforce(boolean expression, String message) {
        if (!expression)
            throw new InternalCompilerError(message);
    }

    /** Escape special characters in a string. */
    public static String escape(String value) {
        StringBuilder builder = new StringBuilder();
        final int length = value.length();
        for (int offset = 0; offset < length; ) {
            final int c = value.codePointAt(offset);
            if (c == '\'')
                builder.append("\\'");
            else if (c == '\\')
                builder.append("\\\\");
            else if (c == '\"' )
                builder.append("\\\"");
            else if (c == '\r' )
                builder.append("\\r");
            else if (c == '\n' )
                builder.append("\\n");
            else if (c == '\t' )
                builder.append("\\t");
            else
                builder.appendCodePoint(c);
            offset += Character.charCount(c);
        }
        return builder.toString();
    }

    /** A mapper whose output does not depend on insertion order:
     * object properties and map entries are sorted by key. */
    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper
                .builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY, true)
                .build();
    }

    /** Copy of a JSON tree where the fields of every object are sorted by name. */
    public static JsonNode sortKeys(JsonNode node) {
        if (node.isObject()) {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            for (String name: names)
                result.set(name, sortKeys(node.get(name)));
            return result;
        } else if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element: node)
                result.add(sortKeys(element));
            return result;
        }
        return node;
    }

    /** Serialize a JSON tree compactly, with the keys of every object sorted. */
    public static String canonicalJson(JsonNode node) {
        try {
            return deterministicObjectMapper().writeValueAsString(sortKeys(node));
        } catch (JsonProcessingException ex) {
            throw new InternalCompilerError("Cannot serialize " + node + ": " + ex.getMessage());
        }
    }

    /** Add double quotes around string and escape symbols that need it. */
    public static String doubleQuote(String value) {
        return "\"" + escape(value) + "\"";
    }

    /** Just adds single quotes around a string.  No escaping is performed. */
    public static String singleQuote(@Nullable String other) {
        return "'" + other + "'";
    }

    /**
     * put something in a hashmap that is supposed to be new.
     * @param map    Map to insert in.
     * @param key    Key to insert in map.
     * @param value  Value to insert in map.
     * @return       The inserted value.
     */
    @SuppressWarnings("UnusedReturnValue")
    public static <K, V, VE extends V> VE putNew(Map<K, V> map, K key, VE value) {
        V previous = map.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
        if (previous != null)
            throw new InternalCompilerError("Key " + key + " already mapped to " + previous + " when adding " + value);
        return value;
    }

    /** Get a value that must exist in a map. */
    public static <K, V> V getExists(Map<K, V> map, K key) {
        V result = map.get(key);
        if (result == null)
            throw new InternalCompilerError("Key " + key + " does not exist in map");
        return result;
    }

    public static <T> T last(List<T> data) {
        if (data.isEmpty())
            throw new InternalCompilerError("Last of empty list");
        return data.get(data.size() - 1);
    }

    public static String readFile(Path filename) throws IOException {
        return Files.readString(filename, StandardCharsets.UTF_8);
    }
}
