package com.toolguard.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the raw argument JSON attached to an agent tool call.
 * Unparsable arguments are treated as absent rather than as an error.
 */
public final class ToolArgumentsParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private ToolArgumentsParser() {}

    /**
     * Parses the arguments as a JSON object, keeping key order.
     * Returns an empty map if the input is null, blank, not an object, or not valid JSON.
     */
    public static Map<String, Object> parse(String argumentsJson) {
        if (argumentsJson == null || argumentsJson.isBlank()) return Collections.emptyMap();
        try {
            JsonNode node = MAPPER.readTree(argumentsJson);
            if (node == null || !node.isObject()) return Collections.emptyMap();
            return MAPPER.convertValue(node, ARGS_TYPE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Collections.emptyMap();
        }
    }

    /**
     * Extracts a string argument, or null when missing or not textual.
     */
    public static String getString(Map<String, ?> args, String key) {
        if (args == null) return null;
        Object value = args.get(key);
        return value instanceof String s ? s : null;
    }
}
