package com.toolguard.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Flattens a tool call into the text that risk patterns and allow/deny lists
 * are evaluated against.
 * <p>
 * Only execution-style tools contribute their full argument set. Other tools
 * contribute the tool name plus path and URL shaped arguments, so that free
 * text (message bodies, memory content) that merely mentions a dangerous
 * command is never classified as one.
 */
@Component
public class ToolCallText {

    public static final Set<String> EXECUTION_TOOLS = Set.of("exec", "shell", "run_command");

    public static final List<String> LOCATION_KEYS =
            List.of("url", "path", "file", "filename", "destination", "target");

    static final int MAX_SEARCH_LENGTH = 65_536;

    private final ObjectMapper objectMapper;

    public ToolCallText(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static boolean isExecutionTool(String toolName) {
        return toolName != null && EXECUTION_TOOLS.contains(toolName.toLowerCase(Locale.ROOT));
    }

    public String buildSearchString(String toolName, Map<String, ?> args) {
        List<String> parts = new ArrayList<>();
        parts.add(toolName != null ? toolName : "");
        if (args != null && !args.isEmpty()) {
            if (isExecutionTool(toolName)) {
                for (Object value : args.values()) {
                    addIfPresent(parts, toText(value));
                }
            } else {
                for (String key : LOCATION_KEYS) {
                    addIfPresent(parts, toText(args.get(key)));
                }
            }
        }
        String joined = String.join(" ", parts);
        return joined.length() > MAX_SEARCH_LENGTH ? joined.substring(0, MAX_SEARCH_LENGTH) : joined;
    }

    /**
     * The command string fed to allow/deny lists: string arguments of an
     * execution-style tool joined by spaces, otherwise just the tool name.
     */
    public String extractCommandString(String toolName, Map<String, ?> args) {
        if (!isExecutionTool(toolName)) {
            return toolName != null ? toolName : "";
        }
        StringJoiner joiner = new StringJoiner(" ");
        if (args != null) {
            for (Object value : args.values()) {
                if (value instanceof String s) joiner.add(s);
            }
        }
        return joiner.toString();
    }

    private String toText(Object value) {
        if (value == null) return null;
        if (value instanceof CharSequence text) return text.toString();
        if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
            return String.valueOf(value);
        }
        if (value instanceof Collection<?> items) {
            StringJoiner joiner = new StringJoiner(" ");
            for (Object item : items) joiner.add(elementText(item));
            return joiner.toString();
        }
        if (value.getClass().isArray()) {
            StringJoiner joiner = new StringJoiner(" ");
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) joiner.add(elementText(Array.get(value, i)));
            return joiner.toString();
        }
        return toJson(value);
    }

    private String elementText(Object item) {
        if (item == null) return "null";
        if (item instanceof Map<?, ?> || item instanceof Collection<?>) return toJson(item);
        return String.valueOf(item);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static void addIfPresent(List<String> parts, String text) {
        if (text != null) parts.add(text);
    }
}
