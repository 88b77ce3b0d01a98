package com.toolguard.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallTextTest {

    private final ToolCallText text = new ToolCallText(new ObjectMapper());

    @Test
    void executionToolIncludesEveryArgument() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("command", "ls -la");
        args.put("timeout", 30);
        args.put("background", true);
        args.put("argv", List.of("a", "b"));

        assertEquals("exec ls -la 30 true a b", text.buildSearchString("exec", args));
    }

    @Test
    void nestedObjectsAreSerializedAsJson() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("env", Map.of("HOME", "/root"));

        assertEquals("shell {\"HOME\":\"/root\"}", text.buildSearchString("shell", args));
    }

    @Test
    void otherToolsOnlyContributeLocationArguments() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("target", "/tmp/out");
        args.put("body", "please run sudo rm -rf /");
        args.put("url", "https://example.com");

        assertEquals("send_message https://example.com /tmp/out",
                text.buildSearchString("send_message", args));
    }

    @Test
    void missingArgumentsYieldToolNameOnly() {
        assertEquals("read_file", text.buildSearchString("read_file", null));
        assertEquals("exec", text.buildSearchString("exec", Map.of()));
    }

    @Test
    void searchStringIsBounded() {
        String huge = "x".repeat(ToolCallText.MAX_SEARCH_LENGTH * 2);
        assertEquals(ToolCallText.MAX_SEARCH_LENGTH,
                text.buildSearchString("exec", Map.of("command", huge)).length());
    }

    @Test
    void executionToolNamesAreCaseInsensitive() {
        assertTrue(ToolCallText.isExecutionTool("Run_Command"));
        assertFalse(ToolCallText.isExecutionTool("write_file"));
        assertFalse(ToolCallText.isExecutionTool(null));
    }

    @Test
    void commandStringJoinsOnlyStringArguments() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("command", "npm");
        args.put("retries", 3);
        args.put("subcommand", "test");

        assertEquals("npm test", text.extractCommandString("exec", args));
    }

    @Test
    void commandStringForOtherToolsIsTheToolName() {
        assertEquals("write_file", text.extractCommandString("write_file", Map.of("path", "/tmp/x")));
    }

    @Test
    void commandStringWithoutStringArgumentsIsEmpty() {
        assertEquals("", text.extractCommandString("exec", Map.of("timeout", 5)));
    }
}
