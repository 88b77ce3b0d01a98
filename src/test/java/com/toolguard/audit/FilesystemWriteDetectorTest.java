package com.toolguard.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolguard.regex.SafeRegexEvaluator;
import com.toolguard.tool.ToolCallText;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FilesystemWriteDetectorTest {

    private final FilesystemWriteDetector detector = new FilesystemWriteDetector(new ToolCallText(new ObjectMapper()),
            SafeRegexEvaluator.withDefaults());

    private FilesystemWriteResult exec(String command) {
        return detector.classify("exec", Map.of("command", command));
    }

    @Test
    void writeToolReportsItsPath() {
        FilesystemWriteResult result = detector.classify("write_file", Map.of("path", "/srv/app/config.yml"));

        assertTrue(result.isWrite());
        assertEquals("/srv/app/config.yml", result.targetPath());
    }

    @Test
    void pathKeysAreTriedInOrder() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("directory", "/srv");
        args.put("target", "/srv/t");
        args.put("filePath", "/srv/f");

        assertEquals("/srv/f", detector.classify("edit_file", args).targetPath());
    }

    @Test
    void writeToolWithoutPathHasNullTarget() {
        FilesystemWriteResult result = detector.classify("apply_patch", Map.of("patch", "--- a\n+++ b"));

        assertTrue(result.isWrite());
        assertNull(result.targetPath());
    }

    @Test
    void shellToolNamesAreWrites() {
        assertTrue(detector.classify("mkdir", Map.of("path", "build")).isWrite());
        assertTrue(detector.classify("RM", Map.of()).isWrite());
        assertTrue(detector.classify("tee", Map.of()).isWrite());
    }

    @Test
    void readToolIsNotAWrite() {
        FilesystemWriteResult result = detector.classify("read_file", Map.of("path", "/etc/hosts"));

        assertFalse(result.isWrite());
        assertNull(result.targetPath());
    }

    @Test
    void rawShellWritesAreCaughtThroughGenericTools() {
        assertTrue(exec("mv draft.txt final.txt").isWrite());
        assertTrue(exec("cd /tmp && rm -f stale.lock").isWrite());
        assertTrue(exec("sed -i 's/foo/bar/' app.conf").isWrite());
        assertTrue(exec("echo done > status.txt").isWrite());
        assertTrue(exec("date >> run.log").isWrite());
    }

    @Test
    void readOnlyShellCommandsAreNotWrites() {
        assertFalse(exec("ls -la").isWrite());
        assertFalse(exec("grep -r TODO src").isWrite());
        assertFalse(exec("make test > /dev/null 2>&1").isWrite());
        assertFalse(exec("sed -n '1,10p' app.conf").isWrite());
    }

    @Test
    void commandTooSlowToScanIsAssumedToWrite() {
        FilesystemWriteDetector impatient = new FilesystemWriteDetector(new ToolCallText(new ObjectMapper()),
                new SafeRegexEvaluator(Duration.ofNanos(1), 16));

        assertTrue(impatient.classify("exec", Map.of("command", "ls " + "a".repeat(50_000))).isWrite());
    }
}
