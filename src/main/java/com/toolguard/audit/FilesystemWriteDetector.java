package com.toolguard.audit;

import com.toolguard.regex.SafeRegexEvaluator;
import com.toolguard.regex.SafeRegexEvaluator.Outcome;
import com.toolguard.tool.ToolArgumentsParser;
import com.toolguard.tool.ToolCallText;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decides whether a tool call writes to the filesystem, for read-only
 * project mode and for scoping audit entries.
 */
@Component
public class FilesystemWriteDetector {

    private static final Pattern WRITE_TOOL = Pattern.compile(
            "^(?:(?:write|edit|create|append|delete|remove|move|copy|rename|save|apply)_\\w+"
                    + "|write|edit|mkdir|rmdir|mv|cp|rm|tee|touch|truncate|ln|install|patch)$",
            Pattern.CASE_INSENSITIVE);

    /** Raw shell writes passed through a general-purpose tool. */
    private static final List<Pattern> WRITE_COMMANDS = List.of(
            Pattern.compile("(?:^|[\\s;&|])(?:mv|cp|rm|rmdir|mkdir|touch|tee|truncate|ln|install|dd)\\s"),
            Pattern.compile("\\bsed\\s+(?:-\\w+\\s+)*-i"),
            Pattern.compile(">>?\\s*(?!/dev/null)[^\\s&|>]")
    );

    static final List<String> PATH_KEYS =
            List.of("path", "filePath", "file", "destination", "dest", "target", "directory");

    private final ToolCallText toolCallText;
    private final SafeRegexEvaluator regexEvaluator;

    public FilesystemWriteDetector(ToolCallText toolCallText, SafeRegexEvaluator regexEvaluator) {
        this.toolCallText = toolCallText;
        this.regexEvaluator = regexEvaluator;
    }

    public FilesystemWriteResult classify(String toolName, Map<String, ?> args) {
        if (toolName != null && WRITE_TOOL.matcher(toolName).matches()) {
            return FilesystemWriteResult.write(extractPath(args));
        }

        // a command too slow to scan is assumed to write
        CharSequence guarded = regexEvaluator.withDeadline(toolCallText.buildSearchString(toolName, args));
        for (Pattern pattern : WRITE_COMMANDS) {
            if (regexEvaluator.find(pattern, guarded) != Outcome.NO_MATCH) {
                return FilesystemWriteResult.write(extractPath(args));
            }
        }
        return FilesystemWriteResult.notAWrite();
    }

    private static String extractPath(Map<String, ?> args) {
        for (String key : PATH_KEYS) {
            String path = ToolArgumentsParser.getString(args, key);
            if (path != null && !path.isBlank()) {
                return path;
            }
        }
        return null;
    }
}
