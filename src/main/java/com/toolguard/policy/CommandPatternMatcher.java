package com.toolguard.policy;

import com.toolguard.observability.ToolguardMetrics;
import com.toolguard.regex.SafeRegexEvaluator;
import com.toolguard.tool.ToolCallText;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates operator-supplied allow/deny pattern lists against a command string.
 * A pattern that is malformed, ReDoS-prone or too slow never matches, and the
 * remaining patterns are still evaluated.
 */
@Component
public class CommandPatternMatcher {

    static final String ALLOWLIST = "allowlist";
    static final String DENYLIST = "denylist";

    private final SafeRegexEvaluator regexEvaluator;
    private final ToolCallText toolCallText;
    private final ToolguardMetrics metrics;

    public CommandPatternMatcher(SafeRegexEvaluator regexEvaluator, ToolCallText toolCallText,
                                 ToolguardMetrics metrics) {
        this.regexEvaluator = regexEvaluator;
        this.toolCallText = toolCallText;
        this.metrics = metrics;
    }

    public boolean matchesAllowlist(String command, List<String> patterns) {
        return matchesAny(ALLOWLIST, command, patterns);
    }

    public boolean matchesDenylist(String command, List<String> patterns) {
        return matchesAny(DENYLIST, command, patterns);
    }

    public String extractCommandString(String toolName, Map<String, ?> args) {
        return toolCallText.extractCommandString(toolName, args);
    }

    private boolean matchesAny(String list, String command, List<String> patterns) {
        if (command == null || patterns == null || patterns.isEmpty()) return false;

        for (String pattern : patterns) {
            SafeRegexEvaluator.Outcome outcome = regexEvaluator.evaluate(pattern, command);
            if (outcome == SafeRegexEvaluator.Outcome.MATCH) {
                metrics.recordListMatch(list, "match");
                return true;
            }
            if (outcome != SafeRegexEvaluator.Outcome.NO_MATCH) {
                metrics.recordPatternRejected(outcome.name().toLowerCase(Locale.ROOT));
            }
        }
        metrics.recordListMatch(list, "no_match");
        return false;
    }
}
