package com.toolguard.risk;

import com.toolguard.regex.SafeRegexEvaluator;
import com.toolguard.regex.SafeRegexEvaluator.Outcome;
import com.toolguard.tool.ToolCallText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Classifies a tool invocation against the ordered danger pattern table.
 * <p>
 * All rules of one call share a single match deadline. A rule still running
 * when the deadline passes counts as matched.
 */
@Component
public class RiskClassifier {

    private static final Logger log = LoggerFactory.getLogger(RiskClassifier.class);

    private static final Pattern PRIVILEGE_ESCALATION =
            Pattern.compile("\\b(sudo|su|doas|pkexec|runas)\\b", Pattern.CASE_INSENSITIVE);

    private final ToolCallText toolCallText;
    private final SafeRegexEvaluator regexEvaluator;
    private final List<DangerPattern> table;

    public RiskClassifier(ToolCallText toolCallText, SafeRegexEvaluator regexEvaluator) {
        this.toolCallText = toolCallText;
        this.regexEvaluator = regexEvaluator;
        this.table = DangerPatternTable.entries();
    }

    /**
     * Returns the classification of the first table entry that matches, or null
     * when the call matches nothing.
     */
    public RiskClassification classify(String toolName, Map<String, ?> args) {
        String searchString = toolCallText.buildSearchString(toolName, args);
        if (searchString.isBlank()) return null;

        CharSequence guarded = regexEvaluator.withDeadline(searchString);
        for (DangerPattern entry : table) {
            Outcome outcome = regexEvaluator.find(entry.pattern(), guarded);
            if (outcome == Outcome.TIMED_OUT) {
                log.warn("Classification of tool {} ran out of time at rule '{}'", toolName, entry.label());
                return entry.toClassification();
            }
            if (outcome == Outcome.MATCH) {
                return entry.toClassification();
            }
        }
        return null;
    }

    /**
     * Narrow check used by the auto-deny-privilege-escalation toggle,
     * independent of the table's ordering.
     */
    public boolean isPrivilegeEscalation(String toolName, Map<String, ?> args) {
        String searchString = toolCallText.buildSearchString(toolName, args);
        if (searchString.isBlank()) return false;
        Outcome outcome = regexEvaluator.find(PRIVILEGE_ESCALATION, regexEvaluator.withDeadline(searchString));
        return outcome != Outcome.NO_MATCH;
    }
}
