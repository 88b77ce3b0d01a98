package com.toolguard.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Logback converter that masks credentials in log messages. Command lines
 * are logged on every decision and often carry tokens or passwords.
 * Additional patterns come from toolguard.logging.redact-patterns via
 * LoggingConfig.
 */
public class SecretRedactionConverter extends ClassicConverter {

    static final String MASK = "[REDACTED]";

    // group 1 is kept, the rest of the match is masked
    private static final List<Pattern> DEFAULT_PATTERNS = List.of(
            Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9._~+/=-]{8,}"),
            Pattern.compile("(?i)(\\b(?:password|passwd|pwd|secret|token|api[_-]?key)\\s*[=:]\\s*)[^\\s&'\"]+"),
            Pattern.compile("(?i)(--password[=\\s])[^\\s'\"]+"),
            Pattern.compile("()\\b(?:sk|pk|rk)-[A-Za-z0-9_-]{16,}"),
            Pattern.compile("()\\bgh[pousr]_[A-Za-z0-9]{20,}"),
            Pattern.compile("()\\bAKIA[0-9A-Z]{16}\\b"),
            Pattern.compile("(://[^/\\s:@]+:)[^@\\s/]+(?=@)")
    );

    private static volatile List<Pattern> configuredPatterns = null;

    /**
     * Called by LoggingConfig with patterns that already passed
     * {@link com.toolguard.regex.SafeRegexEvaluator#validateRegexPattern(String)}.
     */
    public static void setConfiguredPatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>(DEFAULT_PATTERNS);
        if (patterns != null) {
            for (String p : patterns) {
                compiled.add(Pattern.compile(p));
            }
        }
        configuredPatterns = compiled;
    }

    static void resetConfiguredPatterns() {
        configuredPatterns = null;
    }

    @Override
    public String convert(ILoggingEvent event) {
        return redact(event.getFormattedMessage());
    }

    static String redact(String message) {
        if (message == null) return "";

        List<Pattern> patterns = configuredPatterns != null ? configuredPatterns : DEFAULT_PATTERNS;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(message);
            if (!matcher.find()) continue;
            StringBuilder out = new StringBuilder();
            do {
                String keep = matcher.groupCount() >= 1 && matcher.group(1) != null ? matcher.group(1) : "";
                matcher.appendReplacement(out, Matcher.quoteReplacement(keep + MASK));
            } while (matcher.find());
            matcher.appendTail(out);
            message = out.toString();
        }
        return message;
    }
}
