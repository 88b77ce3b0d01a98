package com.toolguard.regex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Single gateway for evaluating operator-supplied regular expressions.
 * <p>
 * Patterns are screened by a cheap syntactic ReDoS heuristic before they are
 * compiled, and every match runs against a deadline-guarded input so that
 * shapes the heuristic misses still terminate. Nothing here throws: a bad
 * pattern simply does not match.
 */
public class SafeRegexEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SafeRegexEvaluator.class);

    public static final String REDOS_MESSAGE =
            "Pattern may cause catastrophic backtracking (nested quantifiers or overlapping alternation)";
    public static final String BLANK_MESSAGE = "Pattern must not be blank";

    public static final Duration DEFAULT_MATCH_TIMEOUT = Duration.ofMillis(100);
    public static final int DEFAULT_CACHE_SIZE = 512;

    public enum Outcome {
        MATCH,
        NO_MATCH,
        REJECTED_REDOS,
        REJECTED_INVALID,
        TIMED_OUT
    }

    private final long matchTimeoutNanos;
    private final int cacheSize;
    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    public SafeRegexEvaluator(Duration matchTimeout, int cacheSize) {
        this.matchTimeoutNanos = Math.max(1, matchTimeout.toNanos());
        this.cacheSize = Math.max(1, cacheSize);
    }

    public static SafeRegexEvaluator withDefaults() {
        return new SafeRegexEvaluator(DEFAULT_MATCH_TIMEOUT, DEFAULT_CACHE_SIZE);
    }

    /**
     * Flags quantifier-group-quantifier shapes such as {@code (a+)+} and two
     * {@code .*} segments joined by an alternation. Known blind spots include
     * ambiguous alternation like {@code (a|aa)+}.
     */
    public static boolean isReDoSRisk(String pattern) {
        if (pattern == null || pattern.isEmpty()) return false;
        return hasNestedQuantifier(pattern) || hasOverlappingWildcardAlternation(pattern);
    }

    /**
     * Returns null when the pattern is usable, otherwise a message suitable for
     * showing next to the offending input.
     */
    public static String validateRegexPattern(String pattern) {
        if (pattern == null || pattern.isBlank()) return BLANK_MESSAGE;
        if (isReDoSRisk(pattern)) return REDOS_MESSAGE;
        try {
            Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
            return null;
        } catch (PatternSyntaxException e) {
            return e.getDescription();
        }
    }

    /**
     * Case-insensitive search of {@code pattern} in {@code input}. Returns false for
     * risky, invalid or timed-out patterns.
     */
    public boolean safeRegexTest(String pattern, String input) {
        return evaluate(pattern, input) == Outcome.MATCH;
    }

    public Outcome evaluate(String pattern, String input) {
        if (pattern == null || pattern.isBlank() || input == null) return Outcome.REJECTED_INVALID;
        if (isReDoSRisk(pattern)) return Outcome.REJECTED_REDOS;

        Pattern regex = compile(pattern);
        if (regex == null) return Outcome.REJECTED_INVALID;

        try {
            CharSequence guarded = new DeadlineCharSequence(input, System.nanoTime() + matchTimeoutNanos);
            return regex.matcher(guarded).find() ? Outcome.MATCH : Outcome.NO_MATCH;
        } catch (DeadlineCharSequence.MatchTimeoutException e) {
            log.warn("Regex evaluation exceeded {} ms, treating as no match: {}",
                    matchTimeoutNanos / 1_000_000, pattern);
            return Outcome.TIMED_OUT;
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Regex evaluation failed for pattern {}: {}", pattern, e.toString());
            return Outcome.REJECTED_INVALID;
        }
    }

    /**
     * Wraps agent-supplied text so that every built-in pattern run against it
     * shares one deadline, starting now.
     */
    public CharSequence withDeadline(String input) {
        return new DeadlineCharSequence(input, System.nanoTime() + matchTimeoutNanos);
    }

    /**
     * Searches a precompiled pattern in input obtained from
     * {@link #withDeadline(String)}. Returns MATCH, NO_MATCH or TIMED_OUT;
     * callers decide which way a timeout falls.
     */
    public Outcome find(Pattern pattern, CharSequence input) {
        try {
            return pattern.matcher(input).find() ? Outcome.MATCH : Outcome.NO_MATCH;
        } catch (DeadlineCharSequence.MatchTimeoutException e) {
            log.warn("Built-in pattern exceeded the {} ms budget: {}", matchTimeoutNanos / 1_000_000, pattern.pattern());
            return Outcome.TIMED_OUT;
        }
    }

    /**
     * Feeds every match to {@code action} until the input is exhausted or the
     * deadline passes. Matches seen before a timeout are kept.
     */
    public Outcome forEachMatch(Pattern pattern, CharSequence input, Consumer<MatchResult> action) {
        boolean found = false;
        try {
            Matcher matcher = pattern.matcher(input);
            while (matcher.find()) {
                found = true;
                action.accept(matcher.toMatchResult());
            }
            return found ? Outcome.MATCH : Outcome.NO_MATCH;
        } catch (DeadlineCharSequence.MatchTimeoutException e) {
            log.warn("Built-in pattern exceeded the {} ms budget: {}", matchTimeoutNanos / 1_000_000, pattern.pattern());
            return Outcome.TIMED_OUT;
        }
    }

    private Pattern compile(String pattern) {
        Pattern cached = compiled.get(pattern);
        if (cached != null) return cached;
        try {
            Pattern fresh = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
            if (compiled.size() >= cacheSize) {
                compiled.clear();
            }
            compiled.put(pattern, fresh);
            return fresh;
        } catch (PatternSyntaxException e) {
            log.debug("Ignoring invalid pattern {}: {}", pattern, e.getDescription());
            return null;
        }
    }

    // (X+)+ (X*)* (X+)* (X*)+
    private static boolean hasNestedQuantifier(String pattern) {
        for (int i = 0; i + 2 < pattern.length(); i++) {
            if (isStarOrPlus(pattern.charAt(i))
                    && pattern.charAt(i + 1) == ')'
                    && isStarOrPlus(pattern.charAt(i + 2))) {
                return true;
            }
        }
        return false;
    }

    // .* ... | ... .*
    private static boolean hasOverlappingWildcardAlternation(String pattern) {
        int first = pattern.indexOf(".*");
        if (first < 0) return false;
        int bar = pattern.indexOf('|', first + 2);
        if (bar < 0) return false;
        return pattern.indexOf(".*", bar + 1) >= 0;
    }

    private static boolean isStarOrPlus(char c) {
        return c == '+' || c == '*';
    }
}
