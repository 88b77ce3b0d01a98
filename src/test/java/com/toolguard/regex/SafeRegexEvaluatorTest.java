package com.toolguard.regex;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class SafeRegexEvaluatorTest {

    private final SafeRegexEvaluator evaluator = SafeRegexEvaluator.withDefaults();

    @Test
    void nestedQuantifiersAreFlagged() {
        assertTrue(SafeRegexEvaluator.isReDoSRisk("(a+)+"));
        assertTrue(SafeRegexEvaluator.isReDoSRisk("(a*)*"));
        assertTrue(SafeRegexEvaluator.isReDoSRisk("^(\\w+)*$"));
        assertTrue(SafeRegexEvaluator.isReDoSRisk("(x*)+y"));
    }

    @Test
    void wildcardAlternationIsFlagged() {
        assertTrue(SafeRegexEvaluator.isReDoSRisk("(.*a|.*b)"));
        assertTrue(SafeRegexEvaluator.isReDoSRisk(".*foo|bar.*"));
    }

    @Test
    void ordinaryPatternsAreNotFlagged() {
        assertFalse(SafeRegexEvaluator.isReDoSRisk("^git\\b"));
        assertFalse(SafeRegexEvaluator.isReDoSRisk("^(ls|pwd)$"));
        assertFalse(SafeRegexEvaluator.isReDoSRisk(".*\\.log$"));
        assertFalse(SafeRegexEvaluator.isReDoSRisk(""));
        assertFalse(SafeRegexEvaluator.isReDoSRisk(null));
    }

    @Test
    void ambiguousAlternationIsAKnownBlindSpot() {
        assertFalse(SafeRegexEvaluator.isReDoSRisk("(a|aa)+"));
    }

    @Test
    void validPatternValidatesToNull() {
        assertNull(SafeRegexEvaluator.validateRegexPattern("^npm\\s+(install|ci)\\b"));
    }

    @Test
    void riskyPatternReportsBacktrackingMessage() {
        assertEquals(SafeRegexEvaluator.REDOS_MESSAGE, SafeRegexEvaluator.validateRegexPattern("(a+)+$"));
    }

    @Test
    void syntaxErrorReportsCompilerMessage() {
        String message = SafeRegexEvaluator.validateRegexPattern("[unclosed");
        assertNotNull(message);
        assertNotEquals(SafeRegexEvaluator.REDOS_MESSAGE, message);
    }

    @Test
    void blankPatternIsRejected() {
        assertEquals(SafeRegexEvaluator.BLANK_MESSAGE, SafeRegexEvaluator.validateRegexPattern("  "));
        assertFalse(evaluator.safeRegexTest("", "anything"));
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertTrue(evaluator.safeRegexTest("^GIT\\b", "git status"));
        assertTrue(evaluator.safeRegexTest("status", "git STATUS"));
    }

    @Test
    void invalidPatternNeverMatchesOrThrows() {
        assertFalse(evaluator.safeRegexTest("[bad", "[bad"));
        assertEquals(SafeRegexEvaluator.Outcome.REJECTED_INVALID, evaluator.evaluate("(unclosed", "x"));
    }

    @Test
    void riskyPatternIsRejectedWithoutMatching() {
        assertFalse(evaluator.safeRegexTest("(a+)+", "aaaa"));
        assertEquals(SafeRegexEvaluator.Outcome.REJECTED_REDOS, evaluator.evaluate("(a+)+", "aaaa"));
    }

    @Test
    void nullInputDoesNotMatch() {
        assertFalse(evaluator.safeRegexTest("^ls", null));
    }

    @Test
    void ambiguousAlternationTerminatesWithinDeadline() {
        SafeRegexEvaluator fast = new SafeRegexEvaluator(Duration.ofMillis(50), 16);
        String input = "a".repeat(5_000) + "!";
        assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertFalse(fast.safeRegexTest("^(a|aa)+$", input)));
    }

    @Test
    void cacheEvictionKeepsEvaluationCorrect() {
        SafeRegexEvaluator tiny = new SafeRegexEvaluator(Duration.ofMillis(100), 2);
        assertTrue(tiny.safeRegexTest("^a", "abc"));
        assertTrue(tiny.safeRegexTest("^b", "bcd"));
        assertTrue(tiny.safeRegexTest("^c", "cde"));
        assertTrue(tiny.safeRegexTest("^a", "abc"));
    }

    @Test
    void builtInPatternsShareOneDeadlinePerInput() {
        SafeRegexEvaluator impatient = new SafeRegexEvaluator(Duration.ofNanos(1), 16);
        CharSequence guarded = impatient.withDeadline("x".repeat(20_000));

        assertEquals(SafeRegexEvaluator.Outcome.TIMED_OUT, impatient.find(Pattern.compile("y"), guarded));
        assertEquals(SafeRegexEvaluator.Outcome.TIMED_OUT, impatient.find(Pattern.compile("z"), guarded));
    }

    @Test
    void forEachMatchCollectsEveryHit() {
        List<String> hits = new ArrayList<>();

        SafeRegexEvaluator.Outcome outcome = evaluator.forEachMatch(Pattern.compile("\\d+"),
                evaluator.withDeadline("a1 b22 c333"), match -> hits.add(match.group()));

        assertEquals(SafeRegexEvaluator.Outcome.MATCH, outcome);
        assertEquals(List.of("1", "22", "333"), hits);
    }
}
