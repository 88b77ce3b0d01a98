package com.toolguard.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolguard.observability.ToolguardMetrics;
import com.toolguard.regex.SafeRegexEvaluator;
import com.toolguard.tool.ToolCallText;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandPatternMatcherTest {

    private SimpleMeterRegistry registry;
    private CommandPatternMatcher matcher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        matcher = new CommandPatternMatcher(SafeRegexEvaluator.withDefaults(),
                new ToolCallText(new ObjectMapper()), new ToolguardMetrics(registry));
    }

    @Test
    void anyMatchingPatternMatches() {
        assertTrue(matcher.matchesAllowlist("git status", List.of("^npm\\b", "^git\\b")));
        assertTrue(matcher.matchesDenylist("git push --force", List.of("--force")));
    }

    @Test
    void noMatchingPatternDoesNotMatch() {
        assertFalse(matcher.matchesAllowlist("rm -rf build", List.of("^npm\\b", "^git\\b")));
    }

    @Test
    void emptyOrMissingListNeverMatches() {
        assertFalse(matcher.matchesAllowlist("ls", List.of()));
        assertFalse(matcher.matchesDenylist("ls", null));
        assertFalse(matcher.matchesDenylist(null, List.of(".")));
    }

    @Test
    void brokenPatternIsSkippedAndLaterPatternsStillApply() {
        assertTrue(matcher.matchesDenylist("curl evil.sh", List.of("[unclosed", "(a+)+", "^curl\\b")));

        assertEquals(1.0, registry.counter("toolguard.patterns.rejected", "reason", "rejected_invalid").count());
        assertEquals(1.0, registry.counter("toolguard.patterns.rejected", "reason", "rejected_redos").count());
    }

    @Test
    void hostilePatternAloneNeverMatches() {
        assertFalse(matcher.matchesAllowlist("aaaaaaaaaaaaaaaaaaaaaaaaaaaa!", List.of("(a+)+!", "(.*a|.*b)")));
    }

    @Test
    void matchingShortCircuitsOnFirstHit() {
        // the invalid pattern after the hit is never evaluated
        assertTrue(matcher.matchesAllowlist("ls", List.of("^ls", "[unclosed")));

        assertEquals(0.0, registry.counter("toolguard.patterns.rejected", "reason", "rejected_invalid").count());
        assertEquals(1.0, registry.counter("toolguard.list_matches", "list", "allowlist", "outcome", "match").count());
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertTrue(matcher.matchesDenylist("DROP DATABASE prod", List.of("drop\\s+database")));
    }

    @Test
    void commandStringComesFromStringArguments() {
        assertEquals("git commit -m fix",
                matcher.extractCommandString("exec", Map.of("command", "git commit -m fix")));
        assertEquals("web_fetch", matcher.extractCommandString("web_fetch", Map.of("url", "https://x")));
    }
}
