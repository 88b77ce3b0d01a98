package com.toolguard.risk;

import java.util.regex.Pattern;

/**
 * One rule of the danger pattern table. Patterns are always case-insensitive.
 */
public record DangerPattern(Pattern pattern, RiskLevel level, String label, String reason) {

    public static DangerPattern of(String regex, RiskLevel level, String label, String reason) {
        return new DangerPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), level, label, reason);
    }

    public RiskClassification toClassification() {
        return new RiskClassification(level, label, reason, pattern.pattern());
    }
}
