package com.toolguard.risk;

/**
 * Result of matching a tool call against the danger pattern table.
 *
 * @param matchedPattern source text of the rule that fired, for audit display
 */
public record RiskClassification(RiskLevel level, String label, String reason, String matchedPattern) {

    public boolean isCritical() {
        return level == RiskLevel.CRITICAL;
    }
}
