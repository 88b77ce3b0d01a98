package com.toolguard.policy;

import com.toolguard.audit.NetworkAuditResult;
import com.toolguard.risk.RiskClassification;

/**
 * Advice for the approval workflow. The caller acts on it; nothing here
 * blocks or runs the tool.
 *
 * @param risk                     first matching danger pattern, or null
 * @param requireTypedConfirmation operator must type a confirmation before approving
 */
public record ApprovalDecision(
        Outcome outcome,
        String reason,
        boolean requireTypedConfirmation,
        RiskClassification risk,
        NetworkAuditResult networkAudit,
        String commandString
) {
    public enum Outcome { AUTO_APPROVE, AUTO_DENY, PROMPT }

    public boolean isApproved() {
        return outcome == Outcome.AUTO_APPROVE;
    }

    public boolean isDenied() {
        return outcome == Outcome.AUTO_DENY;
    }
}
