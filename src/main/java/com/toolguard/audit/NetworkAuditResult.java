package com.toolguard.audit;

import java.util.List;

/**
 * Outcome of auditing a tool call for outbound network use. Audit data only;
 * no allow/deny decision is implied.
 */
public record NetworkAuditResult(
        boolean isNetworkRequest,
        List<String> targets,
        boolean isExfiltration,
        String exfiltrationReason,
        boolean allTargetsLocal
) {
    private static final NetworkAuditResult NONE = new NetworkAuditResult(false, List.of(), false, null, false);

    public NetworkAuditResult {
        targets = targets != null ? List.copyOf(targets) : List.of();
    }

    public static NetworkAuditResult none() {
        return NONE;
    }

    /**
     * Coarse verdict used for metrics and audit entries:
     * none, exfiltration, local or external.
     */
    public String verdict() {
        if (!isNetworkRequest) return "none";
        if (isExfiltration) return "exfiltration";
        return allTargetsLocal ? "local" : "external";
    }
}
