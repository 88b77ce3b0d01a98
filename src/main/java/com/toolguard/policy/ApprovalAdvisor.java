package com.toolguard.policy;

import com.toolguard.audit.FilesystemWriteDetector;
import com.toolguard.audit.NetworkAuditResult;
import com.toolguard.audit.NetworkAuditor;
import com.toolguard.observability.ToolguardMetrics;
import com.toolguard.risk.RiskClassification;
import com.toolguard.risk.RiskClassifier;
import com.toolguard.settings.SecuritySettings;
import com.toolguard.settings.SecuritySettingsStore;
import com.toolguard.settings.SessionOverride;
import com.toolguard.tool.ToolArgumentsParser;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Combines classification, list matching, the session override and the
 * policy toggles into a single approval recommendation.
 * <p>
 * Checks run in a fixed order and the first one that decides wins:
 * session override, read-only mode, privilege escalation, critical risk,
 * denylist, allowlist. Anything left over is put to the operator.
 */
@Service
public class ApprovalAdvisor {

    private static final Logger log = LoggerFactory.getLogger(ApprovalAdvisor.class);

    private final RiskClassifier riskClassifier;
    private final CommandPatternMatcher patternMatcher;
    private final NetworkAuditor networkAuditor;
    private final FilesystemWriteDetector writeDetector;
    private final SecuritySettingsStore settingsStore;
    private final SessionOverride sessionOverride;
    private final ToolguardMetrics metrics;

    public ApprovalAdvisor(RiskClassifier riskClassifier,
                           CommandPatternMatcher patternMatcher,
                           NetworkAuditor networkAuditor,
                           FilesystemWriteDetector writeDetector,
                           SecuritySettingsStore settingsStore,
                           SessionOverride sessionOverride,
                           ToolguardMetrics metrics) {
        this.riskClassifier = riskClassifier;
        this.patternMatcher = patternMatcher;
        this.networkAuditor = networkAuditor;
        this.writeDetector = writeDetector;
        this.settingsStore = settingsStore;
        this.sessionOverride = sessionOverride;
        this.metrics = metrics;
    }

    /**
     * Evaluates a tool call whose arguments are still raw JSON. Unparsable
     * arguments are treated as absent.
     */
    @Observed(name = "toolguard.approval.evaluate", contextualName = "approval-evaluate")
    public ApprovalDecision evaluate(String toolName, String argumentsJson) {
        return evaluate(toolName, ToolArgumentsParser.parse(argumentsJson));
    }

    @Observed(name = "toolguard.approval.evaluate", contextualName = "approval-evaluate")
    public ApprovalDecision evaluate(String toolName, Map<String, ?> args) {
        SecuritySettings settings = settingsStore.load();
        RiskClassification risk = riskClassifier.classify(toolName, args);
        String command = patternMatcher.extractCommandString(toolName, args);
        NetworkAuditResult networkAudit = networkAuditor.audit(toolName, args);

        metrics.recordClassification(risk != null ? risk.level().label() : "none");

        boolean escalation = settings.isAutoDenyPrivilegeEscalation()
                && riskClassifier.isPrivilegeEscalation(toolName, args);

        ApprovalDecision decision;
        long overrideRemaining = sessionOverride.remaining();
        if (overrideRemaining > 0 && !escalation) {
            long minutesLeft = (overrideRemaining + 59_999) / 60_000;
            decision = decide(ApprovalDecision.Outcome.AUTO_APPROVE,
                    "Session override (" + minutesLeft + " min left)", risk, networkAudit, command);
        } else if (settings.isReadOnlyProjects() && writeDetector.classify(toolName, args).isWrite()) {
            decision = decide(ApprovalDecision.Outcome.AUTO_DENY,
                    "Filesystem writes are disabled (read-only project mode)", risk, networkAudit, command);
        } else if (escalation) {
            decision = decide(ApprovalDecision.Outcome.AUTO_DENY,
                    "Privilege escalation blocked by security policy", risk, networkAudit, command);
        } else if (settings.isAutoDenyCritical() && risk != null && risk.isCritical()) {
            decision = decide(ApprovalDecision.Outcome.AUTO_DENY,
                    "Critical risk blocked by security policy: " + risk.label(), risk, networkAudit, command);
        } else if (!settings.getCommandDenylist().isEmpty()
                && patternMatcher.matchesDenylist(command, settings.getCommandDenylist())) {
            decision = decide(ApprovalDecision.Outcome.AUTO_DENY,
                    "Command matches denylist", risk, networkAudit, command);
        } else if (risk == null && patternMatcher.matchesAllowlist(command, settings.getCommandAllowlist())) {
            decision = decide(ApprovalDecision.Outcome.AUTO_APPROVE,
                    "Command matches allowlist", risk, networkAudit, command);
        } else {
            boolean typed = risk != null && risk.isCritical() && settings.isRequireTypeToCritical();
            String reason = risk != null ? risk.label() + ": " + risk.reason() : "Requires operator approval";
            decision = new ApprovalDecision(ApprovalDecision.Outcome.PROMPT, reason, typed,
                    risk, networkAudit, command);
        }

        metrics.recordDecision(decision.outcome().name().toLowerCase(Locale.ROOT));
        if (decision.isDenied()) {
            log.warn("Auto-denied tool {}: {}", toolName, decision.reason());
        } else {
            log.info("Tool {} -> {} ({})", toolName, decision.outcome(), decision.reason());
        }
        return decision;
    }

    private static ApprovalDecision decide(ApprovalDecision.Outcome outcome, String reason,
                                           RiskClassification risk, NetworkAuditResult networkAudit,
                                           String command) {
        return new ApprovalDecision(outcome, reason, false, risk, networkAudit, command);
    }
}
