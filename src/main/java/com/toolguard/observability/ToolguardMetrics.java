package com.toolguard.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized Micrometer metrics for toolguard subsystems.
 */
@Component
public class ToolguardMetrics {

    private final MeterRegistry registry;

    public ToolguardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Classification metrics ---

    public void recordClassification(String level) {
        Counter.builder("toolguard.classifications")
                .tag("level", level)
                .register(registry).increment();
    }

    // --- Allow/deny list metrics ---

    public void recordListMatch(String list, String outcome) {
        Counter.builder("toolguard.list_matches")
                .tag("list", list)
                .tag("outcome", outcome)
                .register(registry).increment();
    }

    public void recordPatternRejected(String reason) {
        Counter.builder("toolguard.patterns.rejected")
                .tag("reason", reason)
                .register(registry).increment();
    }

    // --- Settings persistence metrics ---

    public void recordSettingsPersist(String operation, String outcome) {
        Counter.builder("toolguard.settings.persist")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry).increment();
    }

    // --- Audit metrics ---

    public void recordNetworkAudit(String verdict) {
        Counter.builder("toolguard.network.audits")
                .tag("verdict", verdict)
                .register(registry).increment();
    }

    public void recordDecision(String outcome) {
        Counter.builder("toolguard.decisions")
                .tag("outcome", outcome)
                .register(registry).increment();
    }
}
