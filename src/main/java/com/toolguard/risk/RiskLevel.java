package com.toolguard.risk;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity assigned to a classified tool call.
 * Only CRITICAL, HIGH and MEDIUM are produced by the danger pattern table;
 * LOW and SAFE are reserved.
 */
public enum RiskLevel {

    CRITICAL,

    HIGH,

    MEDIUM,

    LOW,

    SAFE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
