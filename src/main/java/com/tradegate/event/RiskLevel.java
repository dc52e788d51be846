package com.tradegate.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>INFO is for routine state changes (rollover, throttle release), WARNING for
 * denials and throttling, and CRITICAL for the daily stop.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
