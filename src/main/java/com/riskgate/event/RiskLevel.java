package com.riskgate.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>INFO is for non-fatal warnings, WARNING for ordinary rejections, and CRITICAL for
 * rejections that mean no new risk can be taken at all (kill switch, daily loss limit,
 * engine failure).
 */
public enum RiskLevel {

    /** Informational, the trade was still approved. */
    INFO,

    /** The trade was rejected by a limit. */
    WARNING,

    /** Trading is effectively halted until the condition clears. */
    CRITICAL
}
