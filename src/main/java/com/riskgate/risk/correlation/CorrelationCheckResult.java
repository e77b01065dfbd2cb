package com.riskgate.risk.correlation;

import lombok.Value;

/**
 * Verdict of {@link CorrelationGuard#checkNewTrade}: approved with reason "approved", or
 * rejected with a human-readable reason.
 */
@Value
public class CorrelationCheckResult {

    public static final String APPROVED_REASON = "approved";

    boolean approved;
    String reason;

    public static CorrelationCheckResult approved() {
        return new CorrelationCheckResult(true, APPROVED_REASON);
    }

    public static CorrelationCheckResult rejected(String reason) {
        return new CorrelationCheckResult(false, reason);
    }
}
