package com.riskgate.event;

import com.riskgate.domain.enums.RiskCheck;

/**
 * Classifies the risk condition that triggered a {@link RiskEvent}.
 *
 * <p>Rejection types map one-to-one onto the checks of the assessment pipeline, so a
 * listener can react differently to a kill switch than to a correlation breach.
 */
public enum RiskEventType {

    /** Trade rejected because the externally supplied kill switch is engaged. */
    KILL_SWITCH_ACTIVE,

    /** Trade rejected because the circuit breaker is open. */
    CIRCUIT_BREAKER_OPEN,

    /** Daily cumulative loss has reached the configured limit. */
    DAILY_LOSS_LIMIT_BREACH,

    /** Regime-adjusted maximum number of concurrent positions has been reached. */
    MAX_POSITIONS_REACHED,

    /** Existing exposure to the candidate ticker already meets the single-stock limit. */
    SINGLE_STOCK_LIMIT_BREACH,

    /** Candidate ticker is too correlated with a holding or would overfill a cluster. */
    CORRELATION_LIMIT_BREACH,

    /** Holdings plus candidate are highly correlated (non-fatal). */
    CONCENTRATION_HIGH,

    /** The engine failed unexpectedly and the trade was rejected fail-closed. */
    ENGINE_FAILURE;

    /**
     * Maps the check that rejected a trade onto the event type reported for it.
     */
    public static RiskEventType forRejection(RiskCheck check) {
        if (check == null) {
            return ENGINE_FAILURE;
        }
        return switch (check) {
            case KILL_SWITCH -> KILL_SWITCH_ACTIVE;
            case CIRCUIT_BREAKER -> CIRCUIT_BREAKER_OPEN;
            case DAILY_LOSS_LIMIT -> DAILY_LOSS_LIMIT_BREACH;
            case MAX_POSITIONS -> MAX_POSITIONS_REACHED;
            case SINGLE_STOCK_CONCENTRATION -> SINGLE_STOCK_LIMIT_BREACH;
            case CORRELATION_GUARD -> CORRELATION_LIMIT_BREACH;
            default -> ENGINE_FAILURE;
        };
    }
}
