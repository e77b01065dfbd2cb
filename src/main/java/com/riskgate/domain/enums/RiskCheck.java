package com.riskgate.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The checks of the unified assessment pipeline, in execution order.
 *
 * <p>The first five always run. CORRELATION_GUARD and VAR_SIZING run only when enabled by
 * configuration and when the request carries the return history they need; a skipped check
 * is not reported in {@code checksRun}.
 */
@Getter
@RequiredArgsConstructor
public enum RiskCheck {
    KILL_SWITCH("kill_switch"),
    CIRCUIT_BREAKER("circuit_breaker"),
    DAILY_LOSS_LIMIT("daily_loss_limit"),
    MAX_POSITIONS("max_positions"),
    SINGLE_STOCK_CONCENTRATION("single_stock_concentration"),
    CORRELATION_GUARD("correlation_guard"),
    VAR_SIZING("var_sizing");

    /** Stable name reported in assessments and metric tags. */
    private final String checkName;
}
