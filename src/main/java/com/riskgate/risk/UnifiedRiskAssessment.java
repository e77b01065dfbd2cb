package com.riskgate.risk;

import com.riskgate.domain.enums.CircuitBreakerStatus;
import com.riskgate.domain.enums.MarketRegime;
import com.riskgate.domain.enums.RiskCheck;
import com.riskgate.risk.correlation.CorrelationMatrix;
import com.riskgate.risk.regime.RegimeLimits;
import com.riskgate.risk.sizing.VaRResult;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * The single output of {@link RiskContext#assess}: the verdict plus every metric gathered on
 * the way to it.
 *
 * <p>{@code rejectionReason} and {@code rejectedBy} are set if and only if the trade was
 * rejected. {@code correlationMatrix} and {@code varResult} are null when the corresponding
 * check did not run; a correlation rejection still carries its matrix. Daily P&L is the
 * engine's own running figure, the single source of truth for the trading day.
 *
 * <p>Immutable; ownership passes entirely to the caller.
 */
@Value
@Builder
public class UnifiedRiskAssessment {

    boolean approved;
    String rejectionReason;
    RiskCheck rejectedBy;

    double dailyPnl;
    double dailyPnlPct;
    int currentPositions;

    MarketRegime regime;
    RegimeLimits regimeLimits;

    CorrelationMatrix correlationMatrix;

    /** 0-100 correlation concentration of holdings plus the candidate. */
    double concentrationScore;

    VaRResult varResult;

    /** Final risk-adjusted maximum position size in account currency. 0.0 when rejected. */
    double maxPositionSize;

    CircuitBreakerStatus circuitBreakerStatus;
    boolean killSwitchActive;

    @Builder.Default
    List<String> warnings = List.of();

    /** Names of the checks that actually ran, in order. */
    @Builder.Default
    List<String> checksRun = List.of();

    @Builder.Default
    Instant timestamp = Instant.now();

    public boolean isRejected() {
        return !approved;
    }

    /**
     * Plain key-value view for logging and telemetry. Money and percentages are rounded to two
     * decimals, the concentration score to one.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("approved", approved);
        map.put("rejection_reason", rejectionReason);
        map.put("rejected_by", rejectedBy != null ? rejectedBy.getCheckName() : null);
        map.put("daily_pnl", RiskMath.round(dailyPnl, 2));
        map.put("daily_pnl_pct", RiskMath.round(dailyPnlPct, 2));
        map.put("current_positions", currentPositions);
        map.put("regime", regime != null ? regime.getRegimeName() : null);
        map.put("regime_limits", regimeLimits != null ? regimeLimits.toMap() : null);
        map.put("correlation_matrix", correlationMatrix != null ? correlationMatrix.toMap() : null);
        map.put("concentration_score", RiskMath.round(concentrationScore, 1));
        map.put("portfolio_var", varResult != null ? varResult.toMap() : null);
        map.put("max_position_size", RiskMath.round(maxPositionSize, 2));
        map.put("circuit_breaker_status", circuitBreakerStatus != null ? circuitBreakerStatus.getValue() : null);
        map.put("kill_switch_active", killSwitchActive);
        map.put("warnings", warnings);
        map.put("checks_run", checksRun);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
