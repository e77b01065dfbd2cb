package com.riskgate.risk;

import com.riskgate.domain.enums.MarketRegime;
import com.riskgate.exception.InvalidRiskConfigException;
import com.riskgate.risk.correlation.CorrelationConfig;
import com.riskgate.risk.sizing.VaRConfig;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration of the unified risk engine, created once when the
 * {@link RiskContext} is built.
 *
 * <p>Defaults:
 * <ul>
 *   <li>maxDailyLossPct: 10.0 (% of starting equity)</li>
 *   <li>maxConcurrentPositions: 10 (before regime adjustment)</li>
 *   <li>maxSingleStockPct: 15.0 (% of equity, also the flat fallback size)</li>
 *   <li>maxSectorPct: 30.0 (% of equity, carried for sector-aware hosts)</li>
 *   <li>defaultRegime: SIDEWAYS</li>
 *   <li>correlation guard and VaR sizing enabled</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class RiskContextConfig {

    @Builder.Default
    double maxDailyLossPct = 10.0;

    @Builder.Default
    int maxConcurrentPositions = 10;

    @Builder.Default
    double maxSingleStockPct = 15.0;

    @Builder.Default
    double maxSectorPct = 30.0;

    @Builder.Default
    CorrelationConfig correlationConfig = CorrelationConfig.defaults();

    @Builder.Default
    VaRConfig varConfig = VaRConfig.defaults();

    @Builder.Default
    MarketRegime defaultRegime = MarketRegime.SIDEWAYS;

    @Builder.Default
    boolean enableCorrelationGuard = true;

    @Builder.Default
    boolean enableVarSizing = true;

    public static RiskContextConfig defaults() {
        return RiskContextConfig.builder().build();
    }

    /**
     * Checks this config and its nested configs.
     *
     * @throws InvalidRiskConfigException if any invariant is violated
     */
    public void validate() {
        if (maxDailyLossPct <= 0.0) {
            throw new InvalidRiskConfigException("maxDailyLossPct", maxDailyLossPct, "must be > 0");
        }
        if (maxConcurrentPositions < 1) {
            throw new InvalidRiskConfigException("maxConcurrentPositions", maxConcurrentPositions, "must be >= 1");
        }
        if (maxSingleStockPct <= 0.0) {
            throw new InvalidRiskConfigException("maxSingleStockPct", maxSingleStockPct, "must be > 0");
        }
        if (maxSectorPct <= 0.0) {
            throw new InvalidRiskConfigException("maxSectorPct", maxSectorPct, "must be > 0");
        }
        if (correlationConfig == null || varConfig == null || defaultRegime == null) {
            throw new InvalidRiskConfigException("Nested correlation/VaR config and default regime are required");
        }
        correlationConfig.validate();
        varConfig.validate();
    }
}
