package com.riskgate.risk.sizing;

import com.riskgate.exception.InvalidRiskConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters for historical VaR/CVaR estimation and VaR-budget position sizing.
 *
 * <p>Budgets are percentages of account equity. {@code useCvar} selects Expected Shortfall
 * (the default) or plain VaR as the metric charged against the budgets.
 */
@Value
@Builder(toBuilder = true)
public class VaRConfig {

    /** Minimum observations for a VaR estimate; shorter series produce a zeroed result. */
    public static final int MIN_OBSERVATIONS = 10;

    @Builder.Default
    double confidenceLevel = 0.95;

    /** Total risk budget for the portfolio, % of equity. */
    @Builder.Default
    double maxPortfolioVarPct = 2.0;

    /** Risk budget for any single position, % of equity. */
    @Builder.Default
    double maxPositionVarPct = 0.5;

    /** Most recent observations used; 0 means use the whole series. */
    @Builder.Default
    int lookbackDays = 252;

    @Builder.Default
    boolean useCvar = true;

    /** Reserved for exponentially weighted estimates; not applied by the historical estimator. */
    @Builder.Default
    double decayFactor = 0.97;

    public static VaRConfig defaults() {
        return VaRConfig.builder().build();
    }

    /**
     * Checks the config invariants.
     *
     * @throws InvalidRiskConfigException if any invariant is violated
     */
    public void validate() {
        if (confidenceLevel <= 0.0 || confidenceLevel >= 1.0) {
            throw new InvalidRiskConfigException("confidenceLevel", confidenceLevel, "must be in (0, 1)");
        }
        if (maxPortfolioVarPct < 0.0) {
            throw new InvalidRiskConfigException("maxPortfolioVarPct", maxPortfolioVarPct, "must be >= 0");
        }
        if (maxPositionVarPct < 0.0) {
            throw new InvalidRiskConfigException("maxPositionVarPct", maxPositionVarPct, "must be >= 0");
        }
        if (lookbackDays < 0) {
            throw new InvalidRiskConfigException("lookbackDays", lookbackDays, "must be >= 0 (0 = unlimited)");
        }
        if (decayFactor <= 0.0 || decayFactor > 1.0) {
            throw new InvalidRiskConfigException("decayFactor", decayFactor, "must be in (0, 1]");
        }
    }
}
