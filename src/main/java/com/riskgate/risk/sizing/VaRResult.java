package com.riskgate.risk.sizing;

import com.riskgate.risk.RiskMath;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Historical VaR/CVaR estimate for one return series and the position size it allows.
 *
 * <p>Percentages are loss magnitudes (positive numbers). A result built from fewer than
 * {@link VaRConfig#MIN_OBSERVATIONS} observations is all zeros apart from
 * {@code dataPoints} and {@code confidenceLevel}.
 */
@Value
@Builder
public class VaRResult {

    double varPct;
    double cvarPct;

    /** Remaining risk budget converted to account currency. */
    double maxPositionSize;

    /** max(0, portfolio budget - risk metric), % of equity. */
    double riskBudgetRemaining;

    double confidenceLevel;
    int dataPoints;

    static VaRResult insufficient(int dataPoints, double confidenceLevel) {
        return VaRResult.builder()
                .dataPoints(dataPoints)
                .confidenceLevel(confidenceLevel)
                .build();
    }

    /**
     * Returns CVaR when {@code useCvar}, otherwise VaR.
     */
    public double riskMetric(boolean useCvar) {
        return useCvar ? cvarPct : varPct;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("var_pct", RiskMath.round(varPct, 4));
        map.put("cvar_pct", RiskMath.round(cvarPct, 4));
        map.put("max_position_size", RiskMath.round(maxPositionSize, 2));
        map.put("risk_budget_remaining", RiskMath.round(riskBudgetRemaining, 4));
        map.put("confidence_level", confidenceLevel);
        map.put("data_points", dataPoints);
        return map;
    }
}
