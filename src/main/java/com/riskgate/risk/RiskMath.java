package com.riskgate.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Small numeric helpers shared by the risk components.
 */
public final class RiskMath {

    private RiskMath() {}

    /**
     * Rounds half-up to {@code scale} decimal places for telemetry output. Non-finite values
     * are returned unchanged.
     */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
