package com.riskgate.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * An open position as reported by the host pipeline's position store.
 *
 * <p>Only {@code symbol} and {@code marketValue} feed the risk checks. Market value may be
 * negative for short positions; exposure checks use its absolute value.
 */
@Value
@Builder
public class OpenPosition {

    /** Ticker symbol (e.g., "AAPL"). */
    String symbol;

    /** Current market value in account currency. */
    double marketValue;

    /** Signed share quantity. Informational. */
    double quantity;

    /** Sector label if known. Informational. */
    String sector;

    public static OpenPosition of(String symbol, double marketValue) {
        return OpenPosition.builder().symbol(symbol).marketValue(marketValue).build();
    }

    public double getAbsoluteExposure() {
        return Math.abs(marketValue);
    }
}
