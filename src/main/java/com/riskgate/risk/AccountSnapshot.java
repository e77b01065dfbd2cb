package com.riskgate.risk;

import lombok.Value;

/**
 * Consistent view of the account state owned by {@link RiskContext}: current equity, the
 * equity at the start of the trading day, and the running daily P&L.
 *
 * <p>Instances are immutable; {@code RiskContext} swaps whole snapshots atomically so an
 * assessment never sees equity from one update and P&L from another.
 */
@Value
public class AccountSnapshot {

    double equity;
    double startingEquity;
    double dailyPnl;

    public static AccountSnapshot startOfDay(double equity) {
        double clamped = Math.max(0.0, equity);
        return new AccountSnapshot(clamped, clamped, 0.0);
    }

    public AccountSnapshot withPnl(double delta) {
        return new AccountSnapshot(equity, startingEquity, dailyPnl + delta);
    }

    public AccountSnapshot withEquity(double newEquity) {
        return new AccountSnapshot(Math.max(0.0, newEquity), startingEquity, dailyPnl);
    }

    /**
     * Magnitude of the daily P&L as a percentage of starting equity. Starting equity below 1
     * is treated as 1 so the figure stays finite.
     */
    public double getDailyPnlPct() {
        return Math.abs(dailyPnl) / Math.max(startingEquity, 1.0) * 100.0;
    }
}
