package com.riskgate.risk.sizing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sizes positions from a Value-at-Risk budget.
 *
 * <p>Estimates historical VaR and CVaR (Expected Shortfall) from the empirical return
 * distribution and converts the remaining portfolio risk budget into a maximum position size
 * in account currency. The riskier a ticker, or the more of the portfolio budget already
 * consumed, the smaller the size.
 *
 * <p>Formula for {@link #sizePosition}: size = equity * availableBudget / riskMetric, capped
 * at the flat per-position budget (maxPositionVarPct% of equity), where availableBudget =
 * min(maxPortfolioVarPct - existingVarPct, maxPositionVarPct).
 *
 * <p><b>Thread safety:</b> the only mutable state is the cached equity figure, held in a
 * volatile field so writes from the owning {@code RiskContext} are visible to every
 * assessment thread. Callers that need equity consistent with other account state should use
 * the overloads that take equity explicitly.
 */
public class VaRPositionSizer {

    private static final Logger log = LoggerFactory.getLogger(VaRPositionSizer.class);

    private final VaRConfig config;

    private volatile double equity;

    public VaRPositionSizer(double equity) {
        this(VaRConfig.defaults(), equity);
    }

    public VaRPositionSizer(VaRConfig config, double equity) {
        config.validate();
        this.config = config;
        this.equity = Math.max(0.0, equity);
    }

    public VaRConfig getConfig() {
        return config;
    }

    public double getEquity() {
        return equity;
    }

    /**
     * Updates the cached equity. Negative values are clamped to 0.0.
     */
    public void setEquity(double equity) {
        this.equity = Math.max(0.0, equity);
    }

    // ========================
    // VAR ESTIMATION
    // ========================

    /**
     * Historical VaR/CVaR of a return series against the cached equity.
     */
    public VaRResult computeVar(List<Double> returns) {
        return computeVar(returns, equity);
    }

    /**
     * Historical VaR/CVaR of a return series.
     *
     * <p>Sorts returns ascending and takes index {@code floor(n * (1 - confidence))}, clamped to
     * {@code [0, n-1]}. VaR is the magnitude at that index; CVaR is the mean magnitude of all
     * returns at or below it, so CVaR >= VaR whenever the tail holds losses.
     *
     * @param returns daily returns as fractions, oldest first
     * @param equityBase equity used to convert the remaining budget into a position size
     * @return the estimate; zeroed (except data points) below {@link VaRConfig#MIN_OBSERVATIONS}
     */
    public VaRResult computeVar(List<Double> returns, double equityBase) {
        List<Double> window = applyLookback(returns != null ? returns : List.of());
        int n = window.size();
        if (n < VaRConfig.MIN_OBSERVATIONS) {
            return VaRResult.insufficient(n, config.getConfidenceLevel());
        }

        List<Double> sorted = new ArrayList<>(window);
        Collections.sort(sorted);

        int index = (int) Math.floor(n * (1.0 - config.getConfidenceLevel()));
        index = Math.max(0, Math.min(index, n - 1));

        double varPct = Math.abs(sorted.get(index)) * 100.0;

        double tailSum = 0.0;
        for (int i = 0; i <= index; i++) {
            tailSum += Math.abs(sorted.get(i));
        }
        double cvarPct = tailSum / (index + 1) * 100.0;

        double riskMetric = config.isUseCvar() ? cvarPct : varPct;
        double budgetRemaining = Math.max(0.0, config.getMaxPortfolioVarPct() - riskMetric);
        double maxPositionSize = budgetRemaining / 100.0 * Math.max(0.0, equityBase);

        log.debug("VaR over {} obs at {}: var={}%, cvar={}%, budget remaining={}%",
                n, config.getConfidenceLevel(), varPct, cvarPct, budgetRemaining);

        return VaRResult.builder()
                .varPct(varPct)
                .cvarPct(cvarPct)
                .maxPositionSize(maxPositionSize)
                .riskBudgetRemaining(budgetRemaining)
                .confidenceLevel(config.getConfidenceLevel())
                .dataPoints(n)
                .build();
    }

    // ========================
    // POSITION SIZING
    // ========================

    /**
     * Maximum position size with no portfolio risk already consumed.
     */
    public double sizePosition(List<Double> tickerReturns, double currentPrice) {
        return sizePosition(tickerReturns, currentPrice, 0.0);
    }

    public double sizePosition(List<Double> tickerReturns, double currentPrice, double existingVarPct) {
        return sizePosition(tickerReturns, currentPrice, existingVarPct, equity);
    }

    /**
     * Maximum position size in account currency for a ticker.
     *
     * <p>Returns 0.0 when the price or equity is not positive, or when the portfolio budget is
     * already exhausted by {@code existingVarPct}. A ticker without a usable risk estimate
     * (fewer than {@link VaRConfig#MIN_OBSERVATIONS} observations, or no losses in the tail)
     * gets the flat per-position budget.
     *
     * @param tickerReturns the ticker's daily returns, oldest first
     * @param currentPrice current price; only its sign matters
     * @param existingVarPct portfolio risk already consumed, % of equity
     * @param equityBase equity to size against
     */
    public double sizePosition(
            List<Double> tickerReturns, double currentPrice, double existingVarPct, double equityBase) {
        if (currentPrice <= 0.0 || equityBase <= 0.0) {
            return 0.0;
        }

        double availableBudget =
                Math.min(config.getMaxPortfolioVarPct() - existingVarPct, config.getMaxPositionVarPct());
        if (availableBudget <= 0.0) {
            log.debug("Portfolio VaR budget exhausted: existing {}% of {}%",
                    existingVarPct, config.getMaxPortfolioVarPct());
            return 0.0;
        }

        double flatBudget = config.getMaxPositionVarPct() / 100.0 * equityBase;
        VaRResult result = computeVar(tickerReturns, equityBase);
        double riskMetric = result.riskMetric(config.isUseCvar());
        if (riskMetric <= 0.0) {
            return flatBudget;
        }

        double size = equityBase * (availableBudget / riskMetric);
        return Math.min(size, flatBudget);
    }

    /**
     * VaR of a weighted portfolio against the cached equity.
     */
    public VaRResult computePortfolioVar(Map<String, List<Double>> positionsReturns, Map<String, Double> weights) {
        return computePortfolioVar(positionsReturns, weights, equity);
    }

    /**
     * VaR of a weighted portfolio, built as a synthetic weighted-sum return series over the
     * shortest common length (most recent observations). Cross-ticker correlation is not
     * modelled beyond what the summed series carries. Tickers without a weight count as 0;
     * null series are ignored.
     */
    public VaRResult computePortfolioVar(
            Map<String, List<Double>> positionsReturns, Map<String, Double> weights, double equityBase) {
        if (positionsReturns == null || positionsReturns.isEmpty()) {
            return computeVar(List.of(), equityBase);
        }

        int commonLength = Integer.MAX_VALUE;
        for (List<Double> series : positionsReturns.values()) {
            if (series != null) {
                commonLength = Math.min(commonLength, series.size());
            }
        }
        if (commonLength == Integer.MAX_VALUE) {
            return computeVar(List.of(), equityBase);
        }

        double[] portfolio = new double[commonLength];
        for (Map.Entry<String, List<Double>> entry : positionsReturns.entrySet()) {
            double weight = weights != null ? weights.getOrDefault(entry.getKey(), 0.0) : 0.0;
            List<Double> series = entry.getValue();
            if (series == null) {
                continue;
            }
            int offset = series.size() - commonLength;
            for (int i = 0; i < commonLength; i++) {
                portfolio[i] += weight * series.get(offset + i);
            }
        }

        List<Double> synthetic = new ArrayList<>(commonLength);
        for (double value : portfolio) {
            synthetic.add(value);
        }
        return computeVar(synthetic, equityBase);
    }

    private List<Double> applyLookback(List<Double> series) {
        int lookback = config.getLookbackDays();
        if (lookback <= 0 || series.size() <= lookback) {
            return series;
        }
        return series.subList(series.size() - lookback, series.size());
    }
}
