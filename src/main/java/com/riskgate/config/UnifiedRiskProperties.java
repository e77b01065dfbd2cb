package com.riskgate.config;

import com.riskgate.domain.enums.MarketRegime;
import com.riskgate.risk.RiskContextConfig;
import com.riskgate.risk.correlation.CorrelationConfig;
import com.riskgate.risk.sizing.VaRConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the unified risk engine, bound from application.properties
 * under the {@code riskgate.unified-risk} prefix.
 *
 * <p>Defaults match {@link RiskContextConfig#defaults()}. Invariants are checked when the
 * properties are turned into a {@link RiskContextConfig}, so a bad value fails application
 * startup instead of the first assessment.
 */
@Data
@ConfigurationProperties(prefix = "riskgate.unified-risk")
public class UnifiedRiskProperties {

    /** Account equity the engine starts with before the host pushes live values. */
    private double initialEquity = 100_000.0;

    private double maxDailyLossPct = 10.0;
    private int maxConcurrentPositions = 10;
    private double maxSingleStockPct = 15.0;
    private double maxSectorPct = 30.0;

    /** Regime used when a request carries no (or an unknown) regime name. */
    private String defaultRegime = "sideways";

    private boolean enableCorrelationGuard = true;
    private boolean enableVarSizing = true;

    /** Cron for the start-of-day reset of daily P&L. "-" disables the scheduled reset. */
    private String dailyResetCron = "0 0 9 * * MON-FRI";

    private String dailyResetZone = "America/New_York";

    private Correlation correlation = new Correlation();
    private ValueAtRisk valueAtRisk = new ValueAtRisk();

    @Data
    public static class Correlation {
        private double maxPairwiseCorrelation = 0.80;
        private int maxClusterSize = 4;
        private int lookbackDays = 60;
        private int minDataPoints = 20;
        private double clusterThreshold = 0.70;
    }

    @Data
    public static class ValueAtRisk {
        private double confidenceLevel = 0.95;
        private double maxPortfolioVarPct = 2.0;
        private double maxPositionVarPct = 0.5;
        private int lookbackDays = 252;
        private boolean useCvar = true;
        private double decayFactor = 0.97;
    }

    /**
     * Builds the immutable engine config from these properties and validates it.
     */
    public RiskContextConfig toRiskContextConfig() {
        RiskContextConfig config = RiskContextConfig.builder()
                .maxDailyLossPct(maxDailyLossPct)
                .maxConcurrentPositions(maxConcurrentPositions)
                .maxSingleStockPct(maxSingleStockPct)
                .maxSectorPct(maxSectorPct)
                .defaultRegime(MarketRegime.fromName(defaultRegime, MarketRegime.SIDEWAYS))
                .enableCorrelationGuard(enableCorrelationGuard)
                .enableVarSizing(enableVarSizing)
                .correlationConfig(CorrelationConfig.builder()
                        .maxPairwiseCorrelation(correlation.getMaxPairwiseCorrelation())
                        .maxClusterSize(correlation.getMaxClusterSize())
                        .lookbackDays(correlation.getLookbackDays())
                        .minDataPoints(correlation.getMinDataPoints())
                        .clusterThreshold(correlation.getClusterThreshold())
                        .build())
                .varConfig(VaRConfig.builder()
                        .confidenceLevel(valueAtRisk.getConfidenceLevel())
                        .maxPortfolioVarPct(valueAtRisk.getMaxPortfolioVarPct())
                        .maxPositionVarPct(valueAtRisk.getMaxPositionVarPct())
                        .lookbackDays(valueAtRisk.getLookbackDays())
                        .useCvar(valueAtRisk.isUseCvar())
                        .decayFactor(valueAtRisk.getDecayFactor())
                        .build())
                .build();
        config.validate();
        return config;
    }
}
