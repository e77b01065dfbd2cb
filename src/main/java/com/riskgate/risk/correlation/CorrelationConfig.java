package com.riskgate.risk.correlation;

import com.riskgate.exception.InvalidRiskConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Thresholds for the {@link CorrelationGuard}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>maxPairwiseCorrelation: 0.80 (reject a new trade above this |corr| with any holding)</li>
 *   <li>maxClusterSize: 4 (a correlated cluster may not reach this many holdings)</li>
 *   <li>lookbackDays: 60 (only the most recent observations are used)</li>
 *   <li>minDataPoints: 20 (fewer common observations report correlation 0.0)</li>
 *   <li>clusterThreshold: 0.70 (|corr| at or above this groups two tickers)</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class CorrelationConfig {

    @Builder.Default
    double maxPairwiseCorrelation = 0.80;

    @Builder.Default
    int maxClusterSize = 4;

    @Builder.Default
    int lookbackDays = 60;

    @Builder.Default
    int minDataPoints = 20;

    @Builder.Default
    double clusterThreshold = 0.70;

    public static CorrelationConfig defaults() {
        return CorrelationConfig.builder().build();
    }

    /**
     * Checks the config invariants.
     *
     * @throws InvalidRiskConfigException if any invariant is violated
     */
    public void validate() {
        if (maxPairwiseCorrelation < 0.0 || maxPairwiseCorrelation > 1.0) {
            throw new InvalidRiskConfigException("maxPairwiseCorrelation", maxPairwiseCorrelation, "must be in [0, 1]");
        }
        if (clusterThreshold < 0.0 || clusterThreshold > maxPairwiseCorrelation) {
            throw new InvalidRiskConfigException(
                    "clusterThreshold", clusterThreshold, "must be in [0, maxPairwiseCorrelation]");
        }
        if (maxClusterSize < 2) {
            throw new InvalidRiskConfigException("maxClusterSize", maxClusterSize, "must be >= 2");
        }
        if (minDataPoints < 2) {
            throw new InvalidRiskConfigException("minDataPoints", minDataPoints, "must be >= 2");
        }
        if (lookbackDays < 0) {
            throw new InvalidRiskConfigException("lookbackDays", lookbackDays, "must be >= 0 (0 = unlimited)");
        }
    }
}
