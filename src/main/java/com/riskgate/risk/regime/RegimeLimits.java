package com.riskgate.risk.regime;

import com.riskgate.domain.enums.MarketRegime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Risk multipliers for one market regime, relative to 1.0 = unchanged.
 *
 * <p>Values below 1.0 tighten a limit (smaller size, fewer positions, tighter stop); values
 * above 1.0 loosen it.
 */
@Value
@Builder(toBuilder = true)
public class RegimeLimits {

    @Builder.Default
    MarketRegime regime = MarketRegime.SIDEWAYS;

    @Builder.Default
    double positionSizeMult = 1.0;

    @Builder.Default
    double maxPositionsMult = 1.0;

    @Builder.Default
    double sectorConcentrationMult = 1.0;

    @Builder.Default
    double correlationThresholdMult = 1.0;

    @Builder.Default
    double stopLossMult = 1.0;

    @Builder.Default
    String description = "";

    static RegimeLimits of(
            MarketRegime regime,
            double positionSize,
            double maxPositions,
            double sectorConcentration,
            double correlationThreshold,
            double stopLoss,
            String description) {
        return RegimeLimits.builder()
                .regime(regime)
                .positionSizeMult(positionSize)
                .maxPositionsMult(maxPositions)
                .sectorConcentrationMult(sectorConcentration)
                .correlationThresholdMult(correlationThreshold)
                .stopLossMult(stopLoss)
                .description(description)
                .build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("regime", regime.getRegimeName());
        map.put("position_size_mult", positionSizeMult);
        map.put("max_positions_mult", maxPositionsMult);
        map.put("sector_concentration_mult", sectorConcentrationMult);
        map.put("correlation_threshold_mult", correlationThresholdMult);
        map.put("stop_loss_mult", stopLossMult);
        map.put("description", description);
        return map;
    }
}
