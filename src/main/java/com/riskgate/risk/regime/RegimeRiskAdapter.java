package com.riskgate.risk.regime;

import com.riskgate.domain.enums.MarketRegime;
import com.riskgate.exception.InvalidRiskConfigException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scales risk limits by market regime.
 *
 * <p>Holds one {@link RegimeLimits} profile per {@link MarketRegime}. Built-in profiles
 * (position size / max positions / sector / correlation threshold / stop loss):
 * <ul>
 *   <li><b>bull:</b> 1.2 / 1.2 / 1.1 / 1.0 / 1.2</li>
 *   <li><b>bear:</b> 0.5 / 0.6 / 0.8 / 0.85 / 0.8</li>
 *   <li><b>sideways:</b> 0.8 / 0.9 / 1.0 / 1.0 / 0.9</li>
 *   <li><b>crisis:</b> 0.2 / 0.3 / 0.5 / 0.7 / 0.5</li>
 * </ul>
 * Any of these may be replaced at construction.
 *
 * <p>Regime names that do not resolve fall back to the configured default regime, never to
 * an error.
 *
 * <p><b>Thread safety:</b> profiles are immutable after construction. The optional sticky
 * {@code currentRegime} sits in an {@link AtomicReference}; callers on the hot path should
 * pass the regime explicitly instead of relying on it.
 */
public class RegimeRiskAdapter {

    private static final Logger log = LoggerFactory.getLogger(RegimeRiskAdapter.class);

    /** Built-in regime profiles. */
    public static final Map<MarketRegime, RegimeLimits> REGIME_PROFILES = builtInProfiles();

    private final MarketRegime defaultRegime;
    private final Map<MarketRegime, RegimeLimits> profiles;
    private final AtomicReference<MarketRegime> currentRegime;

    public RegimeRiskAdapter() {
        this(MarketRegime.SIDEWAYS);
    }

    public RegimeRiskAdapter(MarketRegime defaultRegime) {
        this(defaultRegime, Map.of());
    }

    /**
     * @param defaultRegime regime used for null or unknown names
     * @param customProfiles profiles replacing the built-in ones for their regimes
     */
    public RegimeRiskAdapter(MarketRegime defaultRegime, Map<MarketRegime, RegimeLimits> customProfiles) {
        this.defaultRegime = defaultRegime != null ? defaultRegime : MarketRegime.SIDEWAYS;
        EnumMap<MarketRegime, RegimeLimits> merged = new EnumMap<>(REGIME_PROFILES);
        for (Map.Entry<MarketRegime, RegimeLimits> entry : customProfiles.entrySet()) {
            validateProfile(entry.getKey(), entry.getValue());
            merged.put(entry.getKey(), entry.getValue());
            log.info("Custom regime profile registered for {}: {}", entry.getKey(), entry.getValue());
        }
        this.profiles = Collections.unmodifiableMap(merged);
        this.currentRegime = new AtomicReference<>(this.defaultRegime);
    }

    // ========================
    // REGIME RESOLUTION
    // ========================

    public MarketRegime getDefaultRegime() {
        return defaultRegime;
    }

    /**
     * Resolves a regime name; null, blank and unknown names give the default regime.
     */
    public MarketRegime resolve(String regimeName) {
        return MarketRegime.fromName(regimeName, defaultRegime);
    }

    public MarketRegime getCurrentRegime() {
        return currentRegime.get();
    }

    /**
     * Sets the sticky regime used by the overloads that take no regime argument.
     */
    public void setCurrentRegime(MarketRegime regime) {
        MarketRegime next = regime != null ? regime : defaultRegime;
        MarketRegime previous = currentRegime.getAndSet(next);
        if (previous != next) {
            log.info("Regime changed: {} -> {}", previous, next);
        }
    }

    public void setCurrentRegime(String regimeName) {
        setCurrentRegime(resolve(regimeName));
    }

    // ========================
    // LIMITS
    // ========================

    public RegimeLimits getLimits() {
        return getLimits(currentRegime.get());
    }

    public RegimeLimits getLimits(String regimeName) {
        return getLimits(resolve(regimeName));
    }

    public RegimeLimits getLimits(MarketRegime regime) {
        return profiles.get(regime != null ? regime : defaultRegime);
    }

    /**
     * All profiles as plain maps, keyed by lower-case regime name.
     */
    public Map<String, Map<String, Object>> getAllProfiles() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (Map.Entry<MarketRegime, RegimeLimits> entry : profiles.entrySet()) {
            result.put(entry.getKey().getRegimeName(), entry.getValue().toMap());
        }
        return result;
    }

    // ========================
    // ADJUSTMENTS
    // ========================

    public double adjustPositionSize(double baseSize) {
        return adjustPositionSize(baseSize, currentRegime.get());
    }

    public double adjustPositionSize(double baseSize, MarketRegime regime) {
        return baseSize * getLimits(regime).getPositionSizeMult();
    }

    public int adjustMaxPositions(int baseMax) {
        return adjustMaxPositions(baseMax, currentRegime.get());
    }

    /**
     * Regime-adjusted position count, never below 1.
     */
    public int adjustMaxPositions(int baseMax, MarketRegime regime) {
        // Epsilon keeps products like 10 * 0.6 from flooring to 5
        int adjusted = (int) Math.floor(baseMax * getLimits(regime).getMaxPositionsMult() + 1e-9);
        return Math.max(1, adjusted);
    }

    public double adjustStopDistance(double baseDistance) {
        return adjustStopDistance(baseDistance, currentRegime.get());
    }

    public double adjustStopDistance(double baseDistance, MarketRegime regime) {
        return baseDistance * getLimits(regime).getStopLossMult();
    }

    public double adjustSectorLimit(double baseSectorPct, MarketRegime regime) {
        return baseSectorPct * getLimits(regime).getSectorConcentrationMult();
    }

    /**
     * Regime-adjusted correlation threshold, capped at 1.0.
     */
    public double adjustCorrelationThreshold(double baseThreshold, MarketRegime regime) {
        return Math.min(1.0, baseThreshold * getLimits(regime).getCorrelationThresholdMult());
    }

    // ========================
    // INTERNALS
    // ========================

    private static void validateProfile(MarketRegime key, RegimeLimits limits) {
        if (key == null || limits == null) {
            throw new InvalidRiskConfigException("Regime profile key and limits must be non-null");
        }
        if (limits.getRegime() != key) {
            throw new InvalidRiskConfigException(
                    "regime", limits.getRegime(), "profile registered under " + key + " must carry the same regime");
        }
        if (limits.getPositionSizeMult() < 0.0
                || limits.getMaxPositionsMult() < 0.0
                || limits.getSectorConcentrationMult() < 0.0
                || limits.getCorrelationThresholdMult() < 0.0
                || limits.getStopLossMult() < 0.0) {
            throw new InvalidRiskConfigException("multipliers", limits, "must all be >= 0");
        }
    }

    private static Map<MarketRegime, RegimeLimits> builtInProfiles() {
        EnumMap<MarketRegime, RegimeLimits> map = new EnumMap<>(MarketRegime.class);
        map.put(
                MarketRegime.BULL,
                RegimeLimits.of(
                        MarketRegime.BULL, 1.2, 1.2, 1.1, 1.0, 1.2,
                        "Uptrend: larger sizes, more positions, wider stops"));
        map.put(
                MarketRegime.BEAR,
                RegimeLimits.of(
                        MarketRegime.BEAR, 0.5, 0.6, 0.8, 0.85, 0.8,
                        "Downtrend: half size, fewer positions, tighter stops"));
        map.put(
                MarketRegime.SIDEWAYS,
                RegimeLimits.of(
                        MarketRegime.SIDEWAYS, 0.8, 0.9, 1.0, 1.0, 0.9,
                        "Range-bound: modestly reduced size and position count"));
        map.put(
                MarketRegime.CRISIS,
                RegimeLimits.of(
                        MarketRegime.CRISIS, 0.2, 0.3, 0.5, 0.7, 0.5,
                        "Market stress: minimal exposure and the tightest limits"));
        return Collections.unmodifiableMap(map);
    }
}
