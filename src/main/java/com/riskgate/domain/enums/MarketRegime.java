package com.riskgate.domain.enums;

import java.util.Locale;

/**
 * Qualitative market-condition label used to scale risk limits.
 *
 * <p>Regime names arrive as free text from upstream detectors; {@link #fromName} resolves
 * them case-insensitively and falls back to a caller-chosen default for anything unknown.
 */
public enum MarketRegime {
    BULL,
    BEAR,
    SIDEWAYS,
    CRISIS;

    /** Lower-case name used in telemetry maps ("bull", "crisis", ...). */
    public String getRegimeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a regime name, returning {@code fallback} when the name is null, blank or unknown.
     */
    public static MarketRegime fromName(String name, MarketRegime fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (MarketRegime regime : values()) {
            if (regime.name().equals(normalized)) {
                return regime;
            }
        }
        return fallback;
    }

    /**
     * Returns true if {@code name} resolves to one of the known regimes.
     */
    public static boolean isKnown(String name) {
        return fromName(name, null) != null;
    }
}
