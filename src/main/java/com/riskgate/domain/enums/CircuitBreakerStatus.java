package com.riskgate.domain.enums;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Circuit-breaker state as computed by the host pipeline. The engine only consumes it:
 * OPEN rejects every trade, HALF_OPEN halves the approved size.
 */
@Getter
@RequiredArgsConstructor
public enum CircuitBreakerStatus {
    CLOSED("closed"),
    OPEN("open"),
    HALF_OPEN("half_open");

    private final String value;

    /**
     * Parses the wire value ("closed", "open", "half_open"). A null value means no breaker is
     * wired in and reads as CLOSED; an unrecognised value reads as OPEN so the gate fails closed.
     */
    public static CircuitBreakerStatus fromValue(String value) {
        if (value == null) {
            return CLOSED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CircuitBreakerStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return OPEN;
    }
}
