package com.riskgate.domain.enums;

/**
 * Direction of a candidate trade. Accepted by the engine for telemetry; none of the
 * current checks depend on it.
 */
public enum TradeDirection {
    LONG,
    SHORT
}
