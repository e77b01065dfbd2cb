package com.riskgate.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the unified risk engine rejects a trade or flags a non-fatal risk condition.
 *
 * <p>Risk events carry the type of condition, its severity level, a human-readable message
 * (usually the rejection reason), and a details map with assessment data such as the
 * ticker, the regime in force and the daily P&L at the time of the decision.
 *
 * <p>Typical listeners are alerting bridges and dashboards owned by the host pipeline; the
 * engine itself never reacts to its own events.
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = new HashMap<>();
    }

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>DAILY_LOSS_LIMIT_BREACH: {"ticker": "AAPL", "dailyPnl": -11000.0}</li>
     *   <li>CONCENTRATION_HIGH: {"ticker": "MSFT", "concentrationScore": 82.4}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
