package com.tradegate.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the risk ledger or the admission path detects a risk condition.
 *
 * <p>Risk events carry the type of condition, its severity, a human-readable message and
 * a details map for condition-specific data (account, current daily R, drawdown R,
 * configured threshold).
 *
 * <p>Key listeners:
 * <ul>
 *   <li>AdmissionMetricsService: counts risk conditions per type</li>
 *   <li>Notification and dashboard collaborators outside this engine</li>
 * </ul>
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
     *   <li>DAILY_STOP_HIT: {"accountId": "primary", "dailyPnlR": -3.2, "dailyStopR": -3.0}</li>
     *   <li>DRAWDOWN_THROTTLE_ENGAGED: {"drawdownR": -6.5, "thresholdR": 6.0}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
