package com.tradegate.event;

import com.tradegate.admission.AdmissionDecision;
import com.tradegate.domain.model.TradeSignal;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed
 * factory methods for the engine's event types.
 *
 * <p>All methods are non-blocking from the engine's point of view; listeners are plain
 * synchronous {@code @EventListener}s that only update in-memory counters.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Admission ----

    public void publishAdmission(Object source, TradeSignal signal, AdmissionDecision decision) {
        applicationEventPublisher.publishEvent(new AdmissionEvent(source, signal, decision));
    }

    // ---- Risk ----

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, details));
    }
}
