package com.tradegate.event;

import com.tradegate.admission.AdmissionDecision;
import com.tradegate.domain.model.TradeSignal;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every signal evaluated by the AdmissionController, approved or rejected.
 */
public class AdmissionEvent extends ApplicationEvent {

    private final TradeSignal signal;
    private final AdmissionDecision decision;

    public AdmissionEvent(Object source, TradeSignal signal, AdmissionDecision decision) {
        super(source);
        this.signal = signal;
        this.decision = decision;
    }

    public TradeSignal getSignal() {
        return signal;
    }

    public AdmissionDecision getDecision() {
        return decision;
    }
}
