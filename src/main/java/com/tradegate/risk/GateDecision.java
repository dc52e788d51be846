package com.tradegate.risk;

import com.tradegate.domain.enums.DenialReason;
import java.math.BigDecimal;
import lombok.Getter;

/**
 * Outcome of the risk gate: approved with an effective risk size, or denied with a reason.
 *
 * <p>Denials are ordinary results, not exceptions.
 */
@Getter
public class GateDecision {

    private final boolean approved;
    private final BigDecimal effectiveRiskR;
    private final DenialReason reason;
    private final String message;

    private GateDecision(boolean approved, BigDecimal effectiveRiskR, DenialReason reason, String message) {
        this.approved = approved;
        this.effectiveRiskR = effectiveRiskR;
        this.reason = reason;
        this.message = message;
    }

    public static GateDecision approved(BigDecimal effectiveRiskR) {
        return new GateDecision(true, effectiveRiskR, null, null);
    }

    public static GateDecision denied(DenialReason reason, String message) {
        return new GateDecision(false, null, reason, message);
    }

    public boolean isDenied() {
        return !approved;
    }

    @Override
    public String toString() {
        return approved ? "Approved(" + effectiveRiskR.toPlainString() + "R)" : "Denied(" + reason.getCode() + ")";
    }
}
