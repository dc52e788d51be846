package com.tradegate.admission;

import com.tradegate.domain.enums.DenialReason;
import java.math.BigDecimal;
import lombok.Getter;

/**
 * Outcome of evaluating one signal: approved with the reserved risk and the commitment
 * holding it, or rejected with a machine-readable reason and a message fit for clients.
 */
@Getter
public class AdmissionDecision {

    private final boolean approved;
    private final BigDecimal effectiveRiskR;
    private final String commitmentId;

    /** Effective risk as percent of equity (effective R times the per-trade risk percent). */
    private final BigDecimal approvedRiskPct;

    /** Units to trade for the approved risk; null unless the signal gave balance and stop distance. */
    private final BigDecimal positionSize;

    private final DenialReason reason;
    private final String message;

    private AdmissionDecision(
            boolean approved,
            BigDecimal effectiveRiskR,
            String commitmentId,
            BigDecimal approvedRiskPct,
            BigDecimal positionSize,
            DenialReason reason,
            String message) {
        this.approved = approved;
        this.effectiveRiskR = effectiveRiskR;
        this.commitmentId = commitmentId;
        this.approvedRiskPct = approvedRiskPct;
        this.positionSize = positionSize;
        this.reason = reason;
        this.message = message;
    }

    public static AdmissionDecision approved(
            BigDecimal effectiveRiskR, String commitmentId, BigDecimal approvedRiskPct, BigDecimal positionSize) {
        return new AdmissionDecision(true, effectiveRiskR, commitmentId, approvedRiskPct, positionSize, null, null);
    }

    public static AdmissionDecision rejected(DenialReason reason, String message) {
        return new AdmissionDecision(false, null, null, null, null, reason, message);
    }

    public boolean isRejected() {
        return !approved;
    }

    /** Stable reason code, e.g. "OutsideSessionWindow"; null when approved. */
    public String getReasonCode() {
        return reason == null ? null : reason.getCode();
    }

    @Override
    public String toString() {
        return approved
                ? "Approved(" + effectiveRiskR.toPlainString() + "R, " + commitmentId + ")"
                : "Rejected(" + reason.getCode() + ": " + message + ")";
    }
}
