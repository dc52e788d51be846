package com.tradegate.risk;

import com.tradegate.domain.enums.DenialReason;
import com.tradegate.domain.vo.OpenCommitment;
import lombok.Getter;

/**
 * Result of a ledger reservation.
 *
 * <ul>
 *   <li>RESERVED: the commitment now holds budget on the ledger</li>
 *   <li>DENIED: the fused gate check refused the trade; ledger untouched</li>
 *   <li>INSUFFICIENT_BUDGET: a direct reserve would have broken the concurrent or daily
 *       budget; ledger untouched</li>
 * </ul>
 */
@Getter
public class ReservationResult {

    public enum Status {
        RESERVED,
        DENIED,
        INSUFFICIENT_BUDGET
    }

    private final Status status;
    private final OpenCommitment commitment;
    private final DenialReason reason;
    private final String message;
    private final RiskLedgerView view;

    private ReservationResult(
            Status status, OpenCommitment commitment, DenialReason reason, String message, RiskLedgerView view) {
        this.status = status;
        this.commitment = commitment;
        this.reason = reason;
        this.message = message;
        this.view = view;
    }

    public static ReservationResult reserved(OpenCommitment commitment, RiskLedgerView viewBefore) {
        return new ReservationResult(Status.RESERVED, commitment, null, null, viewBefore);
    }

    public static ReservationResult denied(GateDecision decision, RiskLedgerView viewBefore) {
        return new ReservationResult(Status.DENIED, null, decision.getReason(), decision.getMessage(), viewBefore);
    }

    public static ReservationResult insufficientBudget(DenialReason reason, String message, RiskLedgerView viewBefore) {
        return new ReservationResult(Status.INSUFFICIENT_BUDGET, null, reason, message, viewBefore);
    }

    public boolean isReserved() {
        return status == Status.RESERVED;
    }
}
