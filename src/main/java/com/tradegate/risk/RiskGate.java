package com.tradegate.risk;

import com.tradegate.domain.enums.DenialReason;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Judges a proposed trade risk against a ledger snapshot and the limits inside it.
 *
 * <p>Checks, in order (first failure wins):
 * <ol>
 *   <li>Daily stop: daily realized R at or below the stop denies everything</li>
 *   <li>Per-trade cap, when configured</li>
 *   <li>Concurrent risk: open R plus the new R must not exceed the concurrent limit</li>
 *   <li>Daily risk: R used today plus the new R must not exceed the daily budget</li>
 * </ol>
 *
 * <p>While the drawdown throttle is active the new risk is halved before the checks,
 * so a throttled trade is sized down rather than blocked. The throttle is read from the
 * same snapshot, which makes it switch off by itself once old losses leave the window.
 *
 * <p>Stateless. The AdmissionController calls {@link #evaluate(String, BigDecimal, RiskLedgerView)}
 * inside the ledger's write lock so that the check and the reservation are one step.
 */
@Component
public class RiskGate {

    static final BigDecimal THROTTLE_FACTOR = new BigDecimal("0.5");

    public GateDecision evaluate(String symbol, BigDecimal proposedRiskR, RiskLedgerView view) {
        if (!view.isCanTrade()) {
            return GateDecision.denied(
                    DenialReason.DAILY_STOP_HIT,
                    "Daily stop hit (daily " + view.getDailyPnlR().toPlainString() + "R, stop "
                            + view.getDailyStopR().toPlainString() + "R), closed until rollover");
        }

        BigDecimal effectiveRiskR = effectiveRisk(proposedRiskR, view);

        if (view.getMaxTradeRiskR() != null && effectiveRiskR.compareTo(view.getMaxTradeRiskR()) > 0) {
            return GateDecision.denied(
                    DenialReason.TRADE_RISK_EXCEEDED,
                    symbol + " risk " + effectiveRiskR.toPlainString() + "R exceeds per-trade cap "
                            + view.getMaxTradeRiskR().toPlainString() + "R");
        }

        BigDecimal concurrentAfter = view.getActiveRiskR().add(effectiveRiskR);
        if (concurrentAfter.compareTo(view.getMaxConcurrentR()) > 0) {
            return GateDecision.denied(
                    DenialReason.CONCURRENT_RISK_EXCEEDED,
                    "Concurrent risk would be " + concurrentAfter.toPlainString() + "R > "
                            + view.getMaxConcurrentR().toPlainString() + "R");
        }

        BigDecimal dailyAfter = view.getDailyRiskUsedR().add(effectiveRiskR);
        if (dailyAfter.compareTo(view.getDailyRiskBudgetR()) > 0) {
            return GateDecision.denied(
                    DenialReason.DAILY_RISK_EXCEEDED,
                    "Daily risk would be " + dailyAfter.toPlainString() + "R > budget "
                            + view.getDailyRiskBudgetR().toPlainString() + "R");
        }

        return GateDecision.approved(effectiveRiskR);
    }

    /** Proposed risk after the drawdown throttle. */
    public BigDecimal effectiveRisk(BigDecimal proposedRiskR, RiskLedgerView view) {
        return view.isRiskReductionActive() ? proposedRiskR.multiply(THROTTLE_FACTOR) : proposedRiskR;
    }
}
