package com.tradegate.admission;

import com.tradegate.domain.model.TradeCloseEvent;
import com.tradegate.event.EventPublisherHelper;
import com.tradegate.event.RiskEventType;
import com.tradegate.event.RiskLevel;
import com.tradegate.exception.BusinessException;
import com.tradegate.exception.ErrorCode;
import com.tradegate.exception.UnknownCommitmentException;
import com.tradegate.risk.RiskLedger;
import com.tradegate.risk.RiskLedgerRegistry;
import com.tradegate.risk.RiskLedgerView;
import java.math.BigDecimal;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Feeds trade closes and cancellations back into the account's risk ledger.
 *
 * <p>Not gated: a close always releases budget. After each close the handler compares
 * the ledger before and after and publishes risk events when the daily stop is hit or
 * the drawdown throttle switches on or off. The before/after views are monitoring
 * reads; the ledger mutation itself is atomic.
 *
 * <p>A close for a commitment the ledger does not hold raises
 * {@link UnknownCommitmentException}.
 */
@Service
public class TradeCloseHandler {

    private static final Logger log = LoggerFactory.getLogger(TradeCloseHandler.class);

    private final RiskLedgerRegistry riskLedgerRegistry;
    private final EventPublisherHelper eventPublisherHelper;

    public TradeCloseHandler(RiskLedgerRegistry riskLedgerRegistry, EventPublisherHelper eventPublisherHelper) {
        this.riskLedgerRegistry = riskLedgerRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Books a full or partial close.
     *
     * @return the ledger view after the close
     */
    public RiskLedgerView onTradeClose(TradeCloseEvent event) {
        validate(event);
        RiskLedger ledger = ledgerFor(event.getAccountId(), event.getCommitmentId());
        BigDecimal pnlDollars = event.getRealizedPnlDollars() != null ? event.getRealizedPnlDollars() : BigDecimal.ZERO;

        RiskLedgerView before = ledger.snapshot();
        if (event.isFullClose()) {
            ledger.release(event.getCommitmentId(), event.getRealizedPnlR(), pnlDollars);
        } else {
            ledger.reduce(event.getCommitmentId(), event.getClosedFraction(), event.getRealizedPnlR(), pnlDollars);
        }
        RiskLedgerView after = ledger.snapshot();

        publishTransitions(before, after);
        return after;
    }

    /**
     * Drops a commitment whose order never filled.
     *
     * @return the ledger view after the cancellation
     */
    public RiskLedgerView onCancel(String accountId, String commitmentId) {
        if (commitmentId == null || commitmentId.isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Cancel needs a commitment id");
        }
        RiskLedger ledger = ledgerFor(accountId, commitmentId);
        ledger.cancel(commitmentId);
        return ledger.snapshot();
    }

    private RiskLedger ledgerFor(String accountId, String commitmentId) {
        return riskLedgerRegistry
                .find(accountId)
                .orElseThrow(() -> new UnknownCommitmentException(
                        accountId != null ? accountId : riskLedgerRegistry.getDefaultAccountId(), commitmentId));
    }

    private void publishTransitions(RiskLedgerView before, RiskLedgerView after) {
        if (before.isCanTrade() && !after.isCanTrade()) {
            log.error(
                    "[{}] Daily stop hit: {}R <= {}R, no new trades until rollover",
                    after.getAccountId(),
                    after.getDailyPnlR().toPlainString(),
                    after.getDailyStopR().toPlainString());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.DAILY_STOP_HIT,
                    RiskLevel.CRITICAL,
                    "Daily stop hit: " + after.getDailyPnlR().toPlainString() + "R",
                    Map.of(
                            "accountId", after.getAccountId(),
                            "dailyPnlR", after.getDailyPnlR(),
                            "dailyStopR", after.getDailyStopR()));
        }

        if (!before.isRiskReductionActive() && after.isRiskReductionActive()) {
            log.warn(
                    "[{}] Drawdown throttle engaged: drawdown {}R, threshold {}R",
                    after.getAccountId(),
                    after.getDrawdownR().toPlainString(),
                    after.getDrawdownThresholdR().toPlainString());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.DRAWDOWN_THROTTLE_ENGAGED,
                    RiskLevel.WARNING,
                    "Drawdown throttle engaged, new risk halved",
                    drawdownDetails(after));
        } else if (before.isRiskReductionActive() && !after.isRiskReductionActive()) {
            log.info("[{}] Drawdown throttle released", after.getAccountId());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.DRAWDOWN_THROTTLE_RELEASED,
                    RiskLevel.INFO,
                    "Drawdown throttle released, full size restored",
                    drawdownDetails(after));
        }
    }

    private static Map<String, Object> drawdownDetails(RiskLedgerView view) {
        return Map.of(
                "accountId", view.getAccountId(),
                "drawdownR", view.getDrawdownR(),
                "thresholdR", view.getDrawdownThresholdR());
    }

    private static void validate(TradeCloseEvent event) {
        if (event == null || event.getCommitmentId() == null) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Trade close needs a commitment id");
        }
        if (event.getRealizedPnlR() == null) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "Trade close for " + event.getCommitmentId() + " has no realized R");
        }
        if (event.getClosedFraction() != null && event.getClosedFraction().signum() <= 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "Closed fraction must be positive: " + event.getClosedFraction());
        }
    }
}
