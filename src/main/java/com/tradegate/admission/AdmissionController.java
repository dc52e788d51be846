package com.tradegate.admission;

import com.tradegate.calendar.EconomicEvent;
import com.tradegate.calendar.TimeWindow;
import com.tradegate.domain.enums.DenialReason;
import com.tradegate.domain.model.TradeSignal;
import com.tradegate.domain.vo.OpenCommitment;
import com.tradegate.event.EventPublisherHelper;
import com.tradegate.event.RiskEventType;
import com.tradegate.event.RiskLevel;
import com.tradegate.exception.BusinessException;
import com.tradegate.exception.ErrorCode;
import com.tradegate.filter.NewsGuard;
import com.tradegate.filter.VolatilityRegimeFilter;
import com.tradegate.risk.PositionSizeCalculator;
import com.tradegate.risk.ReservationResult;
import com.tradegate.risk.RiskGate;
import com.tradegate.risk.RiskLedger;
import com.tradegate.risk.RiskLedgerRegistry;
import com.tradegate.session.SessionGate;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point deciding whether a candidate signal may trade now.
 *
 * <p>Checks (in order, first rejection wins):
 * <ol>
 *   <li>Session windows of the symbol ({@link SessionGate})</li>
 *   <li>News blackout around watched economic releases ({@link NewsGuard})</li>
 *   <li>ATR regime band, when the signal carries an ATR percentile ({@link VolatilityRegimeFilter})</li>
 *   <li>Risk gate and reservation on the account's ledger, fused under the ledger's write
 *       lock ({@link RiskLedger#evaluateAndReserve})</li>
 * </ol>
 *
 * <p>Gate denials come back as rejected decisions, never as exceptions. A reservation
 * that finds the budget gone is reported as ConcurrentRiskExceeded and is not retried;
 * retry policy belongs to the caller.
 *
 * <p>When the signal carries the account balance and stop distance, an approval also
 * carries the position size for the approved risk percent ({@link PositionSizeCalculator}).
 *
 * <p>This is the only admission path. Trade closes go to {@link TradeCloseHandler}.
 */
@Service
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final SessionGate sessionGate;
    private final NewsGuard newsGuard;
    private final VolatilityRegimeFilter volatilityRegimeFilter;
    private final RiskGate riskGate;
    private final RiskLedgerRegistry riskLedgerRegistry;
    private final PositionSizeCalculator positionSizeCalculator;
    private final EventPublisherHelper eventPublisherHelper;

    public AdmissionController(
            SessionGate sessionGate,
            NewsGuard newsGuard,
            VolatilityRegimeFilter volatilityRegimeFilter,
            RiskGate riskGate,
            RiskLedgerRegistry riskLedgerRegistry,
            PositionSizeCalculator positionSizeCalculator,
            EventPublisherHelper eventPublisherHelper) {
        this.sessionGate = sessionGate;
        this.newsGuard = newsGuard;
        this.volatilityRegimeFilter = volatilityRegimeFilter;
        this.riskGate = riskGate;
        this.riskLedgerRegistry = riskLedgerRegistry;
        this.positionSizeCalculator = positionSizeCalculator;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Evaluates a signal and, when approved, reserves its risk on the account's ledger.
     *
     * @throws BusinessException if the signal itself is malformed
     */
    public AdmissionDecision evaluate(TradeSignal signal) {
        validate(signal);
        AdmissionDecision decision = decide(signal);
        eventPublisherHelper.publishAdmission(this, signal, decision);
        return decision;
    }

    private AdmissionDecision decide(TradeSignal signal) {
        String symbol = signal.getSymbol();

        if (!sessionGate.isTradable(symbol, signal.getTimestamp())) {
            return reject(
                    signal,
                    DenialReason.OUTSIDE_SESSION_WINDOW,
                    symbol + " is outside its session windows at " + signal.getTimestamp() + " ("
                            + describe(sessionGate.windowsFor(symbol)) + ")");
        }

        Optional<EconomicEvent> blackout = newsGuard.findBlackout(symbol, signal.getTimestamp());
        if (blackout.isPresent()) {
            return reject(signal, DenialReason.NEWS_BLACKOUT, "News blackout: " + blackout.get());
        }

        Optional<String> regimeViolation = volatilityRegimeFilter.check(signal.getAtrPercentile());
        if (regimeViolation.isPresent()) {
            return reject(signal, DenialReason.VOLATILITY_REGIME_OUT_OF_RANGE, regimeViolation.get());
        }

        RiskLedger ledger = riskLedgerRegistry.getOrCreate(signal.getAccountId());
        ReservationResult result = ledger.evaluateAndReserve(symbol, signal.getProposedRiskR(), riskGate);

        return switch (result.getStatus()) {
            case RESERVED -> approve(signal, result);
            case DENIED -> {
                publishRiskRejection(ledger, signal, result);
                yield reject(signal, result.getReason(), result.getMessage());
            }
            case INSUFFICIENT_BUDGET -> {
                // Budget consumed between check and commit; reported as a concurrency denial
                publishRiskRejection(ledger, signal, result);
                yield reject(signal, DenialReason.CONCURRENT_RISK_EXCEEDED, result.getMessage());
            }
        };
    }

    private AdmissionDecision approve(TradeSignal signal, ReservationResult result) {
        OpenCommitment commitment = result.getCommitment();
        BigDecimal effectiveRiskR = commitment.getRiskR();
        BigDecimal approvedRiskPct = effectiveRiskR.multiply(result.getView().getMaxRiskPerTrade());
        BigDecimal positionSize = null;
        if (signal.getAccountBalance() != null && signal.getStopLossDistance() != null) {
            positionSize = positionSizeCalculator.calculate(
                    signal.getAccountBalance(), signal.getStopLossDistance(), approvedRiskPct);
        }

        if (effectiveRiskR.compareTo(signal.getProposedRiskR()) < 0) {
            log.warn(
                    "Risk reduced by drawdown throttle for {}: {}R -> {}R (drawdown {}R)",
                    signal.getSymbol(),
                    signal.getProposedRiskR().toPlainString(),
                    effectiveRiskR.toPlainString(),
                    result.getView().getDrawdownR().toPlainString());
        }
        log.info(
                "Admitted {} for account {}: {}R ({}%), commitment {}",
                signal.getSymbol(),
                result.getView().getAccountId(),
                effectiveRiskR.toPlainString(),
                approvedRiskPct.toPlainString(),
                commitment.getId());
        return AdmissionDecision.approved(effectiveRiskR, commitment.getId(), approvedRiskPct, positionSize);
    }

    private AdmissionDecision reject(TradeSignal signal, DenialReason reason, String message) {
        log.warn("Rejected {} ({}): {}", signal.getSymbol(), reason.getCode(), message);
        return AdmissionDecision.rejected(reason, message);
    }

    private void publishRiskRejection(RiskLedger ledger, TradeSignal signal, ReservationResult result) {
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.RISK_LIMIT_REJECTION,
                RiskLevel.WARNING,
                "Signal rejected: " + result.getMessage(),
                Map.of(
                        "accountId", ledger.getAccountId(),
                        "symbol", signal.getSymbol(),
                        "reason", result.getReason().getCode(),
                        "activeRiskR", result.getView().getActiveRiskR(),
                        "dailyPnlR", result.getView().getDailyPnlR()));
    }

    private static String describe(List<TimeWindow> windows) {
        return windows.stream().map(TimeWindow::toString).collect(Collectors.joining(", "));
    }

    private static void validate(TradeSignal signal) {
        if (signal == null) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Signal is required");
        }
        if (signal.getSymbol() == null || signal.getSymbol().isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Signal symbol is required");
        }
        if (signal.getTimestamp() == null) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Signal timestamp is required");
        }
        if (signal.getProposedRiskR() == null || signal.getProposedRiskR().signum() <= 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Proposed risk must be positive but was " + signal.getProposedRiskR(),
                    Map.of("symbol", signal.getSymbol()));
        }
        if (signal.getAccountBalance() != null && signal.getAccountBalance().signum() <= 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Account balance must be positive but was " + signal.getAccountBalance(),
                    Map.of("symbol", signal.getSymbol()));
        }
    }
}
