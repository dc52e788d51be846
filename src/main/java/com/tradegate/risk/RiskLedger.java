package com.tradegate.risk;

import com.tradegate.domain.enums.DenialReason;
import com.tradegate.domain.vo.OpenCommitment;
import com.tradegate.domain.vo.PnlEntry;
import com.tradegate.exception.BusinessException;
import com.tradegate.exception.ErrorCode;
import com.tradegate.exception.UnknownCommitmentException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Risk budget of one account: realized daily R and dollars, daily trade count, open
 * commitments and the trailing results used for the drawdown throttle.
 *
 * <p>Mutations:
 * <ul>
 *   <li>{@link #reserve} / {@link #evaluateAndReserve}: add an open commitment (admission)</li>
 *   <li>{@link #release}: remove a commitment and book its realized result (trade close)</li>
 *   <li>{@link #reduce}: shrink a commitment and book a partial result (partial close)</li>
 *   <li>{@link #cancel}: remove a commitment that never filled</li>
 *   <li>{@link #rollover}: reset the daily counters at the account-day boundary</li>
 * </ul>
 *
 * <p><b>Thread safety:</b> every mutation runs under the write lock of a
 * {@link ReentrantReadWriteLock}, so reserve, release and rollover are mutually
 * exclusive. {@link #snapshot()} takes the read lock and never observes a half-applied
 * mutation. Limits are read once per operation from the supplier.
 *
 * <p>A missed boundary (process down over the rollover) is caught up on the next
 * snapshot or mutation by comparing the stored trading date with the current one.
 * Every rollover is reported to the {@link RiskLedgerListener}.
 *
 * <p>Once a booked result takes the daily P&amp;L to the daily stop, the ledger stays
 * stopped until the next rollover, even if later closes bring the P&amp;L back above it.
 */
public class RiskLedger {

    private static final Logger log = LoggerFactory.getLogger(RiskLedger.class);

    private static final MathContext RATIO_PRECISION = MathContext.DECIMAL64;

    private final String accountId;
    private final LedgerPolicy policy;
    private final Supplier<RiskLimits> limitsSupplier;
    private final Clock clock;
    private final RiskLedgerListener listener;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private BigDecimal dailyRealizedPnlR = BigDecimal.ZERO;
    private BigDecimal dailyRealizedPnlDollars = BigDecimal.ZERO;
    private int dailyTradeCount;
    private boolean dailyStopHit;
    private final Map<String, OpenCommitment> openCommitments = new LinkedHashMap<>();
    private final Deque<PnlEntry> trailingPnl = new ArrayDeque<>();

    /** Volatile so the cheap "is a rollover due" check can run before taking the lock. */
    private volatile LocalDate tradingDate;

    public RiskLedger(String accountId, LedgerPolicy policy, Supplier<RiskLimits> limitsSupplier, Clock clock) {
        this(accountId, policy, limitsSupplier, clock, RiskLedgerListener.NONE);
    }

    public RiskLedger(
            String accountId,
            LedgerPolicy policy,
            Supplier<RiskLimits> limitsSupplier,
            Clock clock,
            RiskLedgerListener listener) {
        this.accountId = accountId;
        this.policy = policy;
        this.limitsSupplier = limitsSupplier;
        this.clock = clock;
        this.listener = listener;
        this.tradingDate = policy.tradingDate(clock.instant());
    }

    public String getAccountId() {
        return accountId;
    }

    public LocalDate getTradingDate() {
        return tradingDate;
    }

    // ========================
    // READS
    // ========================

    /**
     * Returns a consistent view of the ledger and every derived quantity.
     */
    public RiskLedgerView snapshot() {
        Instant now = clock.instant();
        rolloverIfDue(now);
        RiskLimits limits = limitsSupplier.get();
        lock.readLock().lock();
        try {
            return buildView(limits, now);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<OpenCommitment> findCommitment(String commitmentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(openCommitments.get(commitmentId));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================
    // RESERVATION
    // ========================

    /**
     * Adds a commitment if it fits both the concurrent and the daily budget.
     *
     * @return RESERVED, or INSUFFICIENT_BUDGET with the ledger unchanged
     */
    public ReservationResult reserve(OpenCommitment commitment) {
        Instant now = clock.instant();
        RiskLimits limits = limitsSupplier.get();
        lock.writeLock().lock();
        try {
            rolloverIfDueLocked(now);
            RiskLedgerView before = buildView(limits, now);
            return doReserve(commitment, before);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs the risk gate and, if it approves, reserves the effective risk, all inside one
     * hold of the write lock. No other reserve or release can slip in between the check
     * and the commit.
     */
    public ReservationResult evaluateAndReserve(String symbol, BigDecimal proposedRiskR, RiskGate riskGate) {
        Instant now = clock.instant();
        RiskLimits limits = limitsSupplier.get();
        lock.writeLock().lock();
        try {
            rolloverIfDueLocked(now);
            RiskLedgerView before = buildView(limits, now);
            GateDecision decision = riskGate.evaluate(symbol, proposedRiskR, before);
            if (decision.isDenied()) {
                return ReservationResult.denied(decision, before);
            }
            OpenCommitment commitment = OpenCommitment.builder()
                    .id(UUID.randomUUID().toString())
                    .symbol(symbol)
                    .riskR(decision.getEffectiveRiskR())
                    .openedAt(now)
                    .build();
            return doReserve(commitment, before);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ReservationResult doReserve(OpenCommitment commitment, RiskLedgerView before) {
        if (openCommitments.containsKey(commitment.getId())) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Commitment " + commitment.getId() + " is already open on account " + accountId);
        }
        BigDecimal riskR = commitment.getRiskR();

        BigDecimal concurrentAfter = before.getActiveRiskR().add(riskR);
        if (concurrentAfter.compareTo(before.getMaxConcurrentR()) > 0) {
            return ReservationResult.insufficientBudget(
                    DenialReason.CONCURRENT_RISK_EXCEEDED,
                    "Reserving " + riskR.toPlainString() + "R would hold " + concurrentAfter.toPlainString()
                            + "R open, limit " + before.getMaxConcurrentR().toPlainString() + "R",
                    before);
        }
        BigDecimal dailyAfter = before.getDailyRiskUsedR().add(riskR);
        if (dailyAfter.compareTo(before.getDailyRiskBudgetR()) > 0) {
            return ReservationResult.insufficientBudget(
                    DenialReason.DAILY_RISK_EXCEEDED,
                    "Reserving " + riskR.toPlainString() + "R would use " + dailyAfter.toPlainString()
                            + "R today, budget " + before.getDailyRiskBudgetR().toPlainString() + "R",
                    before);
        }

        openCommitments.put(commitment.getId(), commitment);
        dailyTradeCount++;
        log.debug(
                "[{}] Reserved {}R for {} (commitment {}), open risk now {}R",
                accountId,
                riskR.toPlainString(),
                commitment.getSymbol(),
                commitment.getId(),
                concurrentAfter.toPlainString());
        return ReservationResult.reserved(commitment, before);
    }

    // ========================
    // CLOSES
    // ========================

    /**
     * Removes a commitment and books its realized result.
     *
     * @return the released commitment
     * @throws UnknownCommitmentException if no such commitment is open
     */
    public OpenCommitment release(String commitmentId, BigDecimal realizedPnlR, BigDecimal realizedPnlDollars) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            rolloverIfDueLocked(now);
            OpenCommitment released = openCommitments.remove(commitmentId);
            if (released == null) {
                log.warn("[{}] Release of unknown commitment {}", accountId, commitmentId);
                throw new UnknownCommitmentException(accountId, commitmentId);
            }
            bookResult(now, realizedPnlR, realizedPnlDollars);
            log.info(
                    "[{}] Released {} ({}R): result {}R / {}, daily {}R",
                    accountId,
                    commitmentId,
                    released.getRiskR().toPlainString(),
                    realizedPnlR.toPlainString(),
                    realizedPnlDollars.toPlainString(),
                    dailyRealizedPnlR.toPlainString());
            return released;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Closes part of a trade: the commitment keeps {@code 1 - closedFraction} of its risk and
     * the partial result is booked. The trade count is unchanged.
     *
     * @return the reduced commitment
     * @throws UnknownCommitmentException if no such commitment is open
     */
    public OpenCommitment reduce(
            String commitmentId, BigDecimal closedFraction, BigDecimal realizedPnlR, BigDecimal realizedPnlDollars) {
        if (closedFraction.signum() <= 0 || closedFraction.compareTo(BigDecimal.ONE) >= 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "Partial close fraction must be between 0 and 1: " + closedFraction);
        }
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            rolloverIfDueLocked(now);
            OpenCommitment current = openCommitments.get(commitmentId);
            if (current == null) {
                log.warn("[{}] Partial close of unknown commitment {}", accountId, commitmentId);
                throw new UnknownCommitmentException(accountId, commitmentId);
            }
            BigDecimal remaining = current.getRiskR().multiply(BigDecimal.ONE.subtract(closedFraction));
            OpenCommitment reduced = current.withRiskR(remaining);
            openCommitments.put(commitmentId, reduced);
            bookResult(now, realizedPnlR, realizedPnlDollars);
            log.info(
                    "[{}] Reduced {} from {}R to {}R: partial result {}R",
                    accountId,
                    commitmentId,
                    current.getRiskR().toPlainString(),
                    remaining.toPlainString(),
                    realizedPnlR.toPlainString());
            return reduced;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops a commitment whose order never filled. Nothing is booked.
     *
     * @throws UnknownCommitmentException if no such commitment is open
     */
    public OpenCommitment cancel(String commitmentId) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            rolloverIfDueLocked(now);
            OpenCommitment cancelled = openCommitments.remove(commitmentId);
            if (cancelled == null) {
                log.warn("[{}] Cancel of unknown commitment {}", accountId, commitmentId);
                throw new UnknownCommitmentException(accountId, commitmentId);
            }
            log.info("[{}] Cancelled {} ({}R)", accountId, commitmentId, cancelled.getRiskR().toPlainString());
            return cancelled;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void bookResult(Instant now, BigDecimal pnlR, BigDecimal pnlDollars) {
        dailyRealizedPnlR = dailyRealizedPnlR.add(pnlR);
        dailyRealizedPnlDollars = dailyRealizedPnlDollars.add(pnlDollars);
        trailingPnl.addLast(new PnlEntry(now, pnlR));
        if (!dailyStopHit && dailyRealizedPnlR.compareTo(limitsSupplier.get().getDailyStopR()) <= 0) {
            dailyStopHit = true;
            log.info(
                    "[{}] Daily stop reached at {}R, closed until rollover",
                    accountId,
                    dailyRealizedPnlR.toPlainString());
        }
        Integer maxTrades = policy.getLookbackTrades();
        if (maxTrades != null) {
            while (trailingPnl.size() > maxTrades) {
                trailingPnl.removeFirst();
            }
        }
    }

    // ========================
    // ROLLOVER
    // ========================

    /**
     * Starts the account-day containing {@code boundaryInstant}: daily R, dollars and trade
     * count go to zero, open commitments stay, and results older than the drawdown horizon
     * are dropped.
     */
    public void rollover(Instant boundaryInstant) {
        lock.writeLock().lock();
        try {
            doRollover(policy.tradingDate(boundaryInstant));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rolls over if {@code now} lies in a later account-day than the ledger's.
     *
     * @return true if a rollover was performed
     */
    public boolean rolloverIfDue(Instant now) {
        if (!policy.tradingDate(now).isAfter(tradingDate)) {
            return false;
        }
        lock.writeLock().lock();
        try {
            return rolloverIfDueLocked(now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean rolloverIfDueLocked(Instant now) {
        LocalDate current = policy.tradingDate(now);
        if (!current.isAfter(tradingDate)) {
            return false;
        }
        log.info("[{}] Account-day boundary passed ({} -> {}), rolling over", accountId, tradingDate, current);
        doRollover(current);
        return true;
    }

    private void doRollover(LocalDate newTradingDate) {
        RiskLimits limits = limitsSupplier.get();
        LocalDate previousDate = tradingDate;
        BigDecimal closedPnlR = dailyRealizedPnlR;
        int closedTradeCount = dailyTradeCount;
        BigDecimal drawdownBeforeR = computeDrawdownR();

        dailyRealizedPnlR = BigDecimal.ZERO;
        dailyRealizedPnlDollars = BigDecimal.ZERO;
        dailyTradeCount = 0;
        dailyStopHit = false;
        if (newTradingDate.isAfter(tradingDate)) {
            tradingDate = newTradingDate;
        }

        Instant cutoff = policy.lookbackCutoff(tradingDate);
        Iterator<PnlEntry> it = trailingPnl.iterator();
        while (it.hasNext()) {
            if (it.next().getTimestamp().isBefore(cutoff)) {
                it.remove();
            }
        }

        log.info(
                "[{}] Rolled over to {}: previous day {}R over {} trades, {} commitments carried, {} results in window",
                accountId,
                tradingDate,
                closedPnlR.toPlainString(),
                closedTradeCount,
                openCommitments.size(),
                trailingPnl.size());

        BigDecimal drawdownAfterR = computeDrawdownR();
        listener.onRollover(LedgerRollover.builder()
                .accountId(accountId)
                .previousTradingDate(previousDate)
                .tradingDate(tradingDate)
                .closedDayPnlR(closedPnlR)
                .closedDayTradeCount(closedTradeCount)
                .drawdownBeforeR(drawdownBeforeR)
                .drawdownAfterR(drawdownAfterR)
                .drawdownThresholdR(limits.getDrawdownThresholdR())
                .throttleActiveBefore(isThrottled(drawdownBeforeR, limits))
                .throttleActiveAfter(isThrottled(drawdownAfterR, limits))
                .build());
    }

    // ========================
    // INTERNALS
    // ========================

    /** Must be called with the read or write lock held. */
    private RiskLedgerView buildView(RiskLimits limits, Instant now) {
        BigDecimal activeRiskR = BigDecimal.ZERO;
        for (OpenCommitment commitment : openCommitments.values()) {
            activeRiskR = activeRiskR.add(commitment.getRiskR());
        }

        BigDecimal realizedLossR = dailyRealizedPnlR.min(BigDecimal.ZERO).negate();
        BigDecimal dailyRiskUsedR = realizedLossR.add(activeRiskR);

        BigDecimal riskUtilization = limits.getMaxConcurrentR().signum() == 0
                ? BigDecimal.ZERO
                : activeRiskR.divide(limits.getMaxConcurrentR(), RATIO_PRECISION);

        BigDecimal drawdownR = computeDrawdownR();
        boolean riskReductionActive = isThrottled(drawdownR, limits);
        boolean canTrade = !dailyStopHit && dailyRealizedPnlR.compareTo(limits.getDailyStopR()) > 0;

        return RiskLedgerView.builder()
                .accountId(accountId)
                .tradingDate(tradingDate)
                .asOf(now)
                .dailyPnlR(dailyRealizedPnlR)
                .dailyPnlDollars(dailyRealizedPnlDollars)
                .tradeCount(dailyTradeCount)
                .activeTradesCount(openCommitments.size())
                .activeRiskR(activeRiskR)
                .dailyRiskUsedR(dailyRiskUsedR)
                .dailyRiskBudgetR(limits.getDailyRiskBudgetR())
                .maxRiskPerTrade(limits.getMaxRiskPerTradePct())
                .maxDailyRisk(limits.getMaxDailyRiskPct())
                .dailyStopR(limits.getDailyStopR())
                .maxConcurrentR(limits.getMaxConcurrentR())
                .drawdownThresholdR(limits.getDrawdownThresholdR())
                .maxTradeRiskR(limits.getMaxTradeRiskR())
                .drawdownR(drawdownR)
                .riskUtilization(riskUtilization)
                .riskReductionActive(riskReductionActive)
                .canTrade(canTrade)
                .openCommitments(List.copyOf(openCommitments.values()))
                .build();
    }

    private static boolean isThrottled(BigDecimal drawdownR, RiskLimits limits) {
        return drawdownR.compareTo(limits.getDrawdownThresholdR().negate()) <= 0;
    }

    /** Sum of losing results inside the lookback horizon (zero or negative). */
    private BigDecimal computeDrawdownR() {
        Instant cutoff = policy.lookbackCutoff(tradingDate);
        BigDecimal drawdownR = BigDecimal.ZERO;
        for (PnlEntry entry : trailingPnl) {
            if (!entry.getTimestamp().isBefore(cutoff) && entry.getPnlR().signum() < 0) {
                drawdownR = drawdownR.add(entry.getPnlR());
            }
        }
        return drawdownR;
    }
}
