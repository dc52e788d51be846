package com.tradegate.risk;

import com.tradegate.domain.vo.OpenCommitment;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Consistent point-in-time read of one account's risk state and the limits it was
 * judged against.
 *
 * <p>Everything derived (active risk, utilization, drawdown, throttle, can-trade) is
 * computed when the view is taken, under the ledger's lock, and never stored on the
 * ledger itself. This is the shape a monitoring layer renders as "current risk status".
 */
@Value
@Builder
public class RiskLedgerView {

    String accountId;
    LocalDate tradingDate;
    Instant asOf;

    BigDecimal dailyPnlR;
    BigDecimal dailyPnlDollars;
    int tradeCount;
    int activeTradesCount;
    BigDecimal activeRiskR;
    BigDecimal dailyRiskUsedR;
    BigDecimal dailyRiskBudgetR;

    BigDecimal maxRiskPerTrade;
    BigDecimal maxDailyRisk;
    BigDecimal dailyStopR;
    BigDecimal maxConcurrentR;
    BigDecimal drawdownThresholdR;
    BigDecimal maxTradeRiskR;

    BigDecimal drawdownR;
    BigDecimal riskUtilization;
    boolean riskReductionActive;
    boolean canTrade;

    List<OpenCommitment> openCommitments;
}
