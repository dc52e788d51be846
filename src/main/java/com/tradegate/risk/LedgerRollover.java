package com.tradegate.risk;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one account-day rollover, handed to {@link RiskLedgerListener}.
 */
@Value
@Builder
public class LedgerRollover {

    String accountId;
    LocalDate previousTradingDate;
    LocalDate tradingDate;
    BigDecimal closedDayPnlR;
    int closedDayTradeCount;

    /** Drawdown over the horizon before and after old results were dropped. */
    BigDecimal drawdownBeforeR;

    BigDecimal drawdownAfterR;
    BigDecimal drawdownThresholdR;
    boolean throttleActiveBefore;
    boolean throttleActiveAfter;

    public boolean isThrottleReleased() {
        return throttleActiveBefore && !throttleActiveAfter;
    }
}
