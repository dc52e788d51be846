package com.tradegate.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A candidate trade produced by a strategy, awaiting admission.
 */
@Value
@Builder(toBuilder = true)
public class TradeSignal {

    /** Account whose budget the trade would use. Null = default account. */
    String accountId;

    String symbol;

    /** When the signal was raised (UTC); session windows are judged at this instant. */
    Instant timestamp;

    /** Risk the strategy wants to take, in R. Must be positive. */
    BigDecimal proposedRiskR;

    /** Current ATR percentile (0-100) if the strategy computed it. Optional. */
    Double atrPercentile;

    /** Account equity in account currency. With a stop distance, approvals carry a position size. */
    BigDecimal accountBalance;

    /** Distance from entry to stop loss in price units. */
    BigDecimal stopLossDistance;
}
