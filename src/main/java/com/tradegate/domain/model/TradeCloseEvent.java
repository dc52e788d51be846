package com.tradegate.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A full or partial close of an admitted trade, reported by the execution side.
 */
@Value
@Builder
public class TradeCloseEvent {

    String accountId;
    String commitmentId;
    BigDecimal realizedPnlR;
    BigDecimal realizedPnlDollars;
    Instant closedAt;

    /** Portion of the position closed, in (0, 1]. Null = full close. */
    BigDecimal closedFraction;

    public boolean isFullClose() {
        return closedFraction == null || closedFraction.compareTo(BigDecimal.ONE) >= 0;
    }
}
