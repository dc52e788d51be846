package com.tradegate.risk;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import lombok.Builder;
import lombok.Value;

/**
 * Validated account-day and drawdown-horizon rules shared by all ledgers.
 *
 * <p>An account-day runs from {@code rolloverTime} local in {@code zone} to the same
 * local time the next day, and is labelled with the calendar date on which it starts.
 */
@Value
@Builder(toBuilder = true)
public class LedgerPolicy {

    ZoneId zone;
    LocalTime rolloverTime;
    int lookbackDays;
    Integer lookbackTrades;

    /** Account-day that contains {@code instant}. */
    public LocalDate tradingDate(Instant instant) {
        return instant.atZone(zone)
                .toLocalDateTime()
                .minusNanos(rolloverTime.toNanoOfDay())
                .toLocalDate();
    }

    /** Instant at which the given account-day begins. */
    public Instant dayStart(LocalDate tradingDate) {
        return tradingDate.atTime(rolloverTime).atZone(zone).toInstant();
    }

    /** Earliest instant whose results still count towards drawdown on {@code tradingDate}. */
    public Instant lookbackCutoff(LocalDate tradingDate) {
        return dayStart(tradingDate.minusDays(lookbackDays - 1L));
    }
}
