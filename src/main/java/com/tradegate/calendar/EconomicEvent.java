package com.tradegate.calendar;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * A scheduled macroeconomic release (NFP, CPI, FOMC) that can block trading around its
 * release time.
 */
@Getter
@Builder
public class EconomicEvent {

    /** Release time (UTC). */
    private final Instant time;

    /** Release name, e.g. "NFP - Non-Farm Payrolls". */
    private final String name;

    /** ISO currency the release moves, e.g. "USD". */
    private final String currency;

    private final EventImpact impact;

    @Override
    public String toString() {
        return name + " (" + currency + ") at " + time;
    }
}
