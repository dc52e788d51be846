package com.tradegate.event;

/**
 * Classifies the risk condition that triggered a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** Daily realized R fell to or below the daily stop. No new admissions until rollover. */
    DAILY_STOP_HIT,

    /** Trailing drawdown crossed the threshold; newly approved risk is halved. */
    DRAWDOWN_THROTTLE_ENGAGED,

    /** Trailing drawdown recovered above the threshold; approvals return to full size. */
    DRAWDOWN_THROTTLE_RELEASED,

    /** A signal was denied by the risk gate. */
    RISK_LIMIT_REJECTION,

    /** Daily counters were reset at the account-day boundary. */
    LEDGER_ROLLOVER
}
