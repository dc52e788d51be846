package com.tradegate.domain.enums;

/**
 * Machine-readable reason a signal was not admitted.
 *
 * <p>{@link #getCode()} is the stable identifier surfaced to clients; {@link #getDescription()}
 * is a short human-readable explanation. The first four are the core session and risk
 * outcomes; the rest come from the optional per-trade cap and market filters.
 */
public enum DenialReason {
    OUTSIDE_SESSION_WINDOW("OutsideSessionWindow", "Symbol is outside all of its trading session windows"),
    DAILY_STOP_HIT("DailyStopHit", "Daily realized loss has reached the daily stop"),
    CONCURRENT_RISK_EXCEEDED("ConcurrentRiskExceeded", "Open risk would exceed the concurrent risk limit"),
    DAILY_RISK_EXCEEDED("DailyRiskExceeded", "Risk used today would exceed the daily risk budget"),
    TRADE_RISK_EXCEEDED("TradeRiskExceeded", "Trade risk exceeds the per-trade cap"),
    NEWS_BLACKOUT("NewsBlackout", "High-impact economic release blackout"),
    VOLATILITY_REGIME_OUT_OF_RANGE("VolatilityRegimeOutOfRange", "ATR percentile is outside the allowed band");

    private final String code;
    private final String description;

    DenialReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
