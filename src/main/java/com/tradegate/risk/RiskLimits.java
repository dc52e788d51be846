package com.tradegate.risk;

import com.tradegate.exception.ConfigurationException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Account risk limits expressed in percent of equity and in R-multiples.
 *
 * <p>One R is the amount risked on a standard trade, i.e. {@code maxRiskPerTradePct}
 * percent of equity. The daily budget in R is therefore
 * {@code maxDailyRiskPct / maxRiskPerTradePct}: with 1% per trade and 5% per day the
 * account may have 5R at stake across the day.
 *
 * <p>Immutable. A reload builds a new instance and swaps it in through
 * {@link RiskLimitService}; an evaluation always reads one instance from start to end.
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {

    private static final MathContext BUDGET_PRECISION = MathContext.DECIMAL64;

    /** Percent of equity that one R represents (e.g. 1.0 = 1%). */
    BigDecimal maxRiskPerTradePct;

    /** Percent of equity the account may put at risk in one account-day. */
    BigDecimal maxDailyRiskPct;

    /** Daily realized R floor; trading stops once daily R is at or below it. Negative. */
    BigDecimal dailyStopR;

    /** Maximum R held by open trades at any moment. */
    BigDecimal maxConcurrentR;

    /** Trailing drawdown (in R, positive number) at which new risk is halved. */
    BigDecimal drawdownThresholdR;

    /** Optional cap on the R of a single admission. Null = check disabled. */
    BigDecimal maxTradeRiskR;

    /** Daily risk budget converted to R. */
    public BigDecimal getDailyRiskBudgetR() {
        return maxDailyRiskPct.divide(maxRiskPerTradePct, BUDGET_PRECISION);
    }

    /**
     * Checks the limits are complete and consistent.
     *
     * @return this, for chaining
     * @throws ConfigurationException naming every broken limit
     */
    public RiskLimits validate() {
        Map<String, Object> problems = new LinkedHashMap<>();
        requirePositive(problems, "maxRiskPerTradePct", maxRiskPerTradePct);
        requireNonNegative(problems, "maxDailyRiskPct", maxDailyRiskPct);
        requireNonNegative(problems, "maxConcurrentR", maxConcurrentR);
        requirePositive(problems, "drawdownThresholdR", drawdownThresholdR);
        if (dailyStopR == null) {
            problems.put("dailyStopR", "missing");
        } else if (dailyStopR.signum() >= 0) {
            problems.put("dailyStopR", "must be negative but was " + dailyStopR);
        }
        if (maxTradeRiskR != null && maxTradeRiskR.signum() <= 0) {
            problems.put("maxTradeRiskR", "must be positive when set but was " + maxTradeRiskR);
        }
        if (maxRiskPerTradePct != null
                && maxDailyRiskPct != null
                && maxRiskPerTradePct.signum() > 0
                && maxDailyRiskPct.compareTo(maxRiskPerTradePct) < 0) {
            problems.put(
                    "maxDailyRiskPct",
                    "daily risk " + maxDailyRiskPct + "% is below per-trade risk " + maxRiskPerTradePct + "%");
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid risk limits: " + problems, problems);
        }
        return this;
    }

    private static void requirePositive(Map<String, Object> problems, String name, BigDecimal value) {
        if (value == null) {
            problems.put(name, "missing");
        } else if (value.signum() <= 0) {
            problems.put(name, "must be positive but was " + value);
        }
    }

    private static void requireNonNegative(Map<String, Object> problems, String name, BigDecimal value) {
        if (value == null) {
            problems.put(name, "missing");
        } else if (value.signum() < 0) {
            problems.put(name, "must not be negative but was " + value);
        }
    }
}
