package com.tradegate.config;

import com.tradegate.risk.RiskLimits;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the startup {@link RiskLimits} bean from application.yml.
 *
 * <p>Unlike session windows, every core limit is required: a missing or inconsistent
 * value fails startup through {@link RiskLimits#validate()}. Only the per-trade R cap is
 * optional (null = check skipped).
 *
 * <p>Properties prefix: {@code tradegate.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${tradegate.risk.max-risk-per-trade-pct:#{null}}") BigDecimal maxRiskPerTradePct,
            @Value("${tradegate.risk.max-daily-risk-pct:#{null}}") BigDecimal maxDailyRiskPct,
            @Value("${tradegate.risk.daily-stop-r:#{null}}") BigDecimal dailyStopR,
            @Value("${tradegate.risk.max-concurrent-r:#{null}}") BigDecimal maxConcurrentR,
            @Value("${tradegate.risk.drawdown-threshold-r:#{null}}") BigDecimal drawdownThresholdR,
            @Value("${tradegate.risk.max-trade-risk-r:#{null}}") BigDecimal maxTradeRiskR) {
        return RiskLimits.builder()
                .maxRiskPerTradePct(maxRiskPerTradePct)
                .maxDailyRiskPct(maxDailyRiskPct)
                .dailyStopR(dailyStopR)
                .maxConcurrentR(maxConcurrentR)
                .drawdownThresholdR(drawdownThresholdR)
                .maxTradeRiskR(maxTradeRiskR)
                .build()
                .validate();
    }
}
