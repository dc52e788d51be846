package com.tradegate.filter;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the ATR regime filter ({@code tradegate.filters.volatility-regime}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradegate.filters.volatility-regime")
public class VolatilityRegimeConfig {

    private boolean enabled = false;
    private double minPercentile = 40.0;
    private double maxPercentile = 85.0;
}
