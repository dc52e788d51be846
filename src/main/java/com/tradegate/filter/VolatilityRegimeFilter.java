package com.tradegate.filter;

import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Rejects signals raised while ATR sits outside its acceptable percentile band:
 * too quiet to reach targets, or too wild for the stop distance.
 *
 * <p>A signal without an ATR percentile is not filtered.
 */
@Component
public class VolatilityRegimeFilter {

    private final VolatilityRegimeConfig volatilityRegimeConfig;

    public VolatilityRegimeFilter(VolatilityRegimeConfig volatilityRegimeConfig) {
        this.volatilityRegimeConfig = volatilityRegimeConfig;
    }

    /**
     * Returns a human-readable violation when the percentile is out of band, empty otherwise.
     */
    public Optional<String> check(Double atrPercentile) {
        if (!volatilityRegimeConfig.isEnabled() || atrPercentile == null) {
            return Optional.empty();
        }
        if (atrPercentile < volatilityRegimeConfig.getMinPercentile()) {
            return Optional.of(String.format(
                    Locale.ROOT,
                    "ATR too low: %.1fth percentile (min: %.1f)",
                    atrPercentile,
                    volatilityRegimeConfig.getMinPercentile()));
        }
        if (atrPercentile > volatilityRegimeConfig.getMaxPercentile()) {
            return Optional.of(String.format(
                    Locale.ROOT,
                    "ATR too high: %.1fth percentile (max: %.1f)",
                    atrPercentile,
                    volatilityRegimeConfig.getMaxPercentile()));
        }
        return Optional.empty();
    }
}
