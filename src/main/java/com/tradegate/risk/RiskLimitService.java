package com.tradegate.risk;

import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holds the account risk limits currently in force and swaps in replacements.
 *
 * <p>Limits are validated before publication, so an invalid reload throws and leaves
 * the previous limits active. Each ledger operation reads the reference once, which
 * means a reload takes effect between evaluations and never in the middle of one.
 */
@Service
public class RiskLimitService {

    private static final Logger log = LoggerFactory.getLogger(RiskLimitService.class);

    private final AtomicReference<RiskLimits> current;

    public RiskLimitService(RiskLimits riskLimits) {
        this.current = new AtomicReference<>(riskLimits.validate());
    }

    public RiskLimits getLimits() {
        return current.get();
    }

    /**
     * Validates and publishes new limits.
     *
     * @return the limits that were replaced
     * @throws com.tradegate.exception.ConfigurationException if the new limits are invalid
     */
    public RiskLimits replaceLimits(RiskLimits newLimits) {
        newLimits.validate();
        RiskLimits previous = current.getAndSet(newLimits);
        log.info("Risk limits replaced: {} -> {}", previous, newLimits);
        return previous;
    }
}
