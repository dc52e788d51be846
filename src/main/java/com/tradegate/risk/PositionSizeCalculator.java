package com.tradegate.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts an approved risk percentage into a position size.
 *
 * <p>Formula: size = (accountBalance * riskPct / 100) / stopLossDistance. For example,
 * a 10,000 balance at 1% risk with a 5.0 stop distance gives a size of 20 units
 * (risking 100). Rounded down so the realized risk never exceeds the approved risk.
 *
 * <p>Returns zero when the stop distance is not positive.
 */
@Component
public class PositionSizeCalculator {

    private static final Logger log = LoggerFactory.getLogger(PositionSizeCalculator.class);

    private static final int SIZE_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public BigDecimal calculate(BigDecimal accountBalance, BigDecimal stopLossDistance, BigDecimal riskPct) {
        if (stopLossDistance == null || stopLossDistance.signum() <= 0) {
            log.warn("Stop loss distance {} is not positive, position size is zero", stopLossDistance);
            return BigDecimal.ZERO;
        }
        BigDecimal riskAmount = accountBalance.multiply(riskPct).divide(HUNDRED);
        BigDecimal size = riskAmount.divide(stopLossDistance, SIZE_SCALE, RoundingMode.DOWN);
        log.debug("Position size {} (risk {}% of {}, stop distance {})", size, riskPct, accountBalance, stopLossDistance);
        return size;
    }
}
