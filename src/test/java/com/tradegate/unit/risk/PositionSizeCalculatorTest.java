package com.tradegate.unit.risk;

import static com.tradegate.support.RiskFixtures.r;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradegate.risk.PositionSizeCalculator;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionSizeCalculatorTest {

    private final PositionSizeCalculator calculator = new PositionSizeCalculator();

    @Test
    @DisplayName("Size is risk amount over stop distance")
    void basicSize() {
        // 1% of 10,000 = 100 at risk, 5.00 stop -> 20 units
        assertThat(calculator.calculate(r("10000"), r("5.00"), r("1.0"))).isEqualByComparingTo("20");
    }

    @Test
    @DisplayName("Size is rounded down to two decimals")
    void roundsDown() {
        // 0.5% of 10,000 = 50 at risk, 3 stop -> 16.666...
        assertThat(calculator.calculate(r("10000"), r("3"), r("0.5"))).isEqualByComparingTo("16.66");
    }

    @Test
    @DisplayName("Non-positive stop distance gives zero")
    void zeroStop() {
        assertThat(calculator.calculate(r("10000"), BigDecimal.ZERO, r("1.0"))).isEqualByComparingTo("0");
        assertThat(calculator.calculate(r("10000"), null, r("1.0"))).isEqualByComparingTo("0");
    }
}
