package com.tradegate.domain.vo;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Value;

/**
 * One realized result in the trailing drawdown window.
 */
@Value
public class PnlEntry {

    Instant timestamp;
    BigDecimal pnlR;
}
