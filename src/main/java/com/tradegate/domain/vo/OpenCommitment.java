package com.tradegate.domain.vo;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Risk budget held by one admitted trade until it is closed or cancelled.
 *
 * <p>Created on admission with the effective (possibly throttled) risk and owned by
 * the account's RiskLedger. A partial close replaces it with a smaller copy via
 * {@link #withRiskR(BigDecimal)}.
 */
@Value
@Builder(toBuilder = true)
public class OpenCommitment {

    String id;
    String symbol;
    BigDecimal riskR;
    Instant openedAt;

    public OpenCommitment withRiskR(BigDecimal newRiskR) {
        return toBuilder().riskR(newRiskR).build();
    }
}
