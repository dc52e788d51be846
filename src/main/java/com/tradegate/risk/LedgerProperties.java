package com.tradegate.risk;

import com.tradegate.exception.ConfigurationException;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for account risk ledgers ({@code tradegate.ledger.*}).
 *
 * <p>{@code drawdown-lookback-days} has no default: how far back losses count towards the
 * drawdown throttle is a policy decision and must be set explicitly.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradegate.ledger")
public class LedgerProperties {

    /** Timezone in which the account-day boundary is defined. */
    private String referenceTimezone = "UTC";

    /** Local time of the daily rollover in the reference timezone. */
    private String rolloverTime = "00:00";

    /** Number of account-days (today included) whose losses count towards drawdown. Required. */
    private Integer drawdownLookbackDays;

    /** Optional cap on the number of most recent closed trades counted. Null = no cap. */
    private Integer drawdownLookbackTrades;

    /** Account used when a signal or close event names none. */
    private String defaultAccountId = "primary";

    /**
     * Validates the properties and converts them into a {@link LedgerPolicy}.
     *
     * @throws ConfigurationException on an unknown zone, malformed time or missing horizon
     */
    public LedgerPolicy toPolicy() {
        ZoneId zone;
        try {
            zone = ZoneId.of(referenceTimezone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Unknown ledger reference timezone: " + referenceTimezone, e);
        }
        LocalTime boundary;
        try {
            boundary = LocalTime.parse(rolloverTime);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Malformed ledger rollover time: " + rolloverTime, e);
        }
        if (drawdownLookbackDays == null) {
            throw new ConfigurationException("tradegate.ledger.drawdown-lookback-days must be configured");
        }
        if (drawdownLookbackDays < 1) {
            throw new ConfigurationException(
                    "tradegate.ledger.drawdown-lookback-days must be at least 1 but was " + drawdownLookbackDays);
        }
        if (drawdownLookbackTrades != null && drawdownLookbackTrades < 1) {
            throw new ConfigurationException(
                    "tradegate.ledger.drawdown-lookback-trades must be at least 1 when set but was "
                            + drawdownLookbackTrades);
        }
        return LedgerPolicy.builder()
                .zone(zone)
                .rolloverTime(boundary)
                .lookbackDays(drawdownLookbackDays)
                .lookbackTrades(drawdownLookbackTrades)
                .build();
    }
}
