package com.tradegate.risk;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Rolls every ledger over at its account-day boundary.
 *
 * <p>Polls once a minute. {@code rolloverIfDue} is idempotent within an account-day; a
 * boundary missed while the process was down is caught up by the first poll or ledger access.
 * Rollover events are published by the ledger's {@link RiskLedgerListener} on either path.
 */
@Component
public class LedgerRolloverScheduler {

    private static final Logger log = LoggerFactory.getLogger(LedgerRolloverScheduler.class);

    private final RiskLedgerRegistry riskLedgerRegistry;
    private final Clock clock;

    public LedgerRolloverScheduler(RiskLedgerRegistry riskLedgerRegistry, Clock clock) {
        this.riskLedgerRegistry = riskLedgerRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedRate = 60_000)
    public void rollOverDueLedgers() {
        rollOverDueLedgers(clock.instant());
    }

    /**
     * Testable version: rolls over every ledger whose account-day has ended by {@code now}.
     *
     * @return number of ledgers rolled over
     */
    public int rollOverDueLedgers(Instant now) {
        int rolled = 0;
        for (RiskLedger ledger : riskLedgerRegistry.all()) {
            if (ledger.rolloverIfDue(now)) {
                rolled++;
            }
        }
        if (rolled > 0) {
            log.debug("Rollover poll at {} rolled {} ledgers", now, rolled);
        }
        return rolled;
    }
}
