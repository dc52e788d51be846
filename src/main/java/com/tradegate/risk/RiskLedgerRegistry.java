package com.tradegate.risk;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Owns one {@link RiskLedger} per account.
 *
 * <p>Ledgers are created lazily on first use and live for the process lifetime; daily
 * state is reset by rollover, not by discarding the ledger. Accounts never share a
 * ledger, so their budgets are independent.
 */
@Service
public class RiskLedgerRegistry {

    private static final Logger log = LoggerFactory.getLogger(RiskLedgerRegistry.class);

    private final LedgerPolicy ledgerPolicy;
    private final RiskLimitService riskLimitService;
    private final Clock clock;
    private final String defaultAccountId;
    private final RiskLedgerListener listener;

    private final Map<String, RiskLedger> ledgers = new ConcurrentHashMap<>();

    @Autowired
    public RiskLedgerRegistry(
            LedgerProperties ledgerProperties,
            RiskLimitService riskLimitService,
            Clock clock,
            RiskLedgerListener listener) {
        this(ledgerProperties.toPolicy(), ledgerProperties.getDefaultAccountId(), riskLimitService, clock, listener);
    }

    public RiskLedgerRegistry(
            LedgerPolicy ledgerPolicy, String defaultAccountId, RiskLimitService riskLimitService, Clock clock) {
        this(ledgerPolicy, defaultAccountId, riskLimitService, clock, RiskLedgerListener.NONE);
    }

    public RiskLedgerRegistry(
            LedgerPolicy ledgerPolicy,
            String defaultAccountId,
            RiskLimitService riskLimitService,
            Clock clock,
            RiskLedgerListener listener) {
        this.ledgerPolicy = ledgerPolicy;
        this.defaultAccountId = defaultAccountId;
        this.riskLimitService = riskLimitService;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Returns the account's ledger, creating it on first use. A null or blank account id
     * resolves to the default account.
     */
    public RiskLedger getOrCreate(String accountId) {
        String resolved = resolve(accountId);
        return ledgers.computeIfAbsent(resolved, id -> {
            log.info("Creating risk ledger for account {} (reference zone {})", id, ledgerPolicy.getZone());
            return new RiskLedger(id, ledgerPolicy, riskLimitService::getLimits, clock, listener);
        });
    }

    public Optional<RiskLedger> find(String accountId) {
        return Optional.ofNullable(ledgers.get(resolve(accountId)));
    }

    public Collection<RiskLedger> all() {
        return Collections.unmodifiableCollection(ledgers.values());
    }

    public String getDefaultAccountId() {
        return defaultAccountId;
    }

    private String resolve(String accountId) {
        return accountId == null || accountId.isBlank() ? defaultAccountId : accountId;
    }
}
