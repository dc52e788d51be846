package com.tradegate.risk;

/**
 * Callback for ledger lifecycle changes that happen outside a trade close.
 *
 * <p>Invoked with the ledger's write lock held, from the scheduler poll as well as from
 * a catch-up rollover on ledger access. Implementations must not block.
 */
public interface RiskLedgerListener {

    RiskLedgerListener NONE = rollover -> {};

    void onRollover(LedgerRollover rollover);
}
