package com.tradegate.risk;

import com.tradegate.event.EventPublisherHelper;
import com.tradegate.event.RiskEventType;
import com.tradegate.event.RiskLevel;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns ledger rollovers into risk events: LEDGER_ROLLOVER for every rollover, plus
 * DRAWDOWN_THROTTLE_RELEASED when losses leaving the horizon switch the throttle off.
 */
@Component
public class LedgerEventPublisher implements RiskLedgerListener {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventPublisher.class);

    private final EventPublisherHelper eventPublisherHelper;

    public LedgerEventPublisher(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void onRollover(LedgerRollover rollover) {
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.LEDGER_ROLLOVER,
                RiskLevel.INFO,
                "Risk ledger rolled over to " + rollover.getTradingDate(),
                Map.of(
                        "accountId", rollover.getAccountId(),
                        "tradingDate", rollover.getTradingDate(),
                        "closedDayPnlR", rollover.getClosedDayPnlR(),
                        "closedDayTradeCount", rollover.getClosedDayTradeCount()));

        if (rollover.isThrottleReleased()) {
            log.info(
                    "[{}] Drawdown throttle released at rollover: drawdown {}R -> {}R",
                    rollover.getAccountId(),
                    rollover.getDrawdownBeforeR().toPlainString(),
                    rollover.getDrawdownAfterR().toPlainString());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.DRAWDOWN_THROTTLE_RELEASED,
                    RiskLevel.INFO,
                    "Drawdown throttle released, full size restored",
                    Map.of(
                            "accountId", rollover.getAccountId(),
                            "drawdownR", rollover.getDrawdownAfterR(),
                            "thresholdR", rollover.getDrawdownThresholdR()));
        }
    }
}
