package com.tradegate.observability;

import com.tradegate.admission.AdmissionDecision;
import com.tradegate.event.AdmissionEvent;
import com.tradegate.event.RiskEvent;
import com.tradegate.risk.RiskLedger;
import com.tradegate.risk.RiskLedgerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers and updates admission and ledger metrics.
 *
 * <ul>
 *   <li><b>admission.approved</b> (counter): approved signals</li>
 *   <li><b>admission.rejected</b> (counter, tag {@code reason}): rejections per reason code</li>
 *   <li><b>risk.events</b> (counter, tags {@code type}, {@code level}): published risk events</li>
 *   <li><b>ledger.active.risk.r</b> / <b>ledger.daily.pnl.r</b> (gauges): default account state</li>
 * </ul>
 *
 * <p>Counters are incremented from Spring event listeners. Gauges are lazily evaluated by
 * Micrometer on scrape from a ledger snapshot.
 */
@Service
public class AdmissionMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter approvedCounter;

    public AdmissionMetricsService(MeterRegistry meterRegistry, RiskLedgerRegistry riskLedgerRegistry) {
        this.meterRegistry = meterRegistry;
        this.approvedCounter = Counter.builder("admission.approved")
                .description("Signals admitted with reserved risk")
                .register(meterRegistry);

        RiskLedger defaultLedger = riskLedgerRegistry.getOrCreate(riskLedgerRegistry.getDefaultAccountId());
        meterRegistry.gauge("ledger.active.risk.r", defaultLedger, l -> l.snapshot()
                .getActiveRiskR()
                .doubleValue());
        meterRegistry.gauge("ledger.daily.pnl.r", defaultLedger, l -> l.snapshot()
                .getDailyPnlR()
                .doubleValue());
    }

    @EventListener
    public void onAdmission(AdmissionEvent event) {
        AdmissionDecision decision = event.getDecision();
        if (decision.isApproved()) {
            approvedCounter.increment();
        } else {
            Counter.builder("admission.rejected")
                    .description("Signals rejected, by reason code")
                    .tag("reason", decision.getReasonCode())
                    .register(meterRegistry)
                    .increment();
        }
    }

    @EventListener
    public void onRiskEvent(RiskEvent event) {
        Counter.builder("risk.events")
                .description("Risk events published by the engine")
                .tag("type", event.getEventType().name())
                .tag("level", event.getLevel().name())
                .register(meterRegistry)
                .increment();
    }
}
