package com.tradegate.unit.observability;

import static com.tradegate.support.RiskFixtures.r;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradegate.admission.AdmissionDecision;
import com.tradegate.domain.enums.DenialReason;
import com.tradegate.domain.model.TradeSignal;
import com.tradegate.event.AdmissionEvent;
import com.tradegate.event.RiskEvent;
import com.tradegate.event.RiskEventType;
import com.tradegate.event.RiskLevel;
import com.tradegate.observability.AdmissionMetricsService;
import com.tradegate.risk.RiskGate;
import com.tradegate.risk.RiskLedger;
import com.tradegate.risk.RiskLedgerRegistry;
import com.tradegate.risk.RiskLimitService;
import com.tradegate.support.MutableClock;
import com.tradegate.support.RiskFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AdmissionMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private RiskLedgerRegistry ledgerRegistry;
    private AdmissionMetricsService metricsService;

    private final TradeSignal signal = TradeSignal.builder()
            .symbol("XAUUSD")
            .timestamp(Instant.parse("2025-01-15T10:00:00Z"))
            .proposedRiskR(r("1.0"))
            .build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ledgerRegistry = new RiskLedgerRegistry(
                RiskFixtures.utcMidnightPolicy(),
                "primary",
                new RiskLimitService(RiskFixtures.defaultLimits()),
                MutableClock.at("2025-01-15T10:00:00Z"));
        metricsService = new AdmissionMetricsService(meterRegistry, ledgerRegistry);
    }

    @Nested
    @DisplayName("Admission counters")
    class AdmissionCounters {

        @Test
        @DisplayName("Approvals increment admission.approved")
        void approvals() {
            AdmissionDecision approved = AdmissionDecision.approved(r("1.0"), "c-1", r("1.0"), null);

            metricsService.onAdmission(new AdmissionEvent(this, signal, approved));
            metricsService.onAdmission(new AdmissionEvent(this, signal, approved));

            assertThat(meterRegistry.counter("admission.approved").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Rejections are counted per reason code")
        void rejectionsByReason() {
            metricsService.onAdmission(new AdmissionEvent(
                    this, signal, AdmissionDecision.rejected(DenialReason.OUTSIDE_SESSION_WINDOW, "closed")));
            metricsService.onAdmission(new AdmissionEvent(
                    this, signal, AdmissionDecision.rejected(DenialReason.DAILY_STOP_HIT, "stopped")));
            metricsService.onAdmission(new AdmissionEvent(
                    this, signal, AdmissionDecision.rejected(DenialReason.DAILY_STOP_HIT, "stopped")));

            assertThat(meterRegistry
                            .get("admission.rejected")
                            .tag("reason", "DailyStopHit")
                            .counter()
                            .count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry
                            .get("admission.rejected")
                            .tag("reason", "OutsideSessionWindow")
                            .counter()
                            .count())
                    .isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Risk events are counted by type and level")
    void riskEvents() {
        metricsService.onRiskEvent(
                new RiskEvent(this, RiskEventType.LEDGER_ROLLOVER, RiskLevel.INFO, "Rolled over"));

        assertThat(meterRegistry
                        .get("risk.events")
                        .tags("type", "LEDGER_ROLLOVER", "level", "INFO")
                        .counter()
                        .count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Ledger gauges read the default account on each scrape")
    void ledgerGauges() {
        RiskLedger ledger = ledgerRegistry.getOrCreate("primary");
        String id = ledger.evaluateAndReserve("XAUUSD", r("1.0"), new RiskGate())
                .getCommitment()
                .getId();
        ledger.evaluateAndReserve("XAUUSD", r("0.5"), new RiskGate());
        ledger.release(id, r("-1.0"), BigDecimal.ZERO);

        assertThat(meterRegistry.get("ledger.active.risk.r").gauge().value()).isEqualTo(0.5);
        assertThat(meterRegistry.get("ledger.daily.pnl.r").gauge().value()).isEqualTo(-1.0);
    }
}
