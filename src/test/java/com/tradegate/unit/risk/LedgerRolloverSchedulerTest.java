package com.tradegate.unit.risk;

import static com.tradegate.support.RiskFixtures.r;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.tradegate.event.EventPublisherHelper;
import com.tradegate.event.RiskEventType;
import com.tradegate.event.RiskLevel;
import com.tradegate.risk.LedgerEventPublisher;
import com.tradegate.risk.LedgerRolloverScheduler;
import com.tradegate.risk.RiskGate;
import com.tradegate.risk.RiskLedger;
import com.tradegate.risk.RiskLedgerRegistry;
import com.tradegate.risk.RiskLimitService;
import com.tradegate.support.MutableClock;
import com.tradegate.support.RiskFixtures;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LedgerRolloverSchedulerTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MutableClock clock;
    private LedgerEventPublisher ledgerEventPublisher;
    private RiskLedgerRegistry registry;
    private LedgerRolloverScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-15T23:30:00Z");
        ledgerEventPublisher = new LedgerEventPublisher(eventPublisherHelper);
        registry = new RiskLedgerRegistry(
                RiskFixtures.utcMidnightPolicy(),
                "primary",
                new RiskLimitService(RiskFixtures.defaultLimits()),
                clock,
                ledgerEventPublisher);
        scheduler = new LedgerRolloverScheduler(registry, clock);
    }

    @Test
    @DisplayName("Poll before the boundary does nothing")
    void beforeBoundary() {
        registry.getOrCreate("primary");

        assertThat(scheduler.rollOverDueLedgers(Instant.parse("2025-01-15T23:59:59Z")))
                .isZero();
        verify(eventPublisherHelper, never()).publishRiskEvent(any(), any(), any(), anyString(), anyMap());
    }

    @Test
    @DisplayName("First poll after the boundary rolls every ledger once")
    void afterBoundary() {
        RiskLedger primary = registry.getOrCreate("primary");
        RiskLedger other = registry.getOrCreate("other");
        String id = primary.evaluateAndReserve("XAUUSD", r("1.0"), new RiskGate())
                .getCommitment()
                .getId();
        primary.release(id, r("-2.0"), BigDecimal.ZERO);

        clock.set(Instant.parse("2025-01-16T00:01:00Z"));
        int rolled = scheduler.rollOverDueLedgers(clock.instant());
        int rolledAgain = scheduler.rollOverDueLedgers(clock.instant());

        assertThat(rolled).isEqualTo(2);
        assertThat(rolledAgain).isZero();
        assertThat(primary.getTradingDate()).isEqualTo(LocalDate.of(2025, 1, 16));
        assertThat(other.getTradingDate()).isEqualTo(LocalDate.of(2025, 1, 16));
        assertThat(primary.snapshot().getDailyPnlR()).isEqualByComparingTo("0");
        verify(eventPublisherHelper, times(2))
                .publishRiskEvent(
                        eq(ledgerEventPublisher),
                        eq(RiskEventType.LEDGER_ROLLOVER),
                        eq(RiskLevel.INFO),
                        anyString(),
                        anyMap());
        verify(eventPublisherHelper, never())
                .publishRiskEvent(any(), eq(RiskEventType.DRAWDOWN_THROTTLE_RELEASED), any(), anyString(), anyMap());
    }

    @Test
    @DisplayName("Throttle engaged by losses is released once they leave the horizon")
    void throttleReleasedAtRollover() {
        RiskLedger primary = registry.getOrCreate("primary");
        // -2R on each of three days: 6R drawdown without touching the -3R daily stop
        for (int day = 0; day < 3; day++) {
            clock.set(Instant.parse("2025-01-16T10:00:00Z").plus(Duration.ofDays(day)));
            for (int trade = 0; trade < 2; trade++) {
                String id = primary.evaluateAndReserve("XAUUSD", r("1.0"), new RiskGate())
                        .getCommitment()
                        .getId();
                primary.release(id, r("-1.0"), BigDecimal.ZERO);
            }
        }
        assertThat(primary.snapshot().isRiskReductionActive()).isTrue();

        clock.set(Instant.parse("2025-01-24T00:00:30Z"));
        assertThat(scheduler.rollOverDueLedgers(clock.instant())).isEqualTo(1);

        assertThat(primary.snapshot().isRiskReductionActive()).isFalse();
        verify(eventPublisherHelper, times(1))
                .publishRiskEvent(
                        eq(ledgerEventPublisher),
                        eq(RiskEventType.DRAWDOWN_THROTTLE_RELEASED),
                        eq(RiskLevel.INFO),
                        anyString(),
                        anyMap());
    }

    @Test
    @DisplayName("Catch-up rollover on ledger access also releases the throttle")
    void throttleReleasedOnCatchUp() {
        RiskLedger primary = registry.getOrCreate("primary");
        for (int day = 0; day < 3; day++) {
            clock.set(Instant.parse("2025-01-16T10:00:00Z").plus(Duration.ofDays(day)));
            for (int trade = 0; trade < 2; trade++) {
                String id = primary.evaluateAndReserve("XAUUSD", r("1.0"), new RiskGate())
                        .getCommitment()
                        .getId();
                primary.release(id, r("-1.0"), BigDecimal.ZERO);
            }
        }

        clock.set(Instant.parse("2025-01-24T09:00:00Z"));
        assertThat(primary.snapshot().isRiskReductionActive()).isFalse();
        assertThat(scheduler.rollOverDueLedgers(clock.instant())).isZero();

        verify(eventPublisherHelper, times(1))
                .publishRiskEvent(any(), eq(RiskEventType.DRAWDOWN_THROTTLE_RELEASED), any(), anyString(), anyMap());
    }

    @Test
    @DisplayName("Scheduled entry point uses the injected clock")
    void scheduledEntryPoint() {
        registry.getOrCreate("primary");
        clock.set(Instant.parse("2025-01-16T00:00:00Z"));

        scheduler.rollOverDueLedgers();

        assertThat(registry.getOrCreate("primary").getTradingDate()).isEqualTo(LocalDate.of(2025, 1, 16));
    }
}
