package com.tradegate.unit.filter;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradegate.calendar.EconomicCalendarService;
import com.tradegate.calendar.EconomicEvent;
import com.tradegate.calendar.EventImpact;
import com.tradegate.filter.NewsGuard;
import com.tradegate.filter.NewsGuardConfig;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for NewsGuard with a US payrolls release at 13:30 UTC and an ECB decision at 12:45 UTC,
 * blocking 15 minutes either side.
 */
class NewsGuardTest {

    private static final Instant NFP_TIME = Instant.parse("2025-02-07T13:30:00Z");
    private static final Instant ECB_TIME = Instant.parse("2025-01-30T12:45:00Z");

    private NewsGuardConfig config;
    private NewsGuard newsGuard;

    @BeforeEach
    void setUp() {
        config = new NewsGuardConfig();
        config.setEnabled(true);
        config.setEvents(List.of("NFP", "ECB"));
        EconomicCalendarService calendar = new EconomicCalendarService(config);
        calendar.loadEvents(List.of(
                EconomicEvent.builder()
                        .time(NFP_TIME)
                        .name("NFP Non-Farm Payrolls")
                        .currency("USD")
                        .impact(EventImpact.HIGH)
                        .build(),
                EconomicEvent.builder()
                        .time(ECB_TIME)
                        .name("ECB Rate Decision")
                        .currency("EUR")
                        .impact(EventImpact.HIGH)
                        .build()));
        newsGuard = new NewsGuard(config, calendar);
    }

    @Nested
    @DisplayName("Blackout window")
    class BlackoutWindow {

        @Test
        @DisplayName("Gold is blocked 15 minutes before a USD release")
        void goldBlockedBefore() {
            assertThat(newsGuard.findBlackout("XAUUSD", NFP_TIME.minusSeconds(15 * 60)))
                    .get()
                    .extracting(EconomicEvent::getName)
                    .isEqualTo("NFP Non-Farm Payrolls");
        }

        @Test
        @DisplayName("Window edges are inclusive")
        void edgesInclusive() {
            assertThat(newsGuard.findBlackout("XAUUSD", NFP_TIME.plusSeconds(15 * 60))).isPresent();
        }

        @Test
        @DisplayName("Outside the window nothing blocks")
        void outsideWindow() {
            assertThat(newsGuard.findBlackout("XAUUSD", NFP_TIME.minusSeconds(16 * 60))).isEmpty();
            assertThat(newsGuard.findBlackout("XAUUSD", NFP_TIME.plusSeconds(16 * 60))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Affected symbols")
    class AffectedSymbols {

        @Test
        @DisplayName("FX pair is blocked by its base currency")
        void baseCurrency() {
            assertThat(newsGuard.findBlackout("EURGBP", ECB_TIME)).isPresent();
        }

        @Test
        @DisplayName("FX pair is blocked by its quote currency")
        void quoteCurrency() {
            assertThat(newsGuard.findBlackout("GBPUSD", NFP_TIME)).isPresent();
        }

        @Test
        @DisplayName("Gold ignores non-USD releases")
        void goldIgnoresEur() {
            assertThat(newsGuard.findBlackout("XAUUSD", ECB_TIME)).isEmpty();
        }

        @Test
        @DisplayName("Unrelated pair is not blocked")
        void unrelatedPair() {
            assertThat(newsGuard.findBlackout("GBPJPY", NFP_TIME)).isEmpty();
        }

        @Test
        @DisplayName("Short symbols are never blocked")
        void shortSymbol() {
            assertThat(newsGuard.findBlackout("SPX", NFP_TIME)).isEmpty();
        }
    }

    @Test
    @DisplayName("Disabled guard never blocks")
    void disabled() {
        config.setEnabled(false);

        assertThat(newsGuard.findBlackout("XAUUSD", NFP_TIME)).isEmpty();
    }
}
