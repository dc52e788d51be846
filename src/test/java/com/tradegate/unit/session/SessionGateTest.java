package com.tradegate.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradegate.calendar.TimeWindow;
import com.tradegate.calendar.TimeWindowEvaluator;
import com.tradegate.exception.ConfigurationException;
import com.tradegate.session.SessionConfig;
import com.tradegate.session.SessionGate;
import com.tradegate.session.SessionWindowConfig;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for SessionGate with XAUUSD traded in a London (08:00-16:00 Europe/London) and a
 * New York (08:00-17:00 America/New_York) session.
 */
class SessionGateTest {

    private SessionGate sessionGate;

    @BeforeEach
    void setUp() {
        SessionConfig config = SessionConfig.builder()
                .window("XAUUSD", TimeWindow.parse("London", "08:00", "16:00", "Europe/London"))
                .window("XAUUSD", TimeWindow.parse("NewYork", "08:00", "17:00", "America/New_York"))
                .build();
        sessionGate = new SessionGate(new TimeWindowEvaluator(), config);
    }

    @Nested
    @DisplayName("Dual sessions")
    class DualSessions {

        @Test
        @DisplayName("Overlap hour is tradable (13:00 London, 08:00 New York)")
        void overlapTradable() {
            assertThat(sessionGate.isTradable("XAUUSD", Instant.parse("2025-01-15T13:00:00Z")))
                    .isTrue();
        }

        @Test
        @DisplayName("After London closes, the New York window still admits")
        void newYorkOnly() {
            assertThat(sessionGate.isTradable("XAUUSD", Instant.parse("2025-01-15T17:00:00Z")))
                    .isTrue();
        }

        @Test
        @DisplayName("Before London opens nothing is open")
        void earlyMorning() {
            assertThat(sessionGate.isTradable("XAUUSD", Instant.parse("2025-01-15T07:00:00Z")))
                    .isFalse();
        }

        @Test
        @DisplayName("After New York closes nothing is open")
        void lateEvening() {
            assertThat(sessionGate.isTradable("XAUUSD", Instant.parse("2025-01-15T22:30:00Z")))
                    .isFalse();
        }

        @Test
        @DisplayName("Symbol lookup ignores case and surrounding spaces")
        void normalizedSymbol() {
            assertThat(sessionGate.isTradable(" xauusd ", Instant.parse("2025-01-15T07:00:00Z")))
                    .isFalse();
            assertThat(sessionGate.windowsFor("xauusd")).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Unconfigured symbols")
    class Unconfigured {

        @Test
        @DisplayName("Symbol without windows is tradable at any time")
        void noWindowsAlwaysTradable() {
            assertThat(sessionGate.isTradable("EURUSD", Instant.parse("2025-01-15T03:00:00Z")))
                    .isTrue();
            assertThat(sessionGate.windowsFor("EURUSD")).isEmpty();
        }

        @Test
        @DisplayName("Symbol configured with an empty list is tradable at any time")
        void emptyListAlwaysTradable() {
            sessionGate.replaceConfig(SessionConfig.builder().symbol("BTCUSD").build());

            assertThat(sessionGate.isTradable("BTCUSD", Instant.parse("2025-01-15T03:00:00Z")))
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("Reload")
    class Reload {

        @Test
        @DisplayName("Replaced configuration applies to the next check")
        void replaceConfig() {
            Instant earlyMorning = Instant.parse("2025-01-15T07:00:00Z");
            assertThat(sessionGate.isTradable("XAUUSD", earlyMorning)).isFalse();

            sessionGate.replaceConfig(SessionConfig.builder()
                    .window("XAUUSD", TimeWindow.parse("Asia", "00:00", "09:00", "UTC"))
                    .build());

            assertThat(sessionGate.isTradable("XAUUSD", earlyMorning)).isTrue();
            assertThat(sessionGate.windowsFor("XAUUSD")).extracting(TimeWindow::getName).containsExactly("Asia");
        }

        @Test
        @DisplayName("Properties reload builds windows from raw strings")
        void reloadFromProperties() {
            SessionWindowConfig properties = new SessionWindowConfig();
            properties.getSymbols()
                    .put("EURUSD", List.of(new SessionWindowConfig.Window("Frankfurt", "07:00", "15:00", "Europe/Berlin")));

            sessionGate.reload(properties);

            assertThat(sessionGate.getConfig().asMap()).containsOnlyKeys("EURUSD");
            assertThat(sessionGate.isTradable("EURUSD", Instant.parse("2025-01-15T05:00:00Z")))
                    .isFalse();
            assertThat(sessionGate.isTradable("EURUSD", Instant.parse("2025-01-15T06:00:00Z")))
                    .isTrue();
            assertThat(sessionGate.isTradable("XAUUSD", Instant.parse("2025-01-15T03:00:00Z")))
                    .isTrue();
        }

        @Test
        @DisplayName("Malformed properties fail before anything is replaced")
        void malformedPropertiesKeepOldConfig() {
            SessionWindowConfig properties = new SessionWindowConfig();
            properties.getSymbols()
                    .put("XAUUSD", List.of(new SessionWindowConfig.Window("Night", "22:00", "02:00", "UTC")));

            assertThatThrownBy(() -> sessionGate.reload(properties)).isInstanceOf(ConfigurationException.class);
            assertThat(sessionGate.windowsFor("XAUUSD")).hasSize(2);
        }
    }
}
