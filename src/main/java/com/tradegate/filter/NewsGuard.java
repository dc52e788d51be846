package com.tradegate.filter;

import com.tradegate.calendar.EconomicCalendarService;
import com.tradegate.calendar.EconomicEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Blocks admissions around high-impact economic releases that move the signal's symbol.
 *
 * <p>An event affects a symbol when:
 * <ul>
 *   <li>the symbol is gold (contains XAU or GOLD) and the event currency is USD</li>
 *   <li>the symbol is an FX pair (six or more letters) and the event currency is its
 *       base (first three letters) or quote (next three letters)</li>
 * </ul>
 * Any other symbol is never blocked. The blackout window is inclusive at both ends.
 */
@Component
public class NewsGuard {

    private final NewsGuardConfig newsGuardConfig;
    private final EconomicCalendarService economicCalendarService;

    public NewsGuard(NewsGuardConfig newsGuardConfig, EconomicCalendarService economicCalendarService) {
        this.newsGuardConfig = newsGuardConfig;
        this.economicCalendarService = economicCalendarService;
    }

    /**
     * Returns the event whose blackout covers {@code instant} for {@code symbol}, if any.
     */
    public Optional<EconomicEvent> findBlackout(String symbol, Instant instant) {
        if (!newsGuardConfig.isEnabled()) {
            return Optional.empty();
        }
        Duration before = Duration.ofMinutes(newsGuardConfig.getBlockMinutesBefore());
        Duration after = Duration.ofMinutes(newsGuardConfig.getBlockMinutesAfter());
        for (EconomicEvent event : economicCalendarService.getEvents()) {
            if (!affectsSymbol(symbol, event.getCurrency())) {
                continue;
            }
            Instant blackoutStart = event.getTime().minus(before);
            Instant blackoutEnd = event.getTime().plus(after);
            if (!instant.isBefore(blackoutStart) && !instant.isAfter(blackoutEnd)) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    boolean affectsSymbol(String symbol, String currency) {
        if (symbol == null || currency == null) {
            return false;
        }
        String upper = symbol.toUpperCase(Locale.ROOT);
        if (upper.contains("XAU") || upper.contains("GOLD")) {
            return "USD".equals(currency);
        }
        if (upper.length() >= 6) {
            return currency.equals(upper.substring(0, 3)) || currency.equals(upper.substring(3, 6));
        }
        return false;
    }
}
