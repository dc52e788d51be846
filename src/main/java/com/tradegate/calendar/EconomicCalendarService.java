package com.tradegate.calendar;

import com.tradegate.filter.NewsGuardConfig;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holds the economic calendar consulted by the news guard.
 *
 * <p>Only HIGH impact events whose name contains one of the watched keywords
 * ({@code tradegate.filters.news-guard.events}) are kept. A load builds the filtered
 * list first and then publishes it with a single reference swap, so a concurrent
 * reader sees either the old calendar or the new one.
 */
@Service
public class EconomicCalendarService {

    private static final Logger log = LoggerFactory.getLogger(EconomicCalendarService.class);

    private final NewsGuardConfig newsGuardConfig;
    private final AtomicReference<List<EconomicEvent>> events = new AtomicReference<>(List.of());

    public EconomicCalendarService(NewsGuardConfig newsGuardConfig) {
        this.newsGuardConfig = newsGuardConfig;
    }

    /**
     * Replaces the calendar with the watched high-impact subset of {@code candidates}.
     *
     * @return number of events retained
     */
    public int loadEvents(List<EconomicEvent> candidates) {
        List<String> watched = newsGuardConfig.getEvents();
        List<EconomicEvent> retained = candidates.stream()
                .filter(e -> e.getTime() != null && e.getImpact() == EventImpact.HIGH)
                .filter(e -> e.getName() != null && watched.stream().anyMatch(w -> e.getName().contains(w)))
                .toList();
        events.set(retained);
        log.info("Loaded {} high-impact economic events (of {} candidates)", retained.size(), candidates.size());
        return retained.size();
    }

    public List<EconomicEvent> getEvents() {
        return events.get();
    }
}
