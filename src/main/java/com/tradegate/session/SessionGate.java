package com.tradegate.session;

import com.tradegate.calendar.TimeWindow;
import com.tradegate.calendar.TimeWindowEvaluator;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Answers "is this symbol tradable at this instant?" from per-symbol session windows.
 *
 * <p>A symbol with no windows is always tradable; session filtering is switched off for
 * it rather than treated as an error. Otherwise the symbol is tradable when at least one
 * window contains the instant, so a London and a New York window together cover the
 * whole stretch from London open to New York close, overlap included.
 *
 * <p><b>Thread safety:</b> the current {@link SessionConfig} lives in an
 * {@link AtomicReference}. Readers take one reference and evaluate against it; a
 * replacement swaps the whole config, so no reader sees a half-updated window list.
 */
@Service
public class SessionGate {

    private static final Logger log = LoggerFactory.getLogger(SessionGate.class);

    private final TimeWindowEvaluator timeWindowEvaluator;
    private final AtomicReference<SessionConfig> config;

    @Autowired
    public SessionGate(TimeWindowEvaluator timeWindowEvaluator, SessionWindowConfig sessionWindowConfig) {
        this(timeWindowEvaluator, SessionConfig.from(sessionWindowConfig));
    }

    public SessionGate(TimeWindowEvaluator timeWindowEvaluator, SessionConfig initialConfig) {
        this.timeWindowEvaluator = timeWindowEvaluator;
        this.config = new AtomicReference<>(initialConfig);
        log.info("Session gate initialized with windows for {} symbols", initialConfig.asMap().size());
    }

    public boolean isTradable(String symbol, Instant instant) {
        List<TimeWindow> windows = config.get().windowsFor(symbol);
        if (windows.isEmpty()) {
            return true;
        }
        for (TimeWindow window : windows) {
            if (timeWindowEvaluator.contains(instant, window)) {
                log.debug("{} tradable at {} via window {}", symbol, instant, window);
                return true;
            }
        }
        return false;
    }

    public List<TimeWindow> windowsFor(String symbol) {
        return config.get().windowsFor(symbol);
    }

    public SessionConfig getConfig() {
        return config.get();
    }

    /**
     * Publishes a fully built replacement config.
     */
    public void replaceConfig(SessionConfig newConfig) {
        SessionConfig previous = config.getAndSet(newConfig);
        log.info(
                "Session windows replaced: {} -> {} symbols configured",
                previous.asMap().size(),
                newConfig.asMap().size());
    }

    /**
     * Validates and publishes windows from raw properties. A malformed entry throws and
     * leaves the current config in place.
     */
    public void reload(SessionWindowConfig properties) {
        replaceConfig(SessionConfig.from(properties));
    }
}
