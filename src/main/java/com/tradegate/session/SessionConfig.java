package com.tradegate.session;

import com.tradegate.calendar.TimeWindow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable mapping from symbol to its trading windows.
 *
 * <p>Built completely (and validated) before it is handed to {@link SessionGate}, which
 * publishes it with one reference swap. Symbol keys are trimmed and upper-cased.
 */
public final class SessionConfig {

    private static final SessionConfig EMPTY = new SessionConfig(Map.of());

    private final Map<String, List<TimeWindow>> windowsBySymbol;

    private SessionConfig(Map<String, List<TimeWindow>> windowsBySymbol) {
        this.windowsBySymbol = windowsBySymbol;
    }

    public static SessionConfig empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a config from bound properties.
     *
     * @throws com.tradegate.exception.ConfigurationException on any malformed window
     */
    public static SessionConfig from(SessionWindowConfig properties) {
        Builder builder = builder();
        properties.getSymbols().forEach((symbol, windows) -> {
            builder.symbol(symbol);
            if (windows != null) {
                for (SessionWindowConfig.Window w : windows) {
                    builder.window(symbol, TimeWindow.parse(w.getName(), w.getStart(), w.getEnd(), w.getTimezone()));
                }
            }
        });
        return builder.build();
    }

    /** Windows for the symbol; empty when the symbol has none configured. */
    public List<TimeWindow> windowsFor(String symbol) {
        return windowsBySymbol.getOrDefault(normalize(symbol), List.of());
    }

    public Map<String, List<TimeWindow>> asMap() {
        return windowsBySymbol;
    }

    static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static class Builder {

        private final Map<String, List<TimeWindow>> windows = new LinkedHashMap<>();

        /** Registers a symbol with no windows yet (always tradable unless windows are added). */
        public Builder symbol(String symbol) {
            windows.computeIfAbsent(normalize(symbol), k -> new ArrayList<>());
            return this;
        }

        public Builder window(String symbol, TimeWindow window) {
            windows.computeIfAbsent(normalize(symbol), k -> new ArrayList<>()).add(window);
            return this;
        }

        public SessionConfig build() {
            Map<String, List<TimeWindow>> copy = new LinkedHashMap<>();
            windows.forEach((symbol, list) -> copy.put(symbol, List.copyOf(list)));
            return new SessionConfig(Collections.unmodifiableMap(copy));
        }
    }
}
