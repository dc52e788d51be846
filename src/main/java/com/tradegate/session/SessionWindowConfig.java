package com.tradegate.session;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for per-symbol trading session windows, loaded via the
 * {@code tradegate.sessions} prefix.
 *
 * <pre>
 * tradegate:
 *   sessions:
 *     symbols:
 *       XAUUSD:
 *         - name: London
 *           start: "08:00"
 *           end: "16:00"
 *           timezone: Europe/London
 * </pre>
 *
 * <p>Values are kept as raw strings here and validated when {@link SessionConfig#from}
 * turns them into windows, so a malformed entry fails startup with a message naming it.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradegate.sessions")
public class SessionWindowConfig {

    private Map<String, List<Window>> symbols = new LinkedHashMap<>();

    /**
     * A single session window entry.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Window {

        private String name;
        private String start;
        private String end;
        private String timezone;
    }
}
