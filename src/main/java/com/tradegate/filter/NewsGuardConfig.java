package com.tradegate.filter;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the news guard, loaded via the
 * {@code tradegate.filters.news-guard} prefix.
 *
 * <p>Defaults block 15 minutes either side of a watched release. The guard is off
 * unless explicitly enabled.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradegate.filters.news-guard")
public class NewsGuardConfig {

    private boolean enabled = false;
    private int blockMinutesBefore = 15;
    private int blockMinutesAfter = 15;

    /** Name keywords of releases worth blocking, e.g. NFP, CPI, FOMC. */
    private List<String> events = new ArrayList<>();
}
