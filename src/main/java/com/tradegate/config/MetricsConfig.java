package com.tradegate.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer metrics configuration.
 *
 * <p>Registers common tags applied to all metrics so dashboards can tell this engine's
 * meters apart. The admission-specific meters live in
 * {@link com.tradegate.observability.AdmissionMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void configureCommonTags() {
        meterRegistry.config().commonTags("application", "tradegate");
    }
}
