package com.riskgate.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer configuration: common tags applied to every meter so risk metrics can be told
 * apart from the host pipeline's own. Metric definitions live in
 * {@link com.riskgate.observability.RiskMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "riskgate");
    }
}
