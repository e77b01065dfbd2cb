package com.riskgate.config;

import com.riskgate.risk.RiskContext;
import com.riskgate.risk.RiskContextConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskContextConfig} and the shared {@link RiskContext} bean from
 * {@link UnifiedRiskProperties}.
 *
 * <p>One RiskContext per application: it owns the daily P&L accumulator, so a second
 * instance would split the single source of truth.
 */
@Configuration
@EnableConfigurationProperties(UnifiedRiskProperties.class)
public class UnifiedRiskConfig {

    private static final Logger log = LoggerFactory.getLogger(UnifiedRiskConfig.class);

    @Bean
    public RiskContextConfig riskContextConfig(UnifiedRiskProperties properties) {
        RiskContextConfig config = properties.toRiskContextConfig();
        log.info("Unified risk config loaded: {}", config);
        return config;
    }

    @Bean
    public RiskContext riskContext(RiskContextConfig riskContextConfig, UnifiedRiskProperties properties) {
        return new RiskContext(riskContextConfig, properties.getInitialEquity());
    }
}
