package com.riskgate.observability;

import com.riskgate.event.RiskEvent;
import com.riskgate.risk.RiskContext;
import com.riskgate.risk.UnifiedRiskAssessment;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates Micrometer metrics for the unified risk engine.
 *
 * <ul>
 *   <li><b>risk.assessments.approved</b> (counter): approved assessments</li>
 *   <li><b>risk.assessments.rejected</b> (counter, tag {@code check}): rejections per check,
 *       {@code engine_error} for fail-closed rejections</li>
 *   <li><b>risk.assessment.latency</b> (timer): wall time of one assessment</li>
 *   <li><b>risk.events</b> (counter, tags {@code type}, {@code level}): published risk events</li>
 *   <li><b>risk.daily.pnl</b> (gauge): the engine's running daily P&L</li>
 *   <li><b>risk.equity</b> (gauge): current account equity</li>
 * </ul>
 *
 * <p>Gauges are polled from {@link RiskContext} by Micrometer at scrape time.
 */
@Service
public class RiskMetricsService {

    private static final Logger log = LoggerFactory.getLogger(RiskMetricsService.class);

    public static final String ENGINE_ERROR_TAG = "engine_error";

    private final MeterRegistry meterRegistry;
    private final Counter approvedCounter;
    private final Timer assessmentTimer;

    public RiskMetricsService(MeterRegistry meterRegistry, RiskContext riskContext) {
        this.meterRegistry = meterRegistry;

        this.approvedCounter = Counter.builder("risk.assessments.approved")
                .description("Trades approved by the unified risk engine")
                .register(meterRegistry);

        this.assessmentTimer = Timer.builder("risk.assessment.latency")
                .description("Wall time of one unified risk assessment")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(1))
                .register(meterRegistry);

        meterRegistry.gauge("risk.daily.pnl", riskContext, RiskContext::getDailyPnl);
        meterRegistry.gauge("risk.equity", riskContext, RiskContext::getEquity);
    }

    /**
     * Counts one finished assessment and records its latency.
     */
    public void recordAssessment(UnifiedRiskAssessment assessment, long elapsedNanos) {
        assessmentTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        if (assessment.isApproved()) {
            approvedCounter.increment();
        } else {
            rejectedCounter(assessment.getRejectedBy() != null
                            ? assessment.getRejectedBy().getCheckName()
                            : ENGINE_ERROR_TAG)
                    .increment();
        }
    }

    /**
     * Counts risk events by type and level. Runs at @Order(20), after alerting listeners.
     */
    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        meterRegistry
                .counter("risk.events", "type", event.getEventType().name(), "level", event.getLevel().name())
                .increment();
        log.debug("Risk event counted: {} {}", event.getEventType(), event.getLevel());
    }

    private Counter rejectedCounter(String checkName) {
        return Counter.builder("risk.assessments.rejected")
                .description("Trades rejected by the unified risk engine")
                .tag("check", checkName)
                .register(meterRegistry);
    }
}
