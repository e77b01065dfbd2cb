package com.riskgate.risk;

import com.riskgate.domain.enums.CircuitBreakerStatus;
import com.riskgate.domain.enums.RiskCheck;
import com.riskgate.domain.model.AssessmentRequest;
import com.riskgate.event.RiskEvent;
import com.riskgate.event.RiskEventType;
import com.riskgate.event.RiskLevel;
import com.riskgate.observability.RiskMetricsService;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Entry point for the host trading pipeline: wraps the shared {@link RiskContext} with
 * fail-closed error handling, risk events and metrics.
 *
 * <p>Every assessment returns an answer. If the engine throws, the trade is rejected with
 * reason {@code "Risk engine error: ..."} and an ENGINE_FAILURE event is published; a failing
 * risk engine must never let a trade through.
 *
 * <p>Events published:
 * <ul>
 *   <li>one RiskEvent per rejection, CRITICAL for kill switch and daily loss, WARNING otherwise</li>
 *   <li>an INFO CONCENTRATION_HIGH event for approved trades whose holdings plus candidate
 *       score above {@link RiskContext#HIGH_CONCENTRATION_THRESHOLD}</li>
 * </ul>
 *
 * <p>Daily counters are reset on the {@code riskgate.unified-risk.daily-reset-cron} schedule.
 */
@Service
public class RiskAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessmentService.class);

    public static final String ENGINE_ERROR_PREFIX = "Risk engine error: ";

    private final RiskContext riskContext;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final RiskMetricsService riskMetricsService;

    public RiskAssessmentService(
            RiskContext riskContext,
            ApplicationEventPublisher applicationEventPublisher,
            RiskMetricsService riskMetricsService) {
        this.riskContext = riskContext;
        this.applicationEventPublisher = applicationEventPublisher;
        this.riskMetricsService = riskMetricsService;
    }

    // ========================
    // ASSESSMENT
    // ========================

    /**
     * Assesses a candidate trade. Never throws: engine failures become rejections.
     */
    public UnifiedRiskAssessment assess(AssessmentRequest request) {
        long start = System.nanoTime();
        UnifiedRiskAssessment assessment;
        try {
            assessment = riskContext.assess(request);
        } catch (RuntimeException e) {
            log.error("Risk assessment failed for {}, rejecting trade", tickerOf(request), e);
            assessment = failClosed(request, e);
        }
        riskMetricsService.recordAssessment(assessment, System.nanoTime() - start);
        publishEvents(request, assessment);
        return assessment;
    }

    // ========================
    // ACCOUNT STATE
    // ========================

    /**
     * Records realized P&L from a fill or a closed position.
     */
    public void recordPnl(double pnl) {
        riskContext.recordPnl(pnl);
    }

    public void updateEquity(double equity) {
        riskContext.setEquity(equity);
    }

    public AccountSnapshot getAccountSnapshot() {
        return riskContext.snapshot();
    }

    public void resetDaily() {
        riskContext.resetDaily();
    }

    /**
     * Start-of-day reset. Cron and zone come from configuration; a cron of "-" disables it.
     */
    @Scheduled(
            cron = "${riskgate.unified-risk.daily-reset-cron:0 0 9 * * MON-FRI}",
            zone = "${riskgate.unified-risk.daily-reset-zone:America/New_York}")
    public void scheduledDailyReset() {
        log.info("Scheduled daily reset, closing day P&L {}", riskContext.getDailyPnl());
        riskContext.resetDaily();
    }

    // ========================
    // INTERNALS
    // ========================

    private UnifiedRiskAssessment failClosed(AssessmentRequest request, RuntimeException e) {
        AccountSnapshot snapshot = riskContext.snapshot();
        CircuitBreakerStatus breakerStatus = request != null && request.getCircuitBreakerStatus() != null
                ? request.getCircuitBreakerStatus()
                : CircuitBreakerStatus.CLOSED;
        return UnifiedRiskAssessment.builder()
                .approved(false)
                .rejectionReason(ENGINE_ERROR_PREFIX + e.getMessage())
                .dailyPnl(snapshot.getDailyPnl())
                .dailyPnlPct(snapshot.getDailyPnlPct())
                .currentPositions(request != null && request.getPositions() != null
                        ? request.getPositions().size()
                        : 0)
                .regime(riskContext.getConfig().getDefaultRegime())
                .maxPositionSize(0.0)
                .circuitBreakerStatus(breakerStatus)
                .killSwitchActive(request != null && request.isKillSwitchActive())
                .warnings(List.of())
                .checksRun(List.of())
                .build();
    }

    private void publishEvents(AssessmentRequest request, UnifiedRiskAssessment assessment) {
        Map<String, Object> details = new HashMap<>();
        details.put("ticker", tickerOf(request));
        details.put("dailyPnl", assessment.getDailyPnl());
        details.put("regime", assessment.getRegime() != null ? assessment.getRegime().getRegimeName() : null);

        if (assessment.isRejected()) {
            RiskCheck check = assessment.getRejectedBy();
            details.put("check", check != null ? check.getCheckName() : null);
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.forRejection(check),
                    levelFor(check),
                    assessment.getRejectionReason(),
                    details));
            return;
        }

        if (assessment.getConcentrationScore() > RiskContext.HIGH_CONCENTRATION_THRESHOLD) {
            details.put("concentrationScore", assessment.getConcentrationScore());
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.CONCENTRATION_HIGH,
                    RiskLevel.INFO,
                    String.format(Locale.ROOT, "High portfolio concentration: %.0f/100",
                            assessment.getConcentrationScore()),
                    details));
        }
    }

    private static RiskLevel levelFor(RiskCheck check) {
        if (check == null || check == RiskCheck.KILL_SWITCH || check == RiskCheck.DAILY_LOSS_LIMIT) {
            return RiskLevel.CRITICAL;
        }
        return RiskLevel.WARNING;
    }

    private static String tickerOf(AssessmentRequest request) {
        return request != null ? request.getTicker() : null;
    }
}
