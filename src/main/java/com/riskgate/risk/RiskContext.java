package com.riskgate.risk;

import com.riskgate.domain.enums.CircuitBreakerStatus;
import com.riskgate.domain.enums.MarketRegime;
import com.riskgate.domain.enums.RiskCheck;
import com.riskgate.domain.model.AssessmentRequest;
import com.riskgate.domain.model.OpenPosition;
import com.riskgate.exception.InvalidAssessmentRequestException;
import com.riskgate.risk.correlation.CorrelationCheckResult;
import com.riskgate.risk.correlation.CorrelationGuard;
import com.riskgate.risk.correlation.CorrelationMatrix;
import com.riskgate.risk.regime.RegimeLimits;
import com.riskgate.risk.regime.RegimeRiskAdapter;
import com.riskgate.risk.sizing.VaRPositionSizer;
import com.riskgate.risk.sizing.VaRResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unified risk-admission engine: one {@link #assess} call turns a candidate trade into a
 * single pass/fail verdict and a risk-adjusted maximum position size.
 *
 * <p>Checks (in order, first failure wins and returns immediately):
 * <ol>
 *   <li><b>kill_switch:</b> caller-supplied kill switch engaged</li>
 *   <li><b>circuit_breaker:</b> breaker OPEN</li>
 *   <li><b>daily_loss_limit:</b> the engine's own daily P&L loss at or beyond the limit</li>
 *   <li><b>max_positions:</b> open positions at the regime-adjusted maximum</li>
 *   <li><b>single_stock_concentration:</b> existing exposure to the ticker at the limit</li>
 *   <li><b>correlation_guard:</b> over-correlated pair or full cluster (only with history)</li>
 *   <li><b>var_sizing:</b> VaR-budget size for the ticker (only with its history)</li>
 * </ol>
 * The resulting size is then scaled by the regime multiplier and halved while the circuit
 * breaker is HALF_OPEN. Rejections are returned, never thrown.
 *
 * <p><b>Thread safety:</b> equity, starting equity and daily P&L live in one immutable
 * {@link AccountSnapshot} inside an {@link AtomicReference}. {@link #recordPnl} updates it
 * lock-free with {@code updateAndGet}; {@link #setEquity} and {@link #resetDaily} are
 * synchronized so the sizer's cached equity follows the snapshot in order. {@link #assess}
 * reads the snapshot once at entry and never mutates shared state. The regime is threaded
 * through every call rather than stored on the adapter.
 */
public class RiskContext {

    private static final Logger log = LoggerFactory.getLogger(RiskContext.class);

    /** Concentration score above which an approved trade carries a warning. */
    public static final double HIGH_CONCENTRATION_THRESHOLD = 75.0;

    /** Size multiplier applied while the circuit breaker is HALF_OPEN. */
    public static final double HALF_OPEN_SIZE_MULTIPLIER = 0.5;

    private final RiskContextConfig config;
    private final CorrelationGuard correlationGuard;
    private final VaRPositionSizer varSizer;
    private final RegimeRiskAdapter regimeAdapter;

    private final AtomicReference<AccountSnapshot> account;

    public RiskContext(double equity) {
        this(RiskContextConfig.defaults(), equity);
    }

    public RiskContext(RiskContextConfig config, double equity) {
        this(
                config,
                equity,
                new CorrelationGuard(config.getCorrelationConfig()),
                new VaRPositionSizer(config.getVarConfig(), equity),
                new RegimeRiskAdapter(config.getDefaultRegime()));
    }

    /**
     * Builds a context around pre-built components, e.g. a regime adapter with custom profiles.
     */
    public RiskContext(
            RiskContextConfig config,
            double equity,
            CorrelationGuard correlationGuard,
            VaRPositionSizer varSizer,
            RegimeRiskAdapter regimeAdapter) {
        config.validate();
        this.config = config;
        this.correlationGuard = correlationGuard;
        this.varSizer = varSizer;
        this.regimeAdapter = regimeAdapter;
        this.account = new AtomicReference<>(AccountSnapshot.startOfDay(equity));
        this.varSizer.setEquity(account.get().getEquity());
    }

    // ========================
    // ACCOUNT STATE
    // ========================

    public RiskContextConfig getConfig() {
        return config;
    }

    public double getEquity() {
        return account.get().getEquity();
    }

    /**
     * Updates current equity (negative values clamp to 0.0) and keeps the VaR sizer in sync.
     * Starting equity and daily P&L are unchanged until the next {@link #resetDaily}.
     */
    public synchronized void setEquity(double equity) {
        AccountSnapshot updated = account.updateAndGet(current -> current.withEquity(equity));
        varSizer.setEquity(updated.getEquity());
        log.info("Equity updated to {}", updated.getEquity());
    }

    /**
     * Adds a realized P&L amount (negative for losses) to the daily running total.
     */
    public void recordPnl(double pnl) {
        AccountSnapshot updated = account.updateAndGet(current -> current.withPnl(pnl));
        log.debug("Recorded P&L: {}, daily total: {}", pnl, updated.getDailyPnl());
    }

    /**
     * Starts a new trading day: daily P&L back to zero, starting equity set to current equity.
     */
    public synchronized void resetDaily() {
        AccountSnapshot updated = account.updateAndGet(current -> AccountSnapshot.startOfDay(current.getEquity()));
        varSizer.setEquity(updated.getEquity());
        log.info("Daily risk counters reset, starting equity {}", updated.getStartingEquity());
    }

    public double getDailyPnl() {
        return account.get().getDailyPnl();
    }

    /**
     * Returns equity, starting equity and daily P&L as one consistent view.
     */
    public AccountSnapshot snapshot() {
        return account.get();
    }

    // ========================
    // ASSESSMENT
    // ========================

    /**
     * Runs the ordered risk checks for a candidate trade.
     *
     * @param request candidate trade, open positions and externally computed state
     * @return approved assessment with the final size, or a rejection with its reason
     * @throws InvalidAssessmentRequestException if the request or its ticker is missing
     */
    public UnifiedRiskAssessment assess(AssessmentRequest request) {
        if (request == null || request.getTicker() == null || request.getTicker().isBlank()) {
            throw new InvalidAssessmentRequestException("Assessment request requires a ticker");
        }

        AccountSnapshot snapshot = account.get();
        String ticker = request.getTicker();
        List<OpenPosition> positions = request.getPositions() != null ? request.getPositions() : List.of();
        CircuitBreakerStatus breakerStatus = request.getCircuitBreakerStatus() != null
                ? request.getCircuitBreakerStatus()
                : CircuitBreakerStatus.CLOSED;

        MarketRegime regime = regimeAdapter.resolve(request.getRegime());
        RegimeLimits limits = regimeAdapter.getLimits(regime);

        Evaluation evaluation = new Evaluation(snapshot, positions.size(), regime, limits, breakerStatus, request);
        if (request.getRegime() != null && !MarketRegime.isKnown(request.getRegime())) {
            evaluation.warnings.add("Unknown regime '" + request.getRegime() + "', using " + regime.getRegimeName());
        }
        log.debug("Assessing {} {} (regime={}, breaker={}, vix={})",
                request.getDirection(), ticker, regime, breakerStatus, request.getVix());

        // 1. Kill switch
        evaluation.ran(RiskCheck.KILL_SWITCH);
        if (request.isKillSwitchActive()) {
            return evaluation.reject(RiskCheck.KILL_SWITCH, "Kill switch is active");
        }

        // 2. Circuit breaker
        evaluation.ran(RiskCheck.CIRCUIT_BREAKER);
        if (breakerStatus == CircuitBreakerStatus.OPEN) {
            return evaluation.reject(RiskCheck.CIRCUIT_BREAKER, "Circuit breaker is OPEN");
        }

        // 3. Daily loss limit, on the engine's own accumulator
        evaluation.ran(RiskCheck.DAILY_LOSS_LIMIT);
        if (snapshot.getStartingEquity() > 0.0 && snapshot.getDailyPnl() < 0.0) {
            double lossPct = Math.abs(snapshot.getDailyPnl()) / snapshot.getStartingEquity() * 100.0;
            if (lossPct >= config.getMaxDailyLossPct()) {
                return evaluation.reject(
                        RiskCheck.DAILY_LOSS_LIMIT,
                        String.format(Locale.ROOT, "Daily loss %.1f%% >= limit %.1f%%",
                                lossPct, config.getMaxDailyLossPct()));
            }
        }

        // 4. Max positions, regime-adjusted
        evaluation.ran(RiskCheck.MAX_POSITIONS);
        int adjustedMax = regimeAdapter.adjustMaxPositions(config.getMaxConcurrentPositions(), regime);
        if (positions.size() >= adjustedMax) {
            return evaluation.reject(
                    RiskCheck.MAX_POSITIONS,
                    String.format(Locale.ROOT, "Max positions reached: %d/%d (regime=%s)",
                            positions.size(), adjustedMax, regime.getRegimeName()));
        }

        // 5. Single stock concentration
        evaluation.ran(RiskCheck.SINGLE_STOCK_CONCENTRATION);
        if (snapshot.getEquity() > 0.0) {
            double tickerExposure = positions.stream()
                    .filter(p -> ticker.equals(p.getSymbol()))
                    .mapToDouble(OpenPosition::getAbsoluteExposure)
                    .sum();
            double exposurePct = tickerExposure / snapshot.getEquity() * 100.0;
            if (exposurePct >= config.getMaxSingleStockPct()) {
                return evaluation.reject(
                        RiskCheck.SINGLE_STOCK_CONCENTRATION,
                        String.format(Locale.ROOT, "%s exposure %.1f%% >= %.1f%%",
                                ticker, exposurePct, config.getMaxSingleStockPct()));
            }
        }

        // 6. Correlation guard
        if (config.isEnableCorrelationGuard() && request.hasReturnHistory()) {
            evaluation.ran(RiskCheck.CORRELATION_GUARD);
            CorrelationMatrix matrix = correlationGuard.computeMatrix(request.getReturnsByTicker());
            evaluation.correlationMatrix = matrix;
            List<String> holdings = holdingSymbols(positions);
            CorrelationCheckResult result = correlationGuard.checkNewTrade(ticker, matrix, holdings);
            if (!result.isApproved()) {
                return evaluation.reject(RiskCheck.CORRELATION_GUARD, result.getReason());
            }
            List<String> withCandidate = new ArrayList<>(holdings);
            withCandidate.add(ticker);
            evaluation.concentrationScore = correlationGuard.getPortfolioConcentrationScore(matrix, withCandidate);
            if (evaluation.concentrationScore > HIGH_CONCENTRATION_THRESHOLD) {
                evaluation.warnings.add(String.format(Locale.ROOT,
                        "High portfolio concentration: %.0f/100", evaluation.concentrationScore));
            }
        }

        // 7. VaR sizing, falling back to the flat single-stock budget
        double maxPositionSize = config.getMaxSingleStockPct() / 100.0 * snapshot.getEquity();
        List<Double> candidateReturns = request.getCandidateReturns();
        if (config.isEnableVarSizing() && !candidateReturns.isEmpty()) {
            evaluation.ran(RiskCheck.VAR_SIZING);
            evaluation.varResult = varSizer.computeVar(candidateReturns, snapshot.getEquity());
            // The candidate's own VaR is charged against the portfolio budget
            double existingVarPct = evaluation.varResult.getVarPct();
            maxPositionSize = varSizer.sizePosition(candidateReturns, 1.0, existingVarPct, snapshot.getEquity());
            if (maxPositionSize <= 0.0) {
                evaluation.warnings.add(String.format(Locale.ROOT,
                        "Portfolio VaR budget exhausted: existing risk %.2f%% of %.2f%%",
                        existingVarPct, config.getVarConfig().getMaxPortfolioVarPct()));
            }
        }

        // 8. Regime multiplier, then half size while the breaker is probing
        maxPositionSize = regimeAdapter.adjustPositionSize(maxPositionSize, regime);
        if (breakerStatus == CircuitBreakerStatus.HALF_OPEN) {
            maxPositionSize *= HALF_OPEN_SIZE_MULTIPLIER;
            evaluation.warnings.add("Circuit breaker HALF_OPEN: position size halved");
        }

        UnifiedRiskAssessment assessment = evaluation.approve(maxPositionSize);
        log.debug("Trade {} approved: maxPositionSize={}, checks={}", ticker, maxPositionSize, assessment.getChecksRun());
        return assessment;
    }

    private static List<String> holdingSymbols(List<OpenPosition> positions) {
        List<String> symbols = new ArrayList<>(positions.size());
        for (OpenPosition position : positions) {
            if (position.getSymbol() != null) {
                symbols.add(position.getSymbol());
            }
        }
        return symbols;
    }

    /**
     * Mutable scratchpad for one {@code assess} call. Never shared between threads.
     */
    private static final class Evaluation {

        private final AccountSnapshot snapshot;
        private final int positionCount;
        private final MarketRegime regime;
        private final RegimeLimits limits;
        private final CircuitBreakerStatus breakerStatus;
        private final AssessmentRequest request;

        private final List<String> warnings = new ArrayList<>();
        private final List<String> checksRun = new ArrayList<>();
        private CorrelationMatrix correlationMatrix;
        private double concentrationScore;
        private VaRResult varResult;

        private Evaluation(
                AccountSnapshot snapshot,
                int positionCount,
                MarketRegime regime,
                RegimeLimits limits,
                CircuitBreakerStatus breakerStatus,
                AssessmentRequest request) {
            this.snapshot = snapshot;
            this.positionCount = positionCount;
            this.regime = regime;
            this.limits = limits;
            this.breakerStatus = breakerStatus;
            this.request = request;
        }

        private void ran(RiskCheck check) {
            checksRun.add(check.getCheckName());
        }

        private UnifiedRiskAssessment reject(RiskCheck check, String reason) {
            log.warn("Trade {} rejected by {}: {}", request.getTicker(), check.getCheckName(), reason);
            return base().approved(false)
                    .rejectionReason(reason)
                    .rejectedBy(check)
                    .maxPositionSize(0.0)
                    .build();
        }

        private UnifiedRiskAssessment approve(double maxPositionSize) {
            return base().approved(true).maxPositionSize(maxPositionSize).build();
        }

        private UnifiedRiskAssessment.UnifiedRiskAssessmentBuilder base() {
            return UnifiedRiskAssessment.builder()
                    .dailyPnl(snapshot.getDailyPnl())
                    .dailyPnlPct(snapshot.getDailyPnlPct())
                    .currentPositions(positionCount)
                    .regime(regime)
                    .regimeLimits(limits)
                    .correlationMatrix(correlationMatrix)
                    .concentrationScore(concentrationScore)
                    .varResult(varResult)
                    .circuitBreakerStatus(breakerStatus)
                    .killSwitchActive(request.isKillSwitchActive())
                    .warnings(List.copyOf(warnings))
                    .checksRun(List.copyOf(checksRun));
        }
    }
}
