package com.riskgate.domain.model;

import com.riskgate.domain.enums.CircuitBreakerStatus;
import com.riskgate.domain.enums.TradeDirection;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Input of a single {@code RiskContext.assess} call: the candidate trade plus the externally
 * computed state the engine consumes but does not own.
 *
 * <p>Return histories are daily returns as fractions (0.01 = +1%), oldest first. A null or
 * empty map disables the correlation guard and VaR sizing for this call. A null regime means
 * "use the engine's default regime".
 *
 * <p>Immutable so the same request may be evaluated from several threads.
 */
@Value
@Builder(toBuilder = true)
public class AssessmentRequest {

    /** Candidate ticker. Required. */
    String ticker;

    @Builder.Default
    TradeDirection direction = TradeDirection.LONG;

    /** Current open positions. */
    @Builder.Default
    List<OpenPosition> positions = List.of();

    /** Historical daily returns per ticker, used for correlation and VaR. */
    Map<String, List<Double>> returnsByTicker;

    /** Regime name ("bull", "bear", "sideways", "crisis"). */
    String regime;

    @Builder.Default
    CircuitBreakerStatus circuitBreakerStatus = CircuitBreakerStatus.CLOSED;

    boolean killSwitchActive;

    /** Current VIX-like volatility reading. Carried for forward compatibility. */
    @Builder.Default
    double vix = 20.0;

    public boolean hasReturnHistory() {
        return returnsByTicker != null && !returnsByTicker.isEmpty();
    }

    /**
     * Returns the candidate ticker's own return series, or an empty list if none was supplied.
     */
    public List<Double> getCandidateReturns() {
        if (returnsByTicker == null) {
            return List.of();
        }
        List<Double> returns = returnsByTicker.get(ticker);
        return returns != null ? returns : List.of();
    }
}
