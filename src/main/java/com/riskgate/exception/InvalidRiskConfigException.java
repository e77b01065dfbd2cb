package com.riskgate.exception;

import java.util.Map;

/**
 * Thrown when a risk configuration violates one of its invariants (for example a cluster
 * threshold above the pairwise correlation limit). Raised at construction time only; an
 * engine that was built successfully never throws this during assessment.
 */
public class InvalidRiskConfigException extends BaseException {

    public InvalidRiskConfigException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public InvalidRiskConfigException(String field, Object value, String constraint) {
        super(
                ErrorCode.VALIDATION_ERROR,
                "Invalid risk config: " + field + "=" + value + " (" + constraint + ")",
                Map.of("field", field, "value", String.valueOf(value)));
    }
}
