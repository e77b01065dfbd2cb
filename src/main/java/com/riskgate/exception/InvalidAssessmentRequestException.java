package com.riskgate.exception;

public class InvalidAssessmentRequestException extends BaseException {

    public InvalidAssessmentRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
