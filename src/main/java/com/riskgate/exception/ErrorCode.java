package com.riskgate.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    INVALID_REQUEST("INVALID_REQUEST");

    private final String code;
}
