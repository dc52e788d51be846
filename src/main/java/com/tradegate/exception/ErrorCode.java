package com.tradegate.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    UNKNOWN_COMMITMENT("UNKNOWN_COMMITMENT"),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR");

    private final String code;
}
