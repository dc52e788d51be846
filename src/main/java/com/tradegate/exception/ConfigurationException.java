package com.tradegate.exception;

import java.util.Map;

/**
 * Thrown when session windows, risk limits or ledger settings are malformed.
 *
 * <p>Raised at load or replace time so a bad configuration never reaches the
 * admission path. The previously published configuration stays in effect.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
