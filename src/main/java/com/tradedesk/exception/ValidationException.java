package com.tradedesk.exception;

import java.util.Map;

/**
 * Malformed or out-of-range request. Raised before anything is persisted or sent to the
 * broker; never retried automatically.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
