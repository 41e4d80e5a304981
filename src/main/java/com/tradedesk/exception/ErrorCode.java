package com.tradedesk.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes with their HTTP status. Only BROKER_UNAVAILABLE is retryable: after a
 * BROKER_TIMEOUT the call may still land, so the order has to be re-queried first.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    INVALID_STATE("INVALID_STATE", 409, false),
    ALREADY_BOUND("ALREADY_BOUND", 409, false),
    INVALID_MODIFICATION("INVALID_MODIFICATION", 422, false),
    UNKNOWN_ORDER("UNKNOWN_ORDER", 422, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    BROKER_ERROR("BROKER_ERROR", 502, false),
    BROKER_UNAVAILABLE("BROKER_UNAVAILABLE", 503, true),
    BROKER_TIMEOUT("BROKER_TIMEOUT", 504, false);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
