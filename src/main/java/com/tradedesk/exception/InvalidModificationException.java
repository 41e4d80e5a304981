package com.tradedesk.exception;

/**
 * A modify request violates the filled-quantity or price guard. Detected locally; the
 * broker is never contacted.
 */
public class InvalidModificationException extends BaseException {

    public InvalidModificationException(String message) {
        super(ErrorCode.INVALID_MODIFICATION, message);
    }
}
