package com.tradedesk.exception;

/**
 * A broker call did not complete within the configured timeout. The outcome is unknown:
 * the call may still land, so callers must re-query the order instead of resubmitting.
 */
public class BrokerTimeoutException extends BaseException {

    public BrokerTimeoutException(String message) {
        super(ErrorCode.BROKER_TIMEOUT, message);
    }
}
