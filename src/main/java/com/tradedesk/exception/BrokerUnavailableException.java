package com.tradedesk.exception;

/**
 * Thrown when a broker call is attempted while the session is not connected.
 * The caller may retry once the session is back.
 */
public class BrokerUnavailableException extends BaseException {

    public BrokerUnavailableException(String message) {
        super(ErrorCode.BROKER_UNAVAILABLE, message);
    }
}
