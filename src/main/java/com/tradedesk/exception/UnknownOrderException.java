package com.tradedesk.exception;

/** The reconciler could not map a broker order id to an internal order. */
public class UnknownOrderException extends BaseException {

    public UnknownOrderException(long brokerOrderId) {
        super(ErrorCode.UNKNOWN_ORDER, "No internal order bound to brokerOrderId=" + brokerOrderId);
    }
}
