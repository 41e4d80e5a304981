package com.tradedesk.exception;

/** An order id or broker order id is already bound to a different counterpart. */
public class AlreadyBoundException extends BaseException {

    public AlreadyBoundException(String message) {
        super(ErrorCode.ALREADY_BOUND, message);
    }
}
