package com.tradedesk.domain.enums;

/** Buy or sell side of an order. */
public enum OrderSide {
    BUY,
    SELL;

    /** +1 for BUY, -1 for SELL. Used to turn a fill quantity into a signed position delta. */
    public int signum() {
        return this == BUY ? 1 : -1;
    }
}
