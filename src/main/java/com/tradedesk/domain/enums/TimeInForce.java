package com.tradedesk.domain.enums;

/** Time-in-force: DAY expires at session close, GTC stays working until cancelled. */
public enum TimeInForce {
    DAY,
    GTC
}
