package com.tradedesk.domain.enums;

/**
 * Asset class of an order's instrument. The constant names are the wire codes used
 * by the broker and by API clients ("STK", "OPT").
 */
public enum AssetClass {
    STK,
    OPT
}
