package com.tradedesk.domain.enums;

/**
 * Order execution type.
 * LMT and STP carry a price (limit price or stop trigger); MKT never does.
 */
public enum OrderType {
    MKT,
    LMT,
    STP;

    public boolean requiresPrice() {
        return this != MKT;
    }
}
