package com.tradedesk.event;

/**
 * Classifies the order state change that triggered an {@link OrderEvent}.
 */
public enum OrderEventType {

    /** Order stored and handed to the broker session. */
    PLACED,

    /** Broker acknowledged the order and assigned its brokerOrderId. */
    ACKNOWLEDGED,

    /** Quantity, type, price or tif changed after the broker accepted a modify. */
    MODIFIED,

    PARTIALLY_FILLED,

    FILLED,

    CANCELLED,

    /** Order rejected by the broker. */
    REJECTED,

    /** Order failed locally or the broker reported it inactive. */
    FAILED,

    /** Foreign order entered outside the engine and adopted into the ledger. */
    ADOPTED
}
