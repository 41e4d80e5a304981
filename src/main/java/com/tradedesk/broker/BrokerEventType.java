package com.tradedesk.broker;

/**
 * Kinds of event a broker session publishes onto the {@link BrokerEventChannel}.
 */
public enum BrokerEventType {

    /** Broker accepted the order and assigned its broker order id. */
    ACK,

    /** Execution that leaves part of the order open. */
    PARTIAL_FILL,

    /** Execution that completes the order. */
    FILL,

    /** Raw broker order status text (PreSubmitted, Submitted, Cancelled, ...). */
    STATUS,

    REJECT,

    /** Order-scoped broker error. */
    ERROR,

    /** Broker refused a cancel request; the order keeps working. */
    CANCEL_REJECT,

    /** Commission and realized P&L report for one execution. */
    COMMISSION,

    /** Open order seen on the broker side, possibly entered outside the engine. */
    OPEN_ORDER,

    POSITION_SNAPSHOT,

    ACCOUNT_VALUE_SNAPSHOT,

    CONNECTION_LOST,

    CONNECTION_RESTORED;

    /** True for events that concern a single order and carry a broker order id. */
    public boolean isOrderScoped() {
        return switch (this) {
            case ACK, PARTIAL_FILL, FILL, STATUS, REJECT, ERROR, CANCEL_REJECT, COMMISSION, OPEN_ORDER -> true;
            default -> false;
        };
    }

    public boolean isFill() {
        return this == PARTIAL_FILL || this == FILL;
    }
}
