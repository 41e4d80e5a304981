package com.tradedesk.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an order.
 *
 * <p>NEW and PENDING_SUBMIT are internal pre-acknowledgement states. SUBMITTED means the
 * broker acknowledged the order; ACKED means it is working at the exchange.
 * CANCEL_REQUESTED overlays a working status until the broker confirms or refuses the
 * cancel. FILLED, CANCELLED, REJECTED and ERROR are terminal.
 */
public enum OrderStatus {
    NEW,
    PENDING_SUBMIT,
    SUBMITTED,
    ACKED,
    PARTIALLY_FILLED,
    CANCEL_REQUESTED,
    FILLED,
    CANCELLED,
    REJECTED,
    ERROR;

    private static final Set<OrderStatus> TERMINAL = EnumSet.of(FILLED, CANCELLED, REJECTED, ERROR);

    private static final Set<OrderStatus> WORKING = EnumSet.of(SUBMITTED, ACKED, PARTIALLY_FILLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** Statuses in which the order is live at the broker and may be modified or cancelled. */
    public boolean isWorking() {
        return WORKING.contains(this);
    }
}
