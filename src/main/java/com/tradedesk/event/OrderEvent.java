package com.tradedesk.event;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published after an order's ledger row changed.
 *
 * <p>Carries a copy of the order as stored after the change, so listeners never observe a
 * half-applied mutation. Metrics are the main consumer.
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        this(source, order, eventType, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** Status before the change. Null for PLACED and ADOPTED. */
    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }
}
