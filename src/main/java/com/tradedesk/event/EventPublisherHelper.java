package com.tradedesk.event;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.model.Order;
import com.tradedesk.session.SessionState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Delivery is synchronous unless a listener is annotated otherwise, so publishing
 * happens after the ledger write has completed and outside any ledger lock.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderPlaced(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.PLACED));
    }

    public void publishOrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, eventType, previousStatus));
    }

    public void publishOrderFailed(Object source, Order order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.FAILED, previousStatus));
    }

    public void publishOrderModified(Object source, Order order) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.MODIFIED, order.getStatus()));
    }

    public void publishOrderAdopted(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.ADOPTED));
    }

    // ---- Session ----

    public void publishSessionEvent(
            Object source,
            SessionEventType eventType,
            SessionState previousState,
            SessionState newState,
            String message) {
        applicationEventPublisher.publishEvent(new SessionEvent(source, eventType, previousState, newState, message));
    }

    // ---- Reconciler ----

    public void publishBrokerEventDropped(Object source, String reason) {
        applicationEventPublisher.publishEvent(new BrokerEventDroppedEvent(source, reason));
    }
}
