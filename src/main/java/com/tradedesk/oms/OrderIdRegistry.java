package com.tradedesk.oms;

import com.tradedesk.domain.model.Order;
import com.tradedesk.exception.AlreadyBoundException;
import com.tradedesk.ledger.OrderLedger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Allocates internal order ids and keeps the two-way mapping to broker order ids.
 *
 * <p>Ids are strictly increasing and never reused within the process; the counter is
 * seeded from the highest id already in the ledger, and existing bindings are reloaded
 * from ledger rows that carry a broker order id.
 *
 * <p>A binding, once made, is permanent. Binding the same pair twice is a no-op; any
 * attempt to re-point either side raises {@link AlreadyBoundException}.
 */
@Component
public class OrderIdRegistry {

    private static final Logger log = LoggerFactory.getLogger(OrderIdRegistry.class);

    private final AtomicLong lastOrderId;
    private final Map<Long, Long> brokerIdByOrderId = new HashMap<>();
    private final Map<Long, Long> orderIdByBrokerId = new HashMap<>();

    public OrderIdRegistry(OrderLedger orderLedger) {
        this.lastOrderId = new AtomicLong(orderLedger.maxOrderId());
        for (Order order : orderLedger.listBoundOrders()) {
            brokerIdByOrderId.put(order.getOrderId(), order.getBrokerOrderId());
            orderIdByBrokerId.put(order.getBrokerOrderId(), order.getOrderId());
        }
        log.info("Order id registry seeded at {} with {} bindings", lastOrderId.get(), brokerIdByOrderId.size());
    }

    public long allocate() {
        return lastOrderId.incrementAndGet();
    }

    /**
     * Records that {@code orderId} is known to the broker as {@code brokerOrderId}.
     *
     * @throws AlreadyBoundException if either id is already bound to a different counterpart
     */
    public synchronized void bind(long orderId, long brokerOrderId) {
        Long existingBroker = brokerIdByOrderId.get(orderId);
        Long existingOrder = orderIdByBrokerId.get(brokerOrderId);

        if (existingBroker != null && existingBroker == brokerOrderId) {
            return;
        }
        if (existingBroker != null) {
            throw new AlreadyBoundException("orderId=" + orderId + " is already bound to brokerOrderId="
                    + existingBroker + ", refusing " + brokerOrderId);
        }
        if (existingOrder != null) {
            throw new AlreadyBoundException("brokerOrderId=" + brokerOrderId + " is already bound to orderId="
                    + existingOrder + ", refusing " + orderId);
        }

        brokerIdByOrderId.put(orderId, brokerOrderId);
        orderIdByBrokerId.put(brokerOrderId, orderId);
        log.debug("Bound orderId={} to brokerOrderId={}", orderId, brokerOrderId);
    }

    public synchronized Optional<Long> resolve(long brokerOrderId) {
        return Optional.ofNullable(orderIdByBrokerId.get(brokerOrderId));
    }

    public synchronized Optional<Long> brokerIdOf(long orderId) {
        return Optional.ofNullable(brokerIdByOrderId.get(orderId));
    }
}
