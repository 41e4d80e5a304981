package com.tradedesk.broker;

import com.tradedesk.domain.model.Order;
import com.tradedesk.oms.OrderModification;

/**
 * The single connection to the brokerage.
 *
 * <p>Implementations are not expected to be thread-safe for mutating calls; the
 * {@link com.tradedesk.session.SessionGuard} is the only caller and serializes them.
 * Everything the broker reports asynchronously (acks, fills, status changes, snapshots)
 * goes onto the {@link BrokerEventChannel}, keyed by broker order id.
 *
 * <p>Refusals are reported by throwing {@link com.tradedesk.exception.BrokerException}.
 */
public interface BrokerSession {

    void connect();

    void disconnect();

    boolean isConnected();

    /**
     * Sends a new order.
     *
     * @return the broker order id; the ack event may arrive before or after this returns
     */
    long submit(Order order);

    void cancel(long brokerOrderId);

    /** Changes a working order in place. The broker order id does not change. */
    void modify(long brokerOrderId, OrderModification modification);

    /** Asks the broker to push fresh position, account value and open order snapshots. */
    void requestSnapshots();
}
