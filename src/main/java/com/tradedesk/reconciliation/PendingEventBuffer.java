package com.tradedesk.reconciliation;

import com.tradedesk.broker.BrokerEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Order-scoped broker events whose broker order id is not bound yet, grouped by broker
 * order id in arrival order.
 *
 * <p>Confined to the reconciler thread; not thread-safe.
 */
class PendingEventBuffer {

    private final Map<Long, Deque<Pending>> pending = new LinkedHashMap<>();
    private int size;

    void add(BrokerEvent event, Instant bufferedAt) {
        pending.computeIfAbsent(event.getBrokerOrderId(), id -> new ArrayDeque<>())
                .addLast(new Pending(event, bufferedAt));
        size++;
    }

    boolean contains(long brokerOrderId) {
        return pending.containsKey(brokerOrderId);
    }

    /** Removes and returns every buffered event for the id, oldest first. */
    List<BrokerEvent> drain(long brokerOrderId) {
        Deque<Pending> events = pending.remove(brokerOrderId);
        if (events == null) {
            return List.of();
        }
        size -= events.size();
        List<BrokerEvent> result = new ArrayList<>(events.size());
        for (Pending entry : events) {
            result.add(entry.event());
        }
        return result;
    }

    /** Broker order ids whose oldest buffered event has waited longer than {@code maxWait}. */
    List<Long> expired(Instant now, Duration maxWait) {
        List<Long> expired = new ArrayList<>();
        for (Map.Entry<Long, Deque<Pending>> entry : pending.entrySet()) {
            Pending oldest = entry.getValue().peekFirst();
            if (oldest != null && oldest.bufferedAt().plus(maxWait).isBefore(now)) {
                expired.add(entry.getKey());
            }
        }
        return expired;
    }

    Set<Long> brokerOrderIds() {
        return Set.copyOf(pending.keySet());
    }

    int size() {
        return size;
    }

    private record Pending(BrokerEvent event, Instant bufferedAt) {}
}
