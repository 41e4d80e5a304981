package com.tradedesk.repository;

import com.tradedesk.domain.model.Order;
import com.tradedesk.exception.ResourceNotFoundException;
import com.tradedesk.ledger.OrderUpdate;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Repository;

/**
 * In-memory order table.
 *
 * <p>Guarded by its own reader/writer lock. Every row handed in or out is a copy, so callers
 * can never mutate the stored row outside {@link #update}.
 */
@Repository
public class OrderRepository {

    static final Comparator<Order> NEWEST_FIRST = Comparator.comparing(
                    Order::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(Order::getOrderId)
            .reversed();

    private final Map<Long, Order> orders = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public void save(Order order) {
        lock.writeLock().lock();
        try {
            orders.put(order.getOrderId(), order.copy());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Order> findById(long orderId) {
        lock.readLock().lock();
        try {
            Order order = orders.get(orderId);
            return Optional.ofNullable(order).map(Order::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies {@code mutation} to a copy of the stored row and stores the result, all under the
     * write lock. If the mutation throws, nothing is stored.
     *
     * @throws ResourceNotFoundException if no order has this id
     */
    public OrderUpdate update(long orderId, UnaryOperator<Order> mutation, Instant now) {
        lock.writeLock().lock();
        try {
            Order stored = orders.get(orderId);
            if (stored == null) {
                throw new ResourceNotFoundException("Order", orderId);
            }
            Order before = stored.copy();
            Order after = mutation.apply(stored.copy());
            if (after == null || after.equals(before)) {
                return new OrderUpdate(before, before.copy(), false);
            }
            after.setUpdatedAt(now);
            orders.put(orderId, after.copy());
            return new OrderUpdate(before, after.copy(), true);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Order> findNewest(int limit) {
        lock.readLock().lock();
        try {
            return orders.values().stream()
                    .sorted(NEWEST_FIRST)
                    .limit(limit)
                    .map(Order::copy)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Order> findAll() {
        lock.readLock().lock();
        try {
            return orders.values().stream().map(Order::copy).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long maxOrderId() {
        lock.readLock().lock();
        try {
            return orders.keySet().stream().mapToLong(Long::longValue).max().orElse(0L);
        } finally {
            lock.readLock().unlock();
        }
    }
}
