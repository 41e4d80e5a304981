package com.tradedesk.repository;

import com.tradedesk.domain.model.OrderFill;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Repository;

/**
 * Append-only fill table. A fill is identified for deduplication by (orderId, execId).
 */
@Repository
public class FillRepository {

    private static final Comparator<OrderFill> NEWEST_FIRST = Comparator.comparing(
                    OrderFill::getRecordedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(OrderFill::getFillId)
            .reversed();

    private final List<OrderFill> fills = new ArrayList<>();
    private final Set<ExecKey> execKeys = new HashSet<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private long lastFillId;

    /**
     * Assigns the next fill id and appends the fill.
     *
     * @return the stored fill, or empty if this execId was already recorded for the order
     */
    public Optional<OrderFill> append(OrderFill fill) {
        lock.writeLock().lock();
        try {
            if (!execKeys.add(new ExecKey(fill.getOrderId(), fill.getExecId()))) {
                return Optional.empty();
            }
            OrderFill stored = fill.toBuilder().fillId(++lastFillId).build();
            fills.add(stored);
            return Optional.of(stored);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean exists(long orderId, String execId) {
        lock.readLock().lock();
        try {
            return execKeys.contains(new ExecKey(orderId, execId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Newest first. {@code orderId} null means all orders. */
    public List<OrderFill> findNewest(Long orderId, int limit) {
        lock.readLock().lock();
        try {
            return fills.stream()
                    .filter(fill -> orderId == null || fill.getOrderId() == orderId)
                    .sorted(NEWEST_FIRST)
                    .limit(limit)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    private record ExecKey(long orderId, String execId) {}
}
