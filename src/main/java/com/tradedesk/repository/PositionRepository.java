package com.tradedesk.repository;

import com.tradedesk.domain.model.Position;
import com.tradedesk.domain.model.PositionKey;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Repository;

/**
 * Position table keyed by (account, symbol, secType, exchange, conId).
 */
@Repository
public class PositionRepository {

    private static final Comparator<String> TEXT = Comparator.nullsFirst(Comparator.naturalOrder());

    private static final Comparator<Position> BY_KEY = Comparator.comparing(Position::getAccount, TEXT)
            .thenComparing(Position::getSymbol, TEXT)
            .thenComparing(Position::getSecType, TEXT)
            .thenComparing(Position::getExchange, TEXT)
            .thenComparingLong(Position::getConId);

    private final Map<PositionKey, Position> positions = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Read-modify-write of one row under the write lock. The mutation receives a copy of the
     * current row (or null when absent) and returns the new row, or null to delete it.
     *
     * @return the row as stored afterwards, empty if the row is absent
     */
    public Optional<Position> compute(PositionKey key, UnaryOperator<Position> mutation) {
        lock.writeLock().lock();
        try {
            Position current = positions.get(key);
            Position next = mutation.apply(current != null ? current.copy() : null);
            if (next == null) {
                positions.remove(key);
                return Optional.empty();
            }
            positions.put(key, next.copy());
            return Optional.of(next.copy());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Position> findByKey(PositionKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(positions.get(key)).map(Position::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Position> findAll() {
        lock.readLock().lock();
        try {
            return positions.values().stream().sorted(BY_KEY).map(Position::copy).toList();
        } finally {
            lock.readLock().unlock();
        }
    }
}
