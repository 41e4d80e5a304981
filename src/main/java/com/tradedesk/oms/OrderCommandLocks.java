package com.tradedesk.oms;

import com.tradedesk.config.EngineProperties;
import com.tradedesk.exception.InvalidStateException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One lock per order id so that at most one command is in flight for any order.
 *
 * <p>Held across the broker round trip, unlike the ledger's table locks which are held only
 * for a single read-modify-write. Waiting is bounded.
 *
 * <p>An entry lives only while some command holds or waits for it. The user count is changed
 * inside {@code compute} for the order's key, so an entry is never removed while a thread is
 * about to lock it.
 */
@Component
public class OrderCommandLocks {

    private final Map<Long, CommandLock> locks = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public OrderCommandLocks(EngineProperties engineProperties) {
        this.waitTimeout = engineProperties.getSession().getCommandLockTimeout();
    }

    /**
     * @throws InvalidStateException if another command for the order does not finish in time
     */
    public <T> T withLock(long orderId, Supplier<T> command) {
        CommandLock entry = locks.compute(orderId, (id, current) -> {
            CommandLock lock = current != null ? current : new CommandLock();
            lock.users++;
            return lock;
        });
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InvalidStateException(null, "Interrupted while waiting for order " + orderId);
            }
            if (!acquired) {
                throw new InvalidStateException(null, "Another command for order " + orderId + " is still in flight");
            }
            try {
                return command.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(orderId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    /** Orders with a command currently holding or waiting for their lock. */
    public int activeLocks() {
        return locks.size();
    }

    private static final class CommandLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
