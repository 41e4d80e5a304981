package com.tradedesk.session;

import com.tradedesk.broker.BrokerSession;
import com.tradedesk.config.EngineProperties;
import com.tradedesk.domain.model.Order;
import com.tradedesk.exception.BaseException;
import com.tradedesk.exception.BrokerException;
import com.tradedesk.exception.BrokerTimeoutException;
import com.tradedesk.exception.BrokerUnavailableException;
import com.tradedesk.oms.OrderModification;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

/**
 * The only gateway to the {@link BrokerSession}.
 *
 * <p>Rules enforced here:
 * <ul>
 *   <li>Mutating calls (submit, cancel, modify) run one at a time on the dedicated
 *       {@code broker-session} thread. Callers are admitted in arrival order by a fair
 *       single-permit semaphore, which is released only when the broker call returns.</li>
 *   <li>Read-only calls (snapshot requests) run concurrently on the query pool.</li>
 *   <li>connect/disconnect take the connection lock exclusively and wait for in-flight
 *       calls to finish; calls hold it shared.</li>
 *   <li>Every call is bounded by {@code tradedesk.session.call-timeout}. A timed-out call is
 *       not cancelled locally: its outcome is unknown and it may still land.</li>
 * </ul>
 */
@Component
public class SessionGuard implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SessionGuard.class);

    private final BrokerSession brokerSession;
    private final SessionHealthService sessionHealthService;
    private final Duration callTimeout;

    private final ExecutorService mutationExecutor = Executors.newSingleThreadExecutor(named("broker-session"));
    private final ExecutorService queryExecutor = Executors.newCachedThreadPool(named("broker-query"));
    private final Semaphore mutationPermit = new Semaphore(1, true);
    private final ReentrantReadWriteLock connectionLock = new ReentrantReadWriteLock(true);

    public SessionGuard(
            BrokerSession brokerSession, SessionHealthService sessionHealthService, EngineProperties engineProperties) {
        this.brokerSession = brokerSession;
        this.sessionHealthService = sessionHealthService;
        this.callTimeout = engineProperties.getSession().getCallTimeout();
    }

    // ---- Connection ----

    /**
     * Connects the session. Waits for in-flight calls to drain first.
     *
     * @throws BrokerTimeoutException if in-flight calls do not drain within the call timeout
     * @throws BrokerException        if the broker refuses the connection
     */
    public void connect() {
        withExclusiveConnection("connect", () -> {
            if (brokerSession.isConnected()) {
                sessionHealthService.onConnected("Already connected");
                return;
            }
            sessionHealthService.onConnecting();
            try {
                brokerSession.connect();
            } catch (RuntimeException e) {
                sessionHealthService.onConnectFailed(e.getMessage());
                throw e instanceof BaseException ? e : new BrokerException("Broker connect failed: " + e.getMessage(), e);
            }
            sessionHealthService.onConnected("Connected");
        });
    }

    public void disconnect() {
        withExclusiveConnection("disconnect", () -> {
            brokerSession.disconnect();
            sessionHealthService.onDisconnected("Disconnected by engine");
        });
    }

    public boolean isConnected() {
        return sessionHealthService.isSessionActive();
    }

    /**
     * @throws BrokerUnavailableException if the session is not connected
     */
    public void requireConnected() {
        if (!isConnected()) {
            throw new BrokerUnavailableException(
                    "Broker session is not connected. Current state: " + sessionHealthService.getState());
        }
    }

    // ---- Mutating calls ----

    /**
     * Dispatches a submit. The returned future completes with the broker order id when the
     * broker call returns, even if the caller already gave up waiting.
     *
     * @throws BrokerUnavailableException if the session is down or too busy to admit the call
     */
    public CompletableFuture<Long> dispatchSubmit(Order order) {
        return dispatchMutation("submit", () -> brokerSession.submit(order));
    }

    public CompletableFuture<Void> dispatchCancel(long brokerOrderId) {
        return dispatchMutation("cancel", () -> {
            brokerSession.cancel(brokerOrderId);
            return null;
        });
    }

    public CompletableFuture<Void> dispatchModify(long brokerOrderId, OrderModification modification) {
        return dispatchMutation("modify", () -> {
            brokerSession.modify(brokerOrderId, modification);
            return null;
        });
    }

    // ---- Read-only calls ----

    public void requestSnapshots() {
        requireConnected();
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> withSharedConnection("snapshots", () -> {
                        brokerSession.requestSnapshots();
                        return null;
                    }),
                    queryExecutor);
        } catch (RejectedExecutionException e) {
            throw new BrokerUnavailableException("Broker session is shutting down");
        }
        await("snapshots", future);
    }

    /**
     * Waits for a dispatched call within the call timeout.
     *
     * @throws BrokerTimeoutException on timeout; the call may still complete later
     * @throws BaseException          the broker failure, unwrapped
     */
    public <T> T await(String operation, CompletableFuture<T> future) {
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            sessionHealthService.onCallTimeout(operation);
            throw new BrokerTimeoutException("Broker " + operation + " did not complete within " + callTimeout
                    + "; outcome unknown, re-query before retrying");
        } catch (ExecutionException e) {
            throw translate(operation, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("Interrupted while waiting for broker " + operation, e);
        }
    }

    public int getQueuedMutations() {
        return mutationPermit.getQueueLength();
    }

    public SessionHealth health() {
        return sessionHealthService.snapshot(getQueuedMutations());
    }

    @Override
    public void destroy() {
        mutationExecutor.shutdown();
        queryExecutor.shutdown();
        try {
            if (!mutationExecutor.awaitTermination(callTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Broker session thread did not finish in-flight call before shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        queryExecutor.shutdownNow();
    }

    private <T> CompletableFuture<T> dispatchMutation(String operation, Supplier<T> call) {
        requireConnected();
        try {
            if (!mutationPermit.tryAcquire(callTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new BrokerUnavailableException(
                        "Broker session busy: " + operation + " was not admitted within " + callTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerUnavailableException("Interrupted while waiting to " + operation);
        }

        try {
            return CompletableFuture.supplyAsync(
                    () -> {
                        try {
                            return withSharedConnection(operation, call);
                        } finally {
                            mutationPermit.release();
                        }
                    },
                    mutationExecutor);
        } catch (RejectedExecutionException e) {
            mutationPermit.release();
            throw new BrokerUnavailableException("Broker session is shutting down");
        }
    }

    private <T> T withSharedConnection(String operation, Supplier<T> call) {
        connectionLock.readLock().lock();
        try {
            if (!brokerSession.isConnected()) {
                throw new BrokerUnavailableException("Broker session disconnected before " + operation);
            }
            log.debug("Broker {} dispatched", operation);
            return call.get();
        } finally {
            connectionLock.readLock().unlock();
        }
    }

    private void withExclusiveConnection(String operation, Runnable action) {
        boolean locked;
        try {
            locked = connectionLock.writeLock().tryLock(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("Interrupted while waiting to " + operation, e);
        }
        if (!locked) {
            sessionHealthService.onCallTimeout(operation);
            throw new BrokerTimeoutException("In-flight broker calls did not drain within " + callTimeout);
        }
        try {
            action.run();
        } finally {
            connectionLock.writeLock().unlock();
        }
    }

    private static RuntimeException translate(String operation, Throwable cause) {
        if (cause instanceof BaseException baseException) {
            return baseException;
        }
        String message = cause != null ? cause.getMessage() : "unknown failure";
        return new BrokerException("Broker " + operation + " failed: " + message, cause);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
