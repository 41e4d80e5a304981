package com.tradedesk.session;

import com.tradedesk.broker.BrokerSession;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.event.SessionEventType;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Owns the canonical {@link SessionState}.
 *
 * <p>The {@link SessionGuard} reports connects, disconnects and call timeouts here; the
 * reconciler reports broker-side CONNECTION_LOST / CONNECTION_RESTORED events. Every
 * transition publishes a {@link com.tradedesk.event.SessionEvent}.
 *
 * <p>Connection loss is surfaced here rather than by failing outstanding calls.
 */
@Service
public class SessionHealthService {

    private static final Logger log = LoggerFactory.getLogger(SessionHealthService.class);

    private final BrokerSession brokerSession;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final AtomicReference<SessionState> currentState = new AtomicReference<>(SessionState.DISCONNECTED);
    private final AtomicReference<String> lastMessage = new AtomicReference<>();
    private final AtomicReference<Instant> lastTransitionAt = new AtomicReference<>();
    private final AtomicLong callTimeouts = new AtomicLong();

    public SessionHealthService(BrokerSession brokerSession, EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.brokerSession = brokerSession;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Cross-checks the recorded state against the session handle. Catches a dropped link
     * the broker never announced.
     */
    @Scheduled(fixedDelayString = "${tradedesk.session.health-check-interval:30000}")
    public void checkSessionHealth() {
        SessionState state = currentState.get();
        boolean connected = brokerSession.isConnected();
        if (state == SessionState.CONNECTED && !connected) {
            onConnectionLost("Session handle reports disconnected");
        } else if (state == SessionState.CONNECTION_LOST && connected) {
            onConnectionRestored("Session handle reports connected");
        } else {
            log.debug("Session health check passed (state={}, connected={})", state, connected);
        }
    }

    public void onConnecting() {
        transition(null, SessionState.CONNECTING, "Connecting to broker");
    }

    public void onConnected(String message) {
        transition(SessionEventType.SESSION_CONNECTED, SessionState.CONNECTED, message);
        log.info("Broker session connected: {}", message);
    }

    public void onConnectFailed(String message) {
        transition(SessionEventType.SESSION_DISCONNECTED, SessionState.DISCONNECTED, message);
        log.error("Broker session connect failed: {}", message);
    }

    public void onDisconnected(String message) {
        transition(SessionEventType.SESSION_DISCONNECTED, SessionState.DISCONNECTED, message);
        log.info("Broker session disconnected: {}", message);
    }

    /** Broker-side drop. Ignored unless the session was connected. */
    public void onConnectionLost(String message) {
        if (currentState.compareAndSet(SessionState.CONNECTED, SessionState.CONNECTION_LOST)) {
            recordTransition(SessionEventType.SESSION_DISCONNECTED, SessionState.CONNECTED,
                    SessionState.CONNECTION_LOST, message);
            log.warn("Broker connection lost: {}", message);
        }
    }

    public void onConnectionRestored(String message) {
        if (currentState.compareAndSet(SessionState.CONNECTION_LOST, SessionState.CONNECTED)) {
            recordTransition(SessionEventType.SESSION_RECONNECTED, SessionState.CONNECTION_LOST,
                    SessionState.CONNECTED, message);
            log.info("Broker connection restored: {}", message);
        }
    }

    public void onCallTimeout(String operation) {
        long count = callTimeouts.incrementAndGet();
        SessionState state = currentState.get();
        eventPublisherHelper.publishSessionEvent(
                this, SessionEventType.CALL_TIMED_OUT, state, state, operation + " timed out");
        log.warn("Broker {} call timed out ({} timeouts so far)", operation, count);
    }

    public SessionState getState() {
        return currentState.get();
    }

    /** True when broker calls may be attempted. */
    public boolean isSessionActive() {
        return currentState.get() == SessionState.CONNECTED && brokerSession.isConnected();
    }

    public SessionHealth snapshot(int queuedMutations) {
        return SessionHealth.builder()
                .state(currentState.get())
                .connected(isSessionActive())
                .lastMessage(lastMessage.get())
                .lastTransitionAt(lastTransitionAt.get())
                .callTimeouts(callTimeouts.get())
                .queuedMutations(queuedMutations)
                .build();
    }

    private void transition(SessionEventType eventType, SessionState newState, String message) {
        SessionState previous = currentState.getAndSet(newState);
        recordTransition(eventType, previous, newState, message);
    }

    private void recordTransition(
            SessionEventType eventType, SessionState previous, SessionState newState, String message) {
        lastMessage.set(message);
        lastTransitionAt.set(clock.instant());
        if (eventType != null) {
            eventPublisherHelper.publishSessionEvent(this, eventType, previous, newState, message);
        }
    }
}
