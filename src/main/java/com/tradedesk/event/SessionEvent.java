package com.tradedesk.event;

import com.tradedesk.session.SessionState;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the broker session's connection state changes.
 */
public class SessionEvent extends ApplicationEvent {

    private final SessionEventType eventType;
    private final SessionState previousState;
    private final SessionState newState;
    private final String message;
    private final Instant occurredAt;

    public SessionEvent(
            Object source,
            SessionEventType eventType,
            SessionState previousState,
            SessionState newState,
            String message) {
        super(source);
        this.eventType = eventType;
        this.previousState = previousState;
        this.newState = newState;
        this.message = message;
        this.occurredAt = Instant.now();
    }

    public SessionEventType getEventType() {
        return eventType;
    }

    public SessionState getPreviousState() {
        return previousState;
    }

    public SessionState getNewState() {
        return newState;
    }

    public String getMessage() {
        return message;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
