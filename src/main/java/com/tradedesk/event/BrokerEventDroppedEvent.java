package com.tradedesk.event;

import org.springframework.context.ApplicationEvent;

/** Published when the reconciler discards a broker event it could not apply. */
public class BrokerEventDroppedEvent extends ApplicationEvent {

    private final String reason;

    public BrokerEventDroppedEvent(Object source, String reason) {
        super(source);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
