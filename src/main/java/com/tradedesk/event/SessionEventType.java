package com.tradedesk.event;

public enum SessionEventType {

    /** connect() completed. */
    SESSION_CONNECTED,

    /** disconnect() completed or the broker dropped the link. */
    SESSION_DISCONNECTED,

    /** Broker reported the link restored after a drop. */
    SESSION_RECONNECTED,

    /** A broker call exceeded the configured timeout. */
    CALL_TIMED_OUT
}
