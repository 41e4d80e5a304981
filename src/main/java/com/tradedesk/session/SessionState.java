package com.tradedesk.session;

/**
 * Connection state of the broker session.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED <-> CONNECTION_LOST
 *       ^                           |
 *       +-------- disconnect -------+
 * </pre>
 *
 * <p>CONNECTION_LOST means the broker dropped the link on its own; outstanding orders stay
 * as they are and the session may come back without a reconnect from the engine.
 */
public enum SessionState {

    DISCONNECTED,

    CONNECTING,

    CONNECTED,

    CONNECTION_LOST
}
