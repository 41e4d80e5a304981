package com.tradedesk.session;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Point-in-time view of the broker session for the health endpoint. */
@Value
@Builder
public class SessionHealth {

    SessionState state;
    boolean connected;
    String lastMessage;
    Instant lastTransitionAt;
    long callTimeouts;
    int queuedMutations;
}
