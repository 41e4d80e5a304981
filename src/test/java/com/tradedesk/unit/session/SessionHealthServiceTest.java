package com.tradedesk.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradedesk.broker.BrokerSession;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.event.SessionEventType;
import com.tradedesk.session.SessionHealth;
import com.tradedesk.session.SessionHealthService;
import com.tradedesk.session.SessionState;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionHealthServiceTest {

    @Mock
    private BrokerSession brokerSession;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private SessionHealthService sessionHealthService;

    @BeforeEach
    void setUp() {
        sessionHealthService = new SessionHealthService(brokerSession, eventPublisherHelper, Clock.systemUTC());
    }

    @Test
    @DisplayName("Starts DISCONNECTED and inactive")
    void initialState() {
        assertThat(sessionHealthService.getState()).isEqualTo(SessionState.DISCONNECTED);
        assertThat(sessionHealthService.isSessionActive()).isFalse();
    }

    @Test
    @DisplayName("Connection lost is only recorded for a connected session")
    void connectionLostRequiresConnected() {
        sessionHealthService.onConnectionLost("dropped");
        assertThat(sessionHealthService.getState()).isEqualTo(SessionState.DISCONNECTED);

        sessionHealthService.onConnected("Connected");
        sessionHealthService.onConnectionLost("dropped");
        assertThat(sessionHealthService.getState()).isEqualTo(SessionState.CONNECTION_LOST);

        sessionHealthService.onConnectionRestored("back");
        assertThat(sessionHealthService.getState()).isEqualTo(SessionState.CONNECTED);
        verify(eventPublisherHelper)
                .publishSessionEvent(any(), eq(SessionEventType.SESSION_RECONNECTED), any(), any(), eq("back"));
    }

    @Test
    @DisplayName("Health check notices a link the broker dropped silently")
    void healthCheckDetectsSilentDrop() {
        sessionHealthService.onConnected("Connected");
        when(brokerSession.isConnected()).thenReturn(false);

        sessionHealthService.checkSessionHealth();

        assertThat(sessionHealthService.getState()).isEqualTo(SessionState.CONNECTION_LOST);
    }

    @Test
    @DisplayName("Call timeouts are counted and published without changing state")
    void callTimeoutCounted() {
        sessionHealthService.onCallTimeout("submit");
        sessionHealthService.onCallTimeout("cancel");

        SessionHealth health = sessionHealthService.snapshot(3);
        assertThat(health.getCallTimeouts()).isEqualTo(2);
        assertThat(health.getQueuedMutations()).isEqualTo(3);
        assertThat(health.getState()).isEqualTo(SessionState.DISCONNECTED);
        verify(eventPublisherHelper, never())
                .publishSessionEvent(any(), eq(SessionEventType.SESSION_DISCONNECTED), any(), any(), anyString());
    }
}
