package com.tradedesk.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.StockInstrument;
import com.tradedesk.event.BrokerEventDroppedEvent;
import com.tradedesk.event.OrderEvent;
import com.tradedesk.event.OrderEventType;
import com.tradedesk.event.SessionEvent;
import com.tradedesk.event.SessionEventType;
import com.tradedesk.observability.EngineMetrics;
import com.tradedesk.session.SessionHealthService;
import com.tradedesk.session.SessionState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Tests for EngineMetrics: counters follow the published events, the session gauge
 * follows SessionHealthService.
 *
 * <p>Lenient strictness because the gauge supplier is only evaluated when read.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EngineMetricsTest {

    private MeterRegistry meterRegistry;
    private EngineMetrics engineMetrics;

    @Mock
    private SessionHealthService sessionHealthService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        when(sessionHealthService.isSessionActive()).thenReturn(false);
        engineMetrics = new EngineMetrics(meterRegistry, sessionHealthService);
    }

    private OrderEvent orderEvent(OrderEventType type) {
        Order order = Order.builder()
                .orderId(1L)
                .instrument(new StockInstrument("AAPL"))
                .side(OrderSide.BUY)
                .quantity(100)
                .orderType(OrderType.MKT)
                .status(OrderStatus.FILLED)
                .build();
        return new OrderEvent(this, order, type);
    }

    private double count(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("Order events drive the placed, failed, adopted and fill counters")
    void orderCounters() {
        engineMetrics.onOrderEvent(orderEvent(OrderEventType.PLACED));
        engineMetrics.onOrderEvent(orderEvent(OrderEventType.PLACED));
        engineMetrics.onOrderEvent(orderEvent(OrderEventType.REJECTED));
        engineMetrics.onOrderEvent(orderEvent(OrderEventType.FAILED));
        engineMetrics.onOrderEvent(orderEvent(OrderEventType.ADOPTED));
        engineMetrics.onOrderEvent(orderEvent(OrderEventType.PARTIALLY_FILLED));
        engineMetrics.onOrderEvent(orderEvent(OrderEventType.FILLED));
        engineMetrics.onOrderEvent(orderEvent(OrderEventType.CANCELLED));

        assertThat(count("orders.placed.count")).isEqualTo(2.0);
        assertThat(count("orders.failed.count")).isEqualTo(2.0);
        assertThat(count("orders.adopted.count")).isEqualTo(1.0);
        assertThat(count("fills.applied.count")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Dropped broker events and call timeouts are counted")
    void dropAndTimeoutCounters() {
        engineMetrics.onBrokerEventDropped(new BrokerEventDroppedEvent(this, "UnknownOrder: 4242"));
        engineMetrics.onSessionEvent(new SessionEvent(
                this, SessionEventType.CALL_TIMED_OUT, SessionState.CONNECTED, SessionState.CONNECTED, "submit"));
        engineMetrics.onSessionEvent(new SessionEvent(
                this, SessionEventType.SESSION_DISCONNECTED, SessionState.CONNECTED, SessionState.DISCONNECTED, null));

        assertThat(count("broker.events.dropped.count")).isEqualTo(1.0);
        assertThat(count("broker.calls.timed_out.count")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("broker.session.state reads 1 while the session is active")
    void sessionGauge() {
        assertThat(meterRegistry.get("broker.session.state").gauge().value()).isEqualTo(0.0);

        when(sessionHealthService.isSessionActive()).thenReturn(true);

        assertThat(meterRegistry.get("broker.session.state").gauge().value()).isEqualTo(1.0);
    }
}
