package com.tradedesk.observability;

import com.tradedesk.event.BrokerEventDroppedEvent;
import com.tradedesk.event.OrderEvent;
import com.tradedesk.event.SessionEvent;
import com.tradedesk.event.SessionEventType;
import com.tradedesk.session.SessionHealthService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the engine's Micrometer metrics:
 * <ul>
 *   <li><b>orders.placed.count</b> (counter): every PLACED OrderEvent</li>
 *   <li><b>orders.failed.count</b> (counter): every REJECTED or FAILED OrderEvent</li>
 *   <li><b>orders.adopted.count</b> (counter): foreign orders taken into the ledger</li>
 *   <li><b>fills.applied.count</b> (counter): every PARTIALLY_FILLED or FILLED OrderEvent</li>
 *   <li><b>broker.events.dropped.count</b> (counter): broker events the reconciler discarded</li>
 *   <li><b>broker.calls.timed_out.count</b> (counter): broker calls that hit the call timeout</li>
 *   <li><b>broker.session.state</b> (gauge 0/1): whether the broker session is active</li>
 * </ul>
 *
 * <p>Counters are driven by Spring ApplicationEvent listeners; the gauge is evaluated by
 * Micrometer on scrape.
 */
@Service
public class EngineMetrics {

    private static final Logger log = LoggerFactory.getLogger(EngineMetrics.class);

    private final Counter ordersPlacedCounter;
    private final Counter ordersFailedCounter;
    private final Counter ordersAdoptedCounter;
    private final Counter fillsAppliedCounter;
    private final Counter brokerEventsDroppedCounter;
    private final Counter callTimeoutCounter;

    public EngineMetrics(MeterRegistry meterRegistry, SessionHealthService sessionHealthService) {
        this.ordersPlacedCounter = Counter.builder("orders.placed.count")
                .description("Total orders accepted by the broker")
                .register(meterRegistry);

        this.ordersFailedCounter = Counter.builder("orders.failed.count")
                .description("Total orders rejected by the broker or failed on submission")
                .register(meterRegistry);

        this.ordersAdoptedCounter = Counter.builder("orders.adopted.count")
                .description("Total orders entered outside the engine and adopted into the ledger")
                .register(meterRegistry);

        this.fillsAppliedCounter = Counter.builder("fills.applied.count")
                .description("Total executions applied to orders and positions")
                .register(meterRegistry);

        this.brokerEventsDroppedCounter = Counter.builder("broker.events.dropped.count")
                .description("Total broker events discarded by the reconciler")
                .register(meterRegistry);

        this.callTimeoutCounter = Counter.builder("broker.calls.timed_out.count")
                .description("Total broker calls that exceeded the call timeout")
                .register(meterRegistry);

        meterRegistry.gauge(
                "broker.session.state", sessionHealthService, service -> service.isSessionActive() ? 1.0 : 0.0);
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        switch (event.getEventType()) {
            case PLACED -> ordersPlacedCounter.increment();
            case REJECTED, FAILED -> ordersFailedCounter.increment();
            case ADOPTED -> ordersAdoptedCounter.increment();
            case PARTIALLY_FILLED, FILLED -> fillsAppliedCounter.increment();
            default -> {}
        }
    }

    @EventListener
    @Order(20)
    public void onBrokerEventDropped(BrokerEventDroppedEvent event) {
        brokerEventsDroppedCounter.increment();
        log.debug("Broker event drop counted: {}", event.getReason());
    }

    @EventListener
    @Order(20)
    public void onSessionEvent(SessionEvent event) {
        if (event.getEventType() == SessionEventType.CALL_TIMED_OUT) {
            callTimeoutCounter.increment();
        }
    }
}
