package com.tradedesk.reconciliation;

import com.tradedesk.broker.BrokerEvent;
import com.tradedesk.broker.BrokerEventChannel;
import com.tradedesk.broker.BrokerEventType;
import com.tradedesk.broker.BrokerOrderStatus;
import com.tradedesk.config.EngineProperties;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.OrderFill;
import com.tradedesk.domain.model.Position;
import com.tradedesk.domain.model.PositionKey;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.event.OrderEventType;
import com.tradedesk.exception.BaseException;
import com.tradedesk.exception.UnknownOrderException;
import com.tradedesk.ledger.OrderLedger;
import com.tradedesk.ledger.OrderUpdate;
import com.tradedesk.oms.OrderIdRegistry;
import com.tradedesk.oms.OrderStateMachine;
import com.tradedesk.session.SessionHealthService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Single consumer of the {@link BrokerEventChannel}.
 *
 * <p>Runs on one dedicated thread, so events are applied strictly in the order the broker
 * session published them and never concurrently with each other. For every order-scoped
 * event the broker order id is resolved through the {@link OrderIdRegistry}; events for an
 * id that is not bound yet are buffered and retried on every loop, and dropped with an
 * UnknownOrder warning after {@code tradedesk.reconciler.unknown-order-wait}.
 *
 * <p>Fills are deduplicated by exec id before the state machine sees them. The order row,
 * the fill row and the position are all written before the next event is taken.
 *
 * <p>No event stops the loop: anything that cannot be applied is logged and dropped.
 */
@Component
public class BrokerEventReconciler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BrokerEventReconciler.class);

    private final BrokerEventChannel brokerEventChannel;
    private final OrderIdRegistry orderIdRegistry;
    private final OrderStateMachine orderStateMachine;
    private final OrderLedger orderLedger;
    private final ForeignOrderAdopter foreignOrderAdopter;
    private final SessionHealthService sessionHealthService;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineProperties engineProperties;
    private final Clock clock;

    private final PendingEventBuffer pendingEvents = new PendingEventBuffer();
    private final Set<String> appliedCommissionExecIds = new HashSet<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consumerThread;

    public BrokerEventReconciler(
            BrokerEventChannel brokerEventChannel,
            OrderIdRegistry orderIdRegistry,
            OrderStateMachine orderStateMachine,
            OrderLedger orderLedger,
            ForeignOrderAdopter foreignOrderAdopter,
            SessionHealthService sessionHealthService,
            EventPublisherHelper eventPublisherHelper,
            EngineProperties engineProperties,
            Clock clock) {
        this.brokerEventChannel = brokerEventChannel;
        this.orderIdRegistry = orderIdRegistry;
        this.orderStateMachine = orderStateMachine;
        this.orderLedger = orderLedger;
        this.foreignOrderAdopter = foreignOrderAdopter;
        this.sessionHealthService = sessionHealthService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    // ---- Lifecycle ----

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            consumerThread = new Thread(this::processLoop, "broker-event-reconciler");
            consumerThread.setDaemon(true);
            consumerThread.start();
            log.info("BrokerEventReconciler started");
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (consumerThread != null) {
                consumerThread.interrupt();
            }
            log.info("BrokerEventReconciler stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // start before anything can submit orders
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void processLoop() {
        Duration pollInterval = engineProperties.getReconciler().getPollInterval();
        while (running.get()) {
            try {
                BrokerEvent event = brokerEventChannel.poll(pollInterval);
                if (event != null) {
                    process(event);
                }
                retryPending();
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.info("BrokerEventReconciler interrupted during shutdown");
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("BrokerEventReconciler interrupted unexpectedly, resuming");
            } catch (RuntimeException e) {
                log.error("BrokerEventReconciler loop error, continuing", e);
            }
        }
        if (pendingEvents.size() > 0) {
            log.warn("BrokerEventReconciler stopped with {} unresolved events buffered", pendingEvents.size());
        }
    }

    // ---- Processing ----

    /** Applies one event. Never throws. */
    public void process(BrokerEvent event) {
        try {
            dispatch(event);
        } catch (BaseException e) {
            drop(event, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure applying broker event {}", describe(event), e);
            drop(event, "unexpected failure: " + e.getMessage());
        }
    }

    /**
     * Re-resolves buffered events. Events whose id got bound are applied in arrival order;
     * ids still unbound after the wait are handed to the foreign-order policy when the broker
     * reported them as open orders, and dropped otherwise.
     */
    public void retryPending() {
        if (pendingEvents.size() == 0) {
            return;
        }
        for (Long brokerOrderId : pendingEvents.brokerOrderIds()) {
            Optional<Long> orderId = orderIdRegistry.resolve(brokerOrderId);
            if (orderId.isPresent()) {
                applyBuffered(brokerOrderId, orderId.get());
            }
        }

        Duration wait = engineProperties.getReconciler().getUnknownOrderWait();
        for (Long brokerOrderId : pendingEvents.expired(clock.instant(), wait)) {
            expire(brokerOrderId);
        }
    }

    public int getPendingEventCount() {
        return pendingEvents.size();
    }

    private void dispatch(BrokerEvent event) {
        if (event == null || event.getType() == null) {
            drop(event, "malformed event");
            return;
        }
        switch (event.getType()) {
            case POSITION_SNAPSHOT -> applyPositionSnapshot(event);
            case ACCOUNT_VALUE_SNAPSHOT -> applyAccountValue(event);
            case CONNECTION_LOST -> sessionHealthService.onConnectionLost(messageOr(event, "Broker reported connection lost"));
            case CONNECTION_RESTORED -> sessionHealthService.onConnectionRestored(
                    messageOr(event, "Broker reported connection restored"));
            default -> dispatchOrderEvent(event);
        }
    }

    private void dispatchOrderEvent(BrokerEvent event) {
        Long brokerOrderId = event.getBrokerOrderId();
        if (brokerOrderId == null) {
            drop(event, "order event without brokerOrderId");
            return;
        }
        Optional<Long> orderId = orderIdRegistry.resolve(brokerOrderId);
        if (orderId.isEmpty()) {
            pendingEvents.add(event, clock.instant());
            log.debug("Buffered {} for unbound brokerOrderId={}", event.getType(), brokerOrderId);
            return;
        }
        // anything buffered for this id arrived earlier and goes first
        if (pendingEvents.contains(brokerOrderId)) {
            applyBuffered(brokerOrderId, orderId.get());
        }
        applyOrderEvent(orderId.get(), event);
    }

    private void applyBuffered(long brokerOrderId, long orderId) {
        List<BrokerEvent> buffered = pendingEvents.drain(brokerOrderId);
        log.debug("Applying {} buffered events for brokerOrderId={} -> orderId={}", buffered.size(), brokerOrderId, orderId);
        for (BrokerEvent event : buffered) {
            applyGuarded(orderId, event);
        }
    }

    private void expire(long brokerOrderId) {
        List<BrokerEvent> buffered = pendingEvents.drain(brokerOrderId);
        Optional<BrokerEvent> openOrder = buffered.stream()
                .filter(event -> event.getType() == BrokerEventType.OPEN_ORDER)
                .findFirst();

        Optional<Long> adopted = Optional.empty();
        if (openOrder.isPresent()) {
            try {
                adopted = foreignOrderAdopter.handle(openOrder.get(), fillQtyBefore(buffered, openOrder.get()));
            } catch (BaseException e) {
                log.warn("Foreign order brokerOrderId={} could not be adopted: {}", brokerOrderId, e.getMessage());
            }
        }

        if (adopted.isPresent()) {
            for (BrokerEvent event : buffered) {
                if (event.getType() != BrokerEventType.OPEN_ORDER) {
                    applyGuarded(adopted.get(), event);
                }
            }
            return;
        }

        String reason = new UnknownOrderException(brokerOrderId).getMessage();
        for (BrokerEvent event : buffered) {
            if (event.getType() == BrokerEventType.OPEN_ORDER) {
                continue;
            }
            drop(event, "UnknownOrder: " + reason);
        }
    }

    /** Executions buffered ahead of the open order report, which its cumulative filled quantity includes. */
    private static int fillQtyBefore(List<BrokerEvent> buffered, BrokerEvent openOrder) {
        Set<String> execIds = new HashSet<>();
        int quantity = 0;
        for (BrokerEvent event : buffered) {
            if (event == openOrder) {
                break;
            }
            if (event.getType().isFill()
                    && event.getQuantity() != null
                    && execIds.add(String.valueOf(event.getExecId()))) {
                quantity += event.getQuantity();
            }
        }
        return quantity;
    }

    private void applyGuarded(long orderId, BrokerEvent event) {
        try {
            applyOrderEvent(orderId, event);
        } catch (BaseException e) {
            drop(event, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure applying broker event {}", describe(event), e);
            drop(event, "unexpected failure: " + e.getMessage());
        }
    }

    private void applyOrderEvent(long orderId, BrokerEvent event) {
        switch (event.getType()) {
            case ACK -> applyTransition(
                    orderId, orderStateMachine.acknowledge(event.getBrokerOrderId()), OrderEventType.ACKNOWLEDGED);
            case PARTIAL_FILL, FILL -> applyFill(orderId, event);
            case STATUS -> applyStatus(orderId, event);
            case REJECT -> applyTransition(
                    orderId, orderStateMachine.reject(messageOr(event, "Rejected by broker")), OrderEventType.REJECTED);
            case ERROR -> applyTransition(
                    orderId, orderStateMachine.fail(messageOr(event, "Broker error")), OrderEventType.FAILED);
            case CANCEL_REJECT -> applyTransition(
                    orderId,
                    orderStateMachine.revertCancel(messageOr(event, "Cancel rejected by broker")),
                    null);
            case COMMISSION -> applyCommission(orderId, event);
            case OPEN_ORDER -> log.debug("Open order report for known orderId={} ignored", orderId);
            default -> drop(event, "unsupported order event type");
        }
    }

    private void applyStatus(long orderId, BrokerEvent event) {
        if (BrokerOrderStatus.isFilled(event.getStatus())) {
            log.debug("Filled status for orderId={} ignored; executions drive fills", orderId);
            return;
        }
        Optional<OrderStatus> mapped = BrokerOrderStatus.toOrderStatus(event.getStatus());
        if (mapped.isEmpty()) {
            drop(event, "unknown broker status '" + event.getStatus() + "'");
            return;
        }
        OrderEventType eventType = switch (mapped.get()) {
            case CANCELLED -> OrderEventType.CANCELLED;
            case ERROR -> OrderEventType.FAILED;
            default -> null;
        };
        applyTransition(orderId, orderStateMachine.applyBrokerStatus(mapped.get(), event.getMessage()), eventType);
    }

    private void applyFill(long orderId, BrokerEvent event) {
        String execId = event.getExecId();
        if (execId == null || execId.isBlank() || event.getQuantity() == null || event.getPrice() == null) {
            drop(event, "fill without execId, quantity or price");
            return;
        }
        if (orderLedger.hasFill(orderId, execId)) {
            log.debug("Duplicate fill execId={} for orderId={} ignored", execId, orderId);
            return;
        }

        OrderUpdate update = orderLedger.updateOrder(
                orderId, orderStateMachine.applyFill(event.getQuantity(), event.getPrice()));
        Order order = update.after();
        Instant fillTime = event.getOccurredAt() != null ? event.getOccurredAt() : clock.instant();

        orderLedger.appendFill(OrderFill.builder()
                .orderId(orderId)
                .execId(execId)
                .price(event.getPrice())
                .filledQty(event.getQuantity())
                .symbol(order.getSymbol())
                .side(order.getSide())
                .time(event.getTime())
                .brokerOrderId(event.getBrokerOrderId())
                .build());

        orderLedger.applyPositionFill(
                positionKey(order, event), order.getSide(), event.getQuantity(), event.getPrice(), fillTime);

        OrderEventType eventType =
                order.getStatus() == OrderStatus.FILLED ? OrderEventType.FILLED : OrderEventType.PARTIALLY_FILLED;
        eventPublisherHelper.publishOrderEvent(this, order, eventType, update.before().getStatus());
        log.info(
                "Fill applied: orderId={}, execId={}, qty={} @ {}, filled={}/{}, avg={}, status={}",
                orderId,
                execId,
                event.getQuantity(),
                event.getPrice(),
                order.getFilledQty(),
                order.getQuantity(),
                order.getAvgPrice(),
                order.getStatus());
    }

    private void applyCommission(long orderId, BrokerEvent event) {
        if (event.getExecId() != null && !appliedCommissionExecIds.add(orderId + ":" + event.getExecId())) {
            log.debug("Duplicate commission report execId={} for orderId={} ignored", event.getExecId(), orderId);
            return;
        }
        orderLedger.updateOrder(
                orderId,
                orderStateMachine.applyCommission(event.getCommission(), event.getCurrency(), event.getRealizedPnl()));
    }

    private void applyTransition(long orderId, UnaryOperator<Order> transition, OrderEventType eventType) {
        OrderUpdate update = orderLedger.updateOrder(orderId, transition);
        if (!update.changed()) {
            log.debug("Event for orderId={} was a no-op (status {})", orderId, update.after().getStatus());
            return;
        }
        log.info(
                "Order {} {} -> {}{}",
                orderId,
                update.before().getStatus(),
                update.after().getStatus(),
                update.after().getMessage() != null ? " (" + update.after().getMessage() + ")" : "");
        if (eventType != null) {
            eventPublisherHelper.publishOrderEvent(this, update.after(), eventType, update.before().getStatus());
        }
    }

    // ---- Snapshots ----

    private void applyPositionSnapshot(BrokerEvent event) {
        if (event.getSymbol() == null || event.getPosition() == null) {
            drop(event, "position snapshot without symbol or position");
            return;
        }
        Position snapshot = Position.builder()
                .account(event.getAccount() != null ? event.getAccount() : engineProperties.getBroker().getAccount())
                .symbol(event.getSymbol())
                .secType(event.getSecType() != null ? event.getSecType() : "STK")
                .exchange(event.getExchange() != null ? event.getExchange() : engineProperties.getBroker().getExchange())
                .conId(event.getConId() != null ? event.getConId() : 0L)
                .position(event.getPosition())
                .avgCost(event.getAvgCost())
                .snapshotAt(event.getOccurredAt() != null ? event.getOccurredAt() : clock.instant())
                .build();
        orderLedger.applyPositionSnapshot(snapshot);
    }

    private void applyAccountValue(BrokerEvent event) {
        if (event.getTag() == null) {
            drop(event, "account value without tag");
            return;
        }
        orderLedger.upsertAccountValue(
                event.getAccount() != null ? event.getAccount() : engineProperties.getBroker().getAccount(),
                event.getTag(),
                event.getCurrency() != null ? event.getCurrency() : "",
                event.getValue());
    }

    // ---- Helpers ----

    private PositionKey positionKey(Order order, BrokerEvent event) {
        return new PositionKey(
                event.getAccount() != null ? event.getAccount() : engineProperties.getBroker().getAccount(),
                order.getSymbol(),
                order.getAssetClass().name(),
                event.getExchange() != null ? event.getExchange() : engineProperties.getBroker().getExchange(),
                event.getConId() != null ? event.getConId() : 0L);
    }

    private void drop(BrokerEvent event, String reason) {
        log.warn("Dropped broker event {}: {}", describe(event), reason);
        eventPublisherHelper.publishBrokerEventDropped(this, reason);
    }

    private static String messageOr(BrokerEvent event, String fallback) {
        return event.getMessage() != null && !event.getMessage().isBlank() ? event.getMessage() : fallback;
    }

    private static String describe(BrokerEvent event) {
        if (event == null) {
            return "null";
        }
        return event.getType() + "[brokerOrderId=" + event.getBrokerOrderId()
                + (event.getExecId() != null ? ", execId=" + event.getExecId() : "")
                + (event.getStatus() != null ? ", status=" + event.getStatus() : "") + "]";
    }
}
