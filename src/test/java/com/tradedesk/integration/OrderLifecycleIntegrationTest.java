package com.tradedesk.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

import com.tradedesk.broker.BrokerEvent;
import com.tradedesk.broker.BrokerEventChannel;
import com.tradedesk.broker.PaperBrokerSession;
import com.tradedesk.config.EngineProperties;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.model.AccountValue;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.Position;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.event.OrderEvent;
import com.tradedesk.exception.BrokerUnavailableException;
import com.tradedesk.exception.ErrorCode;
import com.tradedesk.ledger.OrderLedger;
import com.tradedesk.oms.OrderCommandLocks;
import com.tradedesk.oms.OrderCommandResult;
import com.tradedesk.oms.OrderCommandService;
import com.tradedesk.oms.OrderIdRegistry;
import com.tradedesk.oms.OrderModification;
import com.tradedesk.oms.OrderRequest;
import com.tradedesk.oms.OrderRequestValidator;
import com.tradedesk.oms.OrderStateMachine;
import com.tradedesk.oms.PlaceOrderResult;
import com.tradedesk.reconciliation.BrokerEventReconciler;
import com.tradedesk.reconciliation.ForeignOrderAdopter;
import com.tradedesk.repository.AccountValueRepository;
import com.tradedesk.repository.AuditLogRepository;
import com.tradedesk.repository.FillRepository;
import com.tradedesk.repository.OrderRepository;
import com.tradedesk.repository.PositionRepository;
import com.tradedesk.session.SessionGuard;
import com.tradedesk.session.SessionHealthService;
import com.tradedesk.session.SessionState;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Cross-service integration test for the order lifecycle.
 * Wires the real paper broker, SessionGuard, OrderCommandService, ledger and reconciler;
 * only the Spring event publisher is mocked. Broker events are drained from the channel
 * into the reconciler on the test thread.
 */
@ExtendWith(MockitoExtension.class)
class OrderLifecycleIntegrationTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private BrokerEventChannel brokerEventChannel;
    private PaperBrokerSession paperBrokerSession;
    private SessionHealthService sessionHealthService;
    private SessionGuard sessionGuard;
    private OrderLedger orderLedger;
    private OrderCommandService orderCommandService;
    private BrokerEventReconciler reconciler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        EngineProperties engineProperties = new EngineProperties();
        engineProperties.getSession().setCallTimeout(Duration.ofSeconds(2));
        engineProperties.getBroker().getPaper().getMarks().put("AAPL", new BigDecimal("190.20"));

        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(applicationEventPublisher);
        brokerEventChannel = new BrokerEventChannel();
        paperBrokerSession = new PaperBrokerSession(brokerEventChannel, engineProperties, clock);
        sessionHealthService = new SessionHealthService(paperBrokerSession, eventPublisherHelper, clock);
        sessionGuard = new SessionGuard(paperBrokerSession, sessionHealthService, engineProperties);

        orderLedger = new OrderLedger(
                new OrderRepository(),
                new FillRepository(),
                new PositionRepository(),
                new AccountValueRepository(),
                new AuditLogRepository(),
                engineProperties,
                clock);
        OrderIdRegistry orderIdRegistry = new OrderIdRegistry(orderLedger);
        OrderStateMachine orderStateMachine = new OrderStateMachine();

        orderCommandService = new OrderCommandService(
                orderLedger,
                orderIdRegistry,
                orderStateMachine,
                new OrderRequestValidator(),
                new OrderCommandLocks(engineProperties),
                sessionGuard,
                eventPublisherHelper);
        reconciler = new BrokerEventReconciler(
                brokerEventChannel,
                orderIdRegistry,
                orderStateMachine,
                orderLedger,
                new ForeignOrderAdopter(orderLedger, orderIdRegistry, eventPublisherHelper, engineProperties),
                sessionHealthService,
                eventPublisherHelper,
                engineProperties,
                clock);

        sessionGuard.connect();
    }

    @AfterEach
    void tearDown() {
        sessionGuard.destroy();
    }

    private void drainBrokerEvents() throws InterruptedException {
        BrokerEvent event;
        while ((event = brokerEventChannel.poll(Duration.ZERO)) != null) {
            reconciler.process(event);
        }
        reconciler.retryPending();
    }

    private static OrderRequest stockOrder(String side, int quantity, String orderType, String price) {
        return OrderRequest.builder()
                .symbol("AAPL")
                .side(side)
                .quantity(quantity)
                .orderType(orderType)
                .price(price != null ? new BigDecimal(price) : null)
                .build();
    }

    private Order order(long orderId) {
        return orderLedger.getOrder(orderId).orElseThrow();
    }

    @Test
    @DisplayName("MKT BUY AAPL x100 fills at the mark and opens a position")
    void marketOrderFills() throws Exception {
        PlaceOrderResult result = orderCommandService.placeStockOrder(stockOrder("BUY", 100, "MKT", null));

        assertThat(result.getBrokerOrderId()).isNull();

        drainBrokerEvents();

        Order filled = order(result.getOrderId());
        assertThat(filled.getBrokerOrderId()).isEqualTo(1000L);
        assertThat(filled.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(filled.getFilledQty()).isEqualTo(100);
        assertThat(filled.getAvgPrice()).isEqualByComparingTo("190.20");
        assertThat(filled.getCommission()).isEqualByComparingTo("1.00");
        assertThat(orderLedger.listFills(result.getOrderId(), null)).hasSize(1);

        Position position = orderLedger.listPositions().get(0);
        assertThat(position.getSymbol()).isEqualTo("AAPL");
        assertThat(position.getPosition()).isEqualByComparingTo("100");
        assertThat(position.getAccount()).isEqualTo("DU000000");

        verify(applicationEventPublisher, atLeastOnce()).publishEvent(any(OrderEvent.class));
    }

    @Test
    @DisplayName("A resting LMT order can be cancelled")
    void limitOrderCancelled() throws Exception {
        PlaceOrderResult result = orderCommandService.placeStockOrder(stockOrder("BUY", 10, "LMT", "150.00"));
        drainBrokerEvents();
        assertThat(order(result.getOrderId()).getStatus()).isEqualTo(OrderStatus.ACKED);

        OrderCommandResult cancel = orderCommandService.cancel(result.getOrderId());
        assertThat(cancel.isOk()).isTrue();

        drainBrokerEvents();

        Order cancelled = order(result.getOrderId());
        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(cancelled.getFilledQty()).isZero();
        assertThat(paperBrokerSession.getWorkingOrderCount()).isZero();
    }

    @Test
    @DisplayName("A resting LMT order fills at its limit when the mark crosses it")
    void limitOrderFillsOnMarkMove() throws Exception {
        PlaceOrderResult result = orderCommandService.placeStockOrder(stockOrder("BUY", 10, "LMT", "185.00"));
        drainBrokerEvents();

        paperBrokerSession.setMark("AAPL", new BigDecimal("184.50"));
        drainBrokerEvents();

        Order filled = order(result.getOrderId());
        assertThat(filled.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(filled.getAvgPrice()).isEqualByComparingTo("185.00");
    }

    @Test
    @DisplayName("Cancel of a filled order is refused without a broker call")
    void cancelFilledRefused() throws Exception {
        PlaceOrderResult result = orderCommandService.placeStockOrder(stockOrder("SELL", 5, "MKT", null));
        drainBrokerEvents();

        OrderCommandResult cancel = orderCommandService.cancel(result.getOrderId());

        assertThat(cancel.isOk()).isFalse();
        assertThat(cancel.getErrorCode()).isEqualTo(ErrorCode.INVALID_STATE);
        assertThat(cancel.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(brokerEventChannel.size()).isZero();
    }

    @Test
    @DisplayName("Modify changes the quantity of a resting order at the broker and in the ledger")
    void modifyRestingOrder() throws Exception {
        PlaceOrderResult result = orderCommandService.placeStockOrder(stockOrder("BUY", 10, "LMT", "150.00"));
        drainBrokerEvents();

        OrderCommandResult modify = orderCommandService.modify(
                result.getOrderId(), OrderModification.builder().quantity(20).build());
        drainBrokerEvents();

        assertThat(modify.isOk()).isTrue();
        Order modified = order(result.getOrderId());
        assertThat(modified.getQuantity()).isEqualTo(20);
        assertThat(modified.getStatus()).isEqualTo(OrderStatus.ACKED);
    }

    @Test
    @DisplayName("Cutting a partly filled order back to its filled quantity completes it")
    void modifyDownToFilledQuantity() throws Exception {
        PlaceOrderResult result = orderCommandService.placeStockOrder(stockOrder("BUY", 10, "LMT", "150.00"));
        drainBrokerEvents();
        paperBrokerSession.fillResting(order(result.getOrderId()).getBrokerOrderId(), 4);
        drainBrokerEvents();
        assertThat(order(result.getOrderId()).getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);

        OrderCommandResult modify = orderCommandService.modify(
                result.getOrderId(), OrderModification.builder().quantity(4).build());
        drainBrokerEvents();

        assertThat(modify.isOk()).isTrue();
        Order completed = order(result.getOrderId());
        assertThat(completed.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(completed.getQuantity()).isEqualTo(4);
        assertThat(completed.getFilledQty()).isEqualTo(4);
        assertThat(completed.getAvgPrice()).isEqualByComparingTo("150.00");
        assertThat(paperBrokerSession.getWorkingOrderCount()).isZero();
    }

    @Test
    @DisplayName("Snapshots refresh positions and account values")
    void snapshots() throws Exception {
        orderCommandService.placeStockOrder(stockOrder("BUY", 100, "MKT", null));
        drainBrokerEvents();

        sessionGuard.requestSnapshots();
        drainBrokerEvents();

        assertThat(orderLedger.listPositions()).singleElement()
                .satisfies(position -> assertThat(position.getPosition()).isEqualByComparingTo("100"));
        assertThat(orderLedger.listAccountValues())
                .extracting(AccountValue::getTag)
                .containsExactly("CashBalance");
    }

    @Test
    @DisplayName("After a connection loss new orders are stored as ERROR and refused")
    void connectionLoss() throws Exception {
        paperBrokerSession.simulateConnectionLoss();
        drainBrokerEvents();

        assertThat(sessionHealthService.getState()).isEqualTo(SessionState.CONNECTION_LOST);
        assertThatThrownBy(() -> orderCommandService.placeStockOrder(stockOrder("BUY", 1, "MKT", null)))
                .isInstanceOf(BrokerUnavailableException.class);
        assertThat(orderLedger.listOrders(null)).singleElement()
                .satisfies(failed -> assertThat(failed.getStatus()).isEqualTo(OrderStatus.ERROR));

        paperBrokerSession.simulateConnectionRestored();
        drainBrokerEvents();

        assertThat(sessionGuard.isConnected()).isTrue();
    }
}
