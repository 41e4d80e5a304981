package com.tradedesk.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradedesk.config.EngineProperties;
import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.StockInstrument;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.exception.BrokerException;
import com.tradedesk.exception.BrokerTimeoutException;
import com.tradedesk.exception.BrokerUnavailableException;
import com.tradedesk.exception.ErrorCode;
import com.tradedesk.exception.ResourceNotFoundException;
import com.tradedesk.exception.ValidationException;
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
import com.tradedesk.repository.AccountValueRepository;
import com.tradedesk.repository.AuditLogRepository;
import com.tradedesk.repository.FillRepository;
import com.tradedesk.repository.OrderRepository;
import com.tradedesk.repository.PositionRepository;
import com.tradedesk.session.SessionGuard;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link OrderCommandService} with a real ledger and state machine and a
 * mocked {@link SessionGuard}.
 */
@ExtendWith(MockitoExtension.class)
class OrderCommandServiceTest {

    @Mock
    private SessionGuard sessionGuard;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private OrderLedger orderLedger;
    private OrderIdRegistry orderIdRegistry;
    private OrderCommandService service;

    @BeforeEach
    void setUp() {
        EngineProperties engineProperties = new EngineProperties();
        orderLedger = new OrderLedger(
                new OrderRepository(),
                new FillRepository(),
                new PositionRepository(),
                new AccountValueRepository(),
                new AuditLogRepository(),
                engineProperties,
                Clock.systemUTC());
        orderIdRegistry = new OrderIdRegistry(orderLedger);
        service = new OrderCommandService(
                orderLedger,
                orderIdRegistry,
                new OrderStateMachine(),
                new OrderRequestValidator(),
                new OrderCommandLocks(engineProperties),
                sessionGuard,
                eventPublisherHelper);
    }

    private static OrderRequest marketBuy(String symbol, int quantity) {
        return OrderRequest.builder()
                .symbol(symbol)
                .side("BUY")
                .quantity(quantity)
                .orderType("MKT")
                .build();
    }

    @SuppressWarnings("unchecked")
    private void awaitCompletesNormally() {
        when(sessionGuard.await(any(), any())).thenAnswer(invocation -> {
            CompletableFuture<Object> future = invocation.getArgument(1);
            return future.join();
        });
    }

    /** Stores a working order bound to a broker id, as if it had been placed and acked. */
    private long storeOrder(OrderStatus status, int quantity, int filled, long brokerOrderId) {
        long orderId = orderIdRegistry.allocate();
        orderLedger.putOrder(Order.builder()
                .orderId(orderId)
                .brokerOrderId(brokerOrderId)
                .instrument(new StockInstrument("AAPL"))
                .side(OrderSide.BUY)
                .quantity(quantity)
                .filledQty(filled)
                .avgPrice(filled > 0 ? new BigDecimal("190.00") : null)
                .orderType(OrderType.LMT)
                .price(new BigDecimal("190.00"))
                .status(status)
                .build());
        orderIdRegistry.bind(orderId, brokerOrderId);
        return orderId;
    }

    // ---- Place ----

    @Test
    @DisplayName("Place stores the order, binds the broker id and publishes PLACED")
    void placeBindsBrokerId() {
        when(sessionGuard.dispatchSubmit(any())).thenReturn(CompletableFuture.completedFuture(1000L));
        awaitCompletesNormally();

        PlaceOrderResult result = service.placeStockOrder(marketBuy("AAPL", 100));

        assertThat(result.getOrderId()).isEqualTo(1L);
        // not acked yet, so the order row has no broker id to report
        assertThat(result.getBrokerOrderId()).isNull();
        assertThat(result.getStatus()).isEqualTo(OrderStatus.PENDING_SUBMIT);
        assertThat(orderIdRegistry.resolve(1000L)).contains(1L);
        verify(eventPublisherHelper).publishOrderPlaced(any(), any(Order.class));
    }

    @Test
    @DisplayName("LMT without price is a validation error and nothing reaches the ledger or broker")
    void limitWithoutPriceRejected() {
        OrderRequest request = OrderRequest.builder()
                .symbol("AAPL")
                .side("BUY")
                .quantity(10)
                .orderType("LMT")
                .build();

        assertThatThrownBy(() -> service.placeStockOrder(request)).isInstanceOf(ValidationException.class);
        assertThat(orderLedger.listOrders(null)).isEmpty();
        verifyNoInteractions(sessionGuard);
    }

    @Test
    @DisplayName("Broker unavailable on submit stores the order as ERROR and propagates")
    void brokerUnavailableStoresError() {
        when(sessionGuard.dispatchSubmit(any())).thenThrow(new BrokerUnavailableException("Broker session is not connected"));

        assertThatThrownBy(() -> service.placeStockOrder(marketBuy("AAPL", 5)))
                .isInstanceOf(BrokerUnavailableException.class)
                .satisfies(e -> {
                    BrokerUnavailableException failure = (BrokerUnavailableException) e;
                    assertThat(failure.isRetryable()).isTrue();
                    assertThat(failure.getDetails()).containsEntry("order_id", 1L).containsEntry("status", "ERROR");
                });

        Order stored = orderLedger.getOrder(1L).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(OrderStatus.ERROR);
        assertThat(stored.getMessage()).contains("not connected");
        verify(eventPublisherHelper).publishOrderFailed(any(), any(Order.class), eq(OrderStatus.PENDING_SUBMIT));
    }

    @Test
    @DisplayName("Submit timeout leaves the order PENDING_SUBMIT and binds the late broker id")
    void submitTimeoutBindsLate() {
        CompletableFuture<Long> submission = new CompletableFuture<>();
        when(sessionGuard.dispatchSubmit(any())).thenReturn(submission);
        when(sessionGuard.await(eq("submit"), any())).thenThrow(new BrokerTimeoutException("submit timed out"));

        assertThatThrownBy(() -> service.placeStockOrder(marketBuy("AAPL", 5)))
                .isInstanceOf(BrokerTimeoutException.class)
                .satisfies(e -> assertThat(((BrokerTimeoutException) e).getDetails())
                        .containsEntry("order_id", 1L)
                        .containsEntry("status", "PENDING_SUBMIT"));

        Order stored = orderLedger.getOrder(1L).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(OrderStatus.PENDING_SUBMIT);
        assertThat(stored.getMessage()).isEqualTo("submit timed out");
        assertThat(orderIdRegistry.brokerIdOf(1L)).isEmpty();

        submission.complete(1007L);

        assertThat(orderIdRegistry.brokerIdOf(1L)).contains(1007L);
    }

    @Test
    @DisplayName("Submit failing after a timeout marks the order ERROR")
    void submitFailsAfterTimeout() {
        CompletableFuture<Long> submission = new CompletableFuture<>();
        when(sessionGuard.dispatchSubmit(any())).thenReturn(submission);
        when(sessionGuard.await(eq("submit"), any())).thenThrow(new BrokerTimeoutException("submit timed out"));

        assertThatThrownBy(() -> service.placeStockOrder(marketBuy("AAPL", 5)))
                .isInstanceOf(BrokerTimeoutException.class);
        submission.completeExceptionally(new BrokerException("Order rejected by gateway"));

        assertThat(orderLedger.getOrder(1L).orElseThrow().getStatus()).isEqualTo(OrderStatus.ERROR);
    }

    @Test
    @DisplayName("A broker error on submit names the order it left in ERROR")
    void brokerErrorCarriesOrder() {
        when(sessionGuard.dispatchSubmit(any())).thenReturn(new CompletableFuture<>());
        when(sessionGuard.await(eq("submit"), any())).thenThrow(new BrokerException("Order rejected by gateway"));

        assertThatThrownBy(() -> service.placeStockOrder(marketBuy("AAPL", 5)))
                .isInstanceOf(BrokerException.class)
                .satisfies(e -> assertThat(((BrokerException) e).getDetails())
                        .containsEntry("order_id", 1L)
                        .containsEntry("status", "ERROR"));
    }

    @Test
    @DisplayName("Concurrent placements get distinct consecutive ids and one ledger row each")
    void concurrentPlacements() throws Exception {
        AtomicLong brokerIds = new AtomicLong(1000L);
        when(sessionGuard.dispatchSubmit(any()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(brokerIds.getAndIncrement()));
        awaitCompletesNormally();

        int placements = 100;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PlaceOrderResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < placements; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return service.placeStockOrder(marketBuy("AAPL", 1));
                }));
            }
            start.countDown();

            Set<Long> orderIds = new HashSet<>();
            for (Future<PlaceOrderResult> result : results) {
                orderIds.add(result.get(10, TimeUnit.SECONDS).getOrderId());
            }
            assertThat(orderIds).hasSize(placements);
            assertThat(orderIds).containsExactlyInAnyOrderElementsOf(
                    LongStream.rangeClosed(1, placements).boxed().toList());
        } finally {
            executor.shutdownNow();
        }

        assertThat(orderLedger.listOrders(placements * 2)).hasSize(placements);
        for (long orderId = 1; orderId <= placements; orderId++) {
            assertThat(orderIdRegistry.brokerIdOf(orderId)).isPresent();
        }
        verify(eventPublisherHelper, times(placements)).publishOrderPlaced(any(), any(Order.class));
    }

    // ---- Cancel ----

    @Test
    @DisplayName("Cancel of a FILLED order is refused without a broker call")
    void cancelFilledRefused() {
        long orderId = storeOrder(OrderStatus.FILLED, 10, 10, 1000L);

        OrderCommandResult result = service.cancel(orderId);

        assertThat(result.isOk()).isFalse();
        assertThat(result.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INVALID_STATE);
        verify(sessionGuard, never()).dispatchCancel(anyLong());
    }

    @Test
    @DisplayName("Cancel of a working order moves it to CANCEL_REQUESTED")
    void cancelWorkingOrder() {
        long orderId = storeOrder(OrderStatus.ACKED, 10, 0, 1000L);
        when(sessionGuard.dispatchCancel(1000L)).thenReturn(CompletableFuture.completedFuture(null));
        awaitCompletesNormally();

        OrderCommandResult result = service.cancel(orderId);

        assertThat(result.isOk()).isTrue();
        assertThat(result.getStatus()).isEqualTo(OrderStatus.CANCEL_REQUESTED);
    }

    @Test
    @DisplayName("A failed cancel restores the prior status and propagates")
    void cancelFailureReverts() {
        long orderId = storeOrder(OrderStatus.PARTIALLY_FILLED, 10, 4, 1000L);
        when(sessionGuard.dispatchCancel(1000L)).thenReturn(new CompletableFuture<>());
        when(sessionGuard.await(eq("cancel"), any())).thenThrow(new BrokerException("Order not found"));

        assertThatThrownBy(() -> service.cancel(orderId)).isInstanceOf(BrokerException.class);

        Order stored = orderLedger.getOrder(orderId).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        assertThat(stored.getMessage()).contains("Order not found");
    }

    @Test
    @DisplayName("Cancel of an unknown order is NOT_FOUND")
    void cancelUnknown() {
        assertThatThrownBy(() -> service.cancel(42L)).isInstanceOf(ResourceNotFoundException.class);
    }

    // ---- Modify ----

    @Test
    @DisplayName("Modify below the filled quantity is refused without a broker call")
    void modifyBelowFilledRefused() {
        long orderId = storeOrder(OrderStatus.PARTIALLY_FILLED, 10, 6, 1000L);

        OrderCommandResult result =
                service.modify(orderId, OrderModification.builder().quantity(5).build());

        assertThat(result.isOk()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INVALID_MODIFICATION);
        assertThat(result.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        verify(sessionGuard, never()).dispatchModify(anyLong(), any());
    }

    @Test
    @DisplayName("An accepted modify is applied to the ledger and published")
    void modifyApplied() {
        long orderId = storeOrder(OrderStatus.ACKED, 10, 0, 1000L);
        OrderModification modification =
                OrderModification.builder().price(new BigDecimal("189.50")).build();
        when(sessionGuard.dispatchModify(1000L, modification)).thenReturn(CompletableFuture.completedFuture(null));
        awaitCompletesNormally();

        OrderCommandResult result = service.modify(orderId, modification);

        assertThat(result.isOk()).isTrue();
        assertThat(orderLedger.getOrder(orderId).orElseThrow().getPrice()).isEqualByComparingTo("189.50");
        verify(eventPublisherHelper).publishOrderModified(any(), any(Order.class));
    }

    @Test
    @DisplayName("A modify that times out is applied when the broker accepts it later")
    void modifyTimeoutAppliedLate() {
        long orderId = storeOrder(OrderStatus.ACKED, 10, 0, 1000L);
        OrderModification modification = OrderModification.builder().quantity(6).build();
        CompletableFuture<Void> call = new CompletableFuture<>();
        when(sessionGuard.dispatchModify(1000L, modification)).thenReturn(call);
        when(sessionGuard.await(eq("modify"), any())).thenThrow(new BrokerTimeoutException("modify timed out"));

        assertThatThrownBy(() -> service.modify(orderId, modification))
                .isInstanceOf(BrokerTimeoutException.class)
                .satisfies(e -> assertThat(((BrokerTimeoutException) e).getDetails())
                        .containsEntry("order_id", orderId)
                        .containsEntry("status", "ACKED"));
        assertThat(orderLedger.getOrder(orderId).orElseThrow().getQuantity()).isEqualTo(10);

        call.complete(null);

        Order stored = orderLedger.getOrder(orderId).orElseThrow();
        assertThat(stored.getQuantity()).isEqualTo(6);
        assertThat(stored.getMessage()).isNull();
        verify(eventPublisherHelper).publishOrderModified(any(), any(Order.class));
    }

    @Test
    @DisplayName("A modify that times out and then fails leaves the order unchanged with a message")
    void modifyTimeoutFailsLate() {
        long orderId = storeOrder(OrderStatus.ACKED, 10, 0, 1000L);
        OrderModification modification = OrderModification.builder().quantity(6).build();
        CompletableFuture<Void> call = new CompletableFuture<>();
        when(sessionGuard.dispatchModify(1000L, modification)).thenReturn(call);
        when(sessionGuard.await(eq("modify"), any())).thenThrow(new BrokerTimeoutException("modify timed out"));

        assertThatThrownBy(() -> service.modify(orderId, modification)).isInstanceOf(BrokerTimeoutException.class);
        call.completeExceptionally(new BrokerException("Order is no longer working"));

        Order stored = orderLedger.getOrder(orderId).orElseThrow();
        assertThat(stored.getQuantity()).isEqualTo(10);
        assertThat(stored.getStatus()).isEqualTo(OrderStatus.ACKED);
        assertThat(stored.getMessage()).isEqualTo("Modify failed: Order is no longer working");
        verify(eventPublisherHelper, never()).publishOrderModified(any(), any());
    }

    @Test
    @DisplayName("A modification with no fields is a validation error")
    void emptyModification() {
        long orderId = storeOrder(OrderStatus.ACKED, 10, 0, 1000L);

        assertThatThrownBy(() -> service.modify(orderId, OrderModification.builder().build()))
                .isInstanceOf(ValidationException.class);
    }
}
