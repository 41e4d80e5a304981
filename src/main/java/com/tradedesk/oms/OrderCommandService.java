package com.tradedesk.oms;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.model.AccountValue;
import com.tradedesk.domain.model.AuditEntry;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.OrderFill;
import com.tradedesk.domain.model.Position;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.exception.AlreadyBoundException;
import com.tradedesk.exception.BaseException;
import com.tradedesk.exception.BrokerTimeoutException;
import com.tradedesk.exception.ErrorCode;
import com.tradedesk.exception.InvalidModificationException;
import com.tradedesk.exception.InvalidStateException;
import com.tradedesk.exception.ResourceNotFoundException;
import com.tradedesk.ledger.OrderLedger;
import com.tradedesk.ledger.OrderUpdate;
import com.tradedesk.session.SessionGuard;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for client commands: place, cancel, modify, and the read-only queries.
 *
 * <p>Commands for one order are serialized by {@link OrderCommandLocks}; commands for
 * different orders run concurrently and meet again only at the {@link SessionGuard}.
 * Every order mutation goes through the {@link OrderStateMachine}.
 *
 * <p>Place returns as soon as the broker accepted the submit. Acks and fills are applied
 * later by the reconciler.
 */
@Service
public class OrderCommandService {

    private static final Logger log = LoggerFactory.getLogger(OrderCommandService.class);

    private final OrderLedger orderLedger;
    private final OrderIdRegistry orderIdRegistry;
    private final OrderStateMachine orderStateMachine;
    private final OrderRequestValidator orderRequestValidator;
    private final OrderCommandLocks orderCommandLocks;
    private final SessionGuard sessionGuard;
    private final EventPublisherHelper eventPublisherHelper;

    public OrderCommandService(
            OrderLedger orderLedger,
            OrderIdRegistry orderIdRegistry,
            OrderStateMachine orderStateMachine,
            OrderRequestValidator orderRequestValidator,
            OrderCommandLocks orderCommandLocks,
            SessionGuard sessionGuard,
            EventPublisherHelper eventPublisherHelper) {
        this.orderLedger = orderLedger;
        this.orderIdRegistry = orderIdRegistry;
        this.orderStateMachine = orderStateMachine;
        this.orderRequestValidator = orderRequestValidator;
        this.orderCommandLocks = orderCommandLocks;
        this.sessionGuard = sessionGuard;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ---- Place ----

    /**
     * Validates, stores and submits a stock order.
     *
     * @throws com.tradedesk.exception.ValidationException        before anything is stored
     * @throws com.tradedesk.exception.BrokerUnavailableException order stored as ERROR
     * @throws com.tradedesk.exception.BrokerException            order stored as ERROR
     * @throws BrokerTimeoutException                             order left PENDING_SUBMIT
     */
    public PlaceOrderResult placeStockOrder(OrderRequest request) {
        return place(orderRequestValidator.validateStock(request));
    }

    /** Same contract as {@link #placeStockOrder}, with option contract fields validated too. */
    public PlaceOrderResult placeOptionOrder(OrderRequest request) {
        return place(orderRequestValidator.validateOption(request));
    }

    private PlaceOrderResult place(ValidatedOrderRequest request) {
        long orderId = orderIdRegistry.allocate();
        return orderCommandLocks.withLock(orderId, () -> submitNewOrder(orderId, request));
    }

    private PlaceOrderResult submitNewOrder(long orderId, ValidatedOrderRequest request) {
        orderLedger.putOrder(Order.builder()
                .orderId(orderId)
                .instrument(request.instrument())
                .side(request.side())
                .quantity(request.quantity())
                .orderType(request.orderType())
                .price(request.price())
                .tif(request.tif())
                .status(OrderStatus.NEW)
                .build());
        Order pending = orderLedger.updateOrder(orderId, orderStateMachine.markPendingSubmit()).after();

        log.info(
                "Placing order {}: {} {} {} x{} @ {} ({})",
                orderId,
                pending.getSide(),
                pending.getOrderType(),
                pending.getSymbol(),
                pending.getQuantity(),
                pending.getPrice(),
                pending.getTif());

        CompletableFuture<Long> submission;
        try {
            submission = sessionGuard.dispatchSubmit(pending);
        } catch (BaseException e) {
            failOrder(orderId, e.getMessage());
            throw withOrderContext(e, orderId);
        }

        long brokerOrderId;
        try {
            brokerOrderId = sessionGuard.await("submit", submission);
        } catch (BrokerTimeoutException e) {
            orderLedger.updateOrder(orderId, orderStateMachine.annotate(e.getMessage()));
            submission.whenComplete((lateId, failure) -> completeLate(orderId, lateId, failure));
            log.warn("Submit of order {} timed out; the binding is recorded if the broker answers", orderId);
            throw withOrderContext(e, orderId);
        } catch (BaseException e) {
            failOrder(orderId, e.getMessage());
            throw withOrderContext(e, orderId);
        }

        bindOrFail(orderId, brokerOrderId);

        Order current = orderLedger.getOrder(orderId).orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        eventPublisherHelper.publishOrderPlaced(this, current);
        log.info("Order {} submitted: brokerOrderId={}, status={}", orderId, brokerOrderId, current.getStatus());

        // the ledger row carries the broker id only once the ack has been applied
        return PlaceOrderResult.builder()
                .orderId(orderId)
                .brokerOrderId(current.getBrokerOrderId())
                .status(current.getStatus())
                .message(current.getMessage())
                .build();
    }

    private void bindOrFail(long orderId, long brokerOrderId) {
        try {
            orderIdRegistry.bind(orderId, brokerOrderId);
        } catch (AlreadyBoundException e) {
            log.error("Broker returned an id that is already in use for order {}", orderId, e);
            failOrder(orderId, e.getMessage());
            throw withOrderContext(e, orderId);
        }
    }

    /**
     * Finishes a submit whose caller already saw a timeout. Events that arrived in the
     * meantime wait in the reconciler's buffer and are applied once the binding exists.
     */
    void completeLate(long orderId, Long brokerOrderId, Throwable failure) {
        if (failure != null) {
            Throwable cause = unwrap(failure);
            log.warn("Submit of order {} failed after timing out: {}", orderId, cause.getMessage());
            failOrder(orderId, "Submit failed: " + cause.getMessage());
            return;
        }
        try {
            orderIdRegistry.bind(orderId, brokerOrderId);
            log.info("Late submit result for order {}: brokerOrderId={}", orderId, brokerOrderId);
        } catch (AlreadyBoundException e) {
            log.error("Late submit result for order {} could not be bound", orderId, e);
            failOrder(orderId, e.getMessage());
        }
    }

    private BaseException withOrderContext(BaseException e, long orderId) {
        return e.withOrder(orderId, orderLedger.getOrder(orderId).map(Order::getStatus).orElse(null));
    }

    private void failOrder(long orderId, String message) {
        try {
            OrderUpdate update = orderLedger.updateOrder(orderId, orderStateMachine.fail(message));
            if (update.changed()) {
                eventPublisherHelper.publishOrderFailed(this, update.after(), update.before().getStatus());
            }
        } catch (InvalidStateException e) {
            log.warn("Order {} could not be marked ERROR: {}", orderId, e.getMessage());
        }
    }

    // ---- Cancel ----

    /**
     * Requests cancellation of a working order.
     *
     * <p>Refused with {@code ok=false} and no broker call when the order is terminal, already
     * cancelling, or not yet acknowledged. On a broker failure or timeout the order returns to
     * the status it had before the cancel and the failure propagates.
     *
     * @throws ResourceNotFoundException if the order does not exist
     */
    public OrderCommandResult cancel(long orderId) {
        return orderCommandLocks.withLock(orderId, () -> {
            Order order = requireOrder(orderId);
            try {
                orderStateMachine.checkCancellable(order);
            } catch (InvalidStateException e) {
                log.info("Cancel of order {} refused: {}", orderId, e.getMessage());
                return OrderCommandResult.refused(order.getStatus(), ErrorCode.INVALID_STATE, e.getMessage());
            }
            Optional<Long> brokerOrderId = orderIdRegistry.brokerIdOf(orderId);
            if (brokerOrderId.isEmpty()) {
                return OrderCommandResult.refused(
                        order.getStatus(), ErrorCode.INVALID_STATE, "Order " + orderId + " has no broker order id yet");
            }
            try {
                sessionGuard.requireConnected();
            } catch (BaseException e) {
                throw withOrderContext(e, orderId);
            }

            try {
                orderLedger.updateOrder(orderId, orderStateMachine.requestCancel());
            } catch (InvalidStateException e) {
                // the reconciler moved the order on between the check and the mark
                return OrderCommandResult.refused(requireOrder(orderId).getStatus(), ErrorCode.INVALID_STATE, e.getMessage());
            }

            try {
                sessionGuard.await("cancel", sessionGuard.dispatchCancel(brokerOrderId.get()));
            } catch (BaseException e) {
                orderLedger.updateOrder(orderId, orderStateMachine.revertCancel("Cancel failed: " + e.getMessage()));
                log.warn("Cancel of order {} failed: {}", orderId, e.getMessage());
                throw withOrderContext(e, orderId);
            }

            Order current = requireOrder(orderId);
            log.info("Cancel requested for order {} (status={})", orderId, current.getStatus());
            return OrderCommandResult.accepted(current.getStatus(), "Cancel requested");
        });
    }

    // ---- Modify ----

    /**
     * Changes quantity, type, price or tif of a working order. Null fields are left alone.
     *
     * <p>The state and modification guards run before the broker is contacted; a refusal
     * returns {@code ok=false}. The change is applied to the ledger only after the broker
     * accepted it. After a timeout it is applied when the broker's answer finally arrives.
     *
     * @throws com.tradedesk.exception.ValidationException if no field is given or a value is malformed
     * @throws ResourceNotFoundException                   if the order does not exist
     */
    public OrderCommandResult modify(long orderId, OrderModification modification) {
        orderRequestValidator.validateModification(modification);
        return orderCommandLocks.withLock(orderId, () -> {
            Order order = requireOrder(orderId);
            Optional<OrderCommandResult> refusal = checkModifiable(order, modification);
            if (refusal.isPresent()) {
                return refusal.get();
            }
            Optional<Long> brokerOrderId = orderIdRegistry.brokerIdOf(orderId);
            if (brokerOrderId.isEmpty()) {
                return OrderCommandResult.refused(
                        order.getStatus(), ErrorCode.INVALID_STATE, "Order " + orderId + " has no broker order id yet");
            }

            CompletableFuture<Void> call;
            try {
                call = sessionGuard.dispatchModify(brokerOrderId.get(), modification);
            } catch (BaseException e) {
                throw modifyFailed(orderId, e);
            }
            try {
                sessionGuard.await("modify", call);
            } catch (BrokerTimeoutException e) {
                orderLedger.updateOrder(orderId, orderStateMachine.annotate(e.getMessage()));
                call.whenComplete((ignored, failure) -> completeModifyLate(orderId, modification, failure));
                log.warn("Modify of order {} timed out; it is applied if the broker accepts it later", orderId);
                throw withOrderContext(e, orderId);
            } catch (BaseException e) {
                throw modifyFailed(orderId, e);
            }

            return applyAcceptedModification(orderId, modification);
        });
    }

    private BaseException modifyFailed(long orderId, BaseException e) {
        orderLedger.updateOrder(orderId, orderStateMachine.annotate("Modify failed: " + e.getMessage()));
        log.warn("Modify of order {} failed: {}", orderId, e.getMessage());
        return withOrderContext(e, orderId);
    }

    private OrderCommandResult applyAcceptedModification(long orderId, OrderModification modification) {
        OrderUpdate update;
        try {
            update = orderLedger.updateOrder(orderId, orderStateMachine.applyModification(modification));
        } catch (InvalidStateException | InvalidModificationException e) {
            Order current = requireOrder(orderId);
            log.warn("Broker accepted modify of order {} but it is now {}: {}", orderId, current.getStatus(),
                    e.getMessage());
            return OrderCommandResult.refused(current.getStatus(), e.getErrorCode(), e.getMessage());
        }
        eventPublisherHelper.publishOrderModified(this, update.after());
        log.info("Order {} modified: {}", orderId, modification);
        return OrderCommandResult.accepted(update.after().getStatus(), "Order modified");
    }

    /**
     * Finishes a modify whose caller already saw a timeout. Runs on the broker session thread
     * without the command lock; the ledger update is atomic and re-runs the modification guard,
     * so a change that no longer fits the order is logged and dropped.
     */
    void completeModifyLate(long orderId, OrderModification modification, Throwable failure) {
        if (failure != null) {
            Throwable cause = unwrap(failure);
            log.warn("Modify of order {} failed after timing out: {}", orderId, cause.getMessage());
            orderLedger.updateOrder(orderId, orderStateMachine.annotate("Modify failed: " + cause.getMessage()));
            return;
        }
        log.info("Late modify result for order {}: accepted by the broker", orderId);
        applyAcceptedModification(orderId, modification);
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }

    private Optional<OrderCommandResult> checkModifiable(Order order, OrderModification modification) {
        try {
            orderStateMachine.checkModifiable(order, modification);
            return Optional.empty();
        } catch (InvalidStateException | InvalidModificationException e) {
            log.info("Modify of order {} refused: {}", order.getOrderId(), e.getMessage());
            return Optional.of(OrderCommandResult.refused(order.getStatus(), e.getErrorCode(), e.getMessage()));
        }
    }

    // ---- Queries ----

    public Order getOrder(long orderId) {
        return requireOrder(orderId);
    }

    public List<Order> listOrders(Integer limit) {
        return orderLedger.listOrders(limit);
    }

    public List<OrderFill> listFills(Long orderId, Integer limit) {
        return orderLedger.listFills(orderId, limit);
    }

    public List<Position> getPositions() {
        return orderLedger.listPositions();
    }

    public List<AccountValue> getAccountValues() {
        return orderLedger.listAccountValues();
    }

    public List<AuditEntry> listAuditEntries(Long sinceSeq, Integer limit) {
        return orderLedger.listAuditEntries(sinceSeq, limit);
    }

    private Order requireOrder(long orderId) {
        return orderLedger.getOrder(orderId).orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }
}
