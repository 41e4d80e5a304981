package com.tradedesk.oms;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.model.Order;
import com.tradedesk.exception.InvalidModificationException;
import com.tradedesk.exception.InvalidStateException;
import com.tradedesk.exception.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/**
 * Single authority on order lifecycle transitions.
 *
 * <pre>
 * NEW -> PENDING_SUBMIT -> SUBMITTED -> ACKED -> PARTIALLY_FILLED -> FILLED
 *                 |            |           |            |
 *                 +------------+-----------+------------+--> CANCELLED | REJECTED | ERROR
 *
 * CANCEL_REQUESTED overlays SUBMITTED/ACKED/PARTIALLY_FILLED and resolves to CANCELLED,
 * or back to the remembered status if the broker refuses the cancel.
 * </pre>
 *
 * <p>Every method returns a mutation for {@link com.tradedesk.ledger.OrderLedger#updateOrder}.
 * The mutation runs under the ledger's write lock against the latest row, so the check and
 * the change are atomic. A mutation that throws leaves the row untouched; a mutation that
 * returns its input unchanged is a no-op (duplicate event).
 */
@Component
public class OrderStateMachine {

    static final int PRICE_SCALE = 6;

    private static final Set<OrderStatus> FILLABLE = EnumSet.of(
            OrderStatus.PENDING_SUBMIT,
            OrderStatus.SUBMITTED,
            OrderStatus.ACKED,
            OrderStatus.PARTIALLY_FILLED,
            OrderStatus.CANCEL_REQUESTED);

    /** NEW -> PENDING_SUBMIT. The only transition a client triggers directly. */
    public UnaryOperator<Order> markPendingSubmit() {
        return order -> {
            if (order.getStatus() != OrderStatus.NEW) {
                throw new InvalidStateException(order.getStatus(), "Order " + order.getOrderId() + " was already submitted");
            }
            order.setStatus(OrderStatus.PENDING_SUBMIT);
            return order;
        };
    }

    /** The submit call timed out: the order keeps its pre-call status, only the message changes. */
    public UnaryOperator<Order> annotate(String message) {
        return order -> {
            order.setMessage(message);
            return order;
        };
    }

    /** Broker acknowledgement: PENDING_SUBMIT -> SUBMITTED and record the broker order id. */
    public UnaryOperator<Order> acknowledge(long brokerOrderId) {
        return order -> {
            rejectIfTerminal(order, "ack");
            if (order.getBrokerOrderId() == null) {
                order.setBrokerOrderId(brokerOrderId);
            }
            if (order.getStatus() == OrderStatus.PENDING_SUBMIT || order.getStatus() == OrderStatus.NEW) {
                order.setStatus(OrderStatus.SUBMITTED);
            }
            return order;
        };
    }

    /**
     * Applies a broker status report already mapped to an engine status.
     * Reports that would move the order backwards are ignored.
     */
    public UnaryOperator<Order> applyBrokerStatus(OrderStatus reported, String message) {
        return order -> {
            OrderStatus current = order.getStatus();
            if (current.isTerminal()) {
                if (current == reported) {
                    return order;
                }
                throw new InvalidStateException(
                        current, "Order " + order.getOrderId() + " is " + current + ", ignoring broker status " + reported);
            }

            switch (reported) {
                case SUBMITTED -> {
                    if (current == OrderStatus.PENDING_SUBMIT) {
                        order.setStatus(OrderStatus.SUBMITTED);
                    }
                }
                case ACKED -> {
                    if (current == OrderStatus.PENDING_SUBMIT || current == OrderStatus.SUBMITTED) {
                        order.setStatus(OrderStatus.ACKED);
                    } else if (current == OrderStatus.CANCEL_REQUESTED
                            && order.getCancelPriorStatus() == OrderStatus.SUBMITTED) {
                        order.setCancelPriorStatus(OrderStatus.ACKED);
                    }
                }
                case CANCEL_REQUESTED -> {
                    if (current != OrderStatus.CANCEL_REQUESTED) {
                        order.setCancelPriorStatus(current == OrderStatus.PENDING_SUBMIT ? OrderStatus.SUBMITTED : current);
                        order.setStatus(OrderStatus.CANCEL_REQUESTED);
                    }
                }
                case CANCELLED -> {
                    order.setStatus(OrderStatus.CANCELLED);
                    order.setCancelPriorStatus(null);
                }
                case REJECTED, ERROR -> {
                    order.setStatus(reported);
                    order.setCancelPriorStatus(null);
                }
                default -> throw new InvalidStateException(current, "Broker status " + reported + " cannot be applied");
            }
            if (message != null && !message.isBlank()) {
                order.setMessage(message);
            }
            return order;
        };
    }

    /**
     * Applies one execution. Raises filledQty, recomputes the VWAP and moves the order to
     * FILLED when complete or PARTIALLY_FILLED otherwise. While a cancel is pending the
     * overlay stays and only the remembered status moves to PARTIALLY_FILLED.
     */
    public UnaryOperator<Order> applyFill(int quantity, BigDecimal price) {
        return order -> {
            if (quantity <= 0) {
                throw new ValidationException("Fill quantity must be positive, got " + quantity);
            }
            if (price == null || price.signum() <= 0) {
                throw new ValidationException("Fill price must be positive, got " + price);
            }
            if (!FILLABLE.contains(order.getStatus())) {
                throw new InvalidStateException(
                        order.getStatus(), "Order " + order.getOrderId() + " is " + order.getStatus() + ", fill dropped");
            }
            int newFilled = order.getFilledQty() + quantity;
            if (newFilled > order.getQuantity()) {
                throw new InvalidStateException(
                        order.getStatus(),
                        "Fill of " + quantity + " would exceed order quantity " + order.getQuantity()
                                + " (already filled " + order.getFilledQty() + ")");
            }

            BigDecimal previousNotional = order.getAvgPrice() == null
                    ? BigDecimal.ZERO
                    : order.getAvgPrice().multiply(BigDecimal.valueOf(order.getFilledQty()));
            BigDecimal avgPrice = previousNotional
                    .add(price.multiply(BigDecimal.valueOf(quantity)))
                    .divide(BigDecimal.valueOf(newFilled), PRICE_SCALE, RoundingMode.HALF_UP);

            order.setFilledQty(newFilled);
            order.setAvgPrice(avgPrice);

            if (newFilled == order.getQuantity()) {
                order.setStatus(OrderStatus.FILLED);
                order.setCancelPriorStatus(null);
            } else if (order.getStatus() == OrderStatus.CANCEL_REQUESTED) {
                order.setCancelPriorStatus(OrderStatus.PARTIALLY_FILLED);
            } else {
                order.setStatus(OrderStatus.PARTIALLY_FILLED);
            }
            return order;
        };
    }

    /** Broker rejected the order. Any non-terminal status becomes REJECTED. */
    public UnaryOperator<Order> reject(String message) {
        return terminate(OrderStatus.REJECTED, message);
    }

    /** Local or broker failure. Any non-terminal status becomes ERROR. */
    public UnaryOperator<Order> fail(String message) {
        return terminate(OrderStatus.ERROR, message);
    }

    /**
     * Client cancel: a working order moves to CANCEL_REQUESTED and remembers its status.
     *
     * @throws InvalidStateException if the order is terminal, already cancelling, or not yet
     *     acknowledged by the broker
     */
    public UnaryOperator<Order> requestCancel() {
        return order -> {
            checkCancellable(order);
            order.setCancelPriorStatus(order.getStatus());
            order.setStatus(OrderStatus.CANCEL_REQUESTED);
            order.setMessage(null);
            return order;
        };
    }

    /**
     * The cancel did not go through (broker refusal, failure or timeout): leave the overlay
     * and fall back to the remembered status. A no-op if the order has moved on.
     */
    public UnaryOperator<Order> revertCancel(String message) {
        return order -> {
            if (order.getStatus() != OrderStatus.CANCEL_REQUESTED) {
                return order;
            }
            OrderStatus prior = order.getCancelPriorStatus() != null
                    ? order.getCancelPriorStatus()
                    : order.getFilledQty() > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.SUBMITTED;
            order.setStatus(prior);
            order.setCancelPriorStatus(null);
            order.setMessage(message);
            return order;
        };
    }

    /** Applies an accepted modification. The order must still be working. */
    public UnaryOperator<Order> applyModification(OrderModification modification) {
        return order -> {
            checkModifiable(order, modification);
            if (modification.getQuantity() != null) {
                order.setQuantity(modification.getQuantity());
            }
            OrderType type = effectiveType(order, modification);
            order.setOrderType(type);
            if (!type.requiresPrice()) {
                order.setPrice(null);
            } else if (modification.getPrice() != null) {
                order.setPrice(modification.getPrice());
            }
            if (modification.getTif() != null) {
                order.setTif(modification.getTif());
            }
            if (order.getFilledQty() == order.getQuantity()) {
                order.setStatus(OrderStatus.FILLED);
            }
            order.setMessage(null);
            return order;
        };
    }

    /** Broker commission report for one execution. Amounts accumulate across executions. */
    public UnaryOperator<Order> applyCommission(BigDecimal commission, String currency, BigDecimal realizedPnl) {
        return order -> {
            if (commission != null) {
                order.setCommission(order.getCommission() == null ? commission : order.getCommission().add(commission));
            }
            if (currency != null) {
                order.setCommissionCurrency(currency);
            }
            if (realizedPnl != null) {
                order.setRealizedPnl(
                        order.getRealizedPnl() == null ? realizedPnl : order.getRealizedPnl().add(realizedPnl));
            }
            return order;
        };
    }

    public void checkCancellable(Order order) {
        OrderStatus status = order.getStatus();
        if (status == OrderStatus.CANCEL_REQUESTED) {
            throw new InvalidStateException(status, "Cancel already requested for order " + order.getOrderId());
        }
        if (status.isTerminal()) {
            throw new InvalidStateException(status, "Order " + order.getOrderId() + " is already " + status);
        }
        if (!status.isWorking()) {
            throw new InvalidStateException(
                    status, "Order " + order.getOrderId() + " is not yet acknowledged by the broker");
        }
    }

    /**
     * Guard run before the broker is contacted and again when the change is applied.
     *
     * @throws InvalidStateException        if the order is not working
     * @throws InvalidModificationException if the new quantity is below the filled quantity or
     *                                      the resulting order type lacks a positive price
     */
    public void checkModifiable(Order order, OrderModification modification) {
        OrderStatus status = order.getStatus();
        if (!status.isWorking()) {
            throw new InvalidStateException(status, "Order " + order.getOrderId() + " cannot be modified while " + status);
        }
        if (modification.getQuantity() != null && modification.getQuantity() < order.getFilledQty()) {
            throw new InvalidModificationException("New quantity " + modification.getQuantity()
                    + " is below filled quantity " + order.getFilledQty());
        }
        if (modification.getQuantity() != null && modification.getQuantity() <= 0) {
            throw new InvalidModificationException("New quantity must be positive");
        }
        OrderType type = effectiveType(order, modification);
        if (type.requiresPrice()) {
            BigDecimal price = modification.getPrice() != null ? modification.getPrice() : order.getPrice();
            if (price == null || price.signum() <= 0) {
                throw new InvalidModificationException(type + " orders need a positive price");
            }
        }
    }

    private static OrderType effectiveType(Order order, OrderModification modification) {
        return modification.getOrderType() != null ? modification.getOrderType() : order.getOrderType();
    }

    private static UnaryOperator<Order> terminate(OrderStatus target, String message) {
        return order -> {
            OrderStatus current = order.getStatus();
            if (current == target) {
                return order;
            }
            rejectIfTerminal(order, target.name());
            order.setStatus(target);
            order.setCancelPriorStatus(null);
            order.setMessage(message);
            return order;
        };
    }

    private static void rejectIfTerminal(Order order, String transition) {
        if (order.getStatus().isTerminal()) {
            throw new InvalidStateException(
                    order.getStatus(),
                    "Order " + order.getOrderId() + " is " + order.getStatus() + ", " + transition + " dropped");
        }
    }
}
