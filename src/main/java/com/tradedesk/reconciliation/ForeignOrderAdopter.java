package com.tradedesk.reconciliation;

import com.tradedesk.broker.BrokerEvent;
import com.tradedesk.broker.BrokerOrderStatus;
import com.tradedesk.config.EngineProperties;
import com.tradedesk.domain.enums.ForeignOrderPolicy;
import com.tradedesk.domain.enums.OptionRight;
import com.tradedesk.domain.enums.OrderOrigin;
import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TimeInForce;
import com.tradedesk.domain.model.Instrument;
import com.tradedesk.domain.model.OptionInstrument;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.StockInstrument;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.exception.ValidationException;
import com.tradedesk.ledger.OrderLedger;
import com.tradedesk.oms.OrderIdRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides what happens to an open order the broker reports but the engine never placed,
 * e.g. one entered through the broker's own UI.
 *
 * <p>Under {@link ForeignOrderPolicy#ADOPT} the order is written to the ledger with origin
 * ADOPTED, a fresh internal id and a binding, and is tracked like any other order from then
 * on. Under {@link ForeignOrderPolicy#IGNORE} it is logged and left alone.
 */
@Component
public class ForeignOrderAdopter {

    private static final Logger log = LoggerFactory.getLogger(ForeignOrderAdopter.class);

    private final OrderLedger orderLedger;
    private final OrderIdRegistry orderIdRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineProperties engineProperties;

    public ForeignOrderAdopter(
            OrderLedger orderLedger,
            OrderIdRegistry orderIdRegistry,
            EventPublisherHelper eventPublisherHelper,
            EngineProperties engineProperties) {
        this.orderLedger = orderLedger;
        this.orderIdRegistry = orderIdRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineProperties = engineProperties;
    }

    public ForeignOrderPolicy getPolicy() {
        return engineProperties.getReconciler().getForeignOrderPolicy();
    }

    /**
     * Applies the configured policy to an OPEN_ORDER event for an unbound broker order id.
     *
     * <p>The broker's filled quantity is cumulative. Executions the reconciler is about to
     * replay ({@code replayedFillQty}) are already part of it, so only the remainder is seeded
     * into the ledger; the replayed fills then bring filledQty and avgPrice up to date.
     *
     * @param replayedFillQty quantity of the buffered executions that preceded the open order report
     * @return the internal id of the adopted order, empty if it was ignored
     * @throws ValidationException if the event lacks the fields needed to build an order, or reports
     *     fills that are not replayed without an average price
     */
    public Optional<Long> handle(BrokerEvent event, int replayedFillQty) {
        if (getPolicy() == ForeignOrderPolicy.IGNORE) {
            log.info(
                    "Ignoring foreign order brokerOrderId={} ({} {} {})",
                    event.getBrokerOrderId(),
                    event.getSide(),
                    event.getQuantity(),
                    event.getSymbol());
            return Optional.empty();
        }

        Order order = toOrder(event, replayedFillQty);
        long orderId = orderIdRegistry.allocate();
        order.setOrderId(orderId);
        orderLedger.putOrder(order);
        orderIdRegistry.bind(orderId, event.getBrokerOrderId());

        Order stored = orderLedger.getOrder(orderId).orElse(order);
        eventPublisherHelper.publishOrderAdopted(this, stored);
        log.info(
                "Adopted foreign order brokerOrderId={} as orderId={} ({} {} {}, status={})",
                event.getBrokerOrderId(),
                orderId,
                stored.getSide(),
                stored.getQuantity(),
                stored.getSymbol(),
                stored.getStatus());
        return Optional.of(orderId);
    }

    Order toOrder(BrokerEvent event, int replayedFillQty) {
        if (event.getSymbol() == null || event.getSymbol().isBlank()) {
            throw new ValidationException("Foreign order has no symbol");
        }
        if (event.getQuantity() == null || event.getQuantity() <= 0) {
            throw new ValidationException("Foreign order has no positive quantity");
        }
        OrderSide side = parseEnum(OrderSide.class, event.getSide(), "side");
        OrderType orderType = event.getOrderType() != null
                ? parseEnum(OrderType.class, event.getOrderType(), "order type")
                : event.getPrice() != null ? OrderType.LMT : OrderType.MKT;
        TimeInForce tif = event.getTif() != null ? parseEnum(TimeInForce.class, event.getTif(), "tif") : TimeInForce.DAY;

        int quantity = event.getQuantity();
        int reported = event.getFilledQuantity() != null ? Math.min(Math.max(event.getFilledQuantity(), 0), quantity) : 0;
        int filled = Math.max(0, reported - Math.max(replayedFillQty, 0));
        if (filled > 0 && event.getAvgCost() == null) {
            throw new ValidationException("Foreign order reports " + filled + " filled without an average price");
        }

        OrderStatus status = BrokerOrderStatus.toOrderStatus(event.getStatus())
                .filter(OrderStatus::isWorking)
                .orElse(OrderStatus.ACKED);
        if (filled == quantity) {
            status = OrderStatus.FILLED;
        } else if (filled > 0) {
            status = OrderStatus.PARTIALLY_FILLED;
        }

        return Order.builder()
                .brokerOrderId(event.getBrokerOrderId())
                .instrument(toInstrument(event))
                .side(side)
                .quantity(quantity)
                .orderType(orderType)
                .price(orderType.requiresPrice() ? event.getPrice() : null)
                .tif(tif)
                .status(status)
                .filledQty(filled)
                .avgPrice(filled > 0 ? event.getAvgCost() : null)
                .message(reported > 0 ? "Adopted from broker with " + reported + " filled" : "Adopted from broker")
                .origin(OrderOrigin.ADOPTED)
                .build();
    }

    private static Instrument toInstrument(BrokerEvent event) {
        if ("OPT".equals(event.getSecType())) {
            if (event.getExpiry() == null || event.getStrike() == null || event.getRight() == null) {
                throw new ValidationException("Foreign option order lacks expiry, strike or right");
            }
            return new OptionInstrument(
                    event.getSymbol(), event.getExpiry(), event.getStrike(), parseEnum(OptionRight.class, event.getRight(), "right"));
        }
        return new StockInstrument(event.getSymbol());
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        if (value == null) {
            throw new ValidationException("Foreign order has no " + field);
        }
        try {
            return Enum.valueOf(type, value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Foreign order has unsupported " + field + " '" + value + "'");
        }
    }
}
