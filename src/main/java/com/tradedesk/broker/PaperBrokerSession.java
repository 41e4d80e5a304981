package com.tradedesk.broker;

import com.tradedesk.config.EngineProperties;
import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TimeInForce;
import com.tradedesk.domain.model.Instrument;
import com.tradedesk.domain.model.OptionInstrument;
import com.tradedesk.domain.model.Order;
import com.tradedesk.exception.BrokerException;
import com.tradedesk.oms.OrderModification;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper trading implementation of {@link BrokerSession}.
 *
 * <p>Keeps its own book of working orders and reports everything through the
 * {@link BrokerEventChannel} the way a live session would: an ACK plus a "Submitted"
 * status for every accepted order, then executions and commission reports.
 *
 * <p>Fill logic against the symbol's mark ({@code tradedesk.broker.paper.marks.*}, or the
 * default mark):
 * <ul>
 *   <li>MKT: fills immediately at the mark, split into {@code fill-slices} executions</li>
 *   <li>LMT BUY: fills when mark &lt;= limit price (at the limit price)</li>
 *   <li>LMT SELL: fills when mark &gt;= limit price (at the limit price)</li>
 *   <li>STP BUY: triggers when mark &gt;= stop price, fills at the mark</li>
 *   <li>STP SELL: triggers when mark &lt;= stop price, fills at the mark</li>
 * </ul>
 * Resting orders are re-checked whenever {@link #setMark} moves a price, and
 * {@link #fillResting} executes part of one.
 *
 * <p>Active when {@code tradedesk.broker.mode=PAPER} (the default).
 */
@Component
@ConditionalOnProperty(prefix = "tradedesk.broker", name = "mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperBrokerSession implements BrokerSession {

    private static final Logger log = LoggerFactory.getLogger(PaperBrokerSession.class);

    /** First broker order id handed out. Keeps paper ids visibly apart from internal ids. */
    static final long FIRST_BROKER_ORDER_ID = 1000L;

    /** Starting paper cash balance. */
    static final BigDecimal STARTING_CASH = new BigDecimal("1000000.00");

    private final BrokerEventChannel brokerEventChannel;
    private final EngineProperties.Broker brokerProperties;
    private final Clock clock;

    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicLong nextBrokerOrderId = new AtomicLong(FIRST_BROKER_ORDER_ID);
    private final Map<String, BigDecimal> marks = new ConcurrentHashMap<>();

    /** Every order this session accepted, by broker order id. */
    private final Map<Long, PaperOrder> book = new LinkedHashMap<>();

    /** Net paper position per contract. */
    private final Map<String, PaperPosition> positions = new LinkedHashMap<>();

    private BigDecimal cash = STARTING_CASH;

    public PaperBrokerSession(BrokerEventChannel brokerEventChannel, EngineProperties engineProperties, Clock clock) {
        this.brokerEventChannel = brokerEventChannel;
        this.brokerProperties = engineProperties.getBroker();
        this.clock = clock;
        this.marks.putAll(brokerProperties.getPaper().getMarks());
    }

    // ---- Connection ----

    @Override
    public void connect() {
        connected.set(true);
        log.info("Paper session connected (account {})", brokerProperties.getAccount());
    }

    @Override
    public void disconnect() {
        connected.set(false);
        log.info("Paper session disconnected");
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    /** Drops the connection as a network failure would, reporting it on the event channel. */
    public void simulateConnectionLoss() {
        connected.set(false);
        brokerEventChannel.publish(event(BrokerEventType.CONNECTION_LOST)
                .message("Paper session connection lost")
                .build());
        log.warn("Paper session connection loss simulated");
    }

    public void simulateConnectionRestored() {
        connected.set(true);
        brokerEventChannel.publish(event(BrokerEventType.CONNECTION_RESTORED)
                .message("Paper session connection restored")
                .build());
        log.info("Paper session connection restored");
    }

    // ---- Orders ----

    @Override
    public synchronized long submit(Order order) {
        requireConnected();
        long brokerOrderId = nextBrokerOrderId.getAndIncrement();
        PaperOrder paperOrder = new PaperOrder(brokerOrderId, order);
        book.put(brokerOrderId, paperOrder);

        brokerEventChannel.publish(event(BrokerEventType.ACK).brokerOrderId(brokerOrderId).build());
        publishStatus(paperOrder, BrokerOrderStatus.SUBMITTED, null);

        log.debug(
                "Paper order placed: {} {} {} qty={} @ {}",
                brokerOrderId,
                order.getSide(),
                order.getOrderType(),
                order.getQuantity(),
                order.getPrice());

        match(paperOrder);
        return brokerOrderId;
    }

    @Override
    public synchronized void cancel(long brokerOrderId) {
        requireConnected();
        PaperOrder paperOrder = requireWorking(brokerOrderId, "cancel");
        publishStatus(paperOrder, BrokerOrderStatus.PENDING_CANCEL, null);
        paperOrder.done = true;
        publishStatus(paperOrder, BrokerOrderStatus.CANCELLED, "Cancelled by request");
        log.debug("Paper order cancelled: {}", brokerOrderId);
    }

    @Override
    public synchronized void modify(long brokerOrderId, OrderModification modification) {
        requireConnected();
        PaperOrder paperOrder = requireWorking(brokerOrderId, "modify");

        if (modification.getQuantity() != null) {
            if (modification.getQuantity() < paperOrder.filled) {
                throw new BrokerException("Paper order " + brokerOrderId + " already has "
                        + paperOrder.filled + " filled; quantity " + modification.getQuantity() + " refused");
            }
            paperOrder.quantity = modification.getQuantity();
        }
        if (paperOrder.quantity == paperOrder.filled) {
            // cut back to what already executed: nothing left to work
            paperOrder.done = true;
            publishStatus(paperOrder, BrokerOrderStatus.FILLED, "Modified");
            log.debug("Paper order modified to its filled quantity: {}", brokerOrderId);
            return;
        }
        if (modification.getOrderType() != null) {
            paperOrder.orderType = modification.getOrderType();
            if (paperOrder.orderType == OrderType.MKT) {
                paperOrder.price = null;
            }
        }
        if (modification.getPrice() != null) {
            paperOrder.price = modification.getPrice();
        }
        if (modification.getTif() != null) {
            paperOrder.tif = modification.getTif();
        }
        if (paperOrder.orderType.requiresPrice() && paperOrder.price == null) {
            throw new BrokerException("Paper order " + brokerOrderId + " needs a price for " + paperOrder.orderType);
        }

        publishStatus(paperOrder, BrokerOrderStatus.SUBMITTED, "Modified");
        log.debug("Paper order modified: {}", brokerOrderId);
        match(paperOrder);
    }

    /**
     * Executes part of a resting LMT or STP order at its order price, as a thin book would.
     * The quantity is capped at what is still open.
     */
    public synchronized void fillResting(long brokerOrderId, int quantity) {
        PaperOrder paperOrder = requireWorking(brokerOrderId, "fill");
        if (paperOrder.orderType == OrderType.MKT || quantity <= 0) {
            throw new BrokerException("Paper order " + brokerOrderId + " cannot be filled by " + quantity);
        }
        execute(paperOrder, Math.min(quantity, paperOrder.quantity - paperOrder.filled), paperOrder.price);
        if (paperOrder.filled >= paperOrder.quantity) {
            paperOrder.done = true;
        }
    }

    /**
     * Moves the mark for a symbol and fills any resting order it crosses.
     */
    public synchronized void setMark(String symbol, BigDecimal mark) {
        marks.put(symbol, mark);
        for (PaperOrder paperOrder : new ArrayList<>(book.values())) {
            if (!paperOrder.done && paperOrder.instrument.symbol().equals(symbol)) {
                match(paperOrder);
            }
        }
    }

    public BigDecimal getMark(String symbol) {
        return marks.getOrDefault(symbol, brokerProperties.getPaper().getDefaultMark());
    }

    public synchronized int getWorkingOrderCount() {
        return (int) book.values().stream().filter(o -> !o.done).count();
    }

    // ---- Snapshots ----

    @Override
    public synchronized void requestSnapshots() {
        requireConnected();
        Instant now = clock.instant();
        for (PaperPosition position : positions.values()) {
            brokerEventChannel.publish(contract(event(BrokerEventType.POSITION_SNAPSHOT), position.instrument)
                    .position(BigDecimal.valueOf(position.quantity))
                    .avgCost(position.avgCost)
                    .occurredAt(now)
                    .build());
        }
        brokerEventChannel.publish(event(BrokerEventType.ACCOUNT_VALUE_SNAPSHOT)
                .tag("CashBalance")
                .currency(brokerProperties.getCommissionCurrency())
                .value(cash.toPlainString())
                .occurredAt(now)
                .build());
        for (PaperOrder paperOrder : book.values()) {
            if (!paperOrder.done) {
                brokerEventChannel.publish(contract(event(BrokerEventType.OPEN_ORDER), paperOrder.instrument)
                        .brokerOrderId(paperOrder.brokerOrderId)
                        .side(paperOrder.side.name())
                        .orderType(paperOrder.orderType.name())
                        .tif(paperOrder.tif.name())
                        .quantity(paperOrder.quantity)
                        .filledQuantity(paperOrder.filled)
                        .price(paperOrder.price)
                        .status(BrokerOrderStatus.SUBMITTED)
                        .build());
            }
        }
        log.debug("Paper snapshots published: {} positions, {} working orders", positions.size(), getWorkingOrderCount());
    }

    // ---- Internal matching logic ----

    private void match(PaperOrder paperOrder) {
        BigDecimal mark = getMark(paperOrder.instrument.symbol());
        BigDecimal fillPrice = tryMatch(paperOrder, mark);
        if (fillPrice == null) {
            return;
        }
        int slices = paperOrder.orderType == OrderType.MKT
                ? Math.max(1, brokerProperties.getPaper().getFillSlices())
                : 1;
        int remaining = paperOrder.quantity - paperOrder.filled;
        int sliceQty = Math.max(1, remaining / slices);
        while (paperOrder.filled < paperOrder.quantity) {
            int qty = Math.min(sliceQty, paperOrder.quantity - paperOrder.filled);
            // last slice takes the remainder
            if (paperOrder.quantity - paperOrder.filled - qty < sliceQty) {
                qty = paperOrder.quantity - paperOrder.filled;
            }
            execute(paperOrder, qty, fillPrice);
        }
        paperOrder.done = true;
    }

    private BigDecimal tryMatch(PaperOrder paperOrder, BigDecimal mark) {
        boolean buy = paperOrder.side == OrderSide.BUY;
        return switch (paperOrder.orderType) {
            case MKT -> mark;
            case LMT -> {
                int cmp = mark.compareTo(paperOrder.price);
                yield (buy ? cmp <= 0 : cmp >= 0) ? paperOrder.price : null;
            }
            case STP -> {
                int cmp = mark.compareTo(paperOrder.price);
                yield (buy ? cmp >= 0 : cmp <= 0) ? mark : null;
            }
        };
    }

    private void execute(PaperOrder paperOrder, int qty, BigDecimal price) {
        paperOrder.filled += qty;
        paperOrder.executions++;
        String execId = "P" + paperOrder.brokerOrderId + "." + paperOrder.executions;
        Instant now = clock.instant();
        BigDecimal commission = brokerProperties.getPaper().getCommissionPerFill();

        BigDecimal notional = price.multiply(BigDecimal.valueOf(qty));
        cash = paperOrder.side == OrderSide.BUY ? cash.subtract(notional) : cash.add(notional);
        cash = cash.subtract(commission);
        updatePosition(paperOrder.instrument, paperOrder.side.signum() * qty, price);

        BrokerEventType type =
                paperOrder.filled >= paperOrder.quantity ? BrokerEventType.FILL : BrokerEventType.PARTIAL_FILL;
        brokerEventChannel.publish(contract(event(type), paperOrder.instrument)
                .brokerOrderId(paperOrder.brokerOrderId)
                .execId(execId)
                .quantity(qty)
                .price(price)
                .side(paperOrder.side.name())
                .time(now.toString())
                .occurredAt(now)
                .build());
        brokerEventChannel.publish(event(BrokerEventType.COMMISSION)
                .brokerOrderId(paperOrder.brokerOrderId)
                .execId(execId)
                .commission(commission)
                .currency(brokerProperties.getCommissionCurrency())
                .build());

        log.debug(
                "Paper execution {}: {} {} qty={} @ {} ({}/{})",
                execId,
                paperOrder.side,
                paperOrder.instrument.symbol(),
                qty,
                price,
                paperOrder.filled,
                paperOrder.quantity);
    }

    private void updatePosition(Instrument instrument, int signedQty, BigDecimal price) {
        PaperPosition position = positions.computeIfAbsent(contractKey(instrument), k -> new PaperPosition(instrument));
        int previous = position.quantity;
        int next = previous + signedQty;
        if (previous == 0 || Integer.signum(previous) != Integer.signum(next) && next != 0) {
            position.avgCost = price;
        } else if (Integer.signum(previous) == Integer.signum(signedQty)) {
            BigDecimal total = position.avgCost.multiply(BigDecimal.valueOf(Math.abs(previous)))
                    .add(price.multiply(BigDecimal.valueOf(Math.abs(signedQty))));
            position.avgCost = total.divide(BigDecimal.valueOf(Math.abs(next)), 6, RoundingMode.HALF_UP);
        }
        position.quantity = next;
        if (next == 0) {
            positions.remove(contractKey(instrument));
        }
    }

    // ---- Helpers ----

    private void requireConnected() {
        if (!connected.get()) {
            throw new BrokerException("Paper session is not connected");
        }
    }

    private PaperOrder requireWorking(long brokerOrderId, String operation) {
        PaperOrder paperOrder = book.get(brokerOrderId);
        if (paperOrder == null) {
            throw new BrokerException("Cannot " + operation + ": unknown broker order " + brokerOrderId);
        }
        if (paperOrder.done) {
            throw new BrokerException("Cannot " + operation + ": broker order " + brokerOrderId + " is no longer working");
        }
        return paperOrder;
    }

    private void publishStatus(PaperOrder paperOrder, String status, String message) {
        brokerEventChannel.publish(event(BrokerEventType.STATUS)
                .brokerOrderId(paperOrder.brokerOrderId)
                .status(status)
                .filledQuantity(paperOrder.filled)
                .message(message)
                .build());
    }

    private BrokerEvent.BrokerEventBuilder event(BrokerEventType type) {
        return BrokerEvent.builder()
                .type(type)
                .account(brokerProperties.getAccount())
                .occurredAt(clock.instant());
    }

    private BrokerEvent.BrokerEventBuilder contract(BrokerEvent.BrokerEventBuilder builder, Instrument instrument) {
        builder.symbol(instrument.symbol())
                .secType(instrument.assetClass().name())
                .exchange(brokerProperties.getExchange())
                .conId(conId(instrument));
        if (instrument instanceof OptionInstrument option) {
            builder.expiry(option.expiry()).strike(option.strike()).right(option.right().name());
        }
        return builder;
    }

    /** Stable paper contract id, derived from the contract description. */
    static long conId(Instrument instrument) {
        return Math.abs((long) contractKey(instrument).hashCode());
    }

    private static String contractKey(Instrument instrument) {
        if (instrument instanceof OptionInstrument option) {
            return option.symbol() + " " + option.expiry() + " " + option.strike().stripTrailingZeros().toPlainString()
                    + " " + option.right();
        }
        return instrument.symbol();
    }

    private static final class PaperOrder {

        private final long brokerOrderId;
        private final Instrument instrument;
        private final OrderSide side;
        private int quantity;
        private OrderType orderType;
        private BigDecimal price;
        private TimeInForce tif;
        private int filled;
        private int executions;
        private boolean done;

        private PaperOrder(long brokerOrderId, Order order) {
            this.brokerOrderId = brokerOrderId;
            this.instrument = order.getInstrument();
            this.side = order.getSide();
            this.quantity = order.getQuantity();
            this.orderType = order.getOrderType();
            this.price = order.getPrice();
            this.tif = order.getTif();
        }
    }

    private static final class PaperPosition {

        private final Instrument instrument;
        private int quantity;
        private BigDecimal avgCost = BigDecimal.ZERO;

        private PaperPosition(Instrument instrument) {
            this.instrument = instrument;
        }
    }
}
