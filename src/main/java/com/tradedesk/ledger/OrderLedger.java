package com.tradedesk.ledger;

import com.tradedesk.config.EngineProperties;
import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.model.AccountValue;
import com.tradedesk.domain.model.AuditEntry;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.OrderFill;
import com.tradedesk.domain.model.Position;
import com.tradedesk.domain.model.PositionKey;
import com.tradedesk.repository.AccountValueRepository;
import com.tradedesk.repository.AuditLogRepository;
import com.tradedesk.repository.FillRepository;
import com.tradedesk.repository.OrderRepository;
import com.tradedesk.repository.PositionRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authoritative store of orders, fills, positions and account values.
 *
 * <p>Each table sits behind its own reader/writer lock, so a long order scan does not block
 * position snapshots. Reads return copies. Every mutation is also appended to the audit log.
 *
 * <p>The ledger has no knowledge of lifecycle rules: order mutations arrive as functions
 * built by the {@link com.tradedesk.oms.OrderStateMachine} and are applied atomically here.
 * It never talks to the broker and never publishes application events.
 */
@Component
public class OrderLedger {

    private static final Logger log = LoggerFactory.getLogger(OrderLedger.class);

    static final int COST_SCALE = 6;

    private final OrderRepository orderRepository;
    private final FillRepository fillRepository;
    private final PositionRepository positionRepository;
    private final AccountValueRepository accountValueRepository;
    private final AuditLogRepository auditLogRepository;
    private final EngineProperties engineProperties;
    private final Clock clock;

    public OrderLedger(
            OrderRepository orderRepository,
            FillRepository fillRepository,
            PositionRepository positionRepository,
            AccountValueRepository accountValueRepository,
            AuditLogRepository auditLogRepository,
            EngineProperties engineProperties,
            Clock clock) {
        this.orderRepository = orderRepository;
        this.fillRepository = fillRepository;
        this.positionRepository = positionRepository;
        this.accountValueRepository = accountValueRepository;
        this.auditLogRepository = auditLogRepository;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    // ---- Orders ----

    /** Inserts a new order row, stamping createdAt/updatedAt when absent. */
    public Order putOrder(Order order) {
        Instant now = clock.instant();
        Order row = order.copy();
        if (row.getCreatedAt() == null) {
            row.setCreatedAt(now);
        }
        if (row.getUpdatedAt() == null) {
            row.setUpdatedAt(now);
        }
        orderRepository.save(row);
        audit("order_added", orderPayload(row));
        return row.copy();
    }

    public Optional<Order> getOrder(long orderId) {
        return orderRepository.findById(orderId);
    }

    /**
     * Atomic read-modify-write of one order. The mutation may throw to veto the change, in
     * which case the row is left untouched and the exception propagates.
     *
     * @throws com.tradedesk.exception.ResourceNotFoundException if the order does not exist
     */
    public OrderUpdate updateOrder(long orderId, UnaryOperator<Order> mutation) {
        OrderUpdate update = orderRepository.update(orderId, mutation, clock.instant());
        if (update.changed()) {
            Map<String, Object> payload = orderPayload(update.after());
            payload.put("previous_status", String.valueOf(update.before().getStatus()));
            audit("order_updated", payload);
        }
        return update;
    }

    /** Newest first by creation time, then by order id. */
    public List<Order> listOrders(Integer limit) {
        return orderRepository.findNewest(resolveLimit(limit));
    }

    public long maxOrderId() {
        return orderRepository.maxOrderId();
    }

    /** Every order that has a broker order id, for rebuilding id bindings at startup. */
    public List<Order> listBoundOrders() {
        return orderRepository.findAll().stream()
                .filter(order -> order.getBrokerOrderId() != null)
                .toList();
    }

    // ---- Fills ----

    /**
     * Appends a fill, assigning its fill id.
     *
     * @return the stored fill, or empty when (orderId, execId) was already recorded
     */
    public Optional<OrderFill> appendFill(OrderFill fill) {
        OrderFill row = fill.getRecordedAt() == null
                ? fill.toBuilder().recordedAt(clock.instant()).build()
                : fill;
        Optional<OrderFill> stored = fillRepository.append(row);
        stored.ifPresentOrElse(
                saved -> {
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("fill_id", saved.getFillId());
                    payload.put("order_id", saved.getOrderId());
                    payload.put("exec_id", saved.getExecId());
                    payload.put("filled_qty", saved.getFilledQty());
                    payload.put("price", saved.getPrice());
                    audit("fill_added", payload);
                },
                () -> log.debug("Duplicate fill ignored: orderId={}, execId={}", fill.getOrderId(), fill.getExecId()));
        return stored;
    }

    public boolean hasFill(long orderId, String execId) {
        return fillRepository.exists(orderId, execId);
    }

    /** Newest first. A null orderId lists fills of every order. */
    public List<OrderFill> listFills(Long orderId, Integer limit) {
        return fillRepository.findNewest(orderId, resolveLimit(limit));
    }

    // ---- Positions ----

    /**
     * Moves a position by one execution.
     *
     * <p>Adding to a position re-averages the cost; reducing it keeps the cost; crossing through
     * zero starts a new cost basis at the fill price. A position that lands on zero is removed.
     *
     * @return the row after the fill, empty if the fill flattened it
     */
    public Optional<Position> applyPositionFill(
            PositionKey key, OrderSide side, int quantity, BigDecimal price, Instant fillTime) {
        BigDecimal delta = BigDecimal.valueOf((long) side.signum() * quantity);
        Instant now = clock.instant();
        Optional<Position> result = positionRepository.compute(key, current -> {
            BigDecimal oldQty = current != null ? current.getPosition() : BigDecimal.ZERO;
            BigDecimal oldCost = current != null && current.getAvgCost() != null ? current.getAvgCost() : BigDecimal.ZERO;
            BigDecimal newQty = oldQty.add(delta);
            if (newQty.signum() == 0) {
                return null;
            }

            BigDecimal newCost;
            if (oldQty.signum() == 0 || newQty.signum() != oldQty.signum()) {
                newCost = price;
            } else if (oldQty.signum() == delta.signum()) {
                newCost = oldQty.abs()
                        .multiply(oldCost)
                        .add(delta.abs().multiply(price))
                        .divide(newQty.abs(), COST_SCALE, RoundingMode.HALF_UP);
            } else {
                newCost = oldCost;
            }

            Position next = current != null
                    ? current
                    : Position.builder()
                            .account(key.account())
                            .symbol(key.symbol())
                            .secType(key.secType())
                            .exchange(key.exchange())
                            .conId(key.conId())
                            .build();
            next.setPosition(newQty);
            next.setAvgCost(newCost);
            next.setLastFillAt(fillTime != null ? fillTime : now);
            next.setUpdatedAt(now);
            return next;
        });
        audit("position_fill", positionPayload(key, result.map(Position::getPosition).orElse(BigDecimal.ZERO)));
        return result;
    }

    /**
     * Merges a broker position snapshot.
     *
     * <p>Last writer wins, except when the row was moved by a fill newer than the snapshot:
     * that fill-driven value is kept. A snapshot reporting zero removes the row.
     *
     * @return true if the snapshot was applied
     */
    public boolean applyPositionSnapshot(Position snapshot) {
        PositionKey key = snapshot.key();
        Instant now = clock.instant();
        Instant asOf = snapshot.getSnapshotAt() != null ? snapshot.getSnapshotAt() : now;
        AtomicBoolean applied = new AtomicBoolean(false);
        positionRepository.compute(key, current -> {
            if (current != null && current.getLastFillAt() != null && current.getLastFillAt().isAfter(asOf)) {
                return current;
            }
            applied.set(true);
            if (snapshot.getPosition() == null || snapshot.getPosition().signum() == 0) {
                return null;
            }
            Position next = snapshot.copy();
            next.setSnapshotAt(asOf);
            next.setLastFillAt(current != null ? current.getLastFillAt() : null);
            next.setUpdatedAt(now);
            return next;
        });
        if (applied.get()) {
            audit("position_snapshot", positionPayload(key, snapshot.getPosition()));
        } else {
            log.debug("Position snapshot for {} skipped: a newer fill already moved it", key);
        }
        return applied.get();
    }

    public List<Position> listPositions() {
        return positionRepository.findAll();
    }

    public Optional<Position> getPosition(PositionKey key) {
        return positionRepository.findByKey(key);
    }

    // ---- Account values ----

    public AccountValue upsertAccountValue(String account, String tag, String currency, String value) {
        AccountValue row = AccountValue.builder()
                .account(account)
                .tag(tag)
                .currency(currency)
                .value(value)
                .updatedAt(clock.instant())
                .build();
        accountValueRepository.save(row);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("account", account);
        payload.put("tag", tag);
        payload.put("currency", currency);
        payload.put("value", value);
        audit("account_value_set", payload);
        return row;
    }

    public List<AccountValue> listAccountValues() {
        return accountValueRepository.findAll();
    }

    // ---- Audit ----

    /** Latest entries after {@code sinceSeq}, oldest first. */
    public List<AuditEntry> listAuditEntries(Long sinceSeq, Integer limit) {
        int bound = limit == null || limit <= 0
                ? engineProperties.getLedger().getDefaultAuditLimit()
                : limit;
        return auditLogRepository.findSince(sinceSeq, bound);
    }

    int resolveLimit(Integer limit) {
        return limit == null || limit <= 0 ? engineProperties.getLedger().getDefaultListLimit() : limit;
    }

    private void audit(String eventType, Map<String, Object> payload) {
        auditLogRepository.append(eventType, payload, clock.instant());
    }

    private static Map<String, Object> orderPayload(Order order) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("order_id", order.getOrderId());
        payload.put("broker_order_id", order.getBrokerOrderId());
        payload.put("status", String.valueOf(order.getStatus()));
        payload.put("filled_qty", order.getFilledQty());
        return payload;
    }

    private static Map<String, Object> positionPayload(PositionKey key, BigDecimal position) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("account", key.account());
        payload.put("symbol", key.symbol());
        payload.put("sec_type", key.secType());
        payload.put("con_id", key.conId());
        payload.put("position", position);
        return payload;
    }
}
