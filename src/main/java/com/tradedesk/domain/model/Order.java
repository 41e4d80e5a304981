package com.tradedesk.domain.model;

import com.tradedesk.domain.enums.AssetClass;
import com.tradedesk.domain.enums.OrderOrigin;
import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TimeInForce;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A stock or option order tracked by the ledger.
 *
 * <p>The internal orderId is assigned once by the OrderIdRegistry. The brokerOrderId stays
 * null until the broker acknowledges the order. filledQty never exceeds quantity and
 * avgPrice is the VWAP across all fills (null while nothing is filled).
 *
 * <p>Instances handed out by the ledger are copies; mutate only inside a ledger update.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private long orderId;

    /** Broker-assigned order ID. Null until acknowledged. */
    private Long brokerOrderId;

    private Instrument instrument;
    private OrderSide side;
    private int quantity;
    private OrderType orderType;

    /** Limit or stop price. Present iff orderType is LMT or STP. */
    private BigDecimal price;

    @Builder.Default
    private TimeInForce tif = TimeInForce.DAY;

    private OrderStatus status;

    /** Status to fall back to if a pending cancel is refused. Set only while CANCEL_REQUESTED. */
    private OrderStatus cancelPriorStatus;

    private int filledQty;

    /** Volume-weighted average fill price. Null while filledQty is zero. */
    private BigDecimal avgPrice;

    /** Last human-readable status or error detail. */
    private String message;

    private BigDecimal commission;
    private String commissionCurrency;
    private BigDecimal realizedPnl;

    @Builder.Default
    private OrderOrigin origin = OrderOrigin.ENGINE;

    private Instant createdAt;
    private Instant updatedAt;

    public String getSymbol() {
        return instrument != null ? instrument.symbol() : null;
    }

    public AssetClass getAssetClass() {
        return instrument != null ? instrument.assetClass() : null;
    }

    public int getRemainingQty() {
        return quantity - filledQty;
    }

    public Order copy() {
        return toBuilder().build();
    }
}
