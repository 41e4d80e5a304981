package com.tradedesk.domain.model;

import com.tradedesk.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One execution against an order. Immutable once recorded.
 *
 * <p>filledQty is the increment from this execution, not the order's cumulative quantity.
 * execId is the broker's execution id and is unique per order.
 */
@Value
@Builder(toBuilder = true)
public class OrderFill {

    long fillId;
    long orderId;
    String execId;
    BigDecimal price;
    int filledQty;
    String symbol;
    OrderSide side;

    /** Execution time as reported by the broker. */
    String time;

    Long brokerOrderId;
    Instant recordedAt;
}
