package com.tradedesk.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tradedesk.domain.enums.AssetClass;
import com.tradedesk.domain.enums.OptionRight;
import com.tradedesk.domain.enums.OrderOrigin;
import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TimeInForce;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for one order as the ledger holds it.
 *
 * <p>The instrument is flattened: expiry, strike and right are present only when
 * asset_class is OPT. broker_order_id stays null until the broker acknowledges the order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderRecord {

    private long orderId;
    private Long brokerOrderId;
    private AssetClass assetClass;
    private String symbol;
    private String expiry;
    private BigDecimal strike;
    private OptionRight right;
    private OrderSide side;
    private int quantity;
    private OrderType orderType;
    private BigDecimal price;
    private TimeInForce tif;
    private OrderStatus status;
    private int filledQty;
    private BigDecimal avgPrice;
    private String message;
    private BigDecimal commission;
    private String commissionCurrency;
    private BigDecimal realizedPnl;
    private OrderOrigin origin;
    private Instant createdAt;
    private Instant updatedAt;
}
