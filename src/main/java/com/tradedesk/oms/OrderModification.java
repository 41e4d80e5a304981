package com.tradedesk.oms;

import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TimeInForce;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Changes to an existing working order.
 *
 * <p>Only the non-null fields are applied. The order keeps its brokerOrderId; side and
 * instrument cannot change, cancel and re-place instead.
 */
@Data
@Builder
public class OrderModification {

    /** New total quantity. Null means no change. Must not drop below the filled quantity. */
    private Integer quantity;

    private OrderType orderType;

    /** New limit or stop price. Null means no change. */
    private BigDecimal price;

    private TimeInForce tif;

    public boolean isEmpty() {
        return quantity == null && orderType == null && price == null && tif == null;
    }
}
