package com.tradedesk.oms;

import com.tradedesk.domain.enums.OrderStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Returned by a place call as soon as the broker accepted the submit for dispatch.
 * The ack and any fills arrive later through the reconciler.
 */
@Value
@Builder
public class PlaceOrderResult {

    long orderId;

    /**
     * The ledger row's broker id. Null until the broker's ack has been applied, which with
     * an asynchronous broker is usually after place returns; re-query the order for it.
     */
    Long brokerOrderId;

    OrderStatus status;
    String message;
}
