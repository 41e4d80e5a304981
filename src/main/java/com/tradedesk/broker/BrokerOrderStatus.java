package com.tradedesk.broker;

import com.tradedesk.domain.enums.OrderStatus;
import java.util.Map;
import java.util.Optional;

/**
 * Translates the broker's order status text into engine statuses.
 */
public final class BrokerOrderStatus {

    public static final String PRE_SUBMITTED = "PreSubmitted";
    public static final String SUBMITTED = "Submitted";
    public static final String PENDING_CANCEL = "PendingCancel";
    public static final String CANCELLED = "Cancelled";
    public static final String API_CANCELLED = "ApiCancelled";
    public static final String INACTIVE = "Inactive";
    public static final String FILLED = "Filled";

    private static final Map<String, OrderStatus> MAPPING = Map.of(
            PRE_SUBMITTED, OrderStatus.SUBMITTED,
            SUBMITTED, OrderStatus.ACKED,
            PENDING_CANCEL, OrderStatus.CANCEL_REQUESTED,
            CANCELLED, OrderStatus.CANCELLED,
            API_CANCELLED, OrderStatus.CANCELLED,
            INACTIVE, OrderStatus.ERROR);

    private BrokerOrderStatus() {}

    /**
     * Maps a broker status. "Filled" and unknown strings map to nothing: fills are driven by
     * execution events only, so filledQty and FILLED can never disagree.
     */
    public static Optional<OrderStatus> toOrderStatus(String brokerStatus) {
        if (brokerStatus == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(MAPPING.get(brokerStatus.trim()));
    }

    public static boolean isFilled(String brokerStatus) {
        return brokerStatus != null && FILLED.equals(brokerStatus.trim());
    }
}
