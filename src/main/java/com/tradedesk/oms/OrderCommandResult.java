package com.tradedesk.oms;

import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.exception.ErrorCode;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a cancel or modify command.
 *
 * <p>{@code ok=false} means the command was refused locally (illegal state or modification)
 * and nothing was sent to the broker; {@code status} is the order's status after the call.
 */
@Value
@Builder
public class OrderCommandResult {

    boolean ok;
    OrderStatus status;
    String message;

    /** INVALID_STATE or INVALID_MODIFICATION when refused, null when ok. */
    ErrorCode errorCode;

    public static OrderCommandResult accepted(OrderStatus status, String message) {
        return OrderCommandResult.builder().ok(true).status(status).message(message).build();
    }

    public static OrderCommandResult refused(OrderStatus status, ErrorCode errorCode, String message) {
        return OrderCommandResult.builder()
                .ok(false)
                .status(status)
                .errorCode(errorCode)
                .message(message)
                .build();
    }
}
