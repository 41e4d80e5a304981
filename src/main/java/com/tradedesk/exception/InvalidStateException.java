package com.tradedesk.exception;

import com.tradedesk.domain.enums.OrderStatus;
import java.util.Map;
import lombok.Getter;

/** The command or event is not legal for the order's current lifecycle status. */
@Getter
public class InvalidStateException extends BaseException {

    private final OrderStatus currentStatus;

    public InvalidStateException(OrderStatus currentStatus, String message) {
        super(ErrorCode.INVALID_STATE, message, currentStatus != null ? Map.of("status", currentStatus.name()) : Map.of());
        this.currentStatus = currentStatus;
    }
}
