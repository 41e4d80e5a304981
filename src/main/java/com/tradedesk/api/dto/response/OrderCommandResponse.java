package com.tradedesk.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for cancel and modify. A refusal (order not cancellable, quantity below
 * filled) comes back with ok=false and the order's current status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderCommandResponse {

    private boolean ok;
    private OrderStatus status;
    private String message;

    /** Set only when ok is false. */
    private ErrorCode errorCode;
}
