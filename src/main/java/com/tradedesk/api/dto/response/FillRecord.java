package com.tradedesk.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tradedesk.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one execution. filled_qty is the increment, not the cumulative quantity. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FillRecord {

    private long fillId;
    private long orderId;
    private String execId;
    private BigDecimal price;
    private int filledQty;
    private String symbol;
    private OrderSide side;
    private String time;
    private Long brokerOrderId;
    private Instant recordedAt;
}
