package com.tradedesk.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for placing a stock order.
 * Enum-valued fields arrive as strings and are parsed by the OrderRequestValidator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlaceStockOrderRequest {

    @NotBlank
    private String symbol;

    /** BUY or SELL. */
    @NotBlank
    private String side;

    @NotNull
    private Integer quantity;

    /** MKT, LMT or STP. */
    @NotBlank
    private String orderType;

    /** Required for LMT and STP. */
    private BigDecimal price;

    /** DAY (default) or GTC. */
    private String tif;
}
