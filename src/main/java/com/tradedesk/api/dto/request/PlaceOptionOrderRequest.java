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
 * Request DTO for placing an option order on an underlying symbol.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlaceOptionOrderRequest {

    /** Underlying symbol, e.g. "SPY". */
    @NotBlank
    private String symbol;

    /** Expiry date as YYYYMMDD. */
    @NotBlank
    private String expiry;

    @NotNull
    private BigDecimal strike;

    /** C or P. */
    @NotBlank
    private String right;

    @NotBlank
    private String side;

    @NotNull
    private Integer quantity;

    @NotBlank
    private String orderType;

    private BigDecimal price;

    private String tif;
}
