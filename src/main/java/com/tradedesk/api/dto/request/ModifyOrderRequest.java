package com.tradedesk.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for modifying a working order. Absent fields are left unchanged;
 * at least one must be present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ModifyOrderRequest {

    /** New total quantity. Must not be below the filled quantity. */
    private Integer quantity;

    private String orderType;
    private BigDecimal price;
    private String tif;
}
