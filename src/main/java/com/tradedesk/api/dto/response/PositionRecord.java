package com.tradedesk.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a net position. Positive = long, negative = short. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PositionRecord {

    private String account;
    private String symbol;
    private String secType;
    private String exchange;
    private long conId;
    private BigDecimal position;
    private BigDecimal avgCost;
    private Instant lastFillAt;
    private Instant snapshotAt;
    private Instant updatedAt;
}
