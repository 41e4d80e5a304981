package com.tradedesk.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A net position in one contract.
 *
 * <p>Position is signed: positive = long, negative = short. Rows are moved by fills
 * (lastFillAt) and by broker snapshots (snapshotAt). A snapshot older than the last fill
 * must not overwrite the fill-driven value.
 */
@Data
@Builder(toBuilder = true)
public class Position {

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

    public PositionKey key() {
        return new PositionKey(account, symbol, secType, exchange, conId);
    }

    public Position copy() {
        return toBuilder().build();
    }
}
