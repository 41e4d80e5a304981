package com.tradedesk.oms;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * An order as a client submits it, before validation.
 *
 * <p>Enumerated fields arrive as text and are parsed by {@link OrderRequestValidator}, so a
 * bad value is reported as a validation error alongside every other field problem. The
 * option fields (expiry, strike, right) are ignored for stock orders.
 */
@Data
@Builder
public class OrderRequest {

    private String symbol;

    /** BUY or SELL. */
    private String side;

    private Integer quantity;

    /** MKT, LMT or STP. */
    private String orderType;

    /** Limit or stop price. Required for LMT and STP, must be absent or ignored for MKT. */
    private BigDecimal price;

    /** DAY or GTC. Null means DAY. */
    private String tif;

    /** Option expiry as YYYYMMDD. */
    private String expiry;

    private BigDecimal strike;

    /** C or P. */
    private String right;
}
