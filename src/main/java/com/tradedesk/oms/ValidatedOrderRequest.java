package com.tradedesk.oms;

import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TimeInForce;
import com.tradedesk.domain.model.Instrument;
import java.math.BigDecimal;

/** An {@link OrderRequest} that passed validation, with every field parsed to its type. */
public record ValidatedOrderRequest(
        Instrument instrument,
        OrderSide side,
        int quantity,
        OrderType orderType,
        BigDecimal price,
        TimeInForce tif) {}
