package com.tradedesk.domain.model;

import com.tradedesk.domain.enums.AssetClass;
import com.tradedesk.domain.enums.OptionRight;
import java.math.BigDecimal;

/**
 * An option contract on an underlying symbol.
 *
 * @param symbol underlying ticker
 * @param expiry expiry date in YYYYMMDD form, as the broker expects it
 * @param strike strike price
 * @param right  call or put
 */
public record OptionInstrument(String symbol, String expiry, BigDecimal strike, OptionRight right)
        implements Instrument {

    @Override
    public AssetClass assetClass() {
        return AssetClass.OPT;
    }
}
