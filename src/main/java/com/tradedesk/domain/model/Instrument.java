package com.tradedesk.domain.model;

import com.tradedesk.domain.enums.AssetClass;

/**
 * The contract an order trades: either a stock or an option on an underlying.
 *
 * <p>Validated once at the API boundary; everything downstream can rely on an option
 * always carrying expiry, strike and right.
 */
public sealed interface Instrument permits StockInstrument, OptionInstrument {

    String symbol();

    AssetClass assetClass();
}
