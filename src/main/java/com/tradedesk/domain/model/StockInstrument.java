package com.tradedesk.domain.model;

import com.tradedesk.domain.enums.AssetClass;

/** A stock identified by its ticker symbol. */
public record StockInstrument(String symbol) implements Instrument {

    @Override
    public AssetClass assetClass() {
        return AssetClass.STK;
    }
}
