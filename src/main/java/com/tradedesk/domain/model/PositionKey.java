package com.tradedesk.domain.model;

/** Identity of a position row, as the broker reports it. */
public record PositionKey(String account, String symbol, String secType, String exchange, long conId) {}
