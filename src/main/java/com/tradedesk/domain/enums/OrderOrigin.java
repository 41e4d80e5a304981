package com.tradedesk.domain.enums;

/**
 * Where an order record came from.
 * ADOPTED orders were entered outside this engine (e.g. in the broker's own UI) and
 * discovered on an open-order snapshot.
 */
public enum OrderOrigin {
    ENGINE,
    ADOPTED
}
