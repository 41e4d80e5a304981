package com.tradedesk.domain.enums;

/** Option right: C = call, P = put. */
public enum OptionRight {
    C,
    P
}
