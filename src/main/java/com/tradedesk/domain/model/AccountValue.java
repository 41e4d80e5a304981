package com.tradedesk.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A single account metric (e.g. NetLiquidation/USD). The value is kept exactly as the
 * broker reported it; different tags use different formats.
 */
@Value
@Builder
public class AccountValue {

    String account;
    String tag;
    String currency;
    String value;
    Instant updatedAt;
}
