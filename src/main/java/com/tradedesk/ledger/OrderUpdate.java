package com.tradedesk.ledger;

import com.tradedesk.domain.model.Order;

/**
 * Outcome of an atomic read-modify-write on an order row.
 *
 * @param before  copy of the row as it was before the mutation
 * @param after   copy of the row as stored afterwards (equal to before when unchanged)
 * @param changed whether the mutation altered the row
 */
public record OrderUpdate(Order before, Order after, boolean changed) {}
