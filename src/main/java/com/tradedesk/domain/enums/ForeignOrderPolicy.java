package com.tradedesk.domain.enums;

/**
 * What the reconciler does with an open order reported by the broker that has no
 * internal counterpart.
 */
public enum ForeignOrderPolicy {

    /** Synthesize a new internal order and bind it to the broker id. */
    ADOPT,

    /** Log and drop the snapshot. */
    IGNORE
}
