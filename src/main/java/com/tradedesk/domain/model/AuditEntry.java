package com.tradedesk.domain.model;

import java.time.Instant;
import java.util.Map;

/** One entry of the ledger's append-only audit log. */
public record AuditEntry(long seq, Instant timestamp, String eventType, Map<String, Object> payload) {}
