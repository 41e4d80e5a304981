package com.tradedesk.repository;

import com.tradedesk.domain.model.AuditEntry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Repository;

/**
 * Append-only audit log. Sequence numbers start at 1 and are never reused.
 */
@Repository
public class AuditLogRepository {

    private final List<AuditEntry> entries = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private long lastSeq;

    public AuditEntry append(String eventType, Map<String, Object> payload, Instant timestamp) {
        lock.writeLock().lock();
        try {
            AuditEntry entry = new AuditEntry(++lastSeq, timestamp, eventType, Collections.unmodifiableMap(new LinkedHashMap<>(payload)));
            entries.add(entry);
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the latest {@code limit} entries with seq greater than {@code sinceSeq}, oldest
     * first. A null {@code sinceSeq} means from the beginning.
     */
    public List<AuditEntry> findSince(Long sinceSeq, int limit) {
        lock.readLock().lock();
        try {
            List<AuditEntry> matching = new ArrayList<>();
            for (AuditEntry entry : entries) {
                if (sinceSeq == null || entry.seq() > sinceSeq) {
                    matching.add(entry);
                }
            }
            int from = Math.max(0, matching.size() - limit);
            return List.copyOf(matching.subList(from, matching.size()));
        } finally {
            lock.readLock().unlock();
        }
    }
}
