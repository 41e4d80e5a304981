package com.tradedesk.repository;

import com.tradedesk.domain.model.AccountValue;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Repository;

/** Account values keyed by (account, tag, currency); last write wins. */
@Repository
public class AccountValueRepository {

    private static final Comparator<String> TEXT = Comparator.nullsFirst(Comparator.naturalOrder());

    private static final Comparator<AccountValue> BY_KEY = Comparator.comparing(AccountValue::getAccount, TEXT)
            .thenComparing(AccountValue::getTag, TEXT)
            .thenComparing(AccountValue::getCurrency, TEXT);

    private final Map<AccountValueKey, AccountValue> values = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public void save(AccountValue accountValue) {
        lock.writeLock().lock();
        try {
            values.put(
                    new AccountValueKey(
                            accountValue.getAccount(), accountValue.getTag(), accountValue.getCurrency()),
                    accountValue);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<AccountValue> findAll() {
        lock.readLock().lock();
        try {
            return values.values().stream().sorted(BY_KEY).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    private record AccountValueKey(String account, String tag, String currency) {}
}
