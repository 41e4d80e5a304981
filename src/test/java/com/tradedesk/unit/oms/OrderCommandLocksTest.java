package com.tradedesk.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradedesk.config.EngineProperties;
import com.tradedesk.exception.InvalidStateException;
import com.tradedesk.oms.OrderCommandLocks;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OrderCommandLocksTest {

    private OrderCommandLocks locks;

    @BeforeEach
    void setUp() {
        EngineProperties engineProperties = new EngineProperties();
        engineProperties.getSession().setCommandLockTimeout(Duration.ofMillis(100));
        locks = new OrderCommandLocks(engineProperties);
    }

    @Test
    @DisplayName("Locks of finished commands are released, however many orders were touched")
    void locksDoNotAccumulate() {
        for (long orderId = 1; orderId <= 10_000; orderId++) {
            long id = orderId;
            assertThat(locks.withLock(orderId, () -> id)).isEqualTo(id);
        }
        assertThatThrownBy(() -> locks.withLock(10_001L, () -> {
                    throw new IllegalStateException("command failed");
                }))
                .isInstanceOf(IllegalStateException.class);

        assertThat(locks.activeLocks()).isZero();
    }

    @Test
    @DisplayName("A second command for the same order times out while the first is in flight")
    void sameOrderIsSerialized() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> first = CompletableFuture.supplyAsync(() -> locks.withLock(7L, () -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "first";
        }));
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(locks.activeLocks()).isEqualTo(1);
        assertThatThrownBy(() -> locks.withLock(7L, () -> "second"))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("still in flight");
        assertThat(locks.withLock(8L, () -> "other order")).isEqualTo("other order");

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(locks.activeLocks()).isZero();
        assertThat(locks.withLock(7L, () -> "third")).isEqualTo("third");
    }

    @Test
    @DisplayName("A command may re-enter the lock of its own order")
    void reentrant() {
        String result = locks.withLock(3L, () -> locks.withLock(3L, () -> "nested"));

        assertThat(result).isEqualTo("nested");
        assertThat(locks.activeLocks()).isZero();
    }
}
