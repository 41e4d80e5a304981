package com.tradedesk.broker;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * FIFO hand-off from the broker session to the reconciler.
 *
 * <p>The broker side only publishes; the reconciler's single thread is the only consumer,
 * which keeps per-connection event order intact.
 */
@Component
public class BrokerEventChannel {

    private static final Logger log = LoggerFactory.getLogger(BrokerEventChannel.class);

    private final BlockingQueue<BrokerEvent> queue = new LinkedBlockingQueue<>();

    public void publish(BrokerEvent event) {
        if (event == null) {
            return;
        }
        queue.add(event);
        log.trace("Broker event queued: {} brokerOrderId={}", event.getType(), event.getBrokerOrderId());
    }

    /**
     * Takes the next event, waiting up to {@code timeout}.
     *
     * @return the event, or null if none arrived in time
     */
    public BrokerEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int size() {
        return queue.size();
    }
}
