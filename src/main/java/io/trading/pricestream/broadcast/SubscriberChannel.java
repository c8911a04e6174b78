package io.trading.pricestream.broadcast;

import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.PriceTick;
import org.agrona.concurrent.ManyToOneConcurrentArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded outbound buffer of one subscriber.
 *
 * Ticks are offered from the feed threads and drained by at most one executor task at a
 * time, so a subscriber sees ticks in the order they were offered. A full buffer drops the
 * new tick instead of blocking the feed.
 */
public class SubscriberChannel implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriberChannel.class);

    private static final int DRAIN_BATCH = 256;

    private final String subscriberId;
    private final DeliverySink sink;
    private final Executor executor;
    private final GatewayMetrics metrics;
    private final ManyToOneConcurrentArrayQueue<PriceTick> queue;
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private final AtomicLong delivered = new AtomicLong(0);
    private final AtomicLong dropped = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private volatile boolean closed = false;

    public SubscriberChannel(String subscriberId, DeliverySink sink, Executor executor, int capacity, GatewayMetrics metrics) {
        this.subscriberId = subscriberId;
        this.sink = sink;
        this.executor = executor;
        this.metrics = metrics;
        this.queue = new ManyToOneConcurrentArrayQueue<>(capacity);
    }

    /**
     * Queues a tick for delivery. Never blocks.
     *
     * @return false if the channel is closed or its buffer is full
     */
    public boolean offer(PriceTick tick) {
        if (closed) {
            return false;
        }
        if (!queue.offer(tick)) {
            dropped.incrementAndGet();
            metrics.recordDeliveryDropped();
            LOGGER.warn("[{}] Outbound buffer full, dropping {} tick", subscriberId, tick.symbol());
            return false;
        }
        scheduleDrain();
        return true;
    }

    private void scheduleDrain() {
        if (!drainScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            drainScheduled.set(false);
            LOGGER.debug("[{}] Delivery executor is shut down", subscriberId);
        }
    }

    private void drain() {
        int drained = 0;
        PriceTick tick;
        while (!closed && drained < DRAIN_BATCH && (tick = queue.poll()) != null) {
            drained++;
            try {
                sink.deliver(tick);
                delivered.incrementAndGet();
                metrics.recordDelivery(tick.symbol());
            } catch (Exception e) {
                failed.incrementAndGet();
                metrics.recordDeliveryFailure();
                LOGGER.error("[{}] Delivery of {} failed", subscriberId, tick.symbol(), e);
            }
        }
        drainScheduled.set(false);
        // ticks offered after the last poll but before the flag was cleared
        if (!closed && !queue.isEmpty()) {
            scheduleDrain();
        }
    }

    public String getSubscriberId() {
        return subscriberId;
    }

    public int pending() {
        return queue.size();
    }

    public long getDelivered() {
        return delivered.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getFailed() {
        return failed.get();
    }

    /**
     * Stops delivery and discards buffered ticks.
     */
    @Override
    public void close() {
        closed = true;
        queue.clear();
    }
}
