package io.trading.pricestream.broadcast;

import io.trading.pricestream.feed.TickListener;
import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.PriceTick;
import io.trading.pricestream.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Fans each tick out to the subscribers of its symbol.
 *
 * Recipients are the registry's subscribers at the moment of the tick. Every subscriber
 * has its own {@link SubscriberChannel}, so a slow or failing subscriber only affects itself.
 */
public class BroadcastDispatcher implements TickListener, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final SubscriptionRegistry registry;
    private final Executor deliveryExecutor;
    private final int queueCapacity;
    private final GatewayMetrics metrics;
    private final ConcurrentHashMap<String, SubscriberChannel> channels = new ConcurrentHashMap<>();

    /**
     * @param registry         Source of recipients
     * @param deliveryExecutor Runs subscriber drains
     * @param queueCapacity    Outbound buffer size per subscriber
     * @param metrics          Metrics sink
     */
    public BroadcastDispatcher(SubscriptionRegistry registry, Executor deliveryExecutor, int queueCapacity, GatewayMetrics metrics) {
        this.registry = registry;
        this.deliveryExecutor = deliveryExecutor;
        this.queueCapacity = queueCapacity;
        this.metrics = metrics;
    }

    /**
     * Attaches the outbound sink of a subscriber, replacing any previous one.
     */
    public void registerSink(String subscriberId, DeliverySink sink) {
        SubscriberChannel channel = new SubscriberChannel(subscriberId, sink, deliveryExecutor, queueCapacity, metrics);
        SubscriberChannel previous = channels.put(subscriberId, channel);
        if (previous != null) {
            previous.close();
        }
        LOGGER.debug("[{}] Delivery sink registered", subscriberId);
    }

    public void unregisterSink(String subscriberId) {
        SubscriberChannel channel = channels.remove(subscriberId);
        if (channel != null) {
            channel.close();
            LOGGER.debug("[{}] Delivery sink removed ({} delivered, {} dropped, {} failed)",
                subscriberId, channel.getDelivered(), channel.getDropped(), channel.getFailed());
        }
    }

    @Override
    public void onTick(PriceTick tick) {
        Set<String> recipients = registry.subscribersOf(tick.symbol());
        if (recipients.isEmpty()) {
            return;
        }
        for (String subscriberId : recipients) {
            SubscriberChannel channel = channels.get(subscriberId);
            if (channel == null) {
                LOGGER.debug("[{}] No delivery sink, skipping {}", subscriberId, tick.symbol());
                continue;
            }
            channel.offer(tick);
        }
    }

    public Optional<SubscriberChannel> channel(String subscriberId) {
        return Optional.ofNullable(channels.get(subscriberId));
    }

    public int sinkCount() {
        return channels.size();
    }

    @Override
    public void close() {
        channels.values().forEach(SubscriberChannel::close);
        channels.clear();
    }
}
