package io.trading.pricestream.broadcast;

import io.trading.pricestream.model.PriceTick;

/**
 * Outbound path to one subscriber, e.g. its WebSocket channel.
 */
@FunctionalInterface
public interface DeliverySink {

    /**
     * Pushes a tick to the subscriber. Called from a dispatcher worker thread,
     * never concurrently for the same subscriber.
     */
    void deliver(PriceTick tick) throws Exception;
}
