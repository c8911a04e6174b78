package io.trading.pricestream.feed;

import io.trading.pricestream.model.PriceTick;

/**
 * Receives normalized ticks.
 */
@FunctionalInterface
public interface TickListener {

    void onTick(PriceTick tick);
}
