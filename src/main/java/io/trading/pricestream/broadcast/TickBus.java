package io.trading.pricestream.broadcast;

import io.trading.pricestream.feed.TickListener;
import io.trading.pricestream.model.PriceTick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process tick topic. Connectors publish here; listeners are called in registration
 * order on the publishing thread, and one failing listener does not stop the others.
 */
public class TickBus implements TickListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(TickBus.class);

    private final List<TickListener> listeners = new CopyOnWriteArrayList<>();

    public TickBus addListener(TickListener listener) {
        listeners.add(listener);
        return this;
    }

    public void removeListener(TickListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onTick(PriceTick tick) {
        for (TickListener listener : listeners) {
            try {
                listener.onTick(tick);
            } catch (RuntimeException e) {
                LOGGER.error("[TickBus] Listener {} failed for {}", listener.getClass().getSimpleName(), tick.symbol(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
