package io.trading.pricestream.broadcast;

import io.trading.pricestream.cache.PriceCache;
import io.trading.pricestream.model.PriceTick;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TickBusTest {

    private static final PriceTick TICK = new PriceTick("BTCUSD", new BigDecimal("43250.50"), Instant.now());

    @Test
    void testListenersRunInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        TickBus bus = new TickBus()
            .addListener(tick -> calls.add("cache"))
            .addListener(tick -> calls.add("dispatcher"));

        bus.onTick(TICK);

        assertEquals(List.of("cache", "dispatcher"), calls);
    }

    @Test
    void testCacheIsUpdatedBeforeLaterListeners() {
        PriceCache cache = new PriceCache();
        List<PriceTick> seenInCache = new ArrayList<>();
        TickBus bus = new TickBus()
            .addListener(cache)
            .addListener(tick -> seenInCache.add(cache.get(tick.symbol()).orElse(null)));

        bus.onTick(TICK);

        assertEquals(List.of(TICK), seenInCache);
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        List<PriceTick> received = new ArrayList<>();
        TickBus bus = new TickBus()
            .addListener(tick -> {
                throw new IllegalStateException("boom");
            })
            .addListener(received::add);

        assertDoesNotThrow(() -> bus.onTick(TICK));
        assertEquals(List.of(TICK), received);
        assertEquals(2, bus.listenerCount());
    }
}
