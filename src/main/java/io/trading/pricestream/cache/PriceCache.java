package io.trading.pricestream.cache;

import io.trading.pricestream.feed.TickListener;
import io.trading.pricestream.model.PriceTick;
import io.trading.pricestream.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Latest tick per symbol, with one-shot waiters for the next tick of a symbol.
 *
 * Entries are never evicted. Writes for one symbol are last-write-wins; a reader sees
 * either the previous or the new tick, never a mix.
 */
public class PriceCache implements TickListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(PriceCache.class);

    private final ConcurrentHashMap<String, PriceTick> latest = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<CompletableFuture<PriceTick>>> waiters = new ConcurrentHashMap<>();

    public Optional<PriceTick> get(String symbol) {
        return Optional.ofNullable(latest.get(Symbols.normalize(symbol)));
    }

    /**
     * Stores the tick and completes every waiter registered for its symbol.
     */
    @Override
    public void onTick(PriceTick tick) {
        List<CompletableFuture<PriceTick>> pending = new ArrayList<>();
        // store and detach under the waiters bin lock so a concurrent awaitNext
        // either sees the new tick or gets completed here
        waiters.compute(tick.symbol(), (symbol, registered) -> {
            latest.put(symbol, tick);
            if (registered != null) {
                pending.addAll(registered);
            }
            return null;
        });
        for (CompletableFuture<PriceTick> waiter : pending) {
            waiter.complete(tick);
        }
        if (!pending.isEmpty()) {
            LOGGER.debug("Woke {} waiter(s) for {}", pending.size(), tick.symbol());
        }
    }

    /**
     * Resolves with the cached tick if present, otherwise with the next tick stored for
     * the symbol. Completes exceptionally with {@link java.util.concurrent.TimeoutException}
     * once the budget elapses. Cancelling the returned future deregisters the waiter.
     */
    public CompletableFuture<PriceTick> awaitNext(String requested, Duration timeout) {
        String symbol = Symbols.normalize(requested);
        CompletableFuture<PriceTick> waiter = new CompletableFuture<>();

        waiters.compute(symbol, (key, registered) -> {
            PriceTick cached = latest.get(key);
            if (cached != null) {
                waiter.complete(cached);
                return registered;
            }
            List<CompletableFuture<PriceTick>> list = registered == null ? new ArrayList<>() : registered;
            list.add(waiter);
            return list;
        });

        if (waiter.isDone()) {
            return waiter;
        }

        waiter.whenComplete((tick, error) -> {
            if (error != null) {
                deregister(symbol, waiter);
            }
        });
        return waiter.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void deregister(String symbol, CompletableFuture<PriceTick> waiter) {
        waiters.computeIfPresent(symbol, (key, registered) -> {
            registered.remove(waiter);
            return registered.isEmpty() ? null : registered;
        });
    }

    /**
     * Number of callers currently waiting on a symbol.
     */
    public int waiterCount(String symbol) {
        List<CompletableFuture<PriceTick>> registered = waiters.get(Symbols.normalize(symbol));
        return registered == null ? 0 : registered.size();
    }

    public Map<String, PriceTick> snapshot() {
        return Map.copyOf(latest);
    }

    public int size() {
        return latest.size();
    }
}
