package io.trading.pricestream.subscription;

import io.trading.pricestream.feed.FeedConnectionPool;
import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Who is subscribed to what, indexed both by symbol and by subscriber.
 *
 * The registry holds one pool reference per symbol while that symbol has at least one
 * subscriber: it acquires when the symbol's subscriber set becomes non-empty and releases
 * when it becomes empty again. Mutations of one symbol serialize on that symbol's lock;
 * different symbols proceed independently.
 */
public class SubscriptionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final FeedConnectionPool pool;
    private final GatewayMetrics metrics;
    private final ConcurrentHashMap<String, SymbolEntry> bySymbol = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> bySubscriber = new ConcurrentHashMap<>();

    public SubscriptionRegistry(FeedConnectionPool pool, GatewayMetrics metrics) {
        this.pool = pool;
        this.metrics = metrics;
    }

    /**
     * Records the relation. The first subscriber of a symbol acquires its upstream connection;
     * if that fails nothing is recorded and the failure is rethrown.
     *
     * @return false if the subscriber was already subscribed to the symbol
     * @throws io.trading.pricestream.feed.UnsupportedSymbolException if no vendor mapping exists
     * @throws io.trading.pricestream.feed.ConnectFailureException    if the first connect fails
     */
    public boolean subscribe(String subscriberId, String requested) {
        String symbol = Symbols.normalize(requested);

        while (true) {
            SymbolEntry entry = bySymbol.computeIfAbsent(symbol, SymbolEntry::new);
            entry.lock.lock();
            try {
                if (entry.retired) {
                    continue;
                }
                if (entry.subscribers.contains(subscriberId)) {
                    LOGGER.debug("[{}] Already subscribed to {}", subscriberId, symbol);
                    return false;
                }
                if (entry.subscribers.isEmpty()) {
                    try {
                        pool.acquire(symbol);
                    } catch (RuntimeException e) {
                        retire(entry);
                        LOGGER.warn("[{}] Subscribe to {} failed: {}", subscriberId, symbol, e.getMessage());
                        throw e;
                    }
                }
                entry.subscribers.add(subscriberId);
                bySubscriber.compute(subscriberId, (id, symbols) -> {
                    Set<String> target = symbols == null ? ConcurrentHashMap.newKeySet() : symbols;
                    target.add(symbol);
                    return target;
                });
                metrics.setSubscribers(symbol, entry.subscribers.size());
                LOGGER.info("[{}] Subscribed to {} ({} subscribers)", subscriberId, symbol, entry.subscribers.size());
                return true;
            } finally {
                entry.lock.unlock();
            }
        }
    }

    /**
     * Removes the relation. Releases the symbol's upstream connection when this was its
     * last subscriber.
     *
     * @return false if the relation did not exist
     */
    public boolean unsubscribe(String subscriberId, String requested) {
        String symbol = Symbols.normalize(requested);
        SymbolEntry entry = bySymbol.get(symbol);
        if (entry == null) {
            return false;
        }

        entry.lock.lock();
        try {
            if (entry.retired || !entry.subscribers.remove(subscriberId)) {
                return false;
            }
            bySubscriber.computeIfPresent(subscriberId, (id, symbols) -> {
                symbols.remove(symbol);
                return symbols.isEmpty() ? null : symbols;
            });
            int remaining = entry.subscribers.size();
            metrics.setSubscribers(symbol, remaining);
            LOGGER.info("[{}] Unsubscribed from {} ({} subscribers left)", subscriberId, symbol, remaining);
            if (remaining == 0) {
                retire(entry);
                pool.release(symbol);
            }
            return true;
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Removes every relation of a subscriber, with the same release side effects as
     * unsubscribing from each symbol in turn.
     *
     * @return the symbols the subscriber was removed from
     */
    public Set<String> unsubscribeAll(String subscriberId) {
        Set<String> removed = ConcurrentHashMap.newKeySet();
        for (String symbol : symbolsOf(subscriberId)) {
            if (unsubscribe(subscriberId, symbol)) {
                removed.add(symbol);
            }
        }
        if (!removed.isEmpty()) {
            LOGGER.info("[{}] Removed from {} symbol(s)", subscriberId, removed.size());
        }
        return Set.copyOf(removed);
    }

    /**
     * Point-in-time copy of a symbol's subscribers.
     */
    public Set<String> subscribersOf(String symbol) {
        SymbolEntry entry = bySymbol.get(Symbols.normalize(symbol));
        return entry == null ? Set.of() : Set.copyOf(entry.subscribers);
    }

    /**
     * Point-in-time copy of a subscriber's symbols.
     */
    public Set<String> symbolsOf(String subscriberId) {
        Set<String> symbols = bySubscriber.get(subscriberId);
        return symbols == null ? Set.of() : Set.copyOf(symbols);
    }

    public int subscriberCount(String symbol) {
        SymbolEntry entry = bySymbol.get(Symbols.normalize(symbol));
        return entry == null ? 0 : entry.subscribers.size();
    }

    /**
     * Symbols with at least one subscriber.
     */
    public Set<String> activeSymbols() {
        return Set.copyOf(bySymbol.keySet());
    }

    /**
     * Caller holds entry.lock.
     */
    private void retire(SymbolEntry entry) {
        entry.retired = true;
        bySymbol.remove(entry.symbol, entry);
        metrics.setSubscribers(entry.symbol, 0);
    }

    private static final class SymbolEntry {
        private final String symbol;
        private final ReentrantLock lock = new ReentrantLock();
        private final Set<String> subscribers = ConcurrentHashMap.newKeySet();
        private volatile boolean retired = false;

        private SymbolEntry(String symbol) {
            this.symbol = symbol;
        }
    }
}
