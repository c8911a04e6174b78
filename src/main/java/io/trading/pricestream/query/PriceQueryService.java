package io.trading.pricestream.query;

import io.trading.pricestream.cache.PriceCache;
import io.trading.pricestream.feed.FeedConnectionPool;
import io.trading.pricestream.feed.UnsupportedSymbolException;
import io.trading.pricestream.instrument.InstrumentCatalog;
import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.PriceTick;
import io.trading.pricestream.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Serves "current price" reads from the cache, starting the upstream feed on a miss.
 *
 * The first miss of a symbol takes a pool reference that the service keeps until it is
 * closed, so later reads of that symbol are served from the cache.
 */
public class PriceQueryService implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PriceQueryService.class);

    private final InstrumentCatalog catalog;
    private final FeedConnectionPool pool;
    private final PriceCache cache;
    private final Duration coldReadTimeout;
    private final GatewayMetrics metrics;
    // symbol -> outcome of the pool acquire; readers arriving mid-connect share it
    private final Map<String, CompletableFuture<Void>> leases = new ConcurrentHashMap<>();

    public PriceQueryService(
        InstrumentCatalog catalog,
        FeedConnectionPool pool,
        PriceCache cache,
        Duration coldReadTimeout,
        GatewayMetrics metrics
    ) {
        this.catalog = catalog;
        this.pool = pool;
        this.cache = cache;
        this.coldReadTimeout = coldReadTimeout;
        this.metrics = metrics;
    }

    /**
     * Latest price of a symbol. Completes with an empty Optional when no tick arrives
     * within the cold read budget.
     *
     * A reader that arrives while another reader is starting the feed does not block; its
     * future fails with the same {@link io.trading.pricestream.feed.ConnectFailureException}
     * if that start fails.
     *
     * @throws IllegalArgumentException                                if the symbol is blank
     * @throws UnsupportedSymbolException                              if the symbol is not offered or has no feed
     * @throws io.trading.pricestream.feed.ConnectFailureException     if this call starts the feed and that fails
     */
    public CompletableFuture<Optional<PriceTick>> currentPrice(String requested) {
        String symbol = Symbols.normalize(requested);
        if (!catalog.contains(symbol) || !pool.supports(symbol)) {
            throw new UnsupportedSymbolException(symbol);
        }

        Optional<PriceTick> cached = cache.get(symbol);
        if (cached.isPresent()) {
            metrics.recordColdRead("hit");
            return CompletableFuture.completedFuture(cached);
        }

        CompletableFuture<Void> lease = ensureLease(symbol);
        metrics.recordColdRead("wait");
        LOGGER.debug("No cached price for {}, waiting up to {} ms", symbol, coldReadTimeout.toMillis());
        return lease
            .thenCompose(ignored -> cache.awaitNext(symbol, coldReadTimeout))
            .thenApply(Optional::of)
            .exceptionally(error -> {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
                if (cause instanceof TimeoutException) {
                    metrics.recordColdRead("timeout");
                    LOGGER.info("No price for {} within {} ms", symbol, coldReadTimeout.toMillis());
                    return Optional.empty();
                }
                throw error instanceof CompletionException ? (CompletionException) error : new CompletionException(error);
            });
    }

    private CompletableFuture<Void> ensureLease(String symbol) {
        CompletableFuture<Void> lease = new CompletableFuture<>();
        CompletableFuture<Void> existing = leases.putIfAbsent(symbol, lease);
        if (existing != null) {
            return existing;
        }
        try {
            pool.acquire(symbol);
        } catch (RuntimeException e) {
            leases.remove(symbol, lease);
            lease.completeExceptionally(e);
            throw e;
        }
        lease.complete(null);
        return lease;
    }

    /**
     * Symbols this service keeps, or is taking, an upstream reference on.
     */
    public Set<String> leasedSymbols() {
        return Set.copyOf(leases.keySet());
    }

    @Override
    public void close() {
        for (Map.Entry<String, CompletableFuture<Void>> entry : Map.copyOf(leases).entrySet()) {
            CompletableFuture<Void> lease = entry.getValue();
            if (leases.remove(entry.getKey(), lease) && lease.isDone() && !lease.isCompletedExceptionally()) {
                pool.release(entry.getKey());
            }
        }
    }
}
