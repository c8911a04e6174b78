package io.trading.pricestream.feed;

import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.ConnectorStatus;
import io.trading.pricestream.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference-counted pool of upstream connectors, at most one per symbol.
 *
 * The first {@link #acquire} of a symbol creates, connects and subscribes a connector;
 * the matching last {@link #release} disconnects it. Each symbol has its own slot with
 * its own lock, so a slow connect only holds up callers of the same symbol.
 */
public class FeedConnectionPool implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedConnectionPool.class);

    private final FeedAdapter adapter;
    private final FeedConnector.Factory connectorFactory;
    private final TickListener tickListener;
    private final GatewayMetrics metrics;
    private final ConcurrentHashMap<String, ConnectorSlot> slots = new ConcurrentHashMap<>();

    /**
     * @param adapter          Vendor adapter deciding which symbols are supported
     * @param connectorFactory Creates the connector for a symbol
     * @param tickListener     Receives every tick of every connector
     * @param metrics          Metrics sink
     */
    public FeedConnectionPool(
        FeedAdapter adapter,
        FeedConnector.Factory connectorFactory,
        TickListener tickListener,
        GatewayMetrics metrics
    ) {
        this.adapter = adapter;
        this.connectorFactory = connectorFactory;
        this.tickListener = tickListener;
        this.metrics = metrics;
    }

    /**
     * Takes a reference on the symbol's connector, creating and connecting it on the
     * first reference. Blocks only until the connect attempt completes.
     *
     * @throws UnsupportedSymbolException if the adapter has no mapping for the symbol
     * @throws ConnectFailureException    if the first connect fails; the reference is rolled back
     */
    public void acquire(String requested) {
        String symbol = Symbols.normalize(requested);
        if (!adapter.supports(symbol)) {
            LOGGER.warn("Acquire rejected, {} has no {} mapping", symbol, adapter.name());
            throw new UnsupportedSymbolException(symbol);
        }

        while (true) {
            ConnectorSlot slot = slots.computeIfAbsent(symbol, ConnectorSlot::new);
            slot.lock.lock();
            try {
                if (slot.retired) {
                    // lost a race with the last release, retry on a fresh slot
                    continue;
                }
                int previous = slot.refCount.getAndIncrement();
                if (previous == 0) {
                    LOGGER.info("First reference for {}, opening upstream connection", symbol);
                    openConnector(slot);
                } else {
                    LOGGER.debug("Additional reference for {}, total {} (reusing connection)", symbol, previous + 1);
                }
                metrics.setPoolReferences(symbol, slot.refCount.get());
                return;
            } finally {
                slot.lock.unlock();
            }
        }
    }

    /**
     * Drops a reference; the last one disconnects and removes the connector.
     * Releasing a symbol with no references is logged and ignored.
     */
    public void release(String requested) {
        String symbol = Symbols.normalize(requested);
        ConnectorSlot slot = slots.get(symbol);
        if (slot == null) {
            LOGGER.error("Release of {} without a matching acquire, ignoring", symbol);
            return;
        }

        slot.lock.lock();
        try {
            if (slot.retired || slot.refCount.get() == 0) {
                LOGGER.error("Release of {} would make its reference count negative, ignoring", symbol);
                return;
            }
            int remaining = slot.refCount.decrementAndGet();
            metrics.setPoolReferences(symbol, remaining);
            if (remaining == 0) {
                LOGGER.info("Last reference for {} released, closing upstream connection", symbol);
                retire(slot);
            } else {
                LOGGER.debug("Reference for {} released, {} remaining (connection stays open)", symbol, remaining);
            }
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Reconnects connectors that are DISCONNECTED while still referenced, e.g. after the
     * upstream closed the connection or the retry policy gave up.
     *
     * @return number of connectors revived
     */
    public int reviveDisconnected() {
        int revived = 0;
        for (ConnectorSlot slot : slots.values()) {
            slot.lock.lock();
            try {
                FeedConnector connector = slot.connector;
                if (slot.retired || connector == null || connector.getStatus() != ConnectorStatus.DISCONNECTED) {
                    continue;
                }
                LOGGER.warn("Reviving disconnected connector for {} ({} references)", slot.symbol, slot.refCount.get());
                try {
                    connector.connect();
                    connector.sendSubscribe(slot.symbol);
                    revived++;
                } catch (PriceFeedException e) {
                    LOGGER.error("Revive of {} failed: {}", slot.symbol, e.getMessage());
                }
            } finally {
                slot.lock.unlock();
            }
        }
        return revived;
    }

    /**
     * Current reference count, 0 when the symbol has no connector.
     */
    public int refCount(String symbol) {
        ConnectorSlot slot = slots.get(Symbols.normalize(symbol));
        return slot == null ? 0 : slot.refCount.get();
    }

    /**
     * The live connector of a symbol, if any.
     */
    public Optional<FeedConnector> connector(String symbol) {
        ConnectorSlot slot = slots.get(Symbols.normalize(symbol));
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.connector);
    }

    public boolean hasConnector(String symbol) {
        return connector(symbol).isPresent();
    }

    /**
     * Symbols with a live connector.
     */
    public Set<String> activeSymbols() {
        return Set.copyOf(slots.keySet());
    }

    /**
     * Point-in-time view of every live connector keyed by symbol.
     */
    public Map<String, FeedConnector> connectors() {
        Map<String, FeedConnector> view = new TreeMap<>();
        slots.forEach((symbol, slot) -> {
            FeedConnector connector = slot.connector;
            if (connector != null) {
                view.put(symbol, connector);
            }
        });
        return view;
    }

    public boolean supports(String symbol) {
        return adapter.supports(Symbols.normalize(symbol));
    }

    /**
     * Disconnects every connector regardless of reference counts.
     */
    @Override
    public void close() {
        for (ConnectorSlot slot : slots.values()) {
            slot.lock.lock();
            try {
                if (!slot.retired) {
                    slot.refCount.set(0);
                    retire(slot);
                }
            } finally {
                slot.lock.unlock();
            }
        }
        LOGGER.info("Feed connection pool closed");
    }

    /**
     * Caller holds slot.lock and observed the 0 -> 1 transition.
     */
    private void openConnector(ConnectorSlot slot) {
        FeedConnector connector = connectorFactory.create(slot.symbol, tickListener);
        try {
            connector.connect();
            connector.sendSubscribe(slot.symbol);
        } catch (RuntimeException e) {
            slot.refCount.decrementAndGet();
            closeQuietly(connector);
            slot.retired = true;
            slots.remove(slot.symbol, slot);
            metrics.setPoolReferences(slot.symbol, 0);
            if (e instanceof ConnectFailureException || e instanceof UnsupportedSymbolException) {
                throw e;
            }
            // connection dropped between connect and subscribe
            throw new ConnectFailureException(slot.symbol, e);
        }
        slot.connector = connector;
        metrics.setActiveConnectors(countConnectors());
    }

    /**
     * Caller holds slot.lock and observed the 1 -> 0 transition.
     */
    private void retire(ConnectorSlot slot) {
        slot.retired = true;
        FeedConnector connector = slot.connector;
        slot.connector = null;
        slots.remove(slot.symbol, slot);
        if (connector != null) {
            closeQuietly(connector);
        }
        metrics.setPoolReferences(slot.symbol, 0);
        metrics.setActiveConnectors(countConnectors());
    }

    private void closeQuietly(FeedConnector connector) {
        try {
            connector.close();
        } catch (RuntimeException e) {
            LOGGER.error("Error closing connector for {}", connector.getSymbol(), e);
        }
    }

    private int countConnectors() {
        int count = 0;
        for (ConnectorSlot slot : slots.values()) {
            if (slot.connector != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Per-symbol connector state. {@code connector} and {@code retired} change only under {@code lock}.
     */
    private static final class ConnectorSlot {
        private final String symbol;
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicInteger refCount = new AtomicInteger(0);
        private volatile FeedConnector connector;
        private volatile boolean retired = false;

        private ConnectorSlot(String symbol) {
            this.symbol = symbol;
        }
    }
}
