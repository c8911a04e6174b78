package io.trading.pricestream.feed;

import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.ConnectorStatus;
import io.trading.pricestream.model.PriceTick;
import io.trading.pricestream.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Upstream connector for one symbol.
 *
 * Status moves DISCONNECTED -> CONNECTING -> CONNECTED, back to CONNECTING when the
 * connection fails while receiving, and to DISCONNECTED on an explicit stop, a remote
 * close frame, or when the retry policy gives up. All transitions happen under
 * {@code connectionLock}; transport callbacks are handed to the control thread of the
 * {@link ReconnectHandler} so the I/O thread never waits on that lock.
 */
public class UpstreamFeedConnector implements FeedConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(UpstreamFeedConnector.class);

    private final String symbol;
    private final String name;
    private final FeedAdapter adapter;
    private final FeedTransport.Factory transportFactory;
    private final Duration connectTimeout;
    private final TickListener tickListener;
    private final GatewayMetrics metrics;
    private final ReconnectHandler reconnectHandler;

    private final ReentrantLock connectionLock = new ReentrantLock();
    private final AtomicReference<ConnectorStatus> status = new AtomicReference<>(ConnectorStatus.DISCONNECTED);
    private final Set<String> subscribedSymbols = ConcurrentHashMap.newKeySet();
    private final AtomicLong requestIds = new AtomicLong(0);
    private final AtomicLong messageCount = new AtomicLong(0);
    private final AtomicLong errorCount = new AtomicLong(0);

    // guarded by connectionLock
    private FeedTransport transport;
    // bumped under connectionLock whenever a transport is opened or discarded
    private volatile long generation = 0;
    private volatile boolean stopped = true;
    private volatile Instant lastActivity = Instant.now();

    public UpstreamFeedConnector(
        String symbol,
        FeedAdapter adapter,
        FeedTransport.Factory transportFactory,
        Duration connectTimeout,
        ReconnectPolicy reconnectPolicy,
        TickListener tickListener,
        GatewayMetrics metrics
    ) {
        this.symbol = Symbols.normalize(symbol);
        this.name = adapter.name() + ":" + this.symbol;
        this.adapter = adapter;
        this.transportFactory = transportFactory;
        this.connectTimeout = connectTimeout;
        this.tickListener = tickListener;
        this.metrics = metrics;
        this.reconnectHandler = new ReconnectHandler(name, reconnectPolicy, this::reconnect, this::onRetriesExhausted);
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public void connect() {
        try {
            connectLocked();
        } catch (ConnectFailureException e) {
            reconnectHandler.stop();
            throw e;
        }
    }

    private void connectLocked() {
        connectionLock.lock();
        try {
            if (isConnected()) {
                LOGGER.debug("[{}] Already connected", name);
                return;
            }
            stopped = false;
            reconnectHandler.start();
            openTransport(ConnectorStatus.DISCONNECTED);
        } catch (ConnectFailureException e) {
            stopped = true;
            throw e;
        } finally {
            connectionLock.unlock();
        }
    }

    @Override
    public void disconnect() {
        connectionLock.lock();
        try {
            stopped = true;
            closeTransport();
            subscribedSymbols.clear();
            setStatus(ConnectorStatus.DISCONNECTED);
        } finally {
            connectionLock.unlock();
        }
        // outside the lock: a pending control task may be waiting for it
        reconnectHandler.stop();
        LOGGER.info("[{}] Disconnected", name);
    }

    @Override
    public boolean isConnected() {
        return status.get() == ConnectorStatus.CONNECTED;
    }

    @Override
    public ConnectorStatus getStatus() {
        return status.get();
    }

    @Override
    public void sendSubscribe(String requested) {
        String target = Symbols.normalize(requested);
        if (!adapter.supports(target)) {
            LOGGER.warn("[{}] Symbol {} is not supported by {}", name, target, adapter.name());
            throw new UnsupportedSymbolException(target);
        }

        connectionLock.lock();
        try {
            if (!isConnected() || transport == null) {
                LOGGER.error("[{}] Connection is not available for {}", name, target);
                throw new ConnectionUnavailableException(target);
            }
            // connect() already restores every symbol still in the set
            if (!subscribedSymbols.add(target)) {
                LOGGER.debug("[{}] Already subscribed to {}", name, target);
                return;
            }
            try {
                writeSubscribe(target);
            } catch (IllegalStateException e) {
                subscribedSymbols.remove(target);
                throw new ConnectionUnavailableException(target, e);
            }
        } finally {
            connectionLock.unlock();
        }
        LOGGER.info("[{}] Subscription sent for {} ({}), waiting for prices", name, target, adapter.vendorToken(target));
    }

    @Override
    public void sendUnsubscribe(String requested) {
        String target = Symbols.normalize(requested);
        if (!subscribedSymbols.remove(target)) {
            return;
        }

        connectionLock.lock();
        try {
            if (isConnected() && transport != null) {
                String token = adapter.vendorToken(target);
                transport.send(adapter.unsubscribeMessage(token, requestIds.incrementAndGet()));
                LOGGER.info("[{}] Unsubscribed from {}", name, target);
            }
        } catch (IllegalStateException e) {
            LOGGER.warn("[{}] Could not send unsubscribe for {}: {}", name, target, e.getMessage());
        } finally {
            connectionLock.unlock();
        }
    }

    @Override
    public Instant getLastActivity() {
        return lastActivity;
    }

    @Override
    public long getMessageCount() {
        return messageCount.get();
    }

    @Override
    public long getErrorCount() {
        return errorCount.get();
    }

    /**
     * Returns the number of consecutive reconnect attempts since the last successful connect.
     */
    public int getRetryCount() {
        return reconnectHandler.getRetryCount();
    }

    @Override
    public void close() {
        disconnect();
    }

    /**
     * Replaces any previous transport with a freshly connected one. Caller holds connectionLock.
     *
     * @param statusOnFailure status left behind when the connect fails
     */
    private void openTransport(ConnectorStatus statusOnFailure) {
        // waits for the previous connection's I/O thread to finish
        closeTransport();

        long currentGeneration = ++generation;
        setStatus(ConnectorStatus.CONNECTING);
        metrics.recordConnectAttempt(symbol);
        LOGGER.info("[{}] Connecting to {}", name, adapter.endpoint());

        FeedTransport candidate = transportFactory.create(
            adapter.endpoint(), name, new TransportListener(currentGeneration)
        );
        transport = candidate;
        try {
            candidate.connect(connectTimeout);
        } catch (IOException e) {
            transport = null;
            generation++;
            candidate.close();
            setStatus(statusOnFailure);
            errorCount.incrementAndGet();
            metrics.recordConnectFailure(symbol);
            LOGGER.error("[{}] Failed to connect to {}", name, adapter.endpoint(), e);
            throw new ConnectFailureException(symbol, e);
        }

        reconnectHandler.reset();
        setStatus(ConnectorStatus.CONNECTED);
        LOGGER.info("[{}] Connected", name);

        for (String subscribed : subscribedSymbols) {
            try {
                writeSubscribe(subscribed);
                LOGGER.info("[{}] Resubscribed to {}", name, subscribed);
            } catch (IllegalStateException e) {
                LOGGER.warn("[{}] Resubscribe for {} failed: {}", name, subscribed, e.getMessage());
            }
        }
    }

    /**
     * Caller holds connectionLock.
     */
    private void closeTransport() {
        FeedTransport current = transport;
        if (current == null) {
            return;
        }
        transport = null;
        generation++;
        try {
            current.close();
        } catch (RuntimeException e) {
            LOGGER.warn("[{}] Error while closing transport", name, e);
        }
    }

    private void writeSubscribe(String target) {
        String token = adapter.vendorToken(target);
        transport.send(adapter.subscribeMessage(token, requestIds.incrementAndGet()));
    }

    private void setStatus(ConnectorStatus next) {
        ConnectorStatus previous = status.getAndSet(next);
        lastActivity = Instant.now();
        if (previous != next) {
            LOGGER.debug("[{}] Status {} -> {}", name, previous, next);
        }
        metrics.setConnectionStatus(symbol, next == ConnectorStatus.CONNECTED);
    }

    private void handleMessage(String message) {
        messageCount.incrementAndGet();
        lastActivity = Instant.now();

        Optional<PriceTick> parsed;
        try {
            parsed = adapter.parse(message);
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            metrics.recordFrameDropped(adapter.name());
            LOGGER.warn("[{}] Dropping frame that failed to parse: {}", name, message, e);
            return;
        }

        if (parsed.isEmpty()) {
            metrics.recordFrameDropped(adapter.name());
            return;
        }

        PriceTick tick = parsed.get();
        if (!subscribedSymbols.contains(tick.symbol())) {
            metrics.recordFrameDropped(adapter.name());
            LOGGER.warn("[{}] Dropping price for unsubscribed symbol {}", name, tick.symbol());
            return;
        }

        metrics.recordTickReceived(tick.symbol());
        LOGGER.debug("[{}] Price update: {} = {}", name, tick.symbol(), tick.value());
        try {
            tickListener.onTick(tick);
        } catch (RuntimeException e) {
            LOGGER.error("[{}] Tick listener failed for {}", name, tick.symbol(), e);
        }
    }

    private void handleFailure(long failedGeneration, Throwable cause) {
        connectionLock.lock();
        try {
            if (stopped || failedGeneration != generation) {
                return;
            }
            errorCount.incrementAndGet();
            LOGGER.error("[{}] Upstream receive failed, will retry", name, cause);
            closeTransport();
            setStatus(ConnectorStatus.CONNECTING);
        } finally {
            connectionLock.unlock();
        }
        reconnectHandler.scheduleReconnect();
    }

    private void handleRemoteClose(long closedGeneration, int statusCode, String reason) {
        connectionLock.lock();
        try {
            if (stopped || closedGeneration != generation) {
                return;
            }
            LOGGER.warn("[{}] Upstream closed the connection ({} {})", name, statusCode, reason);
            closeTransport();
            setStatus(ConnectorStatus.DISCONNECTED);
        } finally {
            connectionLock.unlock();
        }
    }

    private void reconnect() {
        connectionLock.lock();
        try {
            if (stopped || status.get() != ConnectorStatus.CONNECTING) {
                return;
            }
            metrics.recordReconnectAttempt(symbol);
            openTransport(ConnectorStatus.CONNECTING);
        } finally {
            connectionLock.unlock();
        }
    }

    private void onRetriesExhausted() {
        connectionLock.lock();
        try {
            if (!stopped) {
                setStatus(ConnectorStatus.DISCONNECTED);
            }
        } finally {
            connectionLock.unlock();
        }
    }

    /**
     * Binds transport callbacks to the generation they were created for.
     */
    private final class TransportListener implements FeedTransport.Listener {

        private final long owner;

        private TransportListener(long owner) {
            this.owner = owner;
        }

        @Override
        public void onMessage(String message) {
            if (owner == generation) {
                handleMessage(message);
            }
        }

        @Override
        public void onRemoteClose(int statusCode, String reason) {
            if (!reconnectHandler.execute(() -> handleRemoteClose(owner, statusCode, reason))) {
                LOGGER.debug("[{}] Ignoring remote close after stop", name);
            }
        }

        @Override
        public void onFailure(Throwable cause) {
            if (!reconnectHandler.execute(() -> handleFailure(owner, cause))) {
                LOGGER.debug("[{}] Ignoring transport failure after stop: {}", name, cause.getMessage());
            }
        }
    }
}
