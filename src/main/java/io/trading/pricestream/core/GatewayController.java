package io.trading.pricestream.core;

import io.trading.pricestream.api.ApiServer;
import io.trading.pricestream.broadcast.BroadcastDispatcher;
import io.trading.pricestream.broadcast.TickBus;
import io.trading.pricestream.cache.PriceCache;
import io.trading.pricestream.config.GatewayConfig;
import io.trading.pricestream.feed.FeedAdapter;
import io.trading.pricestream.feed.FeedConnectionPool;
import io.trading.pricestream.feed.FeedConnector;
import io.trading.pricestream.feed.FeedTransport;
import io.trading.pricestream.feed.UpstreamFeedConnector;
import io.trading.pricestream.feed.binance.BinanceFeedAdapter;
import io.trading.pricestream.hub.HubMessageCodec;
import io.trading.pricestream.hub.PriceHubServer;
import io.trading.pricestream.instrument.InstrumentCatalog;
import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.netty.WebSocketClient;
import io.trading.pricestream.query.InstrumentQueryService;
import io.trading.pricestream.query.PriceQueryService;
import io.trading.pricestream.subscription.SubscriptionRegistry;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main controller for the Price Stream Gateway.
 * Wires the feed pool, cache, registry and dispatcher, and runs the hub and HTTP servers.
 */
public class GatewayController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayController.class);

    private final GatewayConfig config;
    private final GatewayMetrics metrics;
    private final InstrumentCatalog catalog;
    private final FeedAdapter adapter;
    private final TickBus tickBus;
    private final PriceCache cache;
    private final FeedConnectionPool pool;
    private final SubscriptionRegistry registry;
    private final ExecutorService deliveryExecutor;
    private final ExecutorService hubWorkers;
    private final BroadcastDispatcher dispatcher;
    private final PriceQueryService priceQuery;
    private final InstrumentQueryService instrumentQuery;
    private final HealthMonitor healthMonitor;
    private final PriceHubServer hubServer;
    private final ApiServer apiServer;
    private final ShutdownSignalBarrier shutdownBarrier;

    public GatewayController(GatewayConfig config) {
        this(config, new GatewayMetrics(), WebSocketClient::new);
    }

    /**
     * @param config           Gateway configuration
     * @param metrics          Metrics sink
     * @param transportFactory Opens upstream connections
     */
    public GatewayController(GatewayConfig config, GatewayMetrics metrics, FeedTransport.Factory transportFactory) {
        this.config = config;
        this.metrics = metrics;
        this.catalog = new InstrumentCatalog(config.instruments());
        this.adapter = new BinanceFeedAdapter(config.feedUrl(), config.feedSymbols());
        this.tickBus = new TickBus();
        this.cache = new PriceCache();

        FeedConnector.Factory connectorFactory = (symbol, listener) -> new UpstreamFeedConnector(
            symbol,
            adapter,
            transportFactory,
            config.connectTimeout(),
            config.reconnectPolicy(),
            listener,
            metrics
        );
        this.pool = new FeedConnectionPool(adapter, connectorFactory, tickBus, metrics);
        this.registry = new SubscriptionRegistry(pool, metrics);

        this.deliveryExecutor = Executors.newFixedThreadPool(
            Math.max(2, Runtime.getRuntime().availableProcessors()),
            daemonThreads("delivery")
        );
        this.hubWorkers = Executors.newCachedThreadPool(daemonThreads("hub-worker"));
        this.dispatcher = new BroadcastDispatcher(registry, deliveryExecutor, config.subscriberQueueCapacity(), metrics);

        // cache first so a delivered tick can always be read back
        tickBus.addListener(cache).addListener(dispatcher);

        this.priceQuery = new PriceQueryService(catalog, pool, cache, config.coldReadTimeout(), metrics);
        this.instrumentQuery = new InstrumentQueryService(catalog);
        this.healthMonitor = new HealthMonitor(config.healthCheckMs(), pool, metrics);
        this.hubServer = new PriceHubServer(
            config.hubPort(), registry, dispatcher, catalog, new HubMessageCodec(), hubWorkers
        );
        this.apiServer = new ApiServer(
            config.httpPort(), config, metrics, healthMonitor, pool, registry, priceQuery, instrumentQuery
        );
        this.shutdownBarrier = new ShutdownSignalBarrier();

        LOGGER.info("Gateway controller initialized: {}", config.gatewayId());
    }

    /**
     * Starts the health monitor, the HTTP server and the hub.
     */
    public void start() throws IOException, InterruptedException {
        LOGGER.info("Starting Price Stream Gateway...");

        healthMonitor.start();
        apiServer.start();
        hubServer.start();

        LOGGER.info("Price Stream Gateway started successfully");
        logStatus();
    }

    /**
     * Waits for shutdown signal.
     */
    public void waitForShutdown() {
        LOGGER.info("Gateway running. Press Ctrl+C to shutdown.");
        shutdownBarrier.await();

        LOGGER.info("Shutdown signal received");
    }

    /**
     * Stops the gateway gracefully. Client disconnects drain through the hub workers
     * before the pool closes the remaining upstream connections.
     */
    public void shutdown() {
        LOGGER.info("Shutting down Price Stream Gateway...");

        CloseHelper.closeAll(hubServer, apiServer, healthMonitor);
        awaitTermination(hubWorkers, "hub workers");
        CloseHelper.closeAll(priceQuery, dispatcher);
        awaitTermination(deliveryExecutor, "delivery");
        CloseHelper.close(pool);

        LOGGER.info("Price Stream Gateway shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    private static void awaitTermination(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Executor {} did not terminate in time", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Logs current gateway status.
     */
    public void logStatus() {
        LOGGER.info("=== Gateway Status ===");
        LOGGER.info("Gateway ID: {}", config.gatewayId());
        LOGGER.info("Feed: {} ({})", adapter.name(), adapter.endpoint());
        LOGGER.info("Instruments: {}", catalog.size());
        LOGGER.info("Hub: ws://0.0.0.0:{}{}", hubServer.getPort(), PriceHubServer.PATH);
        LOGGER.info("HTTP: http://0.0.0.0:{}", apiServer.getPort());
        LOGGER.info("Active connectors: {}", pool.activeSymbols());
        LOGGER.info("Cached prices: {}", cache.size());
        LOGGER.info("Delivery sinks: {}", dispatcher.sinkCount());

        healthMonitor.logSummary();
        LOGGER.info("=====================");
    }

    /**
     * Gets the shutdown barrier for external signal handling.
     */
    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }

    public FeedConnectionPool getPool() {
        return pool;
    }

    public SubscriptionRegistry getRegistry() {
        return registry;
    }

    public PriceCache getCache() {
        return cache;
    }

    public BroadcastDispatcher getDispatcher() {
        return dispatcher;
    }

    public PriceQueryService getPriceQuery() {
        return priceQuery;
    }

    public PriceHubServer getHubServer() {
        return hubServer;
    }

    public ApiServer getApiServer() {
        return apiServer;
    }
}
