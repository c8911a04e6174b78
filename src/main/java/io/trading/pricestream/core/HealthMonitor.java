package io.trading.pricestream.core;

import io.trading.pricestream.feed.FeedConnectionPool;
import io.trading.pricestream.feed.FeedConnector;
import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.ConnectorStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Monitors the health of upstream connectors and reports statistics.
 * Connectors found DISCONNECTED while still referenced are reconnected.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    private final long checkIntervalMs;
    private final FeedConnectionPool pool;
    private final GatewayMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ConnectionStats> statsMap = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    public HealthMonitor(long checkIntervalMs, FeedConnectionPool pool, GatewayMetrics metrics) {
        this.checkIntervalMs = checkIntervalMs;
        this.pool = pool;
        this.metrics = metrics;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the health monitor.
     */
    public void start() {
        if (running) {
            return;
        }

        running = true;
        scheduler.scheduleAtFixedRate(
            this::performHealthCheck,
            checkIntervalMs,
            checkIntervalMs,
            TimeUnit.MILLISECONDS
        );

        LOGGER.info("Health monitor started (interval: {} ms)", checkIntervalMs);
    }

    /**
     * Stops the health monitor.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Health monitor stopped");
    }

    /**
     * Checks every live connector once and revives the disconnected ones.
     *
     * @return number of connectors revived
     */
    public int performHealthCheck() {
        try {
            Map<String, FeedConnector> connectors = pool.connectors();
            statsMap.keySet().retainAll(connectors.keySet());

            for (Map.Entry<String, FeedConnector> entry : connectors.entrySet()) {
                FeedConnector connector = entry.getValue();
                ConnectorStatus status = connector.getStatus();
                ConnectionStats stats = statsMap.computeIfAbsent(entry.getKey(), ConnectionStats::new);
                stats.update(status);
                metrics.setConnectionStatus(entry.getKey(), status == ConnectorStatus.CONNECTED);

                if (status != ConnectorStatus.CONNECTED) {
                    LOGGER.warn("[HealthMonitor] {} is {} ({} references)", entry.getKey(), status, pool.refCount(entry.getKey()));
                }
            }
            metrics.setActiveConnectors(connectors.size());

            int revived = pool.reviveDisconnected();
            if (revived > 0) {
                LOGGER.info("[HealthMonitor] Revived {} connector(s)", revived);
            }
            return revived;
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            LOGGER.error("[HealthMonitor] Health check failed", e);
            return 0;
        }
    }

    /**
     * Whether every live connector is connected.
     */
    public boolean isHealthy() {
        return pool.connectors().values().stream().allMatch(FeedConnector::isConnected);
    }

    /**
     * Logs a summary of connection statistics.
     */
    public void logSummary() {
        LOGGER.info("=== Health Monitor Summary ===");
        pool.connectors().forEach((symbol, connector) -> {
            ConnectionStats stats = statsMap.get(symbol);
            LOGGER.info("{}: status={}, refs={}, messages={}, errors={}, disconnectCount={}",
                symbol,
                connector.getStatus(),
                pool.refCount(symbol),
                connector.getMessageCount(),
                connector.getErrorCount(),
                stats == null ? 0 : stats.getDisconnectCount()
            );
        });
        LOGGER.info("=============================");
    }

    /**
     * Gets connection statistics for a symbol, null if it was never checked.
     */
    public ConnectionStats getStats(String symbol) {
        return statsMap.get(symbol);
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Statistics for a connection.
     */
    public static class ConnectionStats {
        private final String symbol;
        private volatile ConnectorStatus lastStatus = ConnectorStatus.CONNECTED;
        private volatile long disconnectCount = 0;
        private volatile long lastDisconnectTime = 0;

        public ConnectionStats(String symbol) {
            this.symbol = symbol;
        }

        private void update(ConnectorStatus status) {
            if (status != ConnectorStatus.CONNECTED && lastStatus == ConnectorStatus.CONNECTED) {
                disconnectCount++;
                lastDisconnectTime = System.currentTimeMillis();
            }
            lastStatus = status;
        }

        public String getSymbol() {
            return symbol;
        }

        public ConnectorStatus getLastStatus() {
            return lastStatus;
        }

        public long getDisconnectCount() {
            return disconnectCount;
        }

        public long getLastDisconnectTime() {
            return lastDisconnectTime;
        }
    }
}
