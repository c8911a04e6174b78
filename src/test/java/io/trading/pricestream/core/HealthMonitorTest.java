package io.trading.pricestream.core;

import io.prometheus.client.CollectorRegistry;
import io.trading.pricestream.feed.FakeFeedConnector;
import io.trading.pricestream.feed.FeedConnectionPool;
import io.trading.pricestream.feed.StaticFeedAdapter;
import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.ConnectorStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HealthMonitorTest {

    private FakeFeedConnector.Factory connectors;
    private FeedConnectionPool pool;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        GatewayMetrics metrics = new GatewayMetrics(new CollectorRegistry());
        connectors = new FakeFeedConnector.Factory();
        pool = new FeedConnectionPool(StaticFeedAdapter.create(), connectors, tick -> { }, metrics);
        monitor = new HealthMonitor(60_000, pool, metrics);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
        pool.close();
    }

    @Test
    void testHealthyWhenEveryConnectorIsUp() {
        assertTrue(monitor.isHealthy());

        pool.acquire("BTCUSD");

        assertEquals(0, monitor.performHealthCheck());
        assertTrue(monitor.isHealthy());
        assertEquals(ConnectorStatus.CONNECTED, monitor.getStats("BTCUSD").getLastStatus());
    }

    @Test
    void testRevivesDisconnectedConnector() {
        pool.acquire("BTCUSD");
        FakeFeedConnector connector = connectors.last();
        connector.markDisconnected();
        assertFalse(monitor.isHealthy());

        assertEquals(1, monitor.performHealthCheck());

        assertTrue(connector.isConnected());
        assertTrue(monitor.isHealthy());
        HealthMonitor.ConnectionStats stats = monitor.getStats("BTCUSD");
        assertEquals(1, stats.getDisconnectCount());
        assertEquals(ConnectorStatus.DISCONNECTED, stats.getLastStatus());
    }

    @Test
    void testStatsDroppedForReleasedSymbols() {
        pool.acquire("BTCUSD");
        monitor.performHealthCheck();

        pool.release("BTCUSD");
        monitor.performHealthCheck();

        assertNull(monitor.getStats("BTCUSD"));
    }
}
