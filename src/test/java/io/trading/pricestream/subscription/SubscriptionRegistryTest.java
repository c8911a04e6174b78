package io.trading.pricestream.subscription;

import io.prometheus.client.CollectorRegistry;
import io.trading.pricestream.feed.ConnectFailureException;
import io.trading.pricestream.feed.FakeFeedConnector;
import io.trading.pricestream.feed.FeedConnectionPool;
import io.trading.pricestream.feed.StaticFeedAdapter;
import io.trading.pricestream.feed.UnsupportedSymbolException;
import io.trading.pricestream.metrics.GatewayMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private FakeFeedConnector.Factory connectors;
    private FeedConnectionPool pool;
    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        GatewayMetrics metrics = new GatewayMetrics(new CollectorRegistry());
        connectors = new FakeFeedConnector.Factory();
        pool = new FeedConnectionPool(StaticFeedAdapter.create(), connectors, tick -> { }, metrics);
        registry = new SubscriptionRegistry(pool, metrics);
    }

    @Test
    void testSubscribeUpdatesBothIndices() {
        assertTrue(registry.subscribe("alice", "btcusd"));

        assertEquals(Set.of("alice"), registry.subscribersOf("BTCUSD"));
        assertEquals(Set.of("BTCUSD"), registry.symbolsOf("alice"));
        assertEquals(1, pool.refCount("BTCUSD"));
    }

    @Test
    void testDuplicateSubscribeIsNoop() {
        registry.subscribe("alice", "BTCUSD");

        assertFalse(registry.subscribe("alice", "BTCUSD"));
        assertEquals(1, registry.subscriberCount("BTCUSD"));
        assertEquals(1, pool.refCount("BTCUSD"));
    }

    @Test
    void testThousandSubscribersShareOneConnection() throws Exception {
        int subscribers = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(32);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(subscribers);
        try {
            for (int i = 0; i < subscribers; i++) {
                String id = "sub-" + i;
                executor.execute(() -> {
                    try {
                        start.await();
                        registry.subscribe(id, "BTCUSD");
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, connectors.createdCount());
        assertEquals(subscribers, registry.subscriberCount("BTCUSD"));

        for (int i = 0; i < subscribers - 1; i++) {
            assertTrue(registry.unsubscribe("sub-" + i, "BTCUSD"));
        }
        assertTrue(pool.hasConnector("BTCUSD"));
        assertEquals(0, connectors.closedCount());

        registry.unsubscribe("sub-" + (subscribers - 1), "BTCUSD");
        assertFalse(pool.hasConnector("BTCUSD"));
        assertEquals(1, connectors.closedCount());
        assertTrue(registry.subscribersOf("BTCUSD").isEmpty());
    }

    @Test
    void testUnsupportedSymbolLeavesNoTrace() {
        assertThrows(UnsupportedSymbolException.class, () -> registry.subscribe("alice", "EURUSD"));

        assertTrue(registry.subscribersOf("EURUSD").isEmpty());
        assertTrue(registry.symbolsOf("alice").isEmpty());
        assertTrue(registry.activeSymbols().isEmpty());
    }

    @Test
    void testConnectFailureRollsBackRelation() {
        connectors.failConnect(true);

        assertThrows(ConnectFailureException.class, () -> registry.subscribe("alice", "BTCUSD"));
        assertTrue(registry.subscribersOf("BTCUSD").isEmpty());
        assertTrue(registry.symbolsOf("alice").isEmpty());
        assertEquals(0, pool.refCount("BTCUSD"));

        connectors.failConnect(false);
        assertTrue(registry.subscribe("alice", "BTCUSD"));
        assertEquals(1, pool.refCount("BTCUSD"));
    }

    @Test
    void testUnsubscribeUnknownRelation() {
        assertFalse(registry.unsubscribe("alice", "BTCUSD"));

        registry.subscribe("bob", "BTCUSD");
        assertFalse(registry.unsubscribe("alice", "BTCUSD"));
        assertEquals(1, pool.refCount("BTCUSD"));
    }

    @Test
    void testUnsubscribeAllReleasesEverySymbol() {
        registry.subscribe("alice", "BTCUSD");
        registry.subscribe("alice", "ETHUSD");
        registry.subscribe("bob", "ETHUSD");

        Set<String> removed = registry.unsubscribeAll("alice");

        assertEquals(Set.of("BTCUSD", "ETHUSD"), removed);
        assertTrue(registry.symbolsOf("alice").isEmpty());
        assertFalse(pool.hasConnector("BTCUSD"));
        assertTrue(pool.hasConnector("ETHUSD"));
        assertEquals(Set.of("bob"), registry.subscribersOf("ETHUSD"));
    }

    @Test
    void testSubscribersOfIsSnapshot() {
        registry.subscribe("alice", "BTCUSD");
        Set<String> snapshot = registry.subscribersOf("BTCUSD");

        registry.subscribe("bob", "BTCUSD");

        assertEquals(Set.of("alice"), snapshot);
    }

    @Test
    void testIndicesStayConsistentUnderConcurrentChurn() throws Exception {
        List<String> symbols = List.of("BTCUSD", "ETHUSD");
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        try {
            for (int t = 0; t < threads; t++) {
                long seed = t;
                executor.execute(() -> {
                    Random random = new Random(seed);
                    try {
                        for (int i = 0; i < 500; i++) {
                            String subscriber = "sub-" + random.nextInt(20);
                            String symbol = symbols.get(random.nextInt(symbols.size()));
                            switch (random.nextInt(3)) {
                                case 0 -> registry.subscribe(subscriber, symbol);
                                case 1 -> registry.unsubscribe(subscriber, symbol);
                                default -> registry.unsubscribeAll(subscriber);
                            }
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(20, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        for (String symbol : symbols) {
            Set<String> subscribers = registry.subscribersOf(symbol);
            for (String subscriber : subscribers) {
                assertTrue(registry.symbolsOf(subscriber).contains(symbol));
            }
            // one pool reference while the symbol has subscribers, none otherwise
            assertEquals(subscribers.isEmpty() ? 0 : 1, pool.refCount(symbol));
            assertEquals(!subscribers.isEmpty(), pool.hasConnector(symbol));
        }
        for (int i = 0; i < 20; i++) {
            String subscriber = "sub-" + i;
            for (String symbol : registry.symbolsOf(subscriber)) {
                assertTrue(registry.subscribersOf(symbol).contains(subscriber));
            }
        }
    }
}
