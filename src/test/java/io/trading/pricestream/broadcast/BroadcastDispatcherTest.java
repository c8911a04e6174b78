package io.trading.pricestream.broadcast;

import io.prometheus.client.CollectorRegistry;
import io.trading.pricestream.Await;
import io.trading.pricestream.feed.FakeFeedConnector;
import io.trading.pricestream.feed.FeedConnectionPool;
import io.trading.pricestream.feed.StaticFeedAdapter;
import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.PriceTick;
import io.trading.pricestream.subscription.SubscriptionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BroadcastDispatcherTest {

    private GatewayMetrics metrics;
    private SubscriptionRegistry registry;
    private ExecutorService executor;
    private BroadcastDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        metrics = new GatewayMetrics(new CollectorRegistry());
        FeedConnectionPool pool = new FeedConnectionPool(
            StaticFeedAdapter.create(), new FakeFeedConnector.Factory(), tick -> { }, metrics
        );
        registry = new SubscriptionRegistry(pool, metrics);
        executor = Executors.newFixedThreadPool(4);
        dispatcher = new BroadcastDispatcher(registry, executor, 16, metrics);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        executor.shutdownNow();
    }

    private static PriceTick tick(String symbol, String value) {
        return new PriceTick(symbol, new BigDecimal(value), Instant.ofEpochMilli(1704067200000L));
    }

    private List<PriceTick> attach(String subscriberId) {
        List<PriceTick> received = new CopyOnWriteArrayList<>();
        dispatcher.registerSink(subscriberId, received::add);
        return received;
    }

    @Test
    void testTickReachesExactlyTheSubscribers() {
        List<PriceTick> alice = attach("alice");
        List<PriceTick> bob = attach("bob");
        List<PriceTick> carol = attach("carol");
        registry.subscribe("alice", "BTCUSD");
        registry.subscribe("bob", "BTCUSD");
        registry.subscribe("carol", "ETHUSD");

        PriceTick btc = tick("BTCUSD", "43250.50");
        dispatcher.onTick(btc);

        Await.until(() -> alice.size() == 1 && bob.size() == 1, 2000, "fan-out");
        assertEquals(List.of(btc), alice);
        assertEquals(List.of(btc), bob);
        assertTrue(carol.isEmpty());
        assertEquals(2.0, metrics.getDeliveries("BTCUSD"));
    }

    @Test
    void testTickWithoutSubscribersIsIgnored() {
        List<PriceTick> alice = attach("alice");

        dispatcher.onTick(tick("BTCUSD", "43250.50"));

        assertTrue(alice.isEmpty());
        assertEquals(0, dispatcher.channel("alice").orElseThrow().pending());
    }

    @Test
    void testLateSubscriberDoesNotGetEarlierTicks() throws InterruptedException {
        List<PriceTick> alice = attach("alice");
        List<PriceTick> late = attach("late");
        registry.subscribe("alice", "BTCUSD");

        PriceTick first = tick("BTCUSD", "43000");
        dispatcher.onTick(first);
        Await.until(() -> alice.size() == 1, 2000, "first tick");

        registry.subscribe("late", "BTCUSD");
        Thread.sleep(50);
        assertTrue(late.isEmpty());

        PriceTick second = tick("BTCUSD", "43100");
        dispatcher.onTick(second);
        Await.until(() -> late.size() == 1, 2000, "second tick");
        assertEquals(List.of(second), late);
    }

    @Test
    void testFailingSubscriberDoesNotAffectOthers() {
        dispatcher.registerSink("broken", tick -> {
            throw new IllegalStateException("socket closed");
        });
        List<PriceTick> healthy = attach("healthy");
        registry.subscribe("broken", "BTCUSD");
        registry.subscribe("healthy", "BTCUSD");

        assertDoesNotThrow(() -> dispatcher.onTick(tick("BTCUSD", "43000")));
        dispatcher.onTick(tick("BTCUSD", "43100"));

        Await.until(() -> healthy.size() == 2, 2000, "healthy deliveries");
        Await.until(() -> metrics.getDeliveryFailures() == 2.0, 2000, "failures counted");
        assertEquals(2, dispatcher.channel("broken").orElseThrow().getFailed());
    }

    @Test
    void testSlowSubscriberDoesNotBlockSourceOrOthers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        dispatcher.registerSink("slow", tick -> release.await());
        List<PriceTick> fast = attach("fast");
        registry.subscribe("slow", "BTCUSD");
        registry.subscribe("fast", "BTCUSD");

        long start = System.nanoTime();
        for (int i = 0; i < 40; i++) {
            dispatcher.onTick(tick("BTCUSD", Integer.toString(43000 + i)));
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        Await.until(() -> fast.size() + dispatcher.channel("fast").orElseThrow().getDropped() == 40, 2000, "fast drained");
        assertTrue(elapsedMs < 1000, "publishing took " + elapsedMs + " ms");
        assertTrue(dispatcher.channel("slow").orElseThrow().getDropped() > 0);
        assertTrue(metrics.getDeliveriesDropped() > 0);
        release.countDown();
    }

    @Test
    void testTicksArriveInOrderPerSubscriber() {
        List<PriceTick> alice = attach("alice");
        registry.subscribe("alice", "BTCUSD");

        for (int i = 0; i < 16; i++) {
            dispatcher.onTick(tick("BTCUSD", Integer.toString(i)));
            Await.until(() -> dispatcher.channel("alice").orElseThrow().pending() < 8, 2000, "drain");
        }

        Await.until(() -> alice.size() == 16, 2000, "all ticks");
        for (int i = 0; i < 16; i++) {
            assertEquals(0, new BigDecimal(i).compareTo(alice.get(i).value()));
        }
    }

    @Test
    void testUnregisteredSinkStopsDelivery() {
        List<PriceTick> alice = attach("alice");
        registry.subscribe("alice", "BTCUSD");

        dispatcher.unregisterSink("alice");
        dispatcher.onTick(tick("BTCUSD", "43000"));

        assertTrue(alice.isEmpty());
        assertTrue(dispatcher.channel("alice").isEmpty());
    }
}
