package io.trading.pricestream.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.trading.pricestream.Await;
import io.trading.pricestream.config.GatewayConfig;
import io.trading.pricestream.feed.FakeFeedTransport;
import io.trading.pricestream.hub.PriceHubServer;
import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.InstrumentType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the whole gateway on ephemeral ports against an in-memory upstream.
 */
class GatewayControllerTest {

    private static final String BTC_TRADE =
        "{\"stream\":\"btcusdt@aggTrade\",\"data\":{\"e\":\"aggTrade\",\"E\":1704067200000,\"s\":\"BTCUSDT\",\"p\":\"43250.50\"}}";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private FakeFeedTransport.Factory transports;
    private GatewayController controller;

    @BeforeEach
    void setUp() throws Exception {
        GatewayConfig config = GatewayConfig.builder()
            .hubPort(0)
            .httpPort(0)
            .feedUrl("ws://localhost:9/stream")
            .addInstrument("BTCUSD", "Bitcoin/US Dollar", InstrumentType.CRYPTO)
            .addInstrument("EURUSD", "Euro/US Dollar", InstrumentType.FOREX)
            .addFeedSymbol("BTCUSD", "btcusdt")
            .coldReadTimeoutMs(1000)
            .reconnectDelayMs(20)
            .healthCheckMs(60_000)
            .build();
        transports = new FakeFeedTransport.Factory();
        controller = new GatewayController(config, new GatewayMetrics(new CollectorRegistry()), transports);
        controller.start();
    }

    @AfterEach
    void tearDown() {
        controller.shutdown();
    }

    private HttpResponse<String> get(String path) throws Exception {
        URI uri = URI.create("http://localhost:" + controller.getApiServer().getPort() + path);
        return http.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testPriceEndpoint() throws Exception {
        assertEquals(400, get("/api/prices").statusCode());
        assertEquals(400, get("/api/prices?symbol=").statusCode());
        assertEquals(422, get("/api/prices?symbol=EURUSD").statusCode());
        assertEquals(422, get("/api/prices?symbol=DOGEUSD").statusCode());

        // cold read: the feed starts but stays silent
        assertEquals(404, get("/api/prices?symbol=BTCUSD").statusCode());
        assertEquals(1, transports.created().size());

        transports.last().emit(BTC_TRADE);
        HttpResponse<String> response = get("/api/prices?symbol=btcusd");

        assertEquals(200, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertEquals("BTCUSD", body.get("symbol").asText());
        assertEquals(0, new BigDecimal("43250.50").compareTo(body.get("value").decimalValue()));
        assertEquals(1704067200000L, body.get("timestamp").asLong());
    }

    private CompletableFuture<HttpResponse<String>> getAsync(String path) {
        URI uri = URI.create("http://localhost:" + controller.getApiServer().getPort() + path);
        return http.sendAsync(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testSlowUpstreamConnectDoesNotStallOtherRequests() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        transports.holdConnects(gate);
        try {
            CompletableFuture<HttpResponse<String>> coldRead = getAsync("/api/prices?symbol=BTCUSD");
            Await.until(() -> transports.created().size() == 1, 2000, "upstream connect started");

            long start = System.nanoTime();
            HttpResponse<String> health = get("/health");
            HttpResponse<String> metrics = get("/metrics");
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(200, health.statusCode());
            assertEquals(200, metrics.statusCode());
            assertTrue(elapsedMs < 1000, "requests took " + elapsedMs + " ms behind a cold read");
            assertFalse(coldRead.isDone());

            gate.countDown();
            // the feed stays silent, so the read ends after the cold read budget
            assertEquals(404, coldRead.get(5, TimeUnit.SECONDS).statusCode());
        } finally {
            gate.countDown();
        }
    }

    @Test
    void testWaitingReaderAndHubSubscriberBothGetTheTick() throws Exception {
        BlockingQueue<JsonNode> events = new LinkedBlockingQueue<>();
        URI uri = URI.create("ws://localhost:" + controller.getHubServer().getPort() + PriceHubServer.PATH);
        WebSocket socket = http.newWebSocketBuilder()
            .buildAsync(uri, new CollectingListener(events))
            .get(5, TimeUnit.SECONDS);
        socket.sendText("{\"action\":\"subscribe\",\"symbol\":\"BTCUSD\"}", true).get(5, TimeUnit.SECONDS);
        assertEquals("subscribed", next(events).get("event").asText());

        CompletableFuture<HttpResponse<String>> coldRead = getAsync("/api/prices?symbol=BTCUSD");
        Await.until(() -> controller.getCache().waiterCount("BTCUSD") == 1, 2000, "reader waiting");

        Thread feed = new Thread(() -> transports.last().emit(BTC_TRADE), "test-feed");
        feed.start();
        feed.join(2000);

        HttpResponse<String> response = coldRead.get(5, TimeUnit.SECONDS);
        assertEquals(200, response.statusCode());
        assertEquals("BTCUSD", mapper.readTree(response.body()).get("symbol").asText());
        assertEquals("price", next(events).get("event").asText());
        socket.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
    }

    @Test
    void testUpstreamUnavailable() throws Exception {
        transports.failNextConnects(1);

        assertEquals(503, get("/api/prices?symbol=BTCUSD").statusCode());
    }

    @Test
    void testInstrumentsAndHealth() throws Exception {
        JsonNode instruments = mapper.readTree(get("/api/instruments").body());
        assertEquals(2, instruments.size());
        assertEquals("BTCUSD", instruments.get(0).get("symbol").asText());

        assertEquals("OK", get("/health").body());
        assertEquals(200, get("/api/health").statusCode());
        assertTrue(get("/metrics").body().contains("pricestream_active_connectors"));
    }

    @Test
    void testHubSubscribeReceivesPrices() throws Exception {
        BlockingQueue<JsonNode> events = new LinkedBlockingQueue<>();
        URI uri = URI.create("ws://localhost:" + controller.getHubServer().getPort() + PriceHubServer.PATH);
        WebSocket socket = http.newWebSocketBuilder()
            .buildAsync(uri, new CollectingListener(events))
            .get(5, TimeUnit.SECONDS);

        socket.sendText("{\"action\":\"subscribe\",\"symbol\":\"EURUSD\"}", true).get(5, TimeUnit.SECONDS);
        assertEquals("error", next(events).get("event").asText());

        socket.sendText("{\"action\":\"subscribe\",\"symbol\":\"btcusd\"}", true).get(5, TimeUnit.SECONDS);
        JsonNode subscribed = next(events);
        assertEquals("subscribed", subscribed.get("event").asText());
        assertEquals("BTCUSD", subscribed.get("symbol").asText());
        assertEquals(1, controller.getRegistry().subscriberCount("BTCUSD"));

        transports.last().emit(BTC_TRADE);
        JsonNode price = next(events);
        assertEquals("price", price.get("event").asText());
        assertEquals("BTCUSD", price.get("symbol").asText());

        socket.sendText("{\"action\":\"subscriptions\"}", true).get(5, TimeUnit.SECONDS);
        assertEquals("[\"BTCUSD\"]", next(events).get("symbols").toString());

        socket.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
        Await.until(() -> controller.getRegistry().subscriberCount("BTCUSD") == 0, 5000, "disconnect cleanup");
        Await.until(() -> !controller.getPool().hasConnector("BTCUSD"), 5000, "upstream released");
    }

    private static JsonNode next(BlockingQueue<JsonNode> events) throws InterruptedException {
        JsonNode event = events.poll(5, TimeUnit.SECONDS);
        assertNotNull(event, "no hub event within 5 s");
        return event;
    }

    private final class CollectingListener implements WebSocket.Listener {

        private final BlockingQueue<JsonNode> events;
        private final StringBuilder partial = new StringBuilder();

        private CollectingListener(BlockingQueue<JsonNode> events) {
            this.events = events;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                try {
                    events.add(mapper.readTree(partial.toString()));
                } catch (Exception e) {
                    throw new IllegalStateException("Hub sent invalid JSON: " + partial, e);
                } finally {
                    partial.setLength(0);
                }
            }
            webSocket.request(1);
            return null;
        }
    }
}
