package io.trading.pricestream.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.pricestream.config.GatewayConfig;
import io.trading.pricestream.core.HealthMonitor;
import io.trading.pricestream.feed.ConnectFailureException;
import io.trading.pricestream.feed.FeedConnectionPool;
import io.trading.pricestream.feed.FeedConnector;
import io.trading.pricestream.feed.UnsupportedSymbolException;
import io.trading.pricestream.metrics.GatewayMetrics;
import io.trading.pricestream.model.PriceTick;
import io.trading.pricestream.query.InstrumentQueryService;
import io.trading.pricestream.query.PriceQueryService;
import io.trading.pricestream.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * HTTP server for exposing Prometheus metrics and REST API.
 * Serves metrics, health, status, instrument and price endpoints.
 */
public class ApiServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiServer.class);

    private static final int HTTP_THREADS = Math.max(4, Runtime.getRuntime().availableProcessors());

    private final int port;
    private final GatewayConfig config;
    private final GatewayMetrics metrics;
    private final HealthMonitor healthMonitor;
    private final FeedConnectionPool pool;
    private final SubscriptionRegistry registry;
    private final PriceQueryService priceQuery;
    private final InstrumentQueryService instrumentQuery;
    private final CollectorRegistry collectorRegistry;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;
    private ExecutorService httpExecutor;

    public ApiServer(
        int port,
        GatewayConfig config,
        GatewayMetrics metrics,
        HealthMonitor healthMonitor,
        FeedConnectionPool pool,
        SubscriptionRegistry registry,
        PriceQueryService priceQuery,
        InstrumentQueryService instrumentQuery
    ) {
        this.port = port;
        this.config = config;
        this.metrics = metrics;
        this.healthMonitor = healthMonitor;
        this.pool = pool;
        this.registry = registry;
        this.priceQuery = priceQuery;
        this.instrumentQuery = instrumentQuery;
        this.collectorRegistry = metrics.getRegistry();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        // Metrics endpoint (Prometheus)
        server.createContext("/metrics", handleMetrics());

        // Health endpoint (simple)
        server.createContext("/health", handleHealthSimple());

        // REST API endpoints
        server.createContext("/api/health", handleHealth());
        server.createContext("/api/status", handleStatus());
        server.createContext("/api/instruments", handleInstruments());
        server.createContext("/api/prices", handlePrices());

        // a cold price read may wait on an upstream connect, so requests never share one thread
        AtomicInteger threadCount = new AtomicInteger(0);
        httpExecutor = Executors.newFixedThreadPool(HTTP_THREADS, r -> {
            Thread thread = new Thread(r, "http-api-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(httpExecutor);
        server.start();

        LOGGER.info("HTTP server started on port {}", getPort());
        LOGGER.info("  Prometheus:  http://localhost:{}/metrics", getPort());
        LOGGER.info("  Health:      http://localhost:{}/health", getPort());
        LOGGER.info("  API Status:  http://localhost:{}/api/status", getPort());
        LOGGER.info("  Instruments: http://localhost:{}/api/instruments", getPort());
        LOGGER.info("  Prices:      http://localhost:{}/api/prices?symbol=BTCUSD", getPort());
    }

    /**
     * Bound port, useful when started on port 0.
     */
    public int getPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, collectorRegistry.metricFamilySamples());
                sendResponse(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            }
        };
    }

    private HttpHandler handleHealthSimple() {
        return exchange -> {
            try {
                sendResponse(exchange, 200, "text/plain", "OK");
            } catch (Exception e) {
                LOGGER.error("Error serving health", e);
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                boolean healthy = healthMonitor.isHealthy();
                String message = "All systems operational";
                if (!healthy) {
                    message = pool.connectors().values().stream()
                        .filter(connector -> !connector.isConnected())
                        .map(connector -> connector.getSymbol() + " " + connector.getStatus().name().toLowerCase())
                        .collect(Collectors.joining(", "));
                }
                sendJson(exchange, healthy ? 200 : 503, new HealthResponse(healthy, message));
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                sendError(exchange, 500, "Internal server error");
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                Map<String, ConnectorInfo> connectors = new LinkedHashMap<>();
                for (Map.Entry<String, FeedConnector> entry : pool.connectors().entrySet()) {
                    String symbol = entry.getKey();
                    FeedConnector connector = entry.getValue();
                    connectors.put(symbol, new ConnectorInfo(
                        symbol,
                        connector.getStatus().name(),
                        pool.refCount(symbol),
                        registry.subscriberCount(symbol),
                        connector.getMessageCount(),
                        connector.getErrorCount(),
                        (long) metrics.getTicksReceived(symbol),
                        connector.getLastActivity().toEpochMilli()
                    ));
                }

                StatusResponse statusResponse = new StatusResponse(
                    config.gatewayId(),
                    System.currentTimeMillis() - startTime,
                    config.feedUrl().toString(),
                    connectors
                );
                sendJson(exchange, 200, statusResponse);
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                sendError(exchange, 500, "Internal server error");
            }
        };
    }

    private HttpHandler handleInstruments() {
        return exchange -> {
            try {
                List<InstrumentInfo> instruments = instrumentQuery.instruments().stream()
                    .map(instrument -> new InstrumentInfo(
                        instrument.symbol(),
                        instrument.name(),
                        instrument.type().getDisplayName()
                    ))
                    .collect(Collectors.toList());
                sendJson(exchange, 200, instruments);
            } catch (Exception e) {
                LOGGER.error("Error handling instruments request", e);
                sendError(exchange, 500, "Internal server error");
            }
        };
    }

    /**
     * Runs on an HTTP worker, which a cold read holds only while it starts the upstream feed.
     * The response is written on the HTTP pool once the price future completes, never on the
     * feed thread that completed it.
     */
    private HttpHandler handlePrices() {
        return exchange -> {
            String symbol = queryParameter(exchange, "symbol");
            LOGGER.info("GET /api/prices?symbol={} - Request received", symbol);
            if (symbol == null || symbol.isBlank()) {
                sendError(exchange, 400, "Symbol is required");
                return;
            }

            CompletableFuture<Optional<PriceTick>> price;
            try {
                price = priceQuery.currentPrice(symbol);
            } catch (RuntimeException e) {
                sendPriceFailure(exchange, symbol, e);
                return;
            }

            price.whenCompleteAsync((tick, error) -> {
                try {
                    if (error != null) {
                        sendPriceFailure(exchange, symbol, error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error);
                    } else if (tick.isEmpty()) {
                        LOGGER.warn("Price not found for symbol: {}", symbol);
                        sendError(exchange, 404, "Price not found for symbol: " + symbol);
                    } else {
                        PriceTick value = tick.get();
                        sendJson(exchange, 200, new PriceResponse(value.symbol(), value.value(), value.timestampMillis()));
                    }
                } catch (IOException e) {
                    LOGGER.warn("Failed to write price response for {}: {}", symbol, e.getMessage());
                }
            }, httpExecutor);
        };
    }

    private void sendPriceFailure(HttpExchange exchange, String symbol, Throwable error) throws IOException {
        if (error instanceof UnsupportedSymbolException e) {
            LOGGER.warn("Price requested for unsupported symbol: {}", e.getSymbol());
            sendError(exchange, 422, "Symbol not supported: " + e.getSymbol());
        } else if (error instanceof ConnectFailureException e) {
            LOGGER.error("Upstream unavailable for {}", e.getSymbol(), e);
            sendError(exchange, 503, "Price feed unavailable for symbol: " + e.getSymbol());
        } else {
            LOGGER.error("Error retrieving price for symbol: {}", symbol, error);
            sendError(exchange, 500, "An error occurred while retrieving the price");
        }
    }

    private static String queryParameter(HttpExchange exchange, String name) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        String response;
        try {
            response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialize response", e);
            statusCode = 500;
            response = "{\"error\":\"Internal server error\"}";
        }
        sendJsonResponse(exchange, statusCode, response);
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, new ErrorResponse(message));
    }

    private void sendJsonResponse(HttpExchange exchange, int statusCode, String response) throws IOException {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        sendResponse(exchange, statusCode, "application/json", response);
    }

    private static void sendResponse(HttpExchange exchange, int statusCode, String contentType, String response) throws IOException {
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, bytes.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
        if (httpExecutor != null) {
            httpExecutor.shutdown();
            try {
                if (!httpExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                    httpExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                httpExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private record StatusResponse(String gatewayId, long uptimeMs, String feedUrl, Map<String, ConnectorInfo> connectors) {}
    private record ConnectorInfo(String symbol, String status, int references, int subscribers,
                                 long totalMessages, long errors, long ticks, long lastActivity) {}
    private record HealthResponse(boolean healthy, String message) {}
    private record InstrumentInfo(String symbol, String name, String type) {}
    private record PriceResponse(String symbol, BigDecimal value, long timestamp) {}
    private record ErrorResponse(String error) {}
}
