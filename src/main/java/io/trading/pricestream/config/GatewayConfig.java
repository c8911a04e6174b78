package io.trading.pricestream.config;

import io.trading.pricestream.feed.ReconnectPolicy;
import io.trading.pricestream.model.Instrument;
import io.trading.pricestream.model.InstrumentType;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Configuration for the Price Stream Gateway.
 *
 * @param gatewayId               Unique gateway instance identifier
 * @param hubPort                 Port of the subscriber WebSocket hub
 * @param httpPort                Port of the REST, health and metrics server
 * @param feedUrl                 Upstream WebSocket endpoint
 * @param instruments             Instruments offered to subscribers
 * @param feedSymbols             Instrument to vendor stream mappings
 * @param connectTimeoutMs        Upstream connect and handshake budget
 * @param coldReadTimeoutMs       Wait budget for the first price of a symbol
 * @param reconnectDelayMs        Delay before the first receive retry
 * @param reconnectMaxRetries     Maximum receive retries (-1 for unlimited)
 * @param reconnectBackoff        Retry delay multiplier (1.0 keeps the delay fixed)
 * @param healthCheckMs           Health check interval in milliseconds
 * @param subscriberQueueCapacity Outbound buffer size per subscriber
 */
public record GatewayConfig(
    String gatewayId,
    int hubPort,
    int httpPort,
    URI feedUrl,
    List<Instrument> instruments,
    List<FeedSymbolConfig> feedSymbols,
    int connectTimeoutMs,
    int coldReadTimeoutMs,
    int reconnectDelayMs,
    int reconnectMaxRetries,
    double reconnectBackoff,
    int healthCheckMs,
    int subscriberQueueCapacity
) {
    private static final String DEFAULT_GATEWAY_ID = "price-gateway-0";
    private static final int DEFAULT_HUB_PORT = 5120;
    private static final int DEFAULT_HTTP_PORT = 9090;
    private static final String DEFAULT_FEED_URL = "wss://stream.binance.com:443/stream";
    private static final String DEFAULT_INSTRUMENTS =
        "EURUSD:Euro/US Dollar:forex;USDJPY:US Dollar/Japanese Yen:forex;BTCUSD:Bitcoin/US Dollar:crypto";
    private static final String DEFAULT_FEED_SYMBOLS = "BTCUSD:btcusdt";
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 10000;
    private static final int DEFAULT_COLD_READ_TIMEOUT_MS = 10000;
    private static final int DEFAULT_RECONNECT_DELAY_MS = 1000;
    private static final int DEFAULT_RECONNECT_MAX_RETRIES = -1;
    private static final double DEFAULT_RECONNECT_BACKOFF = 1.0;
    private static final int DEFAULT_HEALTH_CHECK_MS = 5000;
    private static final int DEFAULT_SUBSCRIBER_QUEUE_CAPACITY = 1024;
    private static final long MAX_RECONNECT_DELAY_MS = 60000;

    public GatewayConfig {
        if (gatewayId == null || gatewayId.isEmpty()) {
            throw new IllegalArgumentException("gatewayId cannot be null or empty");
        }
        checkPort("hubPort", hubPort);
        checkPort("httpPort", httpPort);
        if (feedUrl == null) {
            throw new IllegalArgumentException("feedUrl cannot be null");
        }
        if (instruments == null || instruments.isEmpty()) {
            throw new IllegalArgumentException("instruments cannot be null or empty");
        }
        if (feedSymbols == null) {
            throw new IllegalArgumentException("feedSymbols cannot be null");
        }
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive");
        }
        if (coldReadTimeoutMs <= 0) {
            throw new IllegalArgumentException("coldReadTimeoutMs must be positive");
        }
        if (reconnectDelayMs <= 0) {
            throw new IllegalArgumentException("reconnectDelayMs must be positive");
        }
        if (reconnectMaxRetries < -1) {
            throw new IllegalArgumentException("reconnectMaxRetries must be -1 (unlimited) or >= 0");
        }
        if (reconnectBackoff < 1.0) {
            throw new IllegalArgumentException("reconnectBackoff must be >= 1.0");
        }
        if (healthCheckMs <= 0) {
            throw new IllegalArgumentException("healthCheckMs must be positive");
        }
        if (subscriberQueueCapacity < 2) {
            throw new IllegalArgumentException("subscriberQueueCapacity must be at least 2");
        }
        instruments = List.copyOf(instruments);
        feedSymbols = List.copyOf(feedSymbols);
    }

    private static void checkPort(String name, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(name + " must be between 0 and 65535");
        }
    }

    /**
     * Receive retry policy derived from the reconnect settings.
     */
    public ReconnectPolicy reconnectPolicy() {
        return new ReconnectPolicy(
            Duration.ofMillis(reconnectDelayMs),
            reconnectBackoff,
            Duration.ofMillis(Math.max(reconnectDelayMs, MAX_RECONNECT_DELAY_MS)),
            reconnectMaxRetries
        );
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration coldReadTimeout() {
        return Duration.ofMillis(coldReadTimeoutMs);
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - GATEWAY_ID: Gateway instance ID (default: "price-gateway-0")
     * - HUB_PORT / HTTP_PORT: Listener ports (default: 5120 / 9090)
     * - FEED_URL: Upstream WebSocket endpoint
     * - INSTRUMENTS: Instrument list (e.g., "EURUSD:Euro/US Dollar:forex;BTCUSD:Bitcoin/US Dollar:crypto")
     * - FEED_SYMBOLS: Vendor mappings (e.g., "BTCUSD:btcusdt;ETHUSD:ethusdt")
     * - CONNECT_TIMEOUT_MS, COLD_READ_TIMEOUT_MS: Wait budgets (default: 10000)
     * - RECONNECT_DELAY_MS, RECONNECT_MAX_RETRIES, RECONNECT_BACKOFF: Receive retry policy
     * - HEALTH_CHECK_MS: Health check interval (default: 5000)
     * - SUBSCRIBER_QUEUE_CAPACITY: Outbound buffer per subscriber (default: 1024)
     */
    public static GatewayConfig fromEnv() {
        return new GatewayConfig(
            stringEnv("GATEWAY_ID", DEFAULT_GATEWAY_ID),
            parseIntEnv("HUB_PORT", DEFAULT_HUB_PORT),
            parseIntEnv("HTTP_PORT", DEFAULT_HTTP_PORT),
            URI.create(stringEnv("FEED_URL", DEFAULT_FEED_URL)),
            parseList(stringEnv("INSTRUMENTS", DEFAULT_INSTRUMENTS))
                .stream().map(Instrument::fromString).collect(Collectors.toList()),
            parseList(stringEnv("FEED_SYMBOLS", DEFAULT_FEED_SYMBOLS))
                .stream().map(FeedSymbolConfig::fromString).collect(Collectors.toList()),
            parseIntEnv("CONNECT_TIMEOUT_MS", DEFAULT_CONNECT_TIMEOUT_MS),
            parseIntEnv("COLD_READ_TIMEOUT_MS", DEFAULT_COLD_READ_TIMEOUT_MS),
            parseIntEnv("RECONNECT_DELAY_MS", DEFAULT_RECONNECT_DELAY_MS),
            parseIntEnv("RECONNECT_MAX_RETRIES", DEFAULT_RECONNECT_MAX_RETRIES),
            parseDoubleEnv("RECONNECT_BACKOFF", DEFAULT_RECONNECT_BACKOFF),
            parseIntEnv("HEALTH_CHECK_MS", DEFAULT_HEALTH_CHECK_MS),
            parseIntEnv("SUBSCRIBER_QUEUE_CAPACITY", DEFAULT_SUBSCRIBER_QUEUE_CAPACITY)
        );
    }

    private static List<String> parseList(String value) {
        return Arrays.stream(value.split(";"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    private static String stringEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static int parseIntEnv(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + " value: " + value, e);
        }
    }

    private static double parseDoubleEnv(String key, double defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + " value: " + value, e);
        }
    }

    /**
     * Creates a new builder for GatewayConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for GatewayConfig.
     */
    public static class Builder {
        private String gatewayId = DEFAULT_GATEWAY_ID;
        private int hubPort = DEFAULT_HUB_PORT;
        private int httpPort = DEFAULT_HTTP_PORT;
        private URI feedUrl = URI.create(DEFAULT_FEED_URL);
        private final List<Instrument> instruments = new ArrayList<>();
        private final List<FeedSymbolConfig> feedSymbols = new ArrayList<>();
        private int connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        private int coldReadTimeoutMs = DEFAULT_COLD_READ_TIMEOUT_MS;
        private int reconnectDelayMs = DEFAULT_RECONNECT_DELAY_MS;
        private int reconnectMaxRetries = DEFAULT_RECONNECT_MAX_RETRIES;
        private double reconnectBackoff = DEFAULT_RECONNECT_BACKOFF;
        private int healthCheckMs = DEFAULT_HEALTH_CHECK_MS;
        private int subscriberQueueCapacity = DEFAULT_SUBSCRIBER_QUEUE_CAPACITY;

        public Builder gatewayId(String gatewayId) {
            this.gatewayId = gatewayId;
            return this;
        }

        public Builder hubPort(int hubPort) {
            this.hubPort = hubPort;
            return this;
        }

        public Builder httpPort(int httpPort) {
            this.httpPort = httpPort;
            return this;
        }

        public Builder feedUrl(String feedUrl) {
            this.feedUrl = URI.create(feedUrl);
            return this;
        }

        public Builder addInstrument(String symbol, String name, InstrumentType type) {
            this.instruments.add(new Instrument(symbol, name, type));
            return this;
        }

        public Builder addFeedSymbol(String symbol, String vendorToken) {
            this.feedSymbols.add(new FeedSymbolConfig(symbol, vendorToken));
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder coldReadTimeoutMs(int coldReadTimeoutMs) {
            this.coldReadTimeoutMs = coldReadTimeoutMs;
            return this;
        }

        public Builder reconnectDelayMs(int reconnectDelayMs) {
            this.reconnectDelayMs = reconnectDelayMs;
            return this;
        }

        public Builder reconnectMaxRetries(int reconnectMaxRetries) {
            this.reconnectMaxRetries = reconnectMaxRetries;
            return this;
        }

        public Builder reconnectBackoff(double reconnectBackoff) {
            this.reconnectBackoff = reconnectBackoff;
            return this;
        }

        public Builder healthCheckMs(int healthCheckMs) {
            this.healthCheckMs = healthCheckMs;
            return this;
        }

        public Builder subscriberQueueCapacity(int subscriberQueueCapacity) {
            this.subscriberQueueCapacity = subscriberQueueCapacity;
            return this;
        }

        public GatewayConfig build() {
            if (instruments.isEmpty()) {
                throw new IllegalStateException("At least one instrument must be added");
            }
            return new GatewayConfig(
                gatewayId,
                hubPort,
                httpPort,
                feedUrl,
                instruments,
                feedSymbols,
                connectTimeoutMs,
                coldReadTimeoutMs,
                reconnectDelayMs,
                reconnectMaxRetries,
                reconnectBackoff,
                healthCheckMs,
                subscriberQueueCapacity
            );
        }
    }
}
