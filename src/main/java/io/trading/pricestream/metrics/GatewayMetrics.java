package io.trading.pricestream.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.hotspot.DefaultExports;

/**
 * Prometheus metrics collector for the Price Stream Gateway.
 *
 * Tracks:
 * - Ticks received and frames dropped per upstream
 * - Connect, connect failure and reconnect counts per symbol
 * - Live connectors, pool references and subscribers per symbol
 * - Delivery outcomes to subscribers
 * - Cold read outcomes
 */
public class GatewayMetrics {

    // Counters
    private final Counter ticksReceived;
    private final Counter framesDropped;
    private final Counter connectAttempts;
    private final Counter connectFailures;
    private final Counter reconnectAttempts;
    private final Counter deliveries;
    private final Counter deliveryFailures;
    private final Counter deliveriesDropped;
    private final Counter coldReads;

    // Gauges
    private final Gauge connectionStatus;
    private final Gauge activeConnectors;
    private final Gauge poolReferences;
    private final Gauge subscribers;

    private final CollectorRegistry registry;

    /**
     * Registers into the default registry, together with the JVM collectors.
     */
    public GatewayMetrics() {
        this(CollectorRegistry.defaultRegistry);
        DefaultExports.initialize();
    }

    /**
     * Registers into the given registry. Tests use a fresh registry per instance.
     */
    public GatewayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.ticksReceived = Counter.build()
            .name("pricestream_ticks_received_total")
            .help("Total number of normalized ticks received from upstream")
            .labelNames("symbol")
            .register(registry);

        this.framesDropped = Counter.build()
            .name("pricestream_frames_dropped_total")
            .help("Upstream frames that did not carry a price")
            .labelNames("feed")
            .register(registry);

        this.connectAttempts = Counter.build()
            .name("pricestream_connect_attempts_total")
            .help("Total number of upstream connect attempts")
            .labelNames("symbol")
            .register(registry);

        this.connectFailures = Counter.build()
            .name("pricestream_connect_failures_total")
            .help("Total number of failed upstream connect attempts")
            .labelNames("symbol")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("pricestream_reconnect_attempts_total")
            .help("Total number of upstream reconnection attempts")
            .labelNames("symbol")
            .register(registry);

        this.deliveries = Counter.build()
            .name("pricestream_deliveries_total")
            .help("Ticks delivered to subscribers")
            .labelNames("symbol")
            .register(registry);

        this.deliveryFailures = Counter.build()
            .name("pricestream_delivery_failures_total")
            .help("Subscriber deliveries that threw")
            .register(registry);

        this.deliveriesDropped = Counter.build()
            .name("pricestream_deliveries_dropped_total")
            .help("Ticks dropped because a subscriber buffer was full")
            .register(registry);

        this.coldReads = Counter.build()
            .name("pricestream_cold_reads_total")
            .help("Price queries by outcome (hit, wait, timeout)")
            .labelNames("outcome")
            .register(registry);

        // Connection status gauge (1 = connected, 0 = disconnected)
        this.connectionStatus = Gauge.build()
            .name("pricestream_connection_status")
            .help("Upstream connection status per symbol (1 = connected, 0 = disconnected)")
            .labelNames("symbol")
            .register(registry);

        this.activeConnectors = Gauge.build()
            .name("pricestream_active_connectors")
            .help("Number of live upstream connectors")
            .register(registry);

        this.poolReferences = Gauge.build()
            .name("pricestream_pool_references")
            .help("Reference count held on each symbol's connector")
            .labelNames("symbol")
            .register(registry);

        this.subscribers = Gauge.build()
            .name("pricestream_subscribers")
            .help("Number of subscribers per symbol")
            .labelNames("symbol")
            .register(registry);
    }

    public void recordTickReceived(String symbol) {
        ticksReceived.labels(symbol).inc();
    }

    public void recordFrameDropped(String feed) {
        framesDropped.labels(feed).inc();
    }

    public void recordConnectAttempt(String symbol) {
        connectAttempts.labels(symbol).inc();
    }

    public void recordConnectFailure(String symbol) {
        connectFailures.labels(symbol).inc();
    }

    public void recordReconnectAttempt(String symbol) {
        reconnectAttempts.labels(symbol).inc();
    }

    public void recordDelivery(String symbol) {
        deliveries.labels(symbol).inc();
    }

    public void recordDeliveryFailure() {
        deliveryFailures.inc();
    }

    public void recordDeliveryDropped() {
        deliveriesDropped.inc();
    }

    /**
     * Records a price query outcome: "hit", "wait" or "timeout".
     */
    public void recordColdRead(String outcome) {
        coldReads.labels(outcome).inc();
    }

    /**
     * Sets the connection status for a symbol.
     *
     * @param symbol    The symbol
     * @param connected true if connected, false otherwise
     */
    public void setConnectionStatus(String symbol, boolean connected) {
        connectionStatus.labels(symbol).set(connected ? 1 : 0);
    }

    public void setActiveConnectors(int count) {
        activeConnectors.set(count);
    }

    public void setPoolReferences(String symbol, int count) {
        poolReferences.labels(symbol).set(count);
    }

    public void setSubscribers(String symbol, int count) {
        subscribers.labels(symbol).set(count);
    }

    /**
     * Returns the CollectorRegistry for the HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    public double getTicksReceived(String symbol) {
        return ticksReceived.labels(symbol).get();
    }

    public double getConnectAttempts(String symbol) {
        return connectAttempts.labels(symbol).get();
    }

    public double getConnectFailures(String symbol) {
        return connectFailures.labels(symbol).get();
    }

    public double getDeliveries(String symbol) {
        return deliveries.labels(symbol).get();
    }

    public double getDeliveryFailures() {
        return deliveryFailures.get();
    }

    public double getDeliveriesDropped() {
        return deliveriesDropped.get();
    }

    public double getColdReads(String outcome) {
        return coldReads.labels(outcome).get();
    }

    public double getActiveConnectors() {
        return activeConnectors.get();
    }
}
