package io.trading.pricestream.feed;

import io.trading.pricestream.model.ConnectorStatus;

import java.time.Instant;

/**
 * Owner of one upstream network connection.
 * Implementations handle connection management, subscription, and tick normalization.
 */
public interface FeedConnector extends AutoCloseable {

    /**
     * Gets the symbol this connector was created for.
     */
    String getSymbol();

    /**
     * Opens the upstream connection and starts receiving. No-op if already connected.
     *
     * @throws ConnectFailureException if the connection cannot be established
     */
    void connect();

    /**
     * Stops receiving and closes the upstream connection. Safe to call if never connected.
     */
    void disconnect();

    /**
     * Returns whether the connector is currently connected.
     */
    boolean isConnected();

    /**
     * Gets the current lifecycle status.
     */
    ConnectorStatus getStatus();

    /**
     * Sends the vendor subscription for a symbol.
     *
     * @throws UnsupportedSymbolException     if the vendor has no mapping for the symbol
     * @throws ConnectionUnavailableException if the connector is not connected
     */
    void sendSubscribe(String symbol);

    /**
     * Sends the vendor unsubscription for a symbol, if connected.
     */
    void sendUnsubscribe(String symbol);

    /**
     * Time of the last frame or state change.
     */
    Instant getLastActivity();

    /**
     * Gets the number of frames received.
     */
    long getMessageCount();

    /**
     * Gets the number of transport and parse errors.
     */
    long getErrorCount();

    @Override
    void close();

    /**
     * Creates a connector for a symbol, publishing its ticks to the listener.
     */
    @FunctionalInterface
    interface Factory {

        FeedConnector create(String symbol, TickListener listener);
    }
}
