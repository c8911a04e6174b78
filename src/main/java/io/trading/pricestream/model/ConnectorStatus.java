package io.trading.pricestream.model;

/**
 * Lifecycle of an upstream feed connection.
 */
public enum ConnectorStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
