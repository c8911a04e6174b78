package io.trading.pricestream.feed;

/**
 * Raised when a control message is sent while the upstream connection is not open.
 * Callers may retry after a backoff.
 */
public class ConnectionUnavailableException extends PriceFeedException {

    public ConnectionUnavailableException(String symbol) {
        super(symbol, "Upstream connection for " + symbol + " is not available");
    }

    public ConnectionUnavailableException(String symbol, Throwable cause) {
        super(symbol, "Upstream connection for " + symbol + " is not available", cause);
    }
}
