package io.trading.pricestream.feed;

/**
 * Raised when the upstream transport for a symbol could not be established.
 * A later attempt may succeed.
 */
public class ConnectFailureException extends PriceFeedException {

    public ConnectFailureException(String symbol, Throwable cause) {
        super(symbol, "Failed to connect upstream feed for " + symbol + ": " + cause.getMessage(), cause);
    }
}
