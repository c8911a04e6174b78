package io.trading.pricestream.feed;

/**
 * Raised when no upstream mapping exists for a symbol. Permanent; never retried.
 */
public class UnsupportedSymbolException extends PriceFeedException {

    public UnsupportedSymbolException(String symbol) {
        super(symbol, "Symbol " + symbol + " is not supported by the price feed");
    }
}
