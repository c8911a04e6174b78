package io.trading.pricestream.feed;

/**
 * Base class for failures raised by the price feed core.
 */
public abstract class PriceFeedException extends RuntimeException {

    private final String symbol;

    protected PriceFeedException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    protected PriceFeedException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    /**
     * The symbol the failed operation was about.
     */
    public String getSymbol() {
        return symbol;
    }
}
