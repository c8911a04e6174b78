package io.trading.pricestream.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One normalized price observation for an instrument.
 *
 * @param symbol     Instrument symbol, upper case (e.g., "BTCUSD")
 * @param value      Observed price
 * @param observedAt Provider event time
 */
public record PriceTick(
    String symbol,
    BigDecimal value,
    Instant observedAt
) {
    public PriceTick {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (observedAt == null) {
            throw new IllegalArgumentException("observedAt cannot be null");
        }
        symbol = Symbols.normalize(symbol);
    }

    /**
     * Event time in epoch milliseconds.
     */
    public long timestampMillis() {
        return observedAt.toEpochMilli();
    }
}
