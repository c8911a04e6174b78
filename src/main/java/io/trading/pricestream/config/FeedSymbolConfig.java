package io.trading.pricestream.config;

import io.trading.pricestream.model.Symbols;

/**
 * Mapping of one instrument symbol to the upstream vendor's stream token.
 *
 * @param symbol      Instrument symbol (e.g., "BTCUSD")
 * @param vendorToken Vendor stream token (e.g., "btcusdt")
 */
public record FeedSymbolConfig(
    String symbol,
    String vendorToken
) {
    public FeedSymbolConfig {
        if (vendorToken == null || vendorToken.isBlank()) {
            throw new IllegalArgumentException("vendorToken cannot be null or empty");
        }
        symbol = Symbols.normalize(symbol);
        vendorToken = vendorToken.trim();
    }

    /**
     * Parses a feed symbol mapping.
     * Format: "SYMBOL:vendorToken"
     * Example: "BTCUSD:btcusdt"
     */
    public static FeedSymbolConfig fromString(String value) {
        String[] parts = value.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid feed symbol format: " + value);
        }
        return new FeedSymbolConfig(parts[0], parts[1]);
    }
}
