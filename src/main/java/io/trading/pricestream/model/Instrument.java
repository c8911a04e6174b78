package io.trading.pricestream.model;

/**
 * A tradable instrument offered to subscribers.
 *
 * @param symbol Instrument symbol (e.g., "EURUSD")
 * @param name   Human readable name (e.g., "Euro/US Dollar")
 * @param type   Asset class
 */
public record Instrument(
    String symbol,
    String name,
    InstrumentType type
) {
    public Instrument {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        symbol = Symbols.normalize(symbol);
    }

    /**
     * Parses an instrument definition.
     * Format: "SYMBOL:Name:TYPE"
     * Example: "BTCUSD:Bitcoin/US Dollar:crypto"
     */
    public static Instrument fromString(String value) {
        String[] parts = value.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid instrument format: " + value);
        }
        return new Instrument(
            parts[0].trim(),
            parts[1].trim(),
            InstrumentType.valueOf(parts[2].trim().toUpperCase())
        );
    }
}
