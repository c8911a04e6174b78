package io.trading.pricestream.model;

import java.util.Locale;

/**
 * Symbol identity rules. Symbols compare case-insensitively, so every map key
 * and comparison goes through {@link #normalize(String)}.
 */
public final class Symbols {

    private Symbols() {
    }

    /**
     * Trims and upper-cases a symbol.
     *
     * @throws IllegalArgumentException if the symbol is null or blank
     */
    public static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be null or blank");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
