package io.trading.pricestream.model;

/**
 * Instrument asset classes.
 */
public enum InstrumentType {
    FOREX("Forex"),
    CRYPTO("Crypto");

    private final String displayName;

    InstrumentType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
