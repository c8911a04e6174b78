package io.trading.pricestream.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PriceTickTest {

    @Test
    void testSymbolIsNormalized() {
        PriceTick tick = new PriceTick(" btcusd ", new BigDecimal("43250.50"), Instant.ofEpochMilli(1704067200000L));

        assertEquals("BTCUSD", tick.symbol());
        assertEquals(1704067200000L, tick.timestampMillis());
    }

    @Test
    void testRequiredFields() {
        Instant now = Instant.now();
        assertThrows(IllegalArgumentException.class, () -> new PriceTick("", BigDecimal.ONE, now));
        assertThrows(IllegalArgumentException.class, () -> new PriceTick("BTCUSD", null, now));
        assertThrows(IllegalArgumentException.class, () -> new PriceTick("BTCUSD", BigDecimal.ONE, null));
    }

    @Test
    void testBlankSymbolRejected() {
        assertThrows(IllegalArgumentException.class, () -> Symbols.normalize("   "));
        assertThrows(IllegalArgumentException.class, () -> Symbols.normalize(null));
        assertEquals("USDJPY", Symbols.normalize("usdJpy"));
    }
}
