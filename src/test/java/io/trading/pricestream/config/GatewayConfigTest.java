package io.trading.pricestream.config;

import io.trading.pricestream.feed.ReconnectPolicy;
import io.trading.pricestream.model.Instrument;
import io.trading.pricestream.model.InstrumentType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigTest {

    private static GatewayConfig.Builder minimal() {
        return GatewayConfig.builder().addInstrument("BTCUSD", "Bitcoin/US Dollar", InstrumentType.CRYPTO);
    }

    @Test
    void testBuilderDefaults() {
        GatewayConfig config = minimal().build();

        assertEquals("price-gateway-0", config.gatewayId());
        assertEquals(5120, config.hubPort());
        assertEquals(9090, config.httpPort());
        assertEquals("wss://stream.binance.com:443/stream", config.feedUrl().toString());
        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(Duration.ofSeconds(10), config.coldReadTimeout());
        assertEquals(1024, config.subscriberQueueCapacity());
        assertTrue(config.feedSymbols().isEmpty());
    }

    @Test
    void testBuilderRequiresInstrument() {
        assertThrows(IllegalStateException.class, () -> GatewayConfig.builder().build());
    }

    @Test
    void testInvalidValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> minimal().hubPort(70000).build());
        assertThrows(IllegalArgumentException.class, () -> minimal().httpPort(-1).build());
        assertThrows(IllegalArgumentException.class, () -> minimal().coldReadTimeoutMs(0).build());
        assertThrows(IllegalArgumentException.class, () -> minimal().reconnectMaxRetries(-2).build());
        assertThrows(IllegalArgumentException.class, () -> minimal().reconnectBackoff(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> minimal().subscriberQueueCapacity(1).build());
    }

    @Test
    void testDefaultReconnectPolicyIsFixedAndUnlimited() {
        ReconnectPolicy policy = minimal().build().reconnectPolicy();

        assertEquals(Duration.ofSeconds(1), policy.initialDelay());
        assertEquals(Duration.ofSeconds(1), policy.nextDelay(policy.initialDelay()));
        assertTrue(policy.allowsAttempt(1_000_000));
    }

    @Test
    void testBackoffPolicy() {
        ReconnectPolicy policy = minimal()
            .reconnectDelayMs(500)
            .reconnectBackoff(2.0)
            .reconnectMaxRetries(3)
            .build()
            .reconnectPolicy();

        assertEquals(Duration.ofSeconds(1), policy.nextDelay(Duration.ofMillis(500)));
        assertEquals(Duration.ofSeconds(60), policy.nextDelay(Duration.ofSeconds(45)));
        assertTrue(policy.allowsAttempt(2));
        assertFalse(policy.allowsAttempt(3));
    }

    @Test
    void testFeedSymbolFromString() {
        FeedSymbolConfig mapping = FeedSymbolConfig.fromString(" ethusd :ethusdt");

        assertEquals("ETHUSD", mapping.symbol());
        assertEquals("ethusdt", mapping.vendorToken());
        assertThrows(IllegalArgumentException.class, () -> FeedSymbolConfig.fromString("ETHUSD"));
        assertThrows(IllegalArgumentException.class, () -> FeedSymbolConfig.fromString("ETHUSD: "));
    }

    @Test
    void testInstrumentFromString() {
        Instrument instrument = Instrument.fromString("EURUSD:Euro/US Dollar:forex");

        assertEquals("EURUSD", instrument.symbol());
        assertEquals("Euro/US Dollar", instrument.name());
        assertEquals(InstrumentType.FOREX, instrument.type());
        assertThrows(IllegalArgumentException.class, () -> Instrument.fromString("EURUSD:Euro"));
        assertThrows(IllegalArgumentException.class, () -> Instrument.fromString("EURUSD:Euro:bond"));
    }
}
