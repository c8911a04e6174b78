package io.trading.pricestream.hub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.pricestream.model.PriceTick;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HubMessageCodecTest {

    private final HubMessageCodec codec = new HubMessageCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testDecodeCommands() {
        assertEquals(
            new HubCommand(HubCommand.Action.SUBSCRIBE, "BTCUSD"),
            codec.decode("{\"action\":\"subscribe\",\"symbol\":\"BTCUSD\"}")
        );
        assertEquals(
            new HubCommand(HubCommand.Action.UNSUBSCRIBE, "ethusd"),
            codec.decode("{\"action\":\"Unsubscribe\",\"symbol\":\"ethusd\"}")
        );
        assertEquals(
            new HubCommand(HubCommand.Action.SUBSCRIPTIONS, null),
            codec.decode("{\"action\":\"subscriptions\"}")
        );
    }

    @Test
    void testDecodeRejectsBadFrames() {
        assertThrows(IllegalArgumentException.class, () -> codec.decode("subscribe BTCUSD"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("[\"subscribe\"]"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("{\"symbol\":\"BTCUSD\"}"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("{\"action\":\"buy\",\"symbol\":\"BTCUSD\"}"));
    }

    @Test
    void testPriceEvent() throws Exception {
        PriceTick tick = new PriceTick("BTCUSD", new BigDecimal("43250.50"), Instant.ofEpochMilli(1704067200000L));

        JsonNode node = mapper.readTree(codec.price(tick));

        assertEquals("price", node.get("event").asText());
        assertEquals("BTCUSD", node.get("symbol").asText());
        assertEquals(0, new BigDecimal("43250.50").compareTo(node.get("value").decimalValue()));
        assertEquals(1704067200000L, node.get("timestamp").asLong());
    }

    @Test
    void testSubscriptionsAreSorted() throws Exception {
        JsonNode node = mapper.readTree(codec.subscriptions(List.of("ETHUSD", "BTCUSD")));

        assertEquals("subscriptions", node.get("event").asText());
        assertEquals("[\"BTCUSD\",\"ETHUSD\"]", node.get("symbols").toString());
    }

    @Test
    void testReplyEvents() throws Exception {
        assertEquals("subscribed", mapper.readTree(codec.subscribed("BTCUSD")).get("event").asText());
        assertEquals("unsubscribed", mapper.readTree(codec.unsubscribed("BTCUSD")).get("event").asText());
        JsonNode error = mapper.readTree(codec.error("Symbol EURUSD is not supported"));
        assertEquals("error", error.get("event").asText());
        assertEquals("Symbol EURUSD is not supported", error.get("message").asText());
    }
}
