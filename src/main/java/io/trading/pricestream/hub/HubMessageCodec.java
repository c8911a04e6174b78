package io.trading.pricestream.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.pricestream.model.PriceTick;

import java.util.Collection;
import java.util.Locale;
import java.util.TreeSet;

/**
 * JSON text frames exchanged with hub clients.
 *
 * Inbound:  {"action":"subscribe"|"unsubscribe"|"subscriptions","symbol":"BTCUSD"}
 * Outbound: {"event":"subscribed"|"unsubscribed"|"subscriptions"|"error"|"price", ...}
 */
public final class HubMessageCodec {

    private final ObjectMapper objectMapper;

    public HubMessageCodec() {
        this(new ObjectMapper());
    }

    public HubMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a client command.
     *
     * @throws IllegalArgumentException if the frame is not a JSON object with a known action
     */
    public HubCommand decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed command: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Command must be a JSON object");
        }
        JsonNode action = root.get("action");
        if (action == null || !action.isTextual()) {
            throw new IllegalArgumentException("Command has no action");
        }
        HubCommand.Action parsed;
        try {
            parsed = HubCommand.Action.valueOf(action.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action: " + action.asText(), e);
        }
        JsonNode symbol = root.get("symbol");
        return new HubCommand(parsed, symbol == null || symbol.isNull() ? null : symbol.asText());
    }

    public String subscribed(String symbol) {
        return write(event("subscribed").put("symbol", symbol));
    }

    public String unsubscribed(String symbol) {
        return write(event("unsubscribed").put("symbol", symbol));
    }

    public String subscriptions(Collection<String> symbols) {
        ObjectNode node = event("subscriptions");
        ArrayNode array = node.putArray("symbols");
        new TreeSet<>(symbols).forEach(array::add);
        return write(node);
    }

    public String error(String message) {
        return write(event("error").put("message", message));
    }

    public String price(PriceTick tick) {
        return write(event("price")
            .put("symbol", tick.symbol())
            .put("value", tick.value())
            .put("timestamp", tick.timestampMillis()));
    }

    private ObjectNode event(String name) {
        return objectMapper.createObjectNode().put("event", name);
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // a tree of plain values always serializes
            throw new IllegalStateException("Failed to encode hub message", e);
        }
    }
}
