package io.trading.pricestream.feed.binance;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;

/**
 * Streaming parser for Binance aggregate trade frames.
 *
 * Accepts both the combined-stream envelope
 * {@code {"stream":"btcusdt@aggTrade","data":{"e":"aggTrade","E":..,"s":"BTCUSDT","p":"..."}}}
 * and raw stream payloads {@code {"e":"aggTrade","E":..,"s":"BTCUSDT","p":"..."}}.
 * Uses Jackson's token stream instead of building a tree.
 */
public class BinanceAggTradeParser {

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private static final String FIELD_RESULT = "result";
    private static final String FIELD_ID = "id";
    private static final String FIELD_STREAM = "stream";
    private static final String FIELD_DATA = "data";
    private static final String FIELD_PRICE = "p";
    private static final String FIELD_EVENT_TIME = "E";
    private static final String FIELD_SYMBOL = "s";

    /**
     * Outcome of parsing one frame.
     */
    public enum Kind {
        /** Subscription acknowledgement such as {@code {"result":null,"id":1}}. */
        ACK,
        /** A price-carrying trade event. */
        TRADE,
        /** Valid JSON without the fields of a trade event. */
        UNRECOGNIZED
    }

    /**
     * Parsed frame.
     *
     * @param kind         What the frame was
     * @param vendorSymbol Lower-case vendor symbol (stream prefix or "s" field), null unless TRADE
     * @param price        Trade price, null unless TRADE
     * @param eventTime    Event time in epoch milliseconds, 0 unless TRADE
     */
    public record Frame(Kind kind, String vendorSymbol, BigDecimal price, long eventTime) {

        static final Frame ACK_FRAME = new Frame(Kind.ACK, null, null, 0);
        static final Frame UNRECOGNIZED_FRAME = new Frame(Kind.UNRECOGNIZED, null, null, 0);
    }

    /**
     * Parses a frame.
     *
     * @throws UncheckedIOException     if the frame is not a JSON object
     * @throws NumberFormatException    if the price is not a decimal
     */
    public Frame parse(String message) {
        try (JsonParser parser = JSON_FACTORY.createParser(message)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("Frame is not a JSON object");
            }

            boolean ack = false;
            String stream = null;
            TradeFields top = new TradeFields();
            TradeFields data = null;

            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                switch (field) {
                    case FIELD_RESULT, FIELD_ID -> {
                        ack = true;
                        parser.skipChildren();
                    }
                    case FIELD_STREAM -> stream = value == JsonToken.VALUE_STRING ? parser.getText() : null;
                    case FIELD_DATA -> {
                        if (value == JsonToken.START_OBJECT) {
                            data = readTradeFields(parser);
                        } else {
                            parser.skipChildren();
                        }
                    }
                    default -> top.accept(field, value, parser);
                }
            }

            if (ack) {
                return Frame.ACK_FRAME;
            }

            if (stream != null && data != null && data.isComplete()) {
                int at = stream.indexOf('@');
                String vendorSymbol = at > 0 ? stream.substring(0, at) : data.symbol;
                return data.toFrame(vendorSymbol);
            }

            if (top.isComplete() && top.symbol != null) {
                return top.toFrame(top.symbol);
            }

            return Frame.UNRECOGNIZED_FRAME;
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed Binance frame", e);
        }
    }

    private TradeFields readTradeFields(JsonParser parser) throws IOException {
        TradeFields fields = new TradeFields();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            fields.accept(field, value, parser);
        }
        return fields;
    }

    private static final class TradeFields {
        private String price;
        private long eventTime = -1;
        private String symbol;

        private void accept(String field, JsonToken value, JsonParser parser) throws IOException {
            switch (field) {
                case FIELD_PRICE -> price = parser.getValueAsString();
                case FIELD_EVENT_TIME -> {
                    if (value == JsonToken.VALUE_NUMBER_INT) {
                        eventTime = parser.getLongValue();
                    }
                }
                case FIELD_SYMBOL -> symbol = parser.getValueAsString();
                default -> parser.skipChildren();
            }
        }

        private boolean isComplete() {
            return price != null && eventTime >= 0;
        }

        private Frame toFrame(String vendorSymbol) {
            if (vendorSymbol == null) {
                return Frame.UNRECOGNIZED_FRAME;
            }
            return new Frame(Kind.TRADE, vendorSymbol.toLowerCase(), new BigDecimal(price), eventTime);
        }
    }
}
