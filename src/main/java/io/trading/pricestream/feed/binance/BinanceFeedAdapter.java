package io.trading.pricestream.feed.binance;

import io.trading.pricestream.config.FeedSymbolConfig;
import io.trading.pricestream.feed.FeedAdapter;
import io.trading.pricestream.feed.UnsupportedSymbolException;
import io.trading.pricestream.model.PriceTick;
import io.trading.pricestream.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Binance aggregate trade feed.
 * Connects to wss://stream.binance.com:443/stream and subscribes to {@code <token>@aggTrade}.
 */
public class BinanceFeedAdapter implements FeedAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceFeedAdapter.class);

    private static final String NAME = "Binance";
    private static final String STREAM_SUFFIX = "@aggTrade";

    private final URI endpoint;
    private final BinanceAggTradeParser parser = new BinanceAggTradeParser();
    // symbol -> vendor token
    private final Map<String, String> tokens = new HashMap<>();
    // lower-case vendor token -> symbol
    private final Map<String, String> symbols = new HashMap<>();

    public BinanceFeedAdapter(URI endpoint, Collection<FeedSymbolConfig> mappings) {
        this.endpoint = endpoint;
        for (FeedSymbolConfig mapping : mappings) {
            String token = mapping.vendorToken().toLowerCase();
            tokens.put(mapping.symbol(), token);
            symbols.put(token, mapping.symbol());
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public URI endpoint() {
        return endpoint;
    }

    @Override
    public boolean supports(String symbol) {
        return tokens.containsKey(Symbols.normalize(symbol));
    }

    @Override
    public String vendorToken(String symbol) {
        String normalized = Symbols.normalize(symbol);
        String token = tokens.get(normalized);
        if (token == null) {
            throw new UnsupportedSymbolException(normalized);
        }
        return token;
    }

    @Override
    public String subscribeMessage(String vendorToken, long requestId) {
        // {"method":"SUBSCRIBE","params":["btcusdt@aggTrade"],"id":1}
        return String.format(
            "{\"method\":\"SUBSCRIBE\",\"params\":[\"%s%s\"],\"id\":%d}",
            vendorToken, STREAM_SUFFIX, requestId
        );
    }

    @Override
    public String unsubscribeMessage(String vendorToken, long requestId) {
        return String.format(
            "{\"method\":\"UNSUBSCRIBE\",\"params\":[\"%s%s\"],\"id\":%d}",
            vendorToken, STREAM_SUFFIX, requestId
        );
    }

    @Override
    public Optional<PriceTick> parse(String frame) {
        BinanceAggTradeParser.Frame parsed;
        try {
            parsed = parser.parse(frame);
        } catch (RuntimeException e) {
            LOGGER.warn("[Binance] Dropping malformed frame: {} ({})", frame, e.getMessage());
            return Optional.empty();
        }

        switch (parsed.kind()) {
            case ACK -> {
                LOGGER.debug("[Binance] Subscription confirmation: {}", frame);
                return Optional.empty();
            }
            case UNRECOGNIZED -> {
                LOGGER.warn("[Binance] Dropping unrecognized frame: {}", frame);
                return Optional.empty();
            }
            default -> {
                String symbol = symbols.get(parsed.vendorSymbol());
                if (symbol == null) {
                    LOGGER.warn("[Binance] Received price for unknown symbol: {}", parsed.vendorSymbol());
                    return Optional.empty();
                }
                return Optional.of(new PriceTick(symbol, parsed.price(), Instant.ofEpochMilli(parsed.eventTime())));
            }
        }
    }
}
