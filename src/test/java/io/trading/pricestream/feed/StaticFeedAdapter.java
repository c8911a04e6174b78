package io.trading.pricestream.feed;

import io.trading.pricestream.config.FeedSymbolConfig;
import io.trading.pricestream.feed.binance.BinanceFeedAdapter;

import java.net.URI;
import java.util.List;

/**
 * Binance adapter over a fixed test mapping: BTCUSD and ETHUSD are supported, nothing else.
 */
public final class StaticFeedAdapter {

    public static final URI ENDPOINT = URI.create("ws://localhost:9/stream");

    private StaticFeedAdapter() {
    }

    public static FeedAdapter create() {
        return new BinanceFeedAdapter(ENDPOINT, List.of(
            new FeedSymbolConfig("BTCUSD", "btcusdt"),
            new FeedSymbolConfig("ETHUSD", "ethusdt")
        ));
    }
}
