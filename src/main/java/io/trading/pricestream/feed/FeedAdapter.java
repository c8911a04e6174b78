package io.trading.pricestream.feed;

import io.trading.pricestream.model.PriceTick;

import java.net.URI;
import java.util.Optional;

/**
 * Vendor-specific part of an upstream price feed: symbol mapping, control
 * messages and frame parsing. Implementations are stateless and thread-safe.
 */
public interface FeedAdapter {

    /**
     * Vendor name used in logs and metrics.
     */
    String name();

    /**
     * Endpoint the transport connects to.
     */
    URI endpoint();

    /**
     * Returns whether the vendor can stream the given symbol.
     */
    boolean supports(String symbol);

    /**
     * Maps an instrument symbol to the vendor's subscription token.
     *
     * @throws UnsupportedSymbolException if the vendor has no mapping
     */
    String vendorToken(String symbol);

    /**
     * Builds the control message subscribing to a vendor token.
     */
    String subscribeMessage(String vendorToken, long requestId);

    /**
     * Builds the control message unsubscribing from a vendor token.
     */
    String unsubscribeMessage(String vendorToken, long requestId);

    /**
     * Parses a vendor frame.
     *
     * @return the normalized tick, or empty for control acknowledgements,
     *         unrecognized or malformed frames
     */
    Optional<PriceTick> parse(String frame);
}
