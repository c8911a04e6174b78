package io.trading.pricestream.feed;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * A single upstream text-frame connection.
 * Exactly one of {@link Listener#onRemoteClose} or {@link Listener#onFailure}
 * is reported per established connection, and neither after {@link #close()}.
 */
public interface FeedTransport extends AutoCloseable {

    /**
     * Opens the connection and waits until it is ready to carry frames.
     *
     * @throws IOException if the connection or handshake fails or times out
     */
    void connect(Duration timeout) throws IOException;

    /**
     * Writes a text frame.
     *
     * @throws IllegalStateException if the connection is not open
     */
    void send(String message);

    boolean isOpen();

    /**
     * Closes the connection and waits for its I/O resources to be released.
     * Safe to call more than once and before {@link #connect}.
     */
    @Override
    void close();

    /**
     * Callbacks from the transport's I/O thread.
     */
    interface Listener {

        void onMessage(String message);

        /**
         * The remote side sent a close frame.
         */
        void onRemoteClose(int statusCode, String reason);

        /**
         * The connection was lost because of an error.
         */
        void onFailure(Throwable cause);
    }

    /**
     * Creates transports for an endpoint.
     */
    @FunctionalInterface
    interface Factory {

        FeedTransport create(URI endpoint, String name, Listener listener);
    }
}
