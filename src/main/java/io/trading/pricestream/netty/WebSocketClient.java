package io.trading.pricestream.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.trading.pricestream.feed.FeedTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Netty-based WebSocket client for upstream price streams.
 * Supports both epoll (Linux) and NIO (universal) event loop groups, and TLS for wss:// endpoints.
 */
public class WebSocketClient implements FeedTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClient.class);

    private static final int MAX_HANDSHAKE_RESPONSE = 8192;
    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final URI uri;
    private final String name;
    private final Listener listener;
    private final boolean enableCompression;
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private EventLoopGroup eventLoopGroup;
    private Channel channel;
    private volatile boolean established = false;
    private volatile boolean closing = false;
    private volatile Throwable lastError;
    private volatile int closeStatus = -1;
    private volatile String closeReason;

    /**
     * Creates a new WebSocket client with compression enabled.
     */
    public WebSocketClient(URI uri, String name, Listener listener) {
        this(uri, name, listener, true);
    }

    /**
     * Creates a new WebSocket client.
     *
     * @param uri               The WebSocket URI to connect to
     * @param name              Friendly name for this client (e.g., "Binance:BTCUSD")
     * @param listener          Receives frames and the terminal event of the connection
     * @param enableCompression Whether to enable WebSocket compression
     */
    public WebSocketClient(URI uri, String name, Listener listener, boolean enableCompression) {
        this.uri = uri;
        this.name = name;
        this.listener = listener;
        this.enableCompression = enableCompression;
    }

    @Override
    public void connect(Duration timeout) throws IOException {
        if (established) {
            LOGGER.warn("{}: Already connected", name);
            return;
        }

        String scheme = uri.getScheme();
        boolean secure = "wss".equalsIgnoreCase(scheme);
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);
        SslContext sslContext = secure ? buildSslContext() : null;

        WebSocketClientHandler handler = new WebSocketClientHandler(uri, new HandlerEvents());
        eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, "feed-" + name);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .handler(new ChannelInitializer<Channel>() {
                @Override
                protected void initChannel(Channel ch) {
                    ChannelPipeline pipeline = ch.pipeline();

                    // TLS for wss:// connections
                    if (sslContext != null) {
                        pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                    }

                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(MAX_HANDSHAKE_RESPONSE));

                    if (enableCompression) {
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                    }

                    pipeline.addLast(handler);
                }
            });

        LOGGER.info("{}: Connecting to {}:{}...", name, host, port);
        try {
            ChannelFuture connectFuture = bootstrap.connect(host, port);
            if (!connectFuture.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IOException("Timed out connecting to " + host + ":" + port);
            }
            if (!connectFuture.isSuccess()) {
                throw new IOException("Failed to connect to " + host + ":" + port, connectFuture.cause());
            }
            channel = connectFuture.channel();

            ChannelFuture handshake = handler.handshakeFuture();
            if (!handshake.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IOException("Timed out waiting for WebSocket handshake with " + uri);
            }
            if (!handshake.isSuccess()) {
                throw new IOException("WebSocket handshake with " + uri + " failed", handshake.cause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new InterruptedIOException(name + ": Interrupted while connecting");
        } catch (IOException e) {
            close();
            throw e;
        }

        established = true;
        if (!channel.isActive()) {
            // dropped between handshake and here, the inactive event was not reported
            established = false;
            close();
            throw new IOException("Connection to " + uri + " closed right after handshake");
        }
        LOGGER.info("{}: Connected", name);
    }

    private SslContext buildSslContext() throws IOException {
        try {
            return SslContextBuilder.forClient()
                .protocols("TLSv1.2", "TLSv1.3")
                .sslProvider(SslProvider.JDK)
                .build();
        } catch (SSLException e) {
            throw new IOException(name + ": Failed to create SSL context", e);
        }
    }

    @Override
    public void send(String message) {
        Channel current = channel;
        if (!established || current == null || !current.isActive()) {
            throw new IllegalStateException(name + ": Cannot send message, not connected");
        }
        current.writeAndFlush(new TextWebSocketFrame(message)).addListener(future -> {
            if (!future.isSuccess()) {
                LOGGER.error("{}: Failed to send message", name, future.cause());
            }
        });
    }

    @Override
    public boolean isOpen() {
        Channel current = channel;
        return established && current != null && current.isActive();
    }

    @Override
    public void close() {
        closing = true;
        established = false;

        if (channel != null) {
            channel.close().awaitUninterruptibly(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            channel = null;
        }

        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            eventLoopGroup = null;
        }

        LOGGER.debug("{}: Closed", name);
    }

    /**
     * Translates channel events into the single terminal event of the transport contract.
     */
    private final class HandlerEvents implements WebSocketClientHandler.Events {

        @Override
        public void onText(String message) {
            if (established) {
                listener.onMessage(message);
            }
        }

        @Override
        public void onCloseFrame(int statusCode, String reason) {
            closeStatus = statusCode;
            closeReason = reason;
        }

        @Override
        public void onError(Throwable cause) {
            lastError = cause;
        }

        @Override
        public void onInactive() {
            if (!established || closing || !terminated.compareAndSet(false, true)) {
                return;
            }
            established = false;
            if (closeStatus >= 0 || closeReason != null) {
                LOGGER.warn("{}: Closed by server", name);
                listener.onRemoteClose(closeStatus, closeReason);
            } else {
                Throwable cause = lastError != null ? lastError : new IOException("Connection lost");
                LOGGER.warn("{}: Disconnected: {}", name, cause.getMessage());
                listener.onFailure(cause);
            }
        }
    }
}
