package io.trading.pricestream.netty;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Netty handler for WebSocket client connections.
 * Handles handshake, frame processing, and connection lifecycle events.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private static final int MAX_FRAME_PAYLOAD = 1 << 20;

    /**
     * Events raised on the channel's I/O thread.
     */
    interface Events {
        void onText(String message);

        void onCloseFrame(int statusCode, String reason);

        void onError(Throwable cause);

        void onInactive();
    }

    private final WebSocketClientHandshaker handshaker;
    private final Events events;
    private ChannelPromise handshakeFuture;

    public WebSocketClientHandler(URI uri, Events events) {
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            MAX_FRAME_PAYLOAD
        );
        this.events = events;
    }

    /**
     * Completes when the WebSocket handshake succeeds or fails.
     */
    public ChannelFuture handshakeFuture() {
        return handshakeFuture;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        handshakeFuture = ctx.newPromise();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("WebSocket channel inactive");
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(new IllegalStateException("Channel closed before handshake completed"));
        }
        events.onInactive();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("WebSocket handshake complete");
                handshakeFuture.trySuccess();
            } catch (RuntimeException e) {
                LOGGER.error("WebSocket handshake failed", e);
                handshakeFuture.tryFailure(e);
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof TextWebSocketFrame textFrame) {
            try {
                events.onText(textFrame.text());
            } catch (RuntimeException e) {
                LOGGER.error("Error in message handler", e);
            }
            return;
        }

        if (frame instanceof CloseWebSocketFrame closeFrame) {
            LOGGER.debug("Received close frame");
            events.onCloseFrame(closeFrame.statusCode(), closeFrame.reasonText());
            ctx.close();
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            return;
        }

        LOGGER.warn("Unsupported frame type: {}", frame.getClass().getName());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("WebSocket exception", cause);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(cause);
        }
        events.onError(cause);
        ctx.close();
    }
}
