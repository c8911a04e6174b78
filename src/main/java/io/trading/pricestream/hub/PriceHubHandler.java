package io.trading.pricestream.hub;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.trading.pricestream.broadcast.BroadcastDispatcher;
import io.trading.pricestream.feed.PriceFeedException;
import io.trading.pricestream.instrument.InstrumentCatalog;
import io.trading.pricestream.model.Symbols;
import io.trading.pricestream.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.channels.ClosedChannelException;
import java.util.concurrent.Executor;

/**
 * One hub client. Commands run in arrival order on the worker executor since
 * subscribing may wait for an upstream connect; the event loop never blocks.
 */
public class PriceHubHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PriceHubHandler.class);

    private final SubscriptionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final InstrumentCatalog catalog;
    private final HubMessageCodec codec;
    private final ClientCommandQueue commands;

    private String subscriberId;

    public PriceHubHandler(
        SubscriptionRegistry registry,
        BroadcastDispatcher dispatcher,
        InstrumentCatalog catalog,
        HubMessageCodec codec,
        Executor workers
    ) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.catalog = catalog;
        this.codec = codec;
        this.commands = new ClientCommandQueue(workers);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            Channel channel = ctx.channel();
            subscriberId = "hub-" + channel.id().asShortText();
            dispatcher.registerSink(subscriberId, tick -> {
                if (!channel.isActive()) {
                    throw new ClosedChannelException();
                }
                channel.writeAndFlush(new TextWebSocketFrame(codec.price(tick)));
            });
            LOGGER.info("[Hub] Client connected: {} from {}", subscriberId, channel.remoteAddress());
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        Channel channel = ctx.channel();
        HubCommand command;
        try {
            command = codec.decode(frame.text());
        } catch (IllegalArgumentException e) {
            LOGGER.warn("[Hub] {} sent an invalid command: {}", subscriberId, e.getMessage());
            reply(channel, codec.error(e.getMessage()));
            return;
        }
        String id = subscriberId;
        enqueue(() -> handle(channel, id, command));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        String id = subscriberId;
        if (id != null) {
            dispatcher.unregisterSink(id);
            // runs after any command still queued for this client
            enqueue(() -> {
                registry.unsubscribeAll(id);
                LOGGER.info("[Hub] Client disconnected: {}", id);
            });
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("[Hub] Error on client {}", subscriberId, cause);
        ctx.close();
    }

    private void enqueue(Runnable task) {
        commands.submit(subscriberId, task);
    }

    private void handle(Channel channel, String id, HubCommand command) {
        switch (command.action()) {
            case SUBSCRIBE -> subscribe(channel, id, command.symbol());
            case UNSUBSCRIBE -> unsubscribe(channel, id, command.symbol());
            case SUBSCRIPTIONS -> reply(channel, codec.subscriptions(registry.symbolsOf(id)));
        }
    }

    private void subscribe(Channel channel, String id, String requested) {
        if (requested == null || requested.isBlank()) {
            reply(channel, codec.error("Symbol is required"));
            return;
        }
        String symbol = Symbols.normalize(requested);
        if (!catalog.contains(symbol)) {
            reply(channel, codec.error("Unsupported symbol: " + symbol));
            return;
        }
        if (!channel.isActive()) {
            return;
        }
        try {
            registry.subscribe(id, symbol);
            reply(channel, codec.subscribed(symbol));
        } catch (PriceFeedException e) {
            LOGGER.error("[Hub] Error subscribing {} to {}: {}", id, symbol, e.getMessage());
            reply(channel, codec.error("Failed to subscribe to " + symbol + ": " + e.getMessage()));
        }
    }

    private void unsubscribe(Channel channel, String id, String requested) {
        if (requested == null || requested.isBlank()) {
            reply(channel, codec.error("Symbol is required"));
            return;
        }
        String symbol = Symbols.normalize(requested);
        registry.unsubscribe(id, symbol);
        reply(channel, codec.unsubscribed(symbol));
    }

    private void reply(Channel channel, String message) {
        if (channel.isActive()) {
            channel.writeAndFlush(new TextWebSocketFrame(message));
        }
    }
}
