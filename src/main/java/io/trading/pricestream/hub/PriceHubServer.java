package io.trading.pricestream.hub;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.trading.pricestream.broadcast.BroadcastDispatcher;
import io.trading.pricestream.instrument.InstrumentCatalog;
import io.trading.pricestream.netty.NettyEventLoopFactory;
import io.trading.pricestream.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket endpoint for live price subscribers.
 */
public class PriceHubServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PriceHubServer.class);

    public static final String PATH = "/priceHub";

    private static final int MAX_CONTENT_LENGTH = 65536;
    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final int port;
    private final SubscriptionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final InstrumentCatalog catalog;
    private final HubMessageCodec codec;
    private final Executor workers;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    /**
     * @param port       Listen port, 0 for an ephemeral port
     * @param registry   Subscription registry driven by client commands
     * @param dispatcher Receives one delivery sink per client
     * @param catalog    Instruments clients may subscribe to
     * @param codec      Frame codec
     * @param workers    Runs client commands off the event loop
     */
    public PriceHubServer(
        int port,
        SubscriptionRegistry registry,
        BroadcastDispatcher dispatcher,
        InstrumentCatalog catalog,
        HubMessageCodec codec,
        Executor workers
    ) {
        this.port = port;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.catalog = catalog;
        this.codec = codec;
        this.workers = workers;
    }

    /**
     * Binds the listen socket.
     */
    public void start() throws InterruptedException {
        bossGroup = NettyEventLoopFactory.createEventLoopGroup(1, "hub-boss");
        workerGroup = NettyEventLoopFactory.createEventLoopGroup(0, "hub-io");

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
            .channel(NettyEventLoopFactory.getServerChannelClass())
            .childOption(ChannelOption.TCP_NODELAY, true)
            .childHandler(new ChannelInitializer<Channel>() {
                @Override
                protected void initChannel(Channel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    pipeline.addLast(new HttpServerCodec());
                    pipeline.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                    pipeline.addLast(new WebSocketServerCompressionHandler());
                    pipeline.addLast(new WebSocketServerProtocolHandler(PATH, null, true));
                    pipeline.addLast(new PriceHubHandler(registry, dispatcher, catalog, codec, workers));
                }
            });

        try {
            serverChannel = bootstrap.bind(port).sync().channel();
        } catch (InterruptedException e) {
            close();
            throw e;
        }
        LOGGER.info("Price hub listening on ws://0.0.0.0:{}{}", getPort(), PATH);
    }

    /**
     * Bound port, useful when started on port 0.
     */
    public int getPort() {
        Channel channel = serverChannel;
        return channel == null ? port : ((InetSocketAddress) channel.localAddress()).getPort();
    }

    @Override
    public void close() {
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            serverChannel = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            bossGroup = null;
        }
        LOGGER.info("Price hub stopped");
    }
}
