package io.trading.pricestream.netty;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.ServerSocketChannel;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event loop groups and channel classes for the hub server and the upstream clients.
 * Native epoll on Linux, NIO elsewhere.
 */
public final class NettyEventLoopFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyEventLoopFactory.class);

    private static final boolean EPOLL_AVAILABLE = Epoll.isAvailable();

    static {
        if (EPOLL_AVAILABLE) {
            LOGGER.info("Netty: Using native epoll transport");
        } else {
            LOGGER.info("Netty: Using NIO transport");
        }
    }

    private NettyEventLoopFactory() {
    }

    /**
     * Creates an event loop group of daemon threads named after {@code poolName}.
     *
     * @param threads  Number of threads (0 for Netty's default)
     * @param poolName Thread name prefix, e.g. "hub-boss" or "feed-BTCUSD"
     */
    public static EventLoopGroup createEventLoopGroup(int threads, String poolName) {
        DefaultThreadFactory threadFactory = new DefaultThreadFactory(poolName, true);
        return EPOLL_AVAILABLE
            ? new EpollEventLoopGroup(threads, threadFactory)
            : new NioEventLoopGroup(threads, threadFactory);
    }

    /**
     * Gets the appropriate SocketChannel class for the current platform.
     */
    public static Class<? extends SocketChannel> getClientChannelClass() {
        return EPOLL_AVAILABLE ? EpollSocketChannel.class : NioSocketChannel.class;
    }

    /**
     * Gets the appropriate ServerSocketChannel class for the current platform.
     */
    public static Class<? extends ServerSocketChannel> getServerChannelClass() {
        return EPOLL_AVAILABLE ? EpollServerSocketChannel.class : NioServerSocketChannel.class;
    }
}
