package net.spookly.shunt.proxy;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import lombok.extern.slf4j.Slf4j;
import net.spookly.shunt.config.ConfigDefaults;
import net.spookly.shunt.config.ShuntConfig;
import net.spookly.shunt.resolve.EndpointResolver;
import net.spookly.shunt.routing.ServerSelector;
import net.spookly.shunt.status.StatusCache;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TCP listener that accepts client connections and hands each one to a {@link ConnectionStateMachine}.
 */
@Slf4j
public final class ProxyServer {
    private static final String DEFAULT_HOST = "0.0.0.0";

    private final ShuntConfig config;
    private final StatusCache statusCache;
    private final ServerSelector selector;
    private final EndpointResolver resolver;
    private final EventLoopGroup workerGroup;
    private EventLoopGroup bossGroup;
    private AtomicLong contextIds;
    private Channel channel;

    /**
     * Create a listener whose connections run on the given worker group. The group is owned by the caller.
     */
    public ProxyServer(ShuntConfig config,
                       StatusCache statusCache,
                       ServerSelector selector,
                       EndpointResolver resolver,
                       EventLoopGroup workerGroup) {
        this.config = Objects.requireNonNull(config, "config");
        this.statusCache = Objects.requireNonNull(statusCache, "statusCache");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
    }

    /**
     * Bind the listener. Calling start twice is a no-op.
     */
    public void start() {
        if (channel != null) {
            return;
        }
        contextIds = new AtomicLong();
        bossGroup = new NioEventLoopGroup(1);
        String motd = config.motd == null ? ConfigDefaults.DEFAULT_MOTD : config.motd;
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ProxyChannelInitializer(
                        motd,
                        config.handshakeTimeoutMs,
                        statusCache,
                        selector,
                        resolver,
                        contextIds::getAndIncrement));

        InetSocketAddress address = listenAddress();
        try {
            channel = bootstrap.bind(address).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Listener bind interrupted", e);
        }
        log.info("Listening on {}:{}", address.getHostString(), localPort());
    }

    /**
     * Stop accepting connections.
     */
    public void stop() {
        if (channel != null) {
            channel.close().syncUninterruptibly();
            channel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

    /**
     * Port actually bound, useful when configured with port 0.
     */
    public int localPort() {
        if (channel == null) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    long acceptedConnections() {
        return contextIds == null ? 0 : contextIds.get();
    }

    private InetSocketAddress listenAddress() {
        ShuntConfig.ListenConfig listen = config.listen;
        String host = listen == null || listen.host == null || listen.host.trim().isEmpty()
                ? DEFAULT_HOST
                : listen.host.trim();
        int port = listen == null || listen.port == null ? ConfigDefaults.DEFAULT_LISTEN_PORT : listen.port;
        return new InetSocketAddress(host, port);
    }
}
