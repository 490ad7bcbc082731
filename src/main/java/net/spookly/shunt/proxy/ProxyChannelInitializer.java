package net.spookly.shunt.proxy;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.timeout.ReadTimeoutHandler;
import net.spookly.shunt.protocol.ProtocolPipeline;
import net.spookly.shunt.resolve.EndpointResolver;
import net.spookly.shunt.routing.ServerSelector;
import net.spookly.shunt.status.StatusCache;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Initializes client connection pipelines.
 */
public final class ProxyChannelInitializer extends ChannelInitializer<SocketChannel> {
    private final String motd;
    private final Integer readTimeoutMs;
    private final StatusCache statusCache;
    private final ServerSelector selector;
    private final EndpointResolver resolver;
    private final LongSupplier contextIds;

    public ProxyChannelInitializer(String motd,
                                   Integer readTimeoutMs,
                                   StatusCache statusCache,
                                   ServerSelector selector,
                                   EndpointResolver resolver,
                                   LongSupplier contextIds) {
        this.motd = Objects.requireNonNull(motd, "motd");
        this.readTimeoutMs = readTimeoutMs;
        this.statusCache = Objects.requireNonNull(statusCache, "statusCache");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.contextIds = Objects.requireNonNull(contextIds, "contextIds");
    }

    @Override
    protected void initChannel(SocketChannel channel) {
        ChannelPipeline pipeline = channel.pipeline();
        if (readTimeoutMs != null && readTimeoutMs > 0) {
            pipeline.addLast("readTimeout", new ReadTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS));
        }
        ProtocolPipeline.install(pipeline);
        pipeline.addLast("handler",
                new ConnectionStateMachine(contextIds.getAsLong(), motd, statusCache, selector, resolver));
    }
}
