package net.spookly.shunt.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import net.spookly.shunt.protocol.ProtocolPipeline;
import net.spookly.shunt.protocol.RawPacket;
import net.spookly.shunt.protocol.packets.HandshakePacket;
import net.spookly.shunt.protocol.packets.StatusRequestPacket;
import net.spookly.shunt.protocol.packets.StatusResponsePacket;
import net.spookly.shunt.resolve.EndpointResolver;
import net.spookly.shunt.resolve.ResolvedEndpoint;
import net.spookly.shunt.routing.BackendProbe;
import net.spookly.shunt.routing.BackendServer;
import net.spookly.shunt.routing.ProbeException;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Reads a backend's online player count with a server list ping: handshake with the status intent, status
 * request, one status response.
 */
@Slf4j
public final class StatusBackendProbe implements BackendProbe {
    static final int PROBE_PROTOCOL_VERSION = 772;
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 5000;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EventLoopGroup group;
    private final EndpointResolver resolver;

    public StatusBackendProbe(EventLoopGroup group, EndpointResolver resolver) {
        this.group = Objects.requireNonNull(group, "group");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public CompletableFuture<Integer> probe(BackendServer server, int timeoutMs) {
        Objects.requireNonNull(server, "server");
        CompletableFuture<Integer> result = new CompletableFuture<>();
        EventLoop loop = group.next();
        final ScheduledFuture<?> timeoutFuture;
        if (timeoutMs > 0) {
            timeoutFuture = loop.schedule(() -> {
                result.completeExceptionally(new ProbeException("Probe of " + server + " timed out after "
                        + timeoutMs + "ms"));
            }, timeoutMs, TimeUnit.MILLISECONDS);
        } else {
            timeoutFuture = null;
        }
        result.whenComplete((count, error) -> {
            if (timeoutFuture != null) {
                timeoutFuture.cancel(false);
            }
        });

        resolver.resolve(server.address(), "minecraft", "tcp", server.port()).whenComplete((endpoint, error) -> {
            if (error != null) {
                result.completeExceptionally(new ProbeException("Could not resolve " + server, unwrap(error)));
                return;
            }
            if (result.isDone()) {
                return;
            }
            log.debug("Probing {} at {}:{}", server, endpoint.ip(), endpoint.port());
            connect(loop, endpoint, timeoutMs, result);
        });
        return result;
    }

    private void connect(EventLoop loop, ResolvedEndpoint endpoint, int timeoutMs, CompletableFuture<Integer> result) {
        Bootstrap bootstrap = new Bootstrap()
                .group(loop)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs > 0 ? timeoutMs : DEFAULT_CONNECT_TIMEOUT_MS)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel channel) {
                        ProtocolPipeline.install(channel.pipeline());
                        channel.pipeline().addLast("probe", new StatusProbeHandler(endpoint, result));
                    }
                });
        ChannelFuture connectFuture;
        try {
            connectFuture = bootstrap.connect(endpoint.toSocketAddress());
        } catch (RuntimeException e) {
            result.completeExceptionally(new ProbeException("Could not connect to " + endpoint.ip(), e));
            return;
        }
        connectFuture.addListener(future -> {
            if (!future.isSuccess()) {
                result.completeExceptionally(new ProbeException("Could not connect to " + endpoint.ip() + ":"
                        + endpoint.port(), future.cause()));
            }
        });
        result.whenComplete((count, error) -> connectFuture.channel().close());
    }

    static int parseOnlinePlayers(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new ProbeException("Status response is not valid JSON", e);
        }
        JsonNode online = root == null ? null : root.path("players").get("online");
        if (online == null || !online.isIntegralNumber() || !online.canConvertToInt() || online.intValue() < 0) {
            throw new ProbeException("Status response has no valid players.online value");
        }
        return online.intValue();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * Drives one probe connection.
     */
    private static final class StatusProbeHandler extends SimpleChannelInboundHandler<RawPacket> {
        private final ResolvedEndpoint endpoint;
        private final CompletableFuture<Integer> result;

        private StatusProbeHandler(ResolvedEndpoint endpoint, CompletableFuture<Integer> result) {
            this.endpoint = endpoint;
            this.result = result;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            ctx.write(new HandshakePacket(PROBE_PROTOCOL_VERSION, endpoint.ip(), endpoint.port(),
                    HandshakePacket.INTENT_STATUS));
            ctx.writeAndFlush(StatusRequestPacket.INSTANCE);
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, RawPacket packet) {
            if (packet.id() != StatusResponsePacket.ID) {
                throw new ProbeException("Unexpected packet id " + packet.id() + " from " + endpoint.ip());
            }
            StatusResponsePacket response = StatusResponsePacket.read(packet.body());
            result.complete(parseOnlinePlayers(response.json()));
            ctx.close();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (cause instanceof ProbeException) {
                result.completeExceptionally(cause);
            } else {
                result.completeExceptionally(new ProbeException("Probe of " + endpoint.ip() + " failed", cause));
            }
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            result.completeExceptionally(new ProbeException("Connection to " + endpoint.ip()
                    + " closed before a status response"));
            ctx.fireChannelInactive();
        }
    }
}
