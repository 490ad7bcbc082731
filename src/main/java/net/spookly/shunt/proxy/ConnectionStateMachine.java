package net.spookly.shunt.proxy;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import net.spookly.shunt.protocol.ProtocolException;
import net.spookly.shunt.protocol.ProtocolState;
import net.spookly.shunt.protocol.RawPacket;
import net.spookly.shunt.protocol.packets.HandshakePacket;
import net.spookly.shunt.protocol.packets.LoginAcknowledgedPacket;
import net.spookly.shunt.protocol.packets.LoginStartPacket;
import net.spookly.shunt.protocol.packets.LoginSuccessPacket;
import net.spookly.shunt.protocol.packets.PingRequestPacket;
import net.spookly.shunt.protocol.packets.PongResponsePacket;
import net.spookly.shunt.protocol.packets.StatusRequestPacket;
import net.spookly.shunt.protocol.packets.StatusResponsePacket;
import net.spookly.shunt.protocol.packets.TransferPacket;
import net.spookly.shunt.resolve.EndpointResolver;
import net.spookly.shunt.resolve.ResolvedEndpoint;
import net.spookly.shunt.routing.BackendServer;
import net.spookly.shunt.routing.SelectionRequest;
import net.spookly.shunt.routing.ServerSelector;
import net.spookly.shunt.status.StatusCache;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Per-connection protocol handler: answers server list pings, completes an offline login and transfers the
 * client to the selected backend once it reaches the configuration state.
 *
 * <p>Packets are handled strictly in arrival order. While a status lookup or the transfer is pending, later
 * packets are queued and replayed afterwards.
 */
@Slf4j
public final class ConnectionStateMachine extends SimpleChannelInboundHandler<RawPacket> {
    static final int MIN_STATUS_PROTOCOL = 766;

    private final long contextId;
    private final String motd;
    private final StatusCache statusCache;
    private final ServerSelector selector;
    private final EndpointResolver resolver;
    private final Deque<RawPacket> pendingPackets = new ArrayDeque<>();
    private ProtocolState state = ProtocolState.HANDSHAKE;
    private int protocolVersion;
    private boolean busy;
    private boolean closed;

    public ConnectionStateMachine(long contextId,
                                  String motd,
                                  StatusCache statusCache,
                                  ServerSelector selector,
                                  EndpointResolver resolver) {
        this.contextId = contextId;
        this.motd = Objects.requireNonNull(motd, "motd");
        this.statusCache = Objects.requireNonNull(statusCache, "statusCache");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RawPacket packet) {
        if (closed) {
            return;
        }
        if (busy) {
            pendingPackets.addLast(packet);
            return;
        }
        dispatch(ctx, packet);
    }

    private void dispatch(ChannelHandlerContext ctx, RawPacket packet) {
        log.debug("({}) Received packet {} in state {}", contextId, packet.id(), state);
        try {
            switch (state) {
                case HANDSHAKE:
                    handleHandshake(packet);
                    break;
                case STATUS:
                    handleStatus(ctx, packet);
                    break;
                case LOGIN:
                    handleLogin(ctx, packet);
                    break;
                case CONFIG:
                default:
                    break;
            }
        } catch (RuntimeException e) {
            fail(ctx, packet.id(), e);
        }
    }

    private void handleHandshake(RawPacket packet) {
        if (packet.id() != HandshakePacket.ID) {
            log.warn("({}) Ignoring packet {} before handshake", contextId, packet.id());
            return;
        }
        HandshakePacket handshake = HandshakePacket.read(packet.body());
        protocolVersion = handshake.protocolVersion();
        transition(ProtocolState.fromIntent(handshake.intent()));
    }

    private void handleStatus(ChannelHandlerContext ctx, RawPacket packet) {
        switch (packet.id()) {
            case StatusRequestPacket.ID:
                int protocol = Math.max(MIN_STATUS_PROTOCOL, protocolVersion);
                busy = true;
                statusCache.status(motd, protocol).whenComplete((json, error) -> onEventLoop(ctx, () -> {
                    if (error != null) {
                        fail(ctx, packet.id(), error);
                        return;
                    }
                    ctx.writeAndFlush(new StatusResponsePacket(json));
                    resume(ctx);
                }));
                break;
            case PingRequestPacket.ID:
                PingRequestPacket ping = PingRequestPacket.read(packet.body());
                ctx.writeAndFlush(new PongResponsePacket(ping.payload()));
                break;
            default:
                throw new ProtocolException("Unexpected packet id " + packet.id() + " in status state");
        }
    }

    private void handleLogin(ChannelHandlerContext ctx, RawPacket packet) {
        switch (packet.id()) {
            case LoginStartPacket.ID:
                LoginStartPacket login = LoginStartPacket.read(packet.body());
                log.debug("({}) Login start from {} ({})", contextId, login.name(), login.uuid());
                ctx.writeAndFlush(new LoginSuccessPacket(login.uuid(), login.name()));
                break;
            case LoginAcknowledgedPacket.ID:
                transition(ProtocolState.CONFIG);
                transfer(ctx);
                break;
            default:
                throw new ProtocolException("Unexpected packet id " + packet.id() + " in login state");
        }
    }

    private void transfer(ChannelHandlerContext ctx) {
        busy = true;
        ctx.channel().config().setAutoRead(false);
        SelectionRequest request = new SelectionRequest(clientAddress(ctx));
        selector.findServer(request)
                .thenCompose(this::resolveBackend)
                .whenComplete((endpoint, error) -> onEventLoop(ctx, () -> {
                    if (error != null) {
                        fail(ctx, LoginAcknowledgedPacket.ID, error);
                        return;
                    }
                    log.info("({}) Transferring to {}:{}", contextId, endpoint.ip(), endpoint.port());
                    closed = true;
                    pendingPackets.clear();
                    ctx.writeAndFlush(new TransferPacket(endpoint.ip(), endpoint.port()))
                            .addListener(ChannelFutureListener.CLOSE);
                }));
    }

    private CompletableFuture<ResolvedEndpoint> resolveBackend(BackendServer server) {
        log.debug("({}) Selected backend {}", contextId, server.label());
        return resolver.resolve(server.address(), "minecraft", "tcp", server.port());
    }

    private void resume(ChannelHandlerContext ctx) {
        busy = false;
        while (!busy && !closed && !pendingPackets.isEmpty()) {
            dispatch(ctx, pendingPackets.pollFirst());
        }
    }

    private void transition(ProtocolState next) {
        if (!state.canTransitionTo(next)) {
            throw new ProtocolException("Illegal transition from " + state + " to " + next);
        }
        log.debug("({}) Switched from {} to {}", contextId, state, next);
        state = next;
    }

    private void onEventLoop(ChannelHandlerContext ctx, Runnable task) {
        if (ctx.executor().inEventLoop()) {
            task.run();
        } else {
            ctx.executor().execute(task);
        }
    }

    private void fail(ChannelHandlerContext ctx, int packetId, Throwable error) {
        if (closed) {
            return;
        }
        closed = true;
        pendingPackets.clear();
        Throwable cause = unwrap(error);
        log.error("({}) Failed to handle packet with id {} (state: {}): {}",
                contextId, packetId, state, describe(cause));
        ctx.close();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof ReadTimeoutException) {
            log.debug("({}) Read timeout in state {}", contextId, state);
            closed = true;
            pendingPackets.clear();
            ctx.close();
            return;
        }
        if (closed) {
            return;
        }
        closed = true;
        pendingPackets.clear();
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        log.error("({}) Connection error (state: {}): {}", contextId, state, describe(root));
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        closed = true;
        pendingPackets.clear();
        ctx.fireChannelInactive();
    }

    ProtocolState state() {
        return state;
    }

    int protocolVersion() {
        return protocolVersion;
    }

    private static InetAddress clientAddress(ChannelHandlerContext ctx) {
        SocketAddress remote = ctx.channel().remoteAddress();
        if (remote instanceof InetSocketAddress) {
            return ((InetSocketAddress) remote).getAddress();
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
