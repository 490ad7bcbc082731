package net.spookly.shunt.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetAddress;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import net.spookly.shunt.protocol.Packet;
import net.spookly.shunt.protocol.ProtocolPipeline;
import net.spookly.shunt.protocol.ProtocolState;
import net.spookly.shunt.protocol.ProtocolUtil;
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
import net.spookly.shunt.resolve.DnsLookup;
import net.spookly.shunt.resolve.EndpointResolver;
import net.spookly.shunt.resolve.SrvRecord;
import net.spookly.shunt.routing.BackendServer;
import net.spookly.shunt.routing.SelectionException;
import net.spookly.shunt.routing.SelectionRequest;
import net.spookly.shunt.routing.ServerSelector;
import net.spookly.shunt.status.StatusCache;
import org.junit.jupiter.api.Test;

class ConnectionStateMachineTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final UUID PLAYER = UUID.fromString("069a79f4-44e9-4726-a5be-fca90e38aaf5");

    @Test
    void answersStatusAndPing() throws Exception {
        FixedSelector selector = new FixedSelector();
        selector.players = CompletableFuture.completedFuture(4L);
        EmbeddedChannel channel = channel(selector);

        channel.writeInbound(frame(new HandshakePacket(770, "play.example.com", 25565, HandshakePacket.INTENT_STATUS)));
        channel.writeInbound(frame(StatusRequestPacket.INSTANCE));

        RawPacket response = readPacket(channel);
        assertEquals(StatusResponsePacket.ID, response.id());
        JsonNode json = MAPPER.readTree(StatusResponsePacket.read(response.body()).json());
        assertEquals(770, json.path("version").path("protocol").asInt());
        assertEquals(4, json.path("players").path("online").asInt());
        assertEquals("Test motd", json.path("description").asText());

        channel.writeInbound(frame(new PingRequestPacket(123456789L)));
        RawPacket pong = readPacket(channel);
        assertEquals(PongResponsePacket.ID, pong.id());
        assertEquals(123456789L, PongResponsePacket.read(pong.body()).payload());
        assertTrue(channel.isOpen());
        channel.finishAndReleaseAll();
    }

    @Test
    void oldClientsSeeMinimumStatusProtocol() throws Exception {
        FixedSelector selector = new FixedSelector();
        EmbeddedChannel channel = channel(selector);

        channel.writeInbound(frames(
                new HandshakePacket(47, "localhost", 25565, HandshakePacket.INTENT_STATUS),
                StatusRequestPacket.INSTANCE));

        JsonNode json = MAPPER.readTree(StatusResponsePacket.read(readPacket(channel).body()).json());
        assertEquals(766, json.path("version").path("protocol").asInt());
        channel.finishAndReleaseAll();
    }

    @Test
    void loginEndsWithSingleTransferAndClose() {
        FixedSelector selector = new FixedSelector();
        selector.backend = new BackendServer("lobby", "10.0.0.5", 25570);
        EmbeddedChannel channel = channel(selector);

        channel.writeInbound(frame(new HandshakePacket(770, "play.example.com", 25565, HandshakePacket.INTENT_LOGIN)));
        channel.writeInbound(frame(new LoginStartPacket("Steve", PLAYER)));

        RawPacket success = readPacket(channel);
        assertEquals(LoginSuccessPacket.ID, success.id());
        LoginSuccessPacket login = LoginSuccessPacket.read(success.body());
        assertEquals(PLAYER, login.uuid());
        assertEquals("Steve", login.name());

        channel.writeInbound(frame(LoginAcknowledgedPacket.INSTANCE));

        RawPacket transfer = readPacket(channel);
        assertEquals(TransferPacket.ID, transfer.id());
        TransferPacket decoded = TransferPacket.read(transfer.body());
        assertEquals("10.0.0.5", decoded.host());
        assertEquals(25570, decoded.port());
        assertNull(channel.readOutbound());
        assertFalse(channel.isOpen());
        assertEquals(1, selector.findCalls);
        channel.finishAndReleaseAll();
    }

    @Test
    void transferIntentIsTreatedAsLogin() {
        FixedSelector selector = new FixedSelector();
        EmbeddedChannel channel = channel(selector);

        channel.writeInbound(frames(
                new HandshakePacket(770, "play.example.com", 25565, 3),
                new LoginStartPacket("Alex", PLAYER),
                LoginAcknowledgedPacket.INSTANCE));

        assertEquals(LoginSuccessPacket.ID, readPacket(channel).id());
        assertEquals(TransferPacket.ID, readPacket(channel).id());
        assertFalse(channel.isOpen());
        channel.finishAndReleaseAll();
    }

    @Test
    void queuesPacketsWhileStatusIsPending() {
        FixedSelector selector = new FixedSelector();
        CompletableFuture<Long> players = new CompletableFuture<>();
        selector.players = players;
        EmbeddedChannel channel = channel(selector);

        channel.writeInbound(frames(
                new HandshakePacket(770, "localhost", 25565, HandshakePacket.INTENT_STATUS),
                StatusRequestPacket.INSTANCE,
                new PingRequestPacket(7L)));
        assertNull(channel.readOutbound());

        players.complete(2L);

        assertEquals(StatusResponsePacket.ID, readPacket(channel).id());
        RawPacket pong = readPacket(channel);
        assertEquals(PongResponsePacket.ID, pong.id());
        assertEquals(7L, PongResponsePacket.read(pong.body()).payload());
        channel.finishAndReleaseAll();
    }

    @Test
    void ignoresUnknownPacketsBeforeHandshake() {
        FixedSelector selector = new FixedSelector();
        EmbeddedChannel channel = channel(selector);
        ByteBuf stray = Unpooled.buffer();
        ProtocolUtil.writeVarInt(stray, 1);
        ProtocolUtil.writeVarInt(stray, 0x7A);

        channel.writeInbound(stray);
        assertTrue(channel.isOpen());
        assertEquals(ProtocolState.HANDSHAKE, handler(channel).state());

        channel.writeInbound(frame(new HandshakePacket(770, "localhost", 25565, HandshakePacket.INTENT_STATUS)));
        assertEquals(ProtocolState.STATUS, handler(channel).state());
        assertEquals(770, handler(channel).protocolVersion());
        channel.finishAndReleaseAll();
    }

    @Test
    void unknownStatusPacketClosesConnection() {
        EmbeddedChannel channel = channel(new FixedSelector());
        ByteBuf unknown = Unpooled.buffer();
        ProtocolUtil.writeVarInt(unknown, 1);
        ProtocolUtil.writeVarInt(unknown, 0x05);

        channel.writeInbound(frame(new HandshakePacket(770, "localhost", 25565, HandshakePacket.INTENT_STATUS)));
        channel.writeInbound(unknown);

        assertFalse(channel.isOpen());
        assertNull(channel.readOutbound());
        channel.finishAndReleaseAll();
    }

    @Test
    void unknownIntentClosesConnection() {
        EmbeddedChannel channel = channel(new FixedSelector());

        channel.writeInbound(frame(new HandshakePacket(770, "localhost", 25565, 9)));

        assertFalse(channel.isOpen());
        channel.finishAndReleaseAll();
    }

    @Test
    void malformedLoginStartClosesConnection() {
        EmbeddedChannel channel = channel(new FixedSelector());
        ByteBuf truncated = Unpooled.buffer();
        ProtocolUtil.writeVarInt(truncated, 3);
        ProtocolUtil.writeVarInt(truncated, LoginStartPacket.ID);
        ProtocolUtil.writeVarInt(truncated, 1);
        truncated.writeByte('S');

        channel.writeInbound(frame(new HandshakePacket(770, "localhost", 25565, HandshakePacket.INTENT_LOGIN)));
        channel.writeInbound(truncated);

        assertFalse(channel.isOpen());
        assertNull(channel.readOutbound());
        channel.finishAndReleaseAll();
    }

    @Test
    void selectionFailureClosesWithoutTransfer() {
        FixedSelector selector = new FixedSelector();
        selector.failure = new SelectionException("no servers available");
        EmbeddedChannel channel = channel(selector);

        channel.writeInbound(frames(
                new HandshakePacket(770, "localhost", 25565, HandshakePacket.INTENT_LOGIN),
                new LoginStartPacket("Steve", PLAYER),
                LoginAcknowledgedPacket.INSTANCE));

        assertEquals(LoginSuccessPacket.ID, readPacket(channel).id());
        assertNull(channel.readOutbound());
        assertFalse(channel.isOpen());
        channel.finishAndReleaseAll();
    }

    private static EmbeddedChannel channel(FixedSelector selector) {
        EmbeddedChannel channel = new EmbeddedChannel();
        ProtocolPipeline.install(channel.pipeline());
        channel.pipeline().addLast("handler", new ConnectionStateMachine(
                1L, "Test motd", new StatusCache(selector), selector, new EndpointResolver(new NoDnsLookup())));
        return channel;
    }

    private static ConnectionStateMachine handler(EmbeddedChannel channel) {
        return (ConnectionStateMachine) channel.pipeline().get("handler");
    }

    static ByteBuf frame(Packet packet) {
        ByteBuf body = Unpooled.buffer();
        ProtocolUtil.writeVarInt(body, packet.id());
        packet.write(body);
        ByteBuf framed = Unpooled.buffer();
        ProtocolUtil.writeVarInt(framed, body.readableBytes());
        framed.writeBytes(body);
        body.release();
        return framed;
    }

    private static ByteBuf frames(Packet... packets) {
        ByteBuf all = Unpooled.buffer();
        for (Packet packet : packets) {
            ByteBuf framed = frame(packet);
            all.writeBytes(framed);
            framed.release();
        }
        return all;
    }

    static RawPacket readPacket(EmbeddedChannel channel) {
        ByteBuf out = channel.readOutbound();
        if (out == null) {
            throw new AssertionError("expected an outbound packet");
        }
        try {
            int length = ProtocolUtil.readVarInt(out);
            assertEquals(length, out.readableBytes());
            int id = ProtocolUtil.readVarInt(out);
            byte[] payload = new byte[out.readableBytes()];
            out.readBytes(payload);
            return new RawPacket(id, payload);
        } finally {
            out.release();
        }
    }

    private static final class FixedSelector implements ServerSelector {
        private CompletableFuture<Long> players = CompletableFuture.completedFuture(0L);
        private BackendServer backend = new BackendServer(null, "127.0.0.1", 25566);
        private RuntimeException failure;
        private int findCalls;

        @Override
        public CompletableFuture<BackendServer> findServer(SelectionRequest request) {
            findCalls++;
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            return CompletableFuture.completedFuture(backend);
        }

        @Override
        public CompletableFuture<Long> playerCount() {
            return players;
        }
    }

    private static final class NoDnsLookup implements DnsLookup {
        @Override
        public CompletableFuture<List<InetAddress>> lookupHost(String host) {
            return CompletableFuture.failedFuture(new AssertionError("unexpected host lookup " + host));
        }

        @Override
        public CompletableFuture<List<SrvRecord>> lookupSrv(String name) {
            return CompletableFuture.failedFuture(new AssertionError("unexpected SRV lookup " + name));
        }
    }
}
