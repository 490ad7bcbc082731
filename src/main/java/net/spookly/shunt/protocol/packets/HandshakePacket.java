package net.spookly.shunt.protocol.packets;

import io.netty.buffer.ByteBuf;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.shunt.protocol.Packet;
import net.spookly.shunt.protocol.ProtocolUtil;

/**
 * Serverbound handshake, the only packet of the handshake state.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class HandshakePacket implements Packet {
    public static final int ID = 0x00;
    public static final int INTENT_STATUS = 1;
    public static final int INTENT_LOGIN = 2;
    private static final int MAX_ADDRESS_CHARS = 255;

    private final int protocolVersion;
    private final String serverAddress;
    private final int serverPort;
    private final int intent;

    public static HandshakePacket read(ByteBuf in) {
        int protocolVersion = ProtocolUtil.readVarInt(in);
        String serverAddress = ProtocolUtil.readString(in, MAX_ADDRESS_CHARS);
        int serverPort = ProtocolUtil.readUnsignedShort(in);
        int intent = ProtocolUtil.readVarInt(in);
        return new HandshakePacket(protocolVersion, serverAddress, serverPort, intent);
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public void write(ByteBuf out) {
        ProtocolUtil.writeVarInt(out, protocolVersion);
        ProtocolUtil.writeString(out, serverAddress);
        out.writeShort(serverPort);
        ProtocolUtil.writeVarInt(out, intent);
    }
}
