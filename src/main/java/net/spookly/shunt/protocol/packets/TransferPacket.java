package net.spookly.shunt.protocol.packets;

import io.netty.buffer.ByteBuf;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.shunt.protocol.Packet;
import net.spookly.shunt.protocol.ProtocolUtil;

/**
 * Clientbound configuration-state transfer: tells the client to reconnect to another host and port.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class TransferPacket implements Packet {
    public static final int ID = 0x0B;
    private static final int MAX_HOST_CHARS = 32767;

    private final String host;
    private final int port;

    public static TransferPacket read(ByteBuf in) {
        String host = ProtocolUtil.readString(in, MAX_HOST_CHARS);
        int port = ProtocolUtil.readVarInt(in);
        return new TransferPacket(host, port);
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public void write(ByteBuf out) {
        ProtocolUtil.writeString(out, host);
        ProtocolUtil.writeVarInt(out, port);
    }
}
