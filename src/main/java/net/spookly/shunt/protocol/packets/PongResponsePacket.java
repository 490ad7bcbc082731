package net.spookly.shunt.protocol.packets;

import io.netty.buffer.ByteBuf;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.shunt.protocol.Packet;
import net.spookly.shunt.protocol.ProtocolUtil;

/**
 * Clientbound echo of the ping payload.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class PongResponsePacket implements Packet {
    public static final int ID = 0x01;

    private final long payload;

    public static PongResponsePacket read(ByteBuf in) {
        return new PongResponsePacket(ProtocolUtil.readLong(in));
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public void write(ByteBuf out) {
        out.writeLong(payload);
    }
}
