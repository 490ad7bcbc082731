package net.spookly.shunt.protocol.packets;

import io.netty.buffer.ByteBuf;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.shunt.protocol.Packet;
import net.spookly.shunt.protocol.ProtocolUtil;

/**
 * Clientbound status response carrying the JSON server list entry.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class StatusResponsePacket implements Packet {
    public static final int ID = 0x00;
    private static final int MAX_JSON_CHARS = 32767;

    private final String json;

    public static StatusResponsePacket read(ByteBuf in) {
        return new StatusResponsePacket(ProtocolUtil.readString(in, MAX_JSON_CHARS));
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public void write(ByteBuf out) {
        ProtocolUtil.writeString(out, json);
    }
}
