package net.spookly.shunt.protocol.packets;

import java.util.UUID;

import io.netty.buffer.ByteBuf;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.shunt.protocol.Packet;
import net.spookly.shunt.protocol.ProtocolException;
import net.spookly.shunt.protocol.ProtocolUtil;

/**
 * Clientbound login success. The profile property list is always empty because the router does not authenticate.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class LoginSuccessPacket implements Packet {
    public static final int ID = 0x02;
    private static final int MAX_NAME_CHARS = 16;

    private final UUID uuid;
    private final String name;

    public static LoginSuccessPacket read(ByteBuf in) {
        UUID uuid = ProtocolUtil.readUuid(in);
        String name = ProtocolUtil.readString(in, MAX_NAME_CHARS);
        int properties = ProtocolUtil.readVarInt(in);
        if (properties != 0) {
            throw new ProtocolException("Profile properties are not supported");
        }
        return new LoginSuccessPacket(uuid, name);
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public void write(ByteBuf out) {
        ProtocolUtil.writeUuid(out, uuid);
        ProtocolUtil.writeString(out, name);
        ProtocolUtil.writeVarInt(out, 0);
    }
}
