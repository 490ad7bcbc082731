package net.spookly.shunt.protocol.packets;

import java.util.UUID;

import io.netty.buffer.ByteBuf;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.shunt.protocol.Packet;
import net.spookly.shunt.protocol.ProtocolUtil;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class LoginStartPacket implements Packet {
    public static final int ID = 0x00;
    private static final int MAX_NAME_CHARS = 16;

    private final String name;
    private final UUID uuid;

    public static LoginStartPacket read(ByteBuf in) {
        String name = ProtocolUtil.readString(in, MAX_NAME_CHARS);
        UUID uuid = ProtocolUtil.readUuid(in);
        return new LoginStartPacket(name, uuid);
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public void write(ByteBuf out) {
        ProtocolUtil.writeString(out, name);
        ProtocolUtil.writeUuid(out, uuid);
    }
}
