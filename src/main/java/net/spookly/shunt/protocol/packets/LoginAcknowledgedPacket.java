package net.spookly.shunt.protocol.packets;

import io.netty.buffer.ByteBuf;
import net.spookly.shunt.protocol.Packet;

/**
 * Serverbound acknowledgement of login success; moves the connection to the configuration state.
 */
public final class LoginAcknowledgedPacket implements Packet {
    public static final int ID = 0x03;
    public static final LoginAcknowledgedPacket INSTANCE = new LoginAcknowledgedPacket();

    private LoginAcknowledgedPacket() {
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public void write(ByteBuf out) {
    }
}
