package net.spookly.shunt.protocol.packets;

import io.netty.buffer.ByteBuf;
import net.spookly.shunt.protocol.Packet;

/**
 * Serverbound status request; no body.
 */
public final class StatusRequestPacket implements Packet {
    public static final int ID = 0x00;
    public static final StatusRequestPacket INSTANCE = new StatusRequestPacket();

    private StatusRequestPacket() {
    }

    @Override
    public int id() {
        return ID;
    }

    @Override
    public void write(ByteBuf out) {
    }
}
