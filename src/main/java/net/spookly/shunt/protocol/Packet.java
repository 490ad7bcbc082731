package net.spookly.shunt.protocol;

import io.netty.buffer.ByteBuf;

/**
 * A typed packet that can be written to the wire. Each implementation also offers a static {@code read}.
 */
public interface Packet {
    int id();

    /**
     * Write the packet body, without the id.
     */
    void write(ByteBuf out);
}
