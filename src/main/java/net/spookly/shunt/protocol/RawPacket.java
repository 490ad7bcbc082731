package net.spookly.shunt.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A decoded frame: packet id plus the undecoded body. Typed decoding happens once the state is known.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class RawPacket {
    private final int id;
    private final byte[] payload;

    /**
     * Read-only view over the body for the packet {@code read} methods.
     */
    public ByteBuf body() {
        return Unpooled.wrappedBuffer(payload).asReadOnly();
    }
}
