package net.spookly.shunt.protocol;

import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;

/**
 * Turns one frame into a {@link RawPacket}.
 */
public final class PacketDecoder extends MessageToMessageDecoder<ByteBuf> {
    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
        if (!frame.isReadable()) {
            throw new ProtocolException("Empty frame");
        }
        int id = ProtocolUtil.readVarInt(frame);
        byte[] payload = new byte[frame.readableBytes()];
        frame.readBytes(payload);
        out.add(new RawPacket(id, payload));
    }
}
