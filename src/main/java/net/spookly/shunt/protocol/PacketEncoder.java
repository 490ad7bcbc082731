package net.spookly.shunt.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Writes packet id and body; the length prefix is added further down the pipeline.
 */
public final class PacketEncoder extends MessageToByteEncoder<Packet> {
    @Override
    protected void encode(ChannelHandlerContext ctx, Packet packet, ByteBuf out) {
        ProtocolUtil.writeVarInt(out, packet.id());
        packet.write(out);
    }
}
