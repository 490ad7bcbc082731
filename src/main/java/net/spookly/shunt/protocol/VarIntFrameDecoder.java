package net.spookly.shunt.protocol;

import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;

/**
 * Splits the stream into frames prefixed by a varint length, rejecting oversized frames early.
 */
public final class VarIntFrameDecoder extends ByteToMessageDecoder {
    public static final int MAX_FRAME_BYTES = 2 * 1024 * 1024;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        in.markReaderIndex();
        int length = 0;
        for (int i = 0; i < ProtocolUtil.MAX_VARINT_BYTES; i++) {
            if (!in.isReadable()) {
                in.resetReaderIndex();
                return;
            }
            byte current = in.readByte();
            length |= (current & 0x7F) << (i * 7);
            if ((current & 0x80) == 0) {
                if (length < 0 || length > MAX_FRAME_BYTES) {
                    throw new TooLongFrameException("Frame of " + length + " bytes exceeds " + MAX_FRAME_BYTES);
                }
                if (in.readableBytes() < length) {
                    in.resetReaderIndex();
                    return;
                }
                out.add(in.readRetainedSlice(length));
                return;
            }
        }
        throw new CorruptedFrameException("Frame length varint is longer than " + ProtocolUtil.MAX_VARINT_BYTES + " bytes");
    }
}
