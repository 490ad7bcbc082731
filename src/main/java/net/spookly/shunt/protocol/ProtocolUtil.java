package net.spookly.shunt.protocol;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import io.netty.buffer.ByteBuf;

/**
 * Field codecs for the wire protocol: varints, length-prefixed UTF-8 strings and UUIDs.
 */
public final class ProtocolUtil {
    public static final int MAX_VARINT_BYTES = 5;

    private ProtocolUtil() {
    }

    public static int readVarInt(ByteBuf in) {
        int value = 0;
        for (int i = 0; i < MAX_VARINT_BYTES; i++) {
            if (!in.isReadable()) {
                throw new ProtocolException("Truncated varint");
            }
            byte current = in.readByte();
            value |= (current & 0x7F) << (i * 7);
            if ((current & 0x80) == 0) {
                return value;
            }
        }
        throw new ProtocolException("Varint is longer than " + MAX_VARINT_BYTES + " bytes");
    }

    public static void writeVarInt(ByteBuf out, int value) {
        while ((value & ~0x7F) != 0) {
            out.writeByte((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.writeByte(value);
    }

    public static String readString(ByteBuf in, int maxChars) {
        int length = readVarInt(in);
        if (length < 0 || length > maxChars * 3) {
            throw new ProtocolException("String byte length " + length + " exceeds limit for " + maxChars + " chars");
        }
        if (in.readableBytes() < length) {
            throw new ProtocolException("Truncated string, expected " + length + " bytes");
        }
        String value = in.readCharSequence(length, StandardCharsets.UTF_8).toString();
        if (value.length() > maxChars) {
            throw new ProtocolException("String longer than " + maxChars + " chars");
        }
        return value;
    }

    public static void writeString(ByteBuf out, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeVarInt(out, bytes.length);
        out.writeBytes(bytes);
    }

    public static UUID readUuid(ByteBuf in) {
        if (in.readableBytes() < 16) {
            throw new ProtocolException("Truncated uuid");
        }
        return new UUID(in.readLong(), in.readLong());
    }

    public static void writeUuid(ByteBuf out, UUID uuid) {
        out.writeLong(uuid.getMostSignificantBits());
        out.writeLong(uuid.getLeastSignificantBits());
    }

    public static long readLong(ByteBuf in) {
        if (in.readableBytes() < Long.BYTES) {
            throw new ProtocolException("Truncated long");
        }
        return in.readLong();
    }

    public static int readUnsignedShort(ByteBuf in) {
        if (in.readableBytes() < Short.BYTES) {
            throw new ProtocolException("Truncated unsigned short");
        }
        return in.readUnsignedShort();
    }
}
