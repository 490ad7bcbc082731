package net.spookly.shunt.protocol;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;

/**
 * Installs the framing and packet codecs shared by the listener and the backend probe.
 */
public final class ProtocolPipeline {
    public static final String FRAME_DECODER = "frameDecoder";
    public static final String PACKET_DECODER = "packetDecoder";
    public static final String FRAME_ENCODER = "frameEncoder";
    public static final String PACKET_ENCODER = "packetEncoder";

    private ProtocolPipeline() {
    }

    public static void install(ChannelPipeline pipeline) {
        pipeline.addLast(FRAME_DECODER, new VarIntFrameDecoder());
        pipeline.addLast(PACKET_DECODER, new PacketDecoder());
        pipeline.addLast(FRAME_ENCODER, new ProtobufVarint32LengthFieldPrepender());
        pipeline.addLast(PACKET_ENCODER, new PacketEncoder());
    }
}
