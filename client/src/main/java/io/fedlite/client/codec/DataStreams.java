package io.fedlite.client.codec;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageLite;
import com.google.protobuf.Parser;
import io.fedlite.core.stream.ChunkedPayload;
import io.fedlite.protocols.AggregatorProto.DataStream;

import java.util.ArrayList;
import java.util.List;

/**
 * Carries a protobuf message that may exceed one gRPC frame as a sequence of
 * {@link DataStream} frames, and puts it back together on the receiving side.
 */
public final class DataStreams {

    private DataStreams() {
        // utility
    }

    /** Serialize {@code message} and cut it into frames of at most {@code maxChunkBytes}. */
    public static List<DataStream> toFrames(MessageLite message, int maxChunkBytes) {
        List<byte[]> chunks = ChunkedPayload.split(message.toByteArray(), maxChunkBytes);
        List<DataStream> frames = new ArrayList<>(chunks.size());
        for (byte[] chunk : chunks) {
            frames.add(DataStream.newBuilder()
                    .setSize(chunk.length)
                    .setNpbytes(ByteString.copyFrom(chunk))
                    .build());
        }
        return frames;
    }

    /**
     * Concatenate frames and parse the result.
     *
     * @throws IllegalArgumentException on an empty stream or bytes that do not parse
     */
    public static <T extends MessageLite> T fromFrames(Iterable<DataStream> frames, Parser<T> parser) {
        List<byte[]> chunks = new ArrayList<>();
        for (DataStream frame : frames) {
            chunks.add(frame.getNpbytes().toByteArray());
        }
        byte[] payload = ChunkedPayload.reassemble(chunks);
        try {
            return parser.parseFrom(payload);
        } catch (InvalidProtocolBufferException e) {
            throw new IllegalArgumentException("Stream does not hold a valid message", e);
        }
    }
}
