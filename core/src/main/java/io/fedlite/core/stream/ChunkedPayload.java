// file: core/src/main/java/io/fedlite/core/stream/ChunkedPayload.java
package io.fedlite.core.stream;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a serialized message into frames no larger than a buffer size and
 * joins them back together.
 * <p>
 * Layout:
 *   - frame size = min(maxChunkBytes, payload length)
 *   - every frame but the last is exactly frame size bytes
 *   - an empty payload produces no frames
 * <p>
 * split followed by reassemble returns the original bytes.
 */
public final class ChunkedPayload {

    /** Default frame bound, well below gRPC's default 4 MiB message limit. */
    public static final int DEFAULT_MAX_CHUNK_BYTES = 2 * 1024 * 1024;

    private ChunkedPayload() {
        // utility
    }

    public static List<byte[]> split(byte[] payload, int maxChunkBytes) {
        if (maxChunkBytes <= 0) {
            throw new IllegalArgumentException("maxChunkBytes must be > 0");
        }
        int size = payload.length;
        int bufferSize = Math.min(maxChunkBytes, size);

        List<byte[]> chunks = new ArrayList<>();
        for (int i = 0; i < size; i += bufferSize) {
            chunks.add(Arrays.copyOfRange(payload, i, Math.min(size, i + bufferSize)));
        }
        return chunks;
    }

    /**
     * @throws IllegalArgumentException when the frames carry no bytes at all
     */
    public static byte[] reassemble(Iterable<byte[]> chunks) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] chunk : chunks) {
            out.writeBytes(chunk);
        }
        if (out.size() == 0) {
            throw new IllegalArgumentException("Received empty stream message");
        }
        return out.toByteArray();
    }
}
