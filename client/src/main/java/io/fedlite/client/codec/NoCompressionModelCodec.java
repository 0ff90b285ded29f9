// file: client/src/main/java/io/fedlite/client/codec/NoCompressionModelCodec.java
package io.fedlite.client.codec;

import com.google.protobuf.ByteString;
import io.fedlite.core.tensor.TensorData;
import io.fedlite.protocols.AggregatorProto.MetadataProto;
import io.fedlite.protocols.AggregatorProto.NamedTensor;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Lossless pass-through codec.
 * <p>
 * Layout:
 *   - data_bytes:           float32 values, little-endian, row-major
 *   - transformer_metadata: exactly one entry whose int_list is the shape
 * <p>
 * A tensor without metadata is read as a one-dimensional vector.
 */
public final class NoCompressionModelCodec implements ModelCodec {

    @Override
    public NamedTensor encode(String name, TensorData tensor) {
        float[] values = tensor.values();
        ByteBuffer b = ByteBuffer.allocate(values.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : values) {
            b.putFloat(v);
        }

        MetadataProto.Builder shape = MetadataProto.newBuilder();
        for (int dim : tensor.shape()) {
            shape.addIntList(dim);
        }

        return NamedTensor.newBuilder()
                .setName(name)
                .setLossless(true)
                .addTransformerMetadata(shape)
                .setDataBytes(ByteString.copyFrom(b.array()))
                .build();
    }

    @Override
    public TensorData decode(NamedTensor tensor) {
        ByteBuffer b = tensor.getDataBytes().asReadOnlyByteBuffer().order(ByteOrder.LITTLE_ENDIAN);
        if (b.remaining() % Float.BYTES != 0) {
            throw new IllegalArgumentException(
                    "tensor " + tensor.getName() + " has " + b.remaining() + " bytes, not a multiple of 4");
        }
        float[] values = new float[b.remaining() / Float.BYTES];
        b.asFloatBuffer().get(values);

        if (tensor.getTransformerMetadataCount() == 0) {
            return TensorData.vector(values);
        }
        List<Integer> dims = tensor.getTransformerMetadata(0).getIntListList();
        int[] shape = dims.stream().mapToInt(Integer::intValue).toArray();
        return new TensorData(shape, values);
    }
}
