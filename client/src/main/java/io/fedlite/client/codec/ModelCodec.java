package io.fedlite.client.codec;

import io.fedlite.core.tensor.TensorData;
import io.fedlite.protocols.AggregatorProto.ModelProto;
import io.fedlite.protocols.AggregatorProto.NamedTensor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between decoded tensors and their wire form.
 * <p>
 * The compression pipeline behind an implementation is opaque to the client;
 * it only moves the resulting bytes.
 */
public interface ModelCodec {

    NamedTensor encode(String name, TensorData tensor);

    TensorData decode(NamedTensor tensor);

    /** Decode every tensor of a model, keyed by tensor name, in wire order. */
    default Map<String, TensorData> deconstruct(ModelProto model) {
        Map<String, TensorData> out = new LinkedHashMap<>();
        for (NamedTensor t : model.getTensorsList()) {
            out.put(t.getName(), decode(t));
        }
        return out;
    }
}
