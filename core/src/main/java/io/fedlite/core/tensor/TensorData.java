package io.fedlite.core.tensor;

import java.util.Arrays;

/**
 * Decoded numeric payload of a named tensor: a shape and its row-major values.
 */
public record TensorData(int[] shape, float[] values) {

    public TensorData {
        if (shape == null || values == null) {
            throw new IllegalArgumentException("shape and values must not be null");
        }
        long expected = 1;
        for (int dim : shape) {
            if (dim < 0) throw new IllegalArgumentException("negative dimension in shape");
            expected *= dim;
        }
        if (expected != values.length) {
            throw new IllegalArgumentException(
                    "shape %s needs %d values but got %d".formatted(Arrays.toString(shape), expected, values.length));
        }
        shape = shape.clone();
        values = values.clone();
    }

    /** One-dimensional tensor. */
    public static TensorData vector(float... values) {
        return new TensorData(new int[]{values.length}, values);
    }

    public int[] shape() {
        return shape.clone();
    }

    public float[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorData other)) return false;
        return Arrays.equals(shape, other.shape) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TensorData[shape=" + Arrays.toString(shape) + ", values=" + values.length + "]";
    }
}
