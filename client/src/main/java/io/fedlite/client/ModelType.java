package io.fedlite.client;

/** Which snapshot of a trained model to retrieve. */
public enum ModelType {
    BEST,
    LAST
}
