package io.fedlite.core;

/**
 * Transport-neutral view of the four-field identity header.
 */
public record MessageHeader(
        String sender,
        String receiver,
        String federationUuid,
        String commonName
) {
}
