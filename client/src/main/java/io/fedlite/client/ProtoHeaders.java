package io.fedlite.client;

import io.fedlite.core.MessageHeader;
import io.fedlite.protocols.AggregatorProto;

/**
 * Maps the identity header between its wire and core forms.
 */
final class ProtoHeaders {

    private ProtoHeaders() {
        // utility
    }

    static AggregatorProto.MessageHeader toProto(MessageHeader h) {
        return AggregatorProto.MessageHeader.newBuilder()
                .setSender(h.sender())
                .setReceiver(h.receiver())
                .setFederationUuid(h.federationUuid())
                .setSingleColCertCommonName(h.commonName())
                .build();
    }

    static MessageHeader fromProto(AggregatorProto.MessageHeader h) {
        return new MessageHeader(
                h.getSender(),
                h.getReceiver(),
                h.getFederationUuid(),
                h.getSingleColCertCommonName()
        );
    }
}
